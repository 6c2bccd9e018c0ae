package com.swarmprobe.dispatch.cli;

import com.swarmprobe.core.events.SwarmEvent;
import com.swarmprobe.core.model.LoopState;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the SwarmProbe CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SWARMPROBE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SWARMPROBE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void event(SwarmEvent event) {
        String prefix = switch (event.eventType()) {
            case "loop.started", "loop.stopped" -> "@|fg(cyan) [LOOP]|@";
            case "member.registered", "member.reregistered" -> "@|fg(blue) [MEMBER]|@";
            case "member.retired" -> "@|fg(red) [MEMBER]|@";
            case "swarm.members_added" -> "@|fg(blue) [SWARM]|@";
            case "cycle.completed" -> "@|fg(white) [CYCLE]|@";
            case "issue.created" -> "@|fg(green),bold [ISSUE]|@";
            case "issue.duplicate", "issue.reobserved" -> "@|fg(yellow) [ISSUE]|@";
            case "escalation.advanced" -> "@|bold,fg(magenta) [CHAOS]|@";
            case "deploy.unreachable" -> "@|fg(red),bold [DEPLOY]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        var subject = event.memberId() != null ? event.memberId() + " " : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + event.payload()));
    }

    public static void loopState(LoopState state) {
        System.out.println();
        System.out.println("SESSION " + state.sessionId());
        System.out.println("Started: " + state.startedAt());
        ConsoleOutput.info(String.format("Cycles: %d | Without issue: %d | Escalations: %d",
                state.cycleCount(), state.cyclesWithoutIssue(), state.escalationCount()));
        var stress = state.stress();
        if (stress != null) {
            ConsoleOutput.info(String.format("Stress: %s | Members: %d | Cycle delay: %dms | Chaos: %s",
                    stress.level(), stress.memberCount(), stress.cycleDelayMs(), stress.chaosEnabled()));
        }
        if (state.totalIssuesCreated() > 0) {
            ConsoleOutput.success("Issues created: " + state.totalIssuesCreated()
                    + " (last: " + state.lastIssueCreated() + ")");
        } else {
            ConsoleOutput.info("Issues created: 0");
        }
        if (!state.recentIssues().isEmpty()) {
            System.out.println();
            System.out.println("Recent issues:");
            for (String ref : state.recentIssues()) {
                System.out.println("  " + ref);
            }
        }
        if (!state.members().isEmpty()) {
            System.out.println();
            System.out.println("Members (" + state.members().size() + "):");
            for (String id : state.members()) {
                System.out.println("  " + id);
            }
        }
    }
}
