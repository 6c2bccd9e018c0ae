package com.swarmprobe.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Run-level record persisted after every orchestrator cycle.
 * <p>
 * Each mutator returns a new instance; the orchestrator swaps its reference and writes the
 * result as a complete file replacement.
 */
public record LoopState(
    int version,
    String sessionId,
    long cycleCount,
    long cyclesWithoutIssue,
    StressParameters stress,
    long escalationCount,
    long totalIssuesCreated,
    String lastIssueCreated,
    List<String> recentIssues,
    List<String> members,
    Instant startedAt
) {

    public static final int CURRENT_VERSION = 1;
    public static final int MAX_RECENT_ISSUES = 10;

    public LoopState {
        recentIssues = recentIssues == null ? List.of() : List.copyOf(recentIssues);
        members = members == null ? List.of() : List.copyOf(members);
    }

    public static LoopState initial(Instant now, StressParameters stress) {
        return new LoopState(CURRENT_VERSION, "resident_" + now.toEpochMilli(), 0, 0, stress,
                0, 0, null, List.of(), List.of(), now);
    }

    public LoopState nextCycle() {
        return new LoopState(version, sessionId, cycleCount + 1, cyclesWithoutIssue, stress,
                escalationCount, totalIssuesCreated, lastIssueCreated, recentIssues, members, startedAt);
    }

    public LoopState issueCreated(String reference) {
        var recent = new ArrayList<>(recentIssues);
        recent.add(reference);
        while (recent.size() > MAX_RECENT_ISSUES) {
            recent.remove(0);
        }
        return new LoopState(version, sessionId, cycleCount, 0, stress,
                escalationCount, totalIssuesCreated + 1, reference, recent, members, startedAt);
    }

    public LoopState missed() {
        return new LoopState(version, sessionId, cycleCount, cyclesWithoutIssue + 1, stress,
                escalationCount, totalIssuesCreated, lastIssueCreated, recentIssues, members, startedAt);
    }

    public LoopState escalated() {
        return new LoopState(version, sessionId, cycleCount, cyclesWithoutIssue, stress,
                escalationCount + 1, totalIssuesCreated, lastIssueCreated, recentIssues, members, startedAt);
    }

    public LoopState withStress(StressParameters newStress) {
        return new LoopState(version, sessionId, cycleCount, cyclesWithoutIssue, newStress,
                escalationCount, totalIssuesCreated, lastIssueCreated, recentIssues, members, startedAt);
    }

    public LoopState withMembers(List<String> memberIds) {
        return new LoopState(version, sessionId, cycleCount, cyclesWithoutIssue, stress,
                escalationCount, totalIssuesCreated, lastIssueCreated, recentIssues, memberIds, startedAt);
    }
}
