package com.swarmprobe.dispatch.cli;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.engine.LoopFactory;
import com.swarmprobe.core.events.EventBus;
import com.swarmprobe.core.model.StressLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CLI command: swarmprobe run
 * <p>
 * Starts the swarm and runs detection cycles until interrupted. Options override the
 * configured values for this run only.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run the swarm against a target")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"--agents", "-n"}, description = "Initial number of members")
    private Integer agents;

    @Option(names = {"--stress"}, description = "Stress level: ${COMPLETION-CANDIDATES}")
    private StressLevel stress;

    @Option(names = {"--chaos"}, description = "Start with high-entropy behaviour enabled")
    private boolean chaos;

    @Option(names = {"--dry-run"}, description = "Log issues instead of filing them")
    private boolean dryRun;

    @Option(names = {"--room"}, description = "Room id to join")
    private String room;

    @Option(names = {"--url"}, description = "Target base URL")
    private String url;

    @Option(names = {"--delay"}, description = "Member cycle delay in milliseconds")
    private Long delayMs;

    @Option(names = {"--check-interval"}, description = "Detection interval in milliseconds")
    private Long checkIntervalMs;

    @Option(names = {"--seed"}, description = "Random seed for a reproducible run")
    private Long seed;

    private final SwarmProbeProperties properties;
    private final LoopFactory loopFactory;
    private final EventBus eventBus;

    public RunCommand(SwarmProbeProperties properties, LoopFactory loopFactory, EventBus eventBus) {
        this.properties = properties;
        this.loopFactory = loopFactory;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        applyOverrides();
        printConfiguration();

        var subscription = eventBus.subscribeAll(ConsoleOutput::event);
        var filed = new AtomicInteger();
        var issueSubscription = eventBus.subscribe("issue.created", event -> filed.incrementAndGet());
        var orchestrator = loopFactory.create();
        var shutdownHook = new Thread(orchestrator::stopGracefully, "swarmprobe-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            if (!orchestrator.run()) {
                ConsoleOutput.error("Target not reachable at " + properties.getBaseUrl());
                return 1;
            }
            ConsoleOutput.info("Loop stopped after " + orchestrator.state().cycleCount() + " cycles, "
                    + filed.get() + " issues filed this run");
            return 0;
        } finally {
            subscription.unsubscribe();
            issueSubscription.unsubscribe();
            removeHook(shutdownHook);
        }
    }

    void applyOverrides() {
        var swarm = properties.getSwarm();
        if (agents != null) swarm.setMemberCount(agents);
        if (stress != null) swarm.setStressLevel(stress.name());
        if (chaos) swarm.setChaosEnabled(true);
        if (dryRun) properties.getTracker().setDryRun(true);
        if (room != null) properties.getTarget().setRoomId(room);
        if (url != null) properties.getTarget().setBaseUrl(url);
        if (delayMs != null) swarm.setCycleDelayMs(delayMs);
        if (checkIntervalMs != null) swarm.setIssueCheckIntervalMs(checkIntervalMs);
        if (seed != null) swarm.setSeed(seed);
    }

    private void printConfiguration() {
        var swarm = properties.getSwarm();
        ConsoleOutput.info("Target:         " + properties.getBaseUrl() + " (room " + properties.getRoomId() + ")");
        ConsoleOutput.info("Members:        " + swarm.getMemberCount());
        ConsoleOutput.info("Stress:         " + swarm.getStressLevel());
        ConsoleOutput.info("Chaos:          " + swarm.isChaosEnabled());
        ConsoleOutput.info("Dry run:        " + properties.isDryRun());
        ConsoleOutput.info("Cycle delay:    " + swarm.getCycleDelayMs() + "ms");
        ConsoleOutput.info("Check interval: " + swarm.getIssueCheckIntervalMs() + "ms");
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, keeping shutdown hook");
        }
    }
}
