package com.swarmprobe.core.engine;

import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.detection.CycleDetection;
import com.swarmprobe.core.detection.DetectorBank;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.FingerprintStore;
import com.swarmprobe.core.detection.SuppressedHit;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.escalation.ChaosEscalator;
import com.swarmprobe.core.events.EventBus;
import com.swarmprobe.core.events.SwarmEvent;
import com.swarmprobe.core.logging.MdcContext;
import com.swarmprobe.core.metrics.SwarmProbeMetrics;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.LoopState;
import com.swarmprobe.core.model.MemberRole;
import com.swarmprobe.core.model.Severity;
import com.swarmprobe.core.persistence.LoopStateStore;
import com.swarmprobe.core.reporting.IssueReporter;
import com.swarmprobe.core.reporting.ReportOutcome;
import com.swarmprobe.core.swarm.Swarm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the whole run: health check, swarm start-up, then one detection cycle per
 * interval until stopped.
 * <p>
 * Each cycle snapshots every member, scans the snapshot, files or comments on what was
 * found, escalates on a miss streak and persists the loop state.
 */
public class LoopOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(LoopOrchestrator.class);

    private final WorldApi worldApi;
    private final Swarm swarm;
    private final DetectorBank detectors;
    private final FingerprintStore fingerprints;
    private final IssueReporter reporter;
    private final ChaosEscalator escalator;
    private final LoopStateStore stateStore;
    private final DeploymentWatcher deploymentWatcher;
    private final ScheduledExecutorService scheduler;
    private final EventBus eventBus;
    private final SwarmProbeMetrics metrics;
    private final Clock clock;
    private final LoopSettings settings;

    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile LoopState state;

    public LoopOrchestrator(WorldApi worldApi, Swarm swarm, DetectorBank detectors, FingerprintStore fingerprints,
                            IssueReporter reporter, ChaosEscalator escalator, LoopStateStore stateStore,
                            DeploymentWatcher deploymentWatcher, ScheduledExecutorService scheduler,
                            EventBus eventBus, SwarmProbeMetrics metrics, Clock clock, LoopSettings settings) {
        this.worldApi = worldApi;
        this.swarm = swarm;
        this.detectors = detectors;
        this.fingerprints = fingerprints;
        this.reporter = reporter;
        this.escalator = escalator;
        this.stateStore = stateStore;
        this.deploymentWatcher = deploymentWatcher;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
    }

    /**
     * Runs until {@link #stopGracefully()} is called or the deployment watcher asks for a
     * restart.
     *
     * @return false when the target failed its health check and nothing was started
     */
    public boolean run() {
        if (!initialize()) {
            return false;
        }
        start();
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopGracefully();
        }
        return true;
    }

    /**
     * Checks the target, loads state and registers the initial members.
     *
     * @return false when the target is unreachable; a Deploy issue has then been reported
     */
    public boolean initialize() {
        if (!worldApi.healthy()) {
            log.error("Target failed its health check, not starting the swarm");
            publish("deploy.unreachable", Map.of());
            reporter.report(unreachableIssue());
            return false;
        }

        var stress = settings.stress();
        state = stateStore.loadOrCreate(stress).withStress(stress);
        log.info("Loop session {} resuming at cycle {} ({} issues so far)",
                state.sessionId(), state.cycleCount(), state.totalIssuesCreated());

        if (stress.chaosEnabled()) {
            swarm.enableHighEntropy();
        }
        swarm.initialize(stress.memberCount());
        state = state.withMembers(swarm.memberIds());
        stateStore.save(state);
        publish("loop.started", Map.of("members", swarm.members().size(), "stress", stress.level().name()));
        return true;
    }

    public void start() {
        swarm.start();
        long interval = settings.issueCheckIntervalMs();
        scheduler.scheduleWithFixedDelay(this::cycleSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Detection cycles every {}ms", interval);
    }

    /**
     * One orchestrator cycle. Not re-entrant; the scheduler runs cycles back to back.
     */
    public synchronized CycleReport runCycle() {
        state = state.nextCycle();
        long cycle = state.cycleCount();
        MdcContext.setCycle(cycle);
        long started = System.nanoTime();
        try {
            fingerprints.purgeExpired();
            var snapshot = new SwarmSnapshot(clock.instant(), cycle, swarm.snapshot());
            var detection = detectors.scan(snapshot);

            int comments = commentOnSuppressed(detection);
            var outcome = detection.freshFinding().flatMap(this::report);

            int rung = -1;
            if (outcome.isPresent() && outcome.get().created()) {
                state = state.issueCreated(outcome.get().reference());
                escalator.reset();
            } else if (detection.freshFinding().isEmpty()) {
                state = state.missed();
                log.info("No new issue ({} cycles without issue)", state.cyclesWithoutIssue());
                if (state.cyclesWithoutIssue() >= settings.escalateAfterCycles()) {
                    rung = escalate();
                }
            }

            state = state.withMembers(swarm.memberIds());
            stateStore.save(state);

            int active = swarm.activeCount();
            metrics.recordSwarmSize(active);
            var report = new CycleReport(cycle, outcome.map(ReportOutcome::reference).orElse(null),
                    outcome.map(ReportOutcome::created).orElse(false), comments, rung, active);
            publishCycle(report);
            return report;
        } finally {
            metrics.recordCycleDuration((System.nanoTime() - started) / 1_000_000);
            MdcContext.clear();
        }
    }

    /**
     * Stops member loops, unregisters every member within the shutdown timeout and writes
     * the final state. Safe to call more than once.
     */
    public void stopGracefully() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping loop");
        try {
            scheduler.shutdown();
            swarm.stopGracefully(settings.shutdownTimeout());
            if (state != null) {
                state = state.withMembers(swarm.memberIds());
                saveFinalState();
            }
            publish("loop.stopped", Map.of());
        } finally {
            stopped.countDown();
        }
    }

    public LoopState state() {
        return state;
    }

    public boolean isStopping() {
        return stopping.get();
    }

    private void saveFinalState() {
        try {
            stateStore.save(state);
        } catch (UncheckedIOException e) {
            log.error("Failed to persist final loop state, exiting without it", e);
        }
    }

    private void cycleSafely() {
        if (stopping.get()) {
            return;
        }
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("Cycle {} failed", state.cycleCount(), e);
        }
        try {
            if (deploymentWatcher.restartRequested()) {
                log.info("Deployment watcher requested a restart");
                stopGracefully();
            }
        } catch (RuntimeException e) {
            log.error("Deployment check after cycle {} failed", state.cycleCount(), e);
        }
    }

    private Optional<ReportOutcome> report(Finding finding) {
        var outcome = reporter.report(finding.issue());
        outcome.ifPresent(o -> {
            fingerprints.record(finding.fingerprint(), o.reference());
            publish(o.created() ? "issue.created" : "issue.duplicate",
                    Map.of("reference", o.reference(), "title", finding.issue().title(),
                            "area", finding.issue().area()));
        });
        return outcome;
    }

    private int commentOnSuppressed(CycleDetection detection) {
        int comments = 0;
        for (SuppressedHit hit : detection.suppressed()) {
            if (hit.reference() == null) {
                continue;
            }
            reporter.reobserved(hit.reference(), hit.finding().issue());
            publish("issue.reobserved", Map.of("reference", hit.reference(), "title", hit.finding().issue().title()));
            comments++;
        }
        return comments;
    }

    private int escalate() {
        int rung = escalator.advance();
        state = state.escalated();
        var shared = swarm.settings();
        var stress = state.stress()
                .withMemberCount(swarm.members().size())
                .withCycleDelayMs(shared.getCycleDelayMs())
                .withChaosEnabled(state.stress().chaosEnabled() || shared.isHighEntropy()
                        || shared.getRoleOverride() == MemberRole.CHAOS);
        state = state.withStress(stress);
        publish("escalation.advanced", Map.of("rung", rung, "escalations", state.escalationCount()));
        return rung;
    }

    private Issue unreachableIssue() {
        var now = clock.instant();
        return new Issue(
                IssueArea.DEPLOY,
                "Server unreachable",
                "health-check",
                "Server should be reachable and healthy",
                "GET /health did not succeed",
                List.of("Start the world server", "Check the health endpoint at /health"),
                Severity.CRITICAL,
                Frequency.ALWAYS,
                IssueEvidence.of(List.of(), List.of(now), List.of("Server unreachable at " + now)));
    }

    private void publishCycle(CycleReport report) {
        var payload = new HashMap<String, Object>();
        payload.put("cycle", report.cycle());
        payload.put("created", report.created());
        payload.put("comments", report.comments());
        payload.put("escalationRung", report.escalationRung());
        payload.put("activeMembers", report.activeMembers());
        payload.put("totalIssues", state.totalIssuesCreated());
        if (report.issueReference() != null) {
            payload.put("reference", report.issueReference());
        }
        publish("cycle.completed", payload);
    }

    private void publish(String type, Map<String, Object> payload) {
        var sessionId = state != null ? state.sessionId() : null;
        eventBus.publish(SwarmEvent.swarm(type, sessionId, payload, clock.instant()));
    }
}
