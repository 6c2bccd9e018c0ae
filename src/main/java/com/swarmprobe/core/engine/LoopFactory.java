package com.swarmprobe.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmprobe.core.behavior.ActionSelector;
import com.swarmprobe.core.behavior.BehaviorSettings;
import com.swarmprobe.core.behavior.CandidateBuilder;
import com.swarmprobe.core.behavior.RoleCatalog;
import com.swarmprobe.core.behavior.WeightCalculator;
import com.swarmprobe.core.client.TxIds;
import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.DetectorBank;
import com.swarmprobe.core.detection.FingerprintStore;
import com.swarmprobe.core.detection.detectors.StandardDetectors;
import com.swarmprobe.core.escalation.ChaosEscalator;
import com.swarmprobe.core.events.EventBus;
import com.swarmprobe.core.metrics.SwarmProbeMetrics;
import com.swarmprobe.core.model.StressLevel;
import com.swarmprobe.core.model.StressParameters;
import com.swarmprobe.core.persistence.LoopStateStore;
import com.swarmprobe.core.reporting.BuildInfo;
import com.swarmprobe.core.reporting.IssueBodyFormatter;
import com.swarmprobe.core.reporting.IssueReporter;
import com.swarmprobe.core.reporting.IssueTracker;
import com.swarmprobe.core.swarm.MemberSettings;
import com.swarmprobe.core.swarm.MemberToolkit;
import com.swarmprobe.core.swarm.Sleeper;
import com.swarmprobe.core.swarm.Swarm;
import com.swarmprobe.core.swarm.SwarmSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assembles a {@link LoopOrchestrator} from the current properties. Built per run, after
 * command-line overrides have been applied.
 */
@Component
public class LoopFactory {

    private static final Logger log = LoggerFactory.getLogger(LoopFactory.class);

    private final SwarmProbeProperties properties;
    private final WorldApi worldApi;
    private final IssueTracker issueTracker;
    private final RoleCatalog roleCatalog;
    private final ObjectMapper objectMapper;
    private final BuildInfo buildInfo;
    private final EventBus eventBus;
    private final SwarmProbeMetrics metrics;
    private final Clock clock;

    public LoopFactory(SwarmProbeProperties properties, WorldApi worldApi, IssueTracker issueTracker,
                       RoleCatalog roleCatalog, ObjectMapper objectMapper, BuildInfo buildInfo,
                       EventBus eventBus, SwarmProbeMetrics metrics, Clock clock) {
        this.properties = properties;
        this.worldApi = worldApi;
        this.issueTracker = issueTracker;
        this.roleCatalog = roleCatalog;
        this.objectMapper = objectMapper;
        this.buildInfo = buildInfo;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    public LoopOrchestrator create() {
        var swarmProps = properties.getSwarm();
        var detection = properties.getDetection();
        var tracker = properties.getTracker();

        long seed = swarmProps.getSeed() != null ? swarmProps.getSeed() : new Random().nextLong();
        log.info("Run seed {}", seed);
        var seeds = new Random(seed);

        var stress = stressParameters();
        var shared = new SwarmSettings(stress.cycleDelayMs());
        var kit = new MemberToolkit(
                worldApi,
                roleCatalog,
                new CandidateBuilder(BehaviorSettings.from(properties), new WeightCalculator()),
                new ActionSelector(),
                MemberSettings.from(properties),
                shared,
                new TxIds(clock),
                clock,
                Sleeper.THREAD,
                metrics,
                eventBus);
        var swarm = new Swarm(kit, Executors.newCachedThreadPool(named("member")), new Random(seeds.nextLong()));

        var fingerprints = new FingerprintStore(clock, Duration.ofMinutes(detection.getCooldownMinutes()));
        var bank = new DetectorBank(StandardDetectors.create(detection, roleCatalog), fingerprints,
                new Random(seeds.nextLong()), metrics);

        var formatter = new IssueBodyFormatter(buildInfo, clock, tracker.getLogTailLines(),
                properties.getBaseUrl(), properties.getRoomId());
        var reporter = new IssueReporter(issueTracker, formatter, metrics, clock, tracker.getMarkerLabel(),
                tracker.getSimilarityThreshold(), tracker.isDryRun());

        var escalator = new ChaosEscalator(swarm, swarmProps.getEscalationMemberIncrement(),
                swarmProps.getEscalationCycleDelayMs(), metrics);
        var store = new LoopStateStore(properties.getState().resolvePath(), objectMapper, clock);
        DeploymentWatcher watcher = swarmProps.isRestartOnNewCommit()
                ? new GitHeadDeploymentWatcher(BuildInfo::gitCommit)
                : DeploymentWatcher.NEVER;

        var settings = new LoopSettings(stress, swarmProps.getIssueCheckIntervalMs(),
                swarmProps.getEscalateAfterCycles(), Duration.ofSeconds(swarmProps.getShutdownTimeoutSeconds()));

        return new LoopOrchestrator(worldApi, swarm, bank, fingerprints, reporter, escalator, store, watcher,
                Executors.newSingleThreadScheduledExecutor(named("orchestrator")), eventBus, metrics, clock, settings);
    }

    public StressParameters stressParameters() {
        var swarmProps = properties.getSwarm();
        var level = StressLevel.fromKey(swarmProps.getStressLevel());
        return new StressParameters(level, swarmProps.getMemberCount(),
                level.scaleDelayMs(swarmProps.getCycleDelayMs()), swarmProps.isChaosEnabled());
    }

    private static ThreadFactory named(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
