package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.behavior.RoleCatalog;
import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.Detector;

import java.util.List;

/**
 * The full detector set, freshly instantiated. Detectors keep per-run state, so every
 * orchestrator gets its own instances.
 */
public final class StandardDetectors {

    private StandardDetectors() {}

    public static List<Detector> create(SwarmProbeProperties.Detection config, RoleCatalog catalog) {
        return List.of(
                new PositionDesyncDetector(config),
                new ChatMismatchDetector(config),
                new StuckMemberDetector(config),
                new HighErrorRateDetector(config),
                new EntityCountDivergenceDetector(config),
                new FacilityStateDivergenceDetector(config),
                new ObserveInconsistencyDetector(config),
                new InteractFailurePatternDetector(config),
                new EventPollingGapDetector(config),
                new LowApiCoverageDetector(config),
                new RoleComplianceDetector(config, catalog),
                new LowDecisionEntropyDetector(config),
                new IdleDespiteOpportunityDetector(config),
                new CandidateStarvationDetector(config));
    }
}
