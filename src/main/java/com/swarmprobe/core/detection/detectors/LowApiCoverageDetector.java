package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * After warm-up the swarm as a whole has exercised fewer distinct endpoints than the
 * minimum.
 */
public class LowApiCoverageDetector implements Detector {

    public static final String NAME = "low-api-coverage";

    static final int MIN_DISTINCT_ENDPOINTS = 6;

    private final SwarmProbeProperties.Detection config;

    public LowApiCoverageDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        if (snapshot.cycle() < config.getCoverageWarmupCycles() || snapshot.members().isEmpty()) {
            return Optional.empty();
        }
        Set<String> called = new HashSet<>();
        for (MemberSnapshot member : snapshot.members()) {
            called.addAll(member.endpointsCalled());
        }
        if (called.size() >= MIN_DISTINCT_ENDPOINTS) {
            return Optional.empty();
        }
        return Optional.of(toFinding(snapshot, called));
    }

    static String coverageSummary(Set<String> called) {
        var hit = WorldApi.ENDPOINTS.stream().filter(called::contains).toList();
        var missing = WorldApi.ENDPOINTS.stream().filter(e -> !called.contains(e)).toList();
        return "%d/%d endpoints called. Called: %s. Never called: %s".formatted(
                hit.size(), WorldApi.ENDPOINTS.size(), String.join(", ", hit), String.join(", ", missing));
    }

    private Finding toFinding(SwarmSnapshot snapshot, Set<String> called) {
        var summary = coverageSummary(called);
        var issue = new Issue(
                IssueArea.AIC,
                "Low API coverage: only %d endpoints exercised".formatted(called.size()),
                NAME,
                "The swarm should exercise at least %d distinct endpoints".formatted(MIN_DISTINCT_ENDPOINTS),
                "After %d cycles only %d distinct endpoints were called".formatted(snapshot.cycle(), called.size()),
                List.of("Run the swarm for at least %d cycles".formatted(config.getCoverageWarmupCycles()),
                        "Collect the endpoints each member has called"),
                Severity.MINOR,
                Frequency.ALWAYS,
                IssueEvidence.of(snapshot.members().stream().map(MemberSnapshot::displayId).toList(),
                                List.of(snapshot.capturedAt()), List.of(summary))
                        .withCoverageSummary(summary)
                        .withStateTable(DetectorSupport.rows(snapshot.members())));
        return new Finding(issue, "global");
    }
}
