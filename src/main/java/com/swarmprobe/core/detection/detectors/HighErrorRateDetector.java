package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.ConsecutiveGate;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.detection.ViolationGate;
import com.swarmprobe.core.model.ApiCallRecord;
import com.swarmprobe.core.model.ErrorDetail;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Swarm-wide failure rate over the recent time window exceeds the threshold once enough
 * calls have been made.
 */
public class HighErrorRateDetector implements Detector {

    public static final String NAME = "high-error-rate";

    private final SwarmProbeProperties.Detection config;

    public HighErrorRateDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ViolationGate newGate() {
        return new ConsecutiveGate(2);
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        var since = snapshot.capturedAt().minusMillis(config.getErrorRateWindowMs());
        var recent = new ArrayList<ApiCallRecord>();
        for (MemberSnapshot member : snapshot.members()) {
            member.apiCalls().stream()
                    .filter(c -> !c.timestamp().isBefore(since))
                    .forEach(recent::add);
        }
        if (recent.size() < config.getErrorRateMinSamples()) {
            return Optional.empty();
        }
        long failures = recent.stream().filter(c -> !c.success()).count();
        double rate = (double) failures / recent.size();
        if (rate <= config.getErrorRateThreshold()) {
            return Optional.empty();
        }
        return Optional.of(toFinding(snapshot, recent, failures, rate));
    }

    private Finding toFinding(SwarmSnapshot snapshot, List<ApiCallRecord> recent, long failures, double rate) {
        Map<String, Long> byEndpoint = new TreeMap<>();
        recent.stream().filter(c -> !c.success())
                .forEach(c -> byEndpoint.merge(c.endpoint(), 1L, Long::sum));
        var logs = new ArrayList<String>();
        byEndpoint.forEach((endpoint, count) -> logs.add("%s: %d failures".formatted(endpoint, count)));

        var latestError = snapshot.members().stream()
                .map(MemberSnapshot::lastError)
                .filter(Objects::nonNull)
                .max(Comparator.comparing(ErrorDetail::occurredAt))
                .orElse(null);
        var involved = snapshot.members().stream()
                .filter(m -> m.totalErrors() > 0)
                .toList();

        var issue = new Issue(
                IssueArea.PERFORMANCE,
                "High error rate: %.0f%% of calls failing".formatted(rate * 100),
                NAME,
                "Most calls to the world API should succeed",
                "%d of %d calls failed in the last %ds".formatted(failures, recent.size(),
                        config.getErrorRateWindowMs() / 1000),
                List.of("Run the full swarm against the target",
                        "Count failed calls across all members over a one-minute window"),
                Severity.CRITICAL,
                Frequency.ALWAYS,
                IssueEvidence.of(involved.stream().map(MemberSnapshot::displayId).toList(),
                                List.of(snapshot.capturedAt()), logs)
                        .withHttpFailure(latestError)
                        .withStateTable(DetectorSupport.rows(involved)));
        return new Finding(issue, "global");
    }
}
