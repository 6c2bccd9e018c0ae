package com.swarmprobe.core.detection.detectors;

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

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;

/**
 * A member keeps choosing from a very small set of actions.
 */
public class LowDecisionEntropyDetector implements Detector {

    public static final String NAME = "low-decision-entropy";

    private final SwarmProbeProperties.Detection config;

    public LowDecisionEntropyDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        return snapshot.registered().stream()
                .filter(m -> m.actionLabels().size() >= config.getEntropyMinActions())
                .filter(m -> distinct(recent(m)) < config.getEntropyMinDistinct())
                .min(Comparator.comparing(MemberSnapshot::memberId))
                .map(this::toFinding);
    }

    private List<String> recent(MemberSnapshot member) {
        var labels = member.actionLabels();
        return labels.subList(labels.size() - config.getEntropyMinActions(), labels.size());
    }

    private static int distinct(List<String> labels) {
        return new HashSet<>(labels).size();
    }

    private Finding toFinding(MemberSnapshot member) {
        var recent = recent(member);
        var issue = new Issue(
                IssueArea.AIC,
                "Low decision entropy for " + member.memberId(),
                NAME,
                "Members should vary their actions over time",
                "Only %d distinct actions in the last %d (%s)".formatted(
                        distinct(recent), recent.size(), String.join(", ", new HashSet<>(recent))),
                List.of("Spawn a " + member.role().key() + " member",
                        "Record its chosen actions for %d cycles".formatted(config.getEntropyMinActions()),
                        "Count the distinct actions"),
                Severity.MINOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(List.of(member.memberId()), List.of(member.capturedAt()),
                                List.of("Recent actions: " + String.join(", ", recent)))
                        .withStateTable(DetectorSupport.rows(member)));
        return new Finding(issue, member.memberId());
    }
}
