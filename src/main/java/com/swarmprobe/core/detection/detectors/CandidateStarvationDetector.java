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
import java.util.List;
import java.util.Optional;

/**
 * A member has observed nothing at all around it for many consecutive cycles.
 */
public class CandidateStarvationDetector implements Detector {

    public static final String NAME = "candidate-starvation";

    private final SwarmProbeProperties.Detection config;

    public CandidateStarvationDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        return snapshot.registered().stream()
                .filter(m -> m.starvedCycles() >= config.getStarvationMinCycles())
                .min(Comparator.comparing(MemberSnapshot::memberId))
                .map(this::toFinding);
    }

    private Finding toFinding(MemberSnapshot member) {
        var issue = new Issue(
                IssueArea.MOVEMENT,
                "Member %s sees no entities or facilities".formatted(member.memberId()),
                NAME,
                "Members should find entities or facilities to act on after moving around",
                "%d consecutive cycles with empty observations at %s".formatted(
                        member.starvedCycles(), member.position()),
                List.of("Register a member and let it wander",
                        "Observe after every move",
                        "Check whether observe ever returns anything nearby"),
                Severity.MAJOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(List.of(member.memberId()), List.of(member.lastObserveAt()),
                                List.of("Recent actions: " + String.join(", ", member.actionLabels())))
                        .withStateTable(DetectorSupport.rows(member)));
        return new Finding(issue, member.memberId());
    }
}
