package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.InteractionRecord;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Most of a member's recent interactions were rejected as too far or invalid, even though
 * they were only attempted against facilities the member believed to be in range.
 */
public class InteractFailurePatternDetector implements Detector {

    public static final String NAME = "interact-failure-pattern";

    private static final int WINDOW = 10;

    private final SwarmProbeProperties.Detection config;

    public InteractFailurePatternDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        for (MemberSnapshot member : sorted(snapshot)) {
            var recent = recent(member);
            if (recent.size() < config.getInteractMinSamples()) {
                continue;
            }
            long rejected = recent.stream().filter(InteractionRecord::isRejection).count();
            double rate = (double) rejected / recent.size();
            if (rate >= config.getInteractRejectionRate()) {
                return Optional.of(toFinding(member, recent, rejected));
            }
        }
        return Optional.empty();
    }

    private static List<MemberSnapshot> sorted(SwarmSnapshot snapshot) {
        return snapshot.registered().stream()
                .sorted(Comparator.comparing(MemberSnapshot::memberId))
                .toList();
    }

    private static List<InteractionRecord> recent(MemberSnapshot member) {
        var all = member.interactions();
        return all.subList(Math.max(0, all.size() - WINDOW), all.size());
    }

    private Finding toFinding(MemberSnapshot member, List<InteractionRecord> recent, long rejected) {
        var logs = recent.stream()
                .map(r -> "%s %s on %s -> %s".formatted(r.timestamp(), r.action(), r.targetId(), r.outcome()))
                .toList();
        var issue = new Issue(
                IssueArea.INTERACTABLES,
                "Interactions repeatedly rejected for " + member.memberId(),
                NAME,
                "Interactions with facilities reported in range should succeed",
                "%d of the last %d interactions were rejected as too_far or invalid_action".formatted(
                        rejected, recent.size()),
                List.of("Observe facilities near a member",
                        "Interact with a facility reported within range using one of its affordances",
                        "Repeat and count rejections"),
                Severity.MINOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(List.of(member.memberId()),
                                List.of(recent.get(0).timestamp(), recent.get(recent.size() - 1).timestamp()),
                                logs)
                        .withHttpFailure(member.lastError())
                        .withStateTable(DetectorSupport.rows(member)));
        return new Finding(issue, member.memberId());
    }
}
