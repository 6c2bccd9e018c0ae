package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberRole;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A member has had an interactable facility in range for a while but has not interacted
 * with anything. Roles that are expected to stand around are skipped.
 */
public class IdleDespiteOpportunityDetector implements Detector {

    public static final String NAME = "idle-despite-opportunity";

    static final Set<MemberRole> PASSIVE_ROLES = Set.of(MemberRole.AFK, MemberRole.OBSERVER);

    private final SwarmProbeProperties.Detection config;

    public IdleDespiteOpportunityDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        var now = snapshot.capturedAt();
        return snapshot.registered().stream()
                .filter(m -> !PASSIVE_ROLES.contains(m.role()))
                .filter(m -> isIdle(m, now))
                .min(Comparator.comparing(MemberSnapshot::memberId))
                .map(m -> toFinding(m, now));
    }

    private boolean isIdle(MemberSnapshot member, Instant now) {
        if (member.inRangeSince() == null) {
            return false;
        }
        long threshold = config.getIdleOpportunityMs();
        if (Duration.between(member.inRangeSince(), now).toMillis() < threshold) {
            return false;
        }
        return member.lastInteractionAt() == null
                || Duration.between(member.lastInteractionAt(), now).toMillis() >= threshold;
    }

    private Finding toFinding(MemberSnapshot member, Instant now) {
        var inRange = member.facilities().values().stream()
                .filter(f -> member.lastObservedFacilityIds().contains(f.id()) && !f.affordances().isEmpty())
                .map(f -> "%s (%s) offers %s".formatted(f.id(), f.type(), f.affordances()))
                .sorted()
                .toList();
        var issue = new Issue(
                IssueArea.INTERACTABLES,
                "Member %s idle next to interactable facilities".formatted(member.memberId()),
                NAME,
                "Members with facilities in range should interact with them",
                "In range since %s with no interaction for %ds; recent actions: %s".formatted(
                        member.inRangeSince(), Duration.between(member.inRangeSince(), now).toSeconds(),
                        String.join(", ", member.actionLabels())),
                List.of("Move a " + member.role().key() + " member next to a facility",
                        "Observe to confirm the facility offers affordances",
                        "Watch whether the member ever interacts"),
                Severity.MINOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(List.of(member.memberId()), List.of(member.inRangeSince(), now), inRange)
                        .withStateTable(DetectorSupport.rows(member)));
        return new Finding(issue, member.memberId());
    }
}
