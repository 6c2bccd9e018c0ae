package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.model.FacilityObservation;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Two members saw the same facility within a short interval but were offered different
 * affordances.
 */
public class FacilityStateDivergenceDetector implements Detector {

    public static final String NAME = "facility-state-divergence";

    private final SwarmProbeProperties.Detection config;

    public FacilityStateDivergenceDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        Map<String, List<Sighting>> byFacility = new TreeMap<>();
        var members = snapshot.registered().stream()
                .sorted(Comparator.comparing(MemberSnapshot::memberId))
                .toList();
        for (MemberSnapshot member : members) {
            for (FacilityObservation facility : member.facilities().values()) {
                byFacility.computeIfAbsent(facility.id(), k -> new ArrayList<>())
                        .add(new Sighting(member, facility));
            }
        }

        for (var entry : byFacility.entrySet()) {
            var sightings = entry.getValue();
            for (int i = 0; i < sightings.size(); i++) {
                for (int j = i + 1; j < sightings.size(); j++) {
                    var a = sightings.get(i);
                    var b = sightings.get(j);
                    if (DetectorSupport.millisBetween(a.facility().observedAt(), b.facility().observedAt())
                            > config.getFacilitySkewMs()) {
                        continue;
                    }
                    if (!new HashSet<>(a.facility().affordances()).equals(new HashSet<>(b.facility().affordances()))) {
                        return Optional.of(toFinding(entry.getKey(), a, b));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private Finding toFinding(String facilityId, Sighting a, Sighting b) {
        var issue = new Issue(
                IssueArea.INTERACTABLES,
                "Facility state divergence for " + facilityId,
                NAME,
                "Every member should see the same affordances on a facility at the same time",
                "Member %s sees %s while %s sees %s".formatted(
                        a.member().memberId(), a.facility().affordances(),
                        b.member().memberId(), b.facility().affordances()),
                List.of("Place two members near facility " + facilityId + " (" + a.facility().type() + ")",
                        "Observe from both members within two seconds",
                        "Compare the affordances offered"),
                Severity.MAJOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(
                        List.of(a.member().memberId(), b.member().memberId()),
                        List.of(a.facility().observedAt(), b.facility().observedAt()),
                        List.of("Member %s: %s".formatted(a.member().memberId(), a.facility().affordances()),
                                "Member %s: %s".formatted(b.member().memberId(), b.facility().affordances())))
                        .withStateTable(DetectorSupport.rows(a.member(), b.member())));
        return new Finding(issue, facilityId);
    }

    private record Sighting(MemberSnapshot member, FacilityObservation facility) {}
}
