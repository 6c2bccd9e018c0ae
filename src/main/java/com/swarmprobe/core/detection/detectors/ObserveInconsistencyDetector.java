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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Members observing from practically the same spot at practically the same time got
 * different sets of facilities back.
 */
public class ObserveInconsistencyDetector implements Detector {

    public static final String NAME = "observe-inconsistency";

    private final SwarmProbeProperties.Detection config;

    public ObserveInconsistencyDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        Map<String, List<MemberSnapshot>> buckets = new TreeMap<>();
        for (MemberSnapshot member : snapshot.registered()) {
            if (member.lastObserveAt() == null || member.lastObservePosition() == null
                    || member.lastObservedFacilityIds().isEmpty()) {
                continue;
            }
            buckets.computeIfAbsent(member.lastObservePosition().bucket(config.getObserveBucketPx()),
                    k -> new ArrayList<>()).add(member);
        }

        for (var entry : buckets.entrySet()) {
            var group = entry.getValue().stream()
                    .sorted(Comparator.comparing(MemberSnapshot::memberId))
                    .toList();
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    var a = group.get(i);
                    var b = group.get(j);
                    if (DetectorSupport.millisBetween(a.lastObserveAt(), b.lastObserveAt()) > config.getFacilitySkewMs()) {
                        continue;
                    }
                    if (!a.lastObservedFacilityIds().equals(b.lastObservedFacilityIds())) {
                        return Optional.of(toFinding(entry.getKey(), a, b));
                    }
                }
            }
        }
        return Optional.empty();
    }

    private Finding toFinding(String bucket, MemberSnapshot a, MemberSnapshot b) {
        var issue = new Issue(
                IssueArea.SYNC,
                "Inconsistent observe results at " + bucket,
                NAME,
                "Observing from the same position at the same time should return the same facilities",
                "Member %s saw %d facilities, %s saw %d".formatted(
                        a.memberId(), a.lastObservedFacilityIds().size(),
                        b.memberId(), b.lastObservedFacilityIds().size()),
                List.of("Move two members to the same position",
                        "Call observe from both at the same time",
                        "Compare the facility ids returned"),
                Severity.MINOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(
                        List.of(a.memberId(), b.memberId()),
                        List.of(a.lastObserveAt(), b.lastObserveAt()),
                        List.of("Member %s: %s".formatted(a.memberId(), a.lastObservedFacilityIds().stream().sorted().toList()),
                                "Member %s: %s".formatted(b.memberId(), b.lastObservedFacilityIds().stream().sorted().toList())))
                        .withStateTable(DetectorSupport.rows(a, b)));
        return new Finding(issue, bucket);
    }
}
