package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.ConsecutiveGate;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.detection.ViolationGate;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Members standing in the same spatial bucket, observing at about the same time, report very
 * different numbers of nearby entities. Each pair of observations counts once, so a pair that
 * has not observed again since the last cycle is not a new violation.
 */
public class EntityCountDivergenceDetector implements Detector {

    public static final String NAME = "entity-count-divergence";

    private final SwarmProbeProperties.Detection config;
    private Map<String, String> counted = new HashMap<>();

    public EntityCountDivergenceDetector(SwarmProbeProperties.Detection config) {
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
        Map<String, List<MemberSnapshot>> buckets = new TreeMap<>();
        for (MemberSnapshot member : snapshot.registered()) {
            if (member.lastObserveAt() == null || member.lastObservePosition() == null) {
                continue;
            }
            buckets.computeIfAbsent(member.lastObservePosition().bucket(config.getEntityBucketPx()),
                    k -> new ArrayList<>()).add(member);
        }

        var seen = new HashMap<String, String>();
        Finding finding = null;
        for (var entry : buckets.entrySet()) {
            var group = entry.getValue().stream()
                    .sorted(Comparator.comparing(MemberSnapshot::memberId))
                    .toList();
            for (int i = 0; i < group.size(); i++) {
                for (int j = i + 1; j < group.size(); j++) {
                    var a = group.get(i);
                    var b = group.get(j);
                    if (DetectorSupport.millisBetween(a.lastObserveAt(), b.lastObserveAt()) > config.getEntitySkewMs()) {
                        continue;
                    }
                    var pair = a.memberId() + "|" + b.memberId();
                    var observations = a.lastObserveAt() + "|" + b.lastObserveAt();
                    seen.put(pair, observations);
                    if (finding != null || observations.equals(counted.get(pair))) {
                        continue;
                    }
                    int max = Math.max(a.lastObservedEntityCount(), b.lastObservedEntityCount());
                    int min = Math.min(a.lastObservedEntityCount(), b.lastObservedEntityCount());
                    if (max > 0 && (double) max / Math.max(min, 1) > config.getEntityCountRatio()) {
                        finding = toFinding(entry.getKey(), a, b);
                    }
                }
            }
        }
        counted = seen;
        return Optional.ofNullable(finding);
    }

    private Finding toFinding(String bucket, MemberSnapshot a, MemberSnapshot b) {
        var issue = new Issue(
                IssueArea.SYNC,
                "Entity count divergence at " + bucket,
                NAME,
                "Members at the same location should see a similar number of nearby entities",
                "Member %s sees %d entities while %s sees %d".formatted(
                        a.memberId(), a.lastObservedEntityCount(), b.memberId(), b.lastObservedEntityCount()),
                List.of("Place two members in the same area",
                        "Observe from both within a second of each other",
                        "Compare the number of nearby entities returned"),
                Severity.MAJOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(
                        List.of(a.memberId(), b.memberId()),
                        List.of(a.lastObserveAt(), b.lastObserveAt()),
                        List.of("Member %s at %s: %d entities".formatted(a.memberId(), a.lastObservePosition(),
                                        a.lastObservedEntityCount()),
                                "Member %s at %s: %d entities".formatted(b.memberId(), b.lastObservePosition(),
                                        b.lastObservedEntityCount())))
                        .withStateTable(DetectorSupport.rows(a, b)));
        return new Finding(issue, bucket);
    }
}
