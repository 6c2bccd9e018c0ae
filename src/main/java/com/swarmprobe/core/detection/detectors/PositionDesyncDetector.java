package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.detection.ViolationGate;
import com.swarmprobe.core.detection.WindowGate;
import com.swarmprobe.core.model.EntityTrack;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An observed entity jumps further than the minimum jump, faster than the speed threshold,
 * between two sightings that are close together in time. Each sighting pair counts once.
 */
public class PositionDesyncDetector implements Detector {

    public static final String NAME = "position-desync";

    private final SwarmProbeProperties.Detection config;
    private Map<String, Instant> counted = new HashMap<>();

    public PositionDesyncDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ViolationGate newGate() {
        return new WindowGate(2, 3);
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        var seen = new HashMap<String, Instant>();
        Finding finding = null;
        for (MemberSnapshot member : snapshot.registered()) {
            var tracks = member.entityTracks().values().stream()
                    .filter(EntityTrack::hasPrevious)
                    .sorted(Comparator.comparing(EntityTrack::entityId))
                    .toList();
            for (EntityTrack track : tracks) {
                var key = member.memberId() + "/" + track.entityId();
                var sightingAt = track.current().observedAt();
                seen.put(key, sightingAt);
                if (sightingAt.equals(counted.get(key))) {
                    continue;
                }
                if (finding == null && isViolation(track)) {
                    finding = toFinding(member, track);
                }
            }
        }
        counted = seen;
        return Optional.ofNullable(finding);
    }

    /**
     * True when the jump is at least the minimum distance, the sightings are within the
     * maximum delta, and the implied speed exceeds the threshold.
     */
    public boolean isViolation(EntityTrack track) {
        long deltaMs = track.deltaMs();
        if (deltaMs <= 0 || deltaMs > config.getDesyncMaxDeltaMs()) {
            return false;
        }
        double jump = track.jumpPx();
        return jump >= config.getDesyncMinJumpPx() && jump / deltaMs > config.getDesyncSpeedPxPerMs();
    }

    private Finding toFinding(MemberSnapshot member, EntityTrack track) {
        var prev = track.previous();
        var cur = track.current();
        double jump = track.jumpPx();
        long deltaMs = track.deltaMs();
        var issue = new Issue(
                IssueArea.SYNC,
                "Position desync detected for entity " + track.entityId(),
                NAME,
                "Entity positions should update smoothly without sudden jumps",
                "Entity %s jumped %spx in %dms (%s px/ms) as seen by %s".formatted(
                        track.entityId(), DetectorSupport.fmt(jump), deltaMs,
                        DetectorSupport.fmt(jump / deltaMs), member.memberId()),
                List.of("Run multiple members in the same room",
                        "Observe nearby entities every cycle",
                        "Compare consecutive sightings of the same entity"),
                Severity.MAJOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(
                        List.of(member.memberId()),
                        List.of(prev.observedAt(), cur.observedAt()),
                        List.of("Previous: (%s, %s) at %s".formatted(DetectorSupport.fmt(prev.position().x()),
                                        DetectorSupport.fmt(prev.position().y()), prev.observedAt()),
                                "Current: (%s, %s) at %s".formatted(DetectorSupport.fmt(cur.position().x()),
                                        DetectorSupport.fmt(cur.position().y()), cur.observedAt())))
                        .withStateTable(DetectorSupport.rows(member)));
        return new Finding(issue, track.entityId());
    }
}
