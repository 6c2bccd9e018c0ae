package com.swarmprobe.core.detection;

import java.util.List;
import java.util.Optional;

/**
 * What one pass of the detector bank produced: at most one fresh finding, plus any
 * findings seen before it whose fingerprints were cooling down.
 */
public record CycleDetection(Finding fresh, List<SuppressedHit> suppressed) {

    public static final CycleDetection NONE = new CycleDetection(null, List.of());

    public CycleDetection {
        suppressed = List.copyOf(suppressed);
    }

    public Optional<Finding> freshFinding() {
        return Optional.ofNullable(fresh);
    }
}
