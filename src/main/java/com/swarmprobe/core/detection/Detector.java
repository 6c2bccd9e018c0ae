package com.swarmprobe.core.detection;

import java.util.Optional;

/**
 * A check over one swarm snapshot. Implementations read only the snapshot (plus whatever
 * bookkeeping they keep about earlier snapshots) and never touch live members.
 */
public interface Detector {

    /** Stable name, used in fingerprints and metrics. */
    String name();

    /** A fresh gate for this detector; the bank owns one per detector. */
    default ViolationGate newGate() {
        return new ImmediateGate();
    }

    Optional<Finding> evaluate(SwarmSnapshot snapshot);
}
