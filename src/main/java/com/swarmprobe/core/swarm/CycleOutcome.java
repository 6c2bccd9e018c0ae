package com.swarmprobe.core.swarm;

import com.swarmprobe.core.model.ErrorDetail;

/**
 * Result of one member cycle.
 *
 * @param label action label executed, "none" when nothing ran
 * @param error structured failure, or null when the cycle succeeded
 */
public record CycleOutcome(String label, ErrorDetail error) {

    public static final String NONE = "none";

    public static CycleOutcome ok(String label) {
        return new CycleOutcome(label, null);
    }

    public static CycleOutcome idle() {
        return new CycleOutcome(NONE, null);
    }

    public boolean succeeded() {
        return error == null;
    }
}
