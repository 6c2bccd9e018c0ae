package com.swarmprobe.core.model;

import java.time.Instant;

/**
 * Outcome of an interaction with a facility or object.
 *
 * @param targetId  facility or entity id
 * @param action    affordance that was invoked
 * @param outcome   server outcome type: ok, no_effect, invalid_action, too_far, or "error"
 * @param timestamp when the interaction completed
 */
public record InteractionRecord(String targetId, String action, String outcome, Instant timestamp) {

    public static final String TOO_FAR = "too_far";
    public static final String INVALID_ACTION = "invalid_action";

    public boolean succeeded() {
        return "ok".equals(outcome);
    }

    public boolean isRejection() {
        return TOO_FAR.equals(outcome) || INVALID_ACTION.equals(outcome);
    }
}
