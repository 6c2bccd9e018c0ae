package com.swarmprobe.core.behavior;

/**
 * One executable option for the current cycle. Discarded after selection.
 *
 * @param label         normalized label, e.g. "interact:whiteboard:write" or "wander"
 * @param category      coarse category
 * @param weight        non-negative selection weight
 * @param preferenceKey role-preference key that matched, or null when the epsilon default applied
 * @param operation     the call to run if selected
 */
public record ActionCandidate(
    String label,
    CandidateCategory category,
    double weight,
    String preferenceKey,
    Runnable operation
) {
    public ActionCandidate {
        if (weight < 0 || Double.isNaN(weight)) {
            throw new IllegalArgumentException("weight must be non-negative: " + weight);
        }
    }

    public ActionCandidate withWeight(double newWeight) {
        return new ActionCandidate(label, category, newWeight, preferenceKey, operation);
    }
}
