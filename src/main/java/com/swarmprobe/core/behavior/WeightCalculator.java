package com.swarmprobe.core.behavior;

/**
 * Computes {@code rolePreference × novelty × missionBoost} and the situational
 * multipliers applied on top of it.
 */
public class WeightCalculator {

    public static final double[] NOVELTY = {1.0, 0.7, 0.4, 0.1};

    public static final double MISSION_EXACT = 3.0;
    public static final double MISSION_CATEGORY = 1.5;
    public static final double MISSION_OTHER = 0.6;

    public static final double STARVATION_WANDER = 5.0;
    public static final double ERROR_BACKOFF = 0.2;
    public static final double DAMPEN_FACILITY_NAVIGATE = 0.5;
    public static final double DAMPEN_ENTITY_NAVIGATE = 0.3;

    private static final double UNIFORM_PREFERENCE = 1.0;

    /**
     * Weight of a candidate before situational dampening.
     *
     * @param preference resolved preference for the candidate
     */
    public double weigh(String label, CandidateCategory category, PreferenceMatch preference,
                        SelectionContext context) {
        double pref = preference.value();
        if (context.highEntropy()) {
            pref = (pref + UNIFORM_PREFERENCE) / 2.0;
        }
        double weight = pref * novelty(label, context) * missionBoost(label, category, context.missionStep());

        if (context.starving() && category == CandidateCategory.WANDER) {
            weight *= STARVATION_WANDER;
        }
        for (String endpoint : context.failingEndpoints()) {
            if (category.callsEndpoint(endpoint)) {
                weight *= ERROR_BACKOFF;
                break;
            }
        }
        return weight;
    }

    public double novelty(String label, SelectionContext context) {
        int occurrences = 0;
        for (String recent : context.recentLabels()) {
            if (recent.equals(label)) {
                occurrences++;
            }
        }
        return NOVELTY[Math.min(occurrences, NOVELTY.length - 1)];
    }

    public double missionBoost(String label, CandidateCategory category, MissionStep step) {
        if (step == null) {
            return 1.0;
        }
        if (step.matchesLabel(label)) {
            return MISSION_EXACT;
        }
        if (step.category().equals(category.key())) {
            return MISSION_CATEGORY;
        }
        return MISSION_OTHER;
    }
}
