package com.swarmprobe.core.behavior;

/**
 * One step of a mission script.
 *
 * @param action         exact candidate label this step boosts, or a label prefix ending in ':'
 * @param category       category key boosted at the lower rate
 * @param durationCycles member cycles spent on this step before advancing
 */
public record MissionStep(String action, String category, int durationCycles) {

    public MissionStep {
        if (durationCycles <= 0) {
            throw new IllegalArgumentException("durationCycles must be positive: " + durationCycles);
        }
    }

    public boolean matchesLabel(String label) {
        return action.endsWith(":") ? label.startsWith(action) : action.equals(label);
    }
}
