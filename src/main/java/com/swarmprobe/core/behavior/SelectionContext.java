package com.swarmprobe.core.behavior;

import java.util.List;
import java.util.Set;

/**
 * Member-local inputs to weighting for one cycle.
 *
 * @param profile          the member's current role profile
 * @param recentLabels     most recent action labels, oldest first (the novelty window)
 * @param missionStep      current mission step, or null when the role has no missions
 * @param starving         nothing observed on the last observation
 * @param failingEndpoints endpoints failing recently; non-empty only above the suppression threshold
 * @param highEntropy      preferences blended toward uniform
 */
public record SelectionContext(
    RoleProfile profile,
    List<String> recentLabels,
    MissionStep missionStep,
    boolean starving,
    Set<String> failingEndpoints,
    boolean highEntropy
) {
    public SelectionContext {
        recentLabels = List.copyOf(recentLabels);
        failingEndpoints = Set.copyOf(failingEndpoints);
    }
}
