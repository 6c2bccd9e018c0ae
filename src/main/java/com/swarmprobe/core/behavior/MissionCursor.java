package com.swarmprobe.core.behavior;

/**
 * Position inside a role's mission scripts. Steps advance after their cycle duration;
 * exhausted missions advance to the next one and the list loops.
 *
 * @param missionIndex   index into the role's missions
 * @param stepIndex      index into the mission's steps
 * @param cyclesOnStep   cycles already spent on the current step
 */
public record MissionCursor(int missionIndex, int stepIndex, int cyclesOnStep) {

    public static final MissionCursor START = new MissionCursor(0, 0, 0);

    /** The step this cursor points at, or null when the role has no missions. */
    public MissionStep currentStep(RoleProfile profile) {
        if (profile.missions().isEmpty()) {
            return null;
        }
        var mission = profile.missions().get(missionIndex % profile.missions().size());
        return mission.steps().get(stepIndex % mission.steps().size());
    }

    public MissionCursor advance(RoleProfile profile) {
        var step = currentStep(profile);
        if (step == null) {
            return this;
        }
        if (cyclesOnStep + 1 < step.durationCycles()) {
            return new MissionCursor(missionIndex, stepIndex, cyclesOnStep + 1);
        }
        var missions = profile.missions();
        var mission = missions.get(missionIndex % missions.size());
        if (stepIndex + 1 < mission.steps().size()) {
            return new MissionCursor(missionIndex, stepIndex + 1, 0);
        }
        return new MissionCursor((missionIndex + 1) % missions.size(), 0, 0);
    }
}
