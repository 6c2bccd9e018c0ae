package com.swarmprobe.core.engine;

/**
 * Summary of one orchestrator cycle.
 *
 * @param issueReference reference of the issue created or matched this cycle (nullable)
 * @param created        whether a new issue was filed
 * @param comments       re-observation comments posted for suppressed findings
 * @param escalationRung rung after this cycle's escalation, or -1 when the ladder did not move
 */
public record CycleReport(
    long cycle,
    String issueReference,
    boolean created,
    int comments,
    int escalationRung,
    int activeMembers
) {

    public boolean escalated() {
        return escalationRung >= 0;
    }
}
