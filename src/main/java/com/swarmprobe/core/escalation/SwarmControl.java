package com.swarmprobe.core.escalation;

import com.swarmprobe.core.model.MemberRole;

/**
 * Operations escalation may apply to the running swarm. None of them touch member state
 * directly; members pick up shared settings at the start of their next cycle.
 */
public interface SwarmControl {

    /**
     * @param role role for every new member, or null to continue the round-robin assignment
     */
    void addMembers(int count, MemberRole role);

    void setCycleDelay(long cycleDelayMs);

    void enableHighEntropy();

    void convertAll(MemberRole role);
}
