package com.swarmprobe.core.swarm;

import com.swarmprobe.core.model.MemberRole;

/**
 * Settings shared by every member and changed at runtime by escalation.
 * Members read them at the start of each cycle.
 */
public class SwarmSettings {

    private volatile long cycleDelayMs;
    private volatile boolean highEntropy;
    private volatile MemberRole roleOverride;

    public SwarmSettings(long cycleDelayMs) {
        this.cycleDelayMs = cycleDelayMs;
    }

    public long getCycleDelayMs() { return cycleDelayMs; }
    public void setCycleDelayMs(long cycleDelayMs) { this.cycleDelayMs = cycleDelayMs; }
    public boolean isHighEntropy() { return highEntropy; }
    public void setHighEntropy(boolean highEntropy) { this.highEntropy = highEntropy; }

    /** Role every member switches to, or null to keep assigned roles. */
    public MemberRole getRoleOverride() { return roleOverride; }
    public void setRoleOverride(MemberRole roleOverride) { this.roleOverride = roleOverride; }
}
