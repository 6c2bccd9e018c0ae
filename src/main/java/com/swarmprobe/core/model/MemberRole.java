package com.swarmprobe.core.model;

/**
 * Behavioral archetype of a swarm member. Each role has its own preference table,
 * mission scripts and chat lines in the role catalog.
 */
public enum MemberRole {
    EXPLORER,
    WORKER,
    SOCIALIZER,
    COORDINATOR,
    HELPER,
    MERCHANT,
    OBSERVER,
    AFK,
    CHAOS,
    SPAMMER;

    /** Lowercase name used in member display names and the role catalog file. */
    public String key() {
        return name().toLowerCase();
    }

    public static MemberRole fromKey(String key) {
        return MemberRole.valueOf(key.trim().toUpperCase());
    }
}
