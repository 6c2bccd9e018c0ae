package com.swarmprobe.core.model;

/**
 * Lifecycle phase of a swarm member.
 * <p>
 * {@code UNREGISTERED -> REGISTERED -> ACTIVE <-> REREGISTERING -> RETIRED}.
 * {@link #RETIRED} is terminal.
 */
public enum MemberPhase {
    UNREGISTERED,
    REGISTERED,
    ACTIVE,
    REREGISTERING,
    RETIRED;

    public boolean isTerminal() {
        return this == RETIRED;
    }
}
