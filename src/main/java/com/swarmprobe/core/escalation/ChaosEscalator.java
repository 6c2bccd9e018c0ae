package com.swarmprobe.core.escalation;

import com.swarmprobe.core.metrics.SwarmProbeMetrics;
import com.swarmprobe.core.model.MemberRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Five-rung chaos ladder, advanced once per orchestrator cycle without an issue.
 * <p>
 * Rungs: add members, shorten cycle delay, high-entropy behaviour, add spammers, convert
 * everyone to chaos. Advancing past the last rung returns to rung zero without applying
 * anything. {@link #reset()} only moves the ladder back; changes already applied to the
 * swarm stay in place.
 */
public class ChaosEscalator {

    private static final Logger log = LoggerFactory.getLogger(ChaosEscalator.class);

    public static final int TOP_RUNG = 5;

    private final SwarmControl swarm;
    private final int memberIncrement;
    private final long escalatedCycleDelayMs;
    private final SwarmProbeMetrics metrics;

    private int level;

    public ChaosEscalator(SwarmControl swarm, int memberIncrement, long escalatedCycleDelayMs,
                          SwarmProbeMetrics metrics) {
        this.swarm = swarm;
        this.memberIncrement = memberIncrement;
        this.escalatedCycleDelayMs = escalatedCycleDelayMs;
        this.metrics = metrics;
    }

    /**
     * Moves one rung up and applies it.
     *
     * @return the rung now in effect, 0 after wrapping
     */
    public synchronized int advance() {
        level++;
        switch (level) {
            case 1 -> {
                log.warn("Chaos escalation 1: adding {} members", memberIncrement);
                swarm.addMembers(memberIncrement, null);
            }
            case 2 -> {
                log.warn("Chaos escalation 2: cycle delay down to {}ms", escalatedCycleDelayMs);
                swarm.setCycleDelay(escalatedCycleDelayMs);
            }
            case 3 -> {
                log.warn("Chaos escalation 3: high-entropy behaviour for all roles");
                swarm.enableHighEntropy();
            }
            case 4 -> {
                log.warn("Chaos escalation 4: adding {} spammers", memberIncrement);
                swarm.addMembers(memberIncrement, MemberRole.SPAMMER);
            }
            case 5 -> {
                log.warn("Chaos escalation 5: converting the whole swarm to chaos");
                swarm.convertAll(MemberRole.CHAOS);
            }
            default -> {
                log.warn("Chaos escalation exhausted, back to rung 0");
                level = 0;
            }
        }
        if (level > 0) {
            metrics.incrementEscalations(level);
        }
        return level;
    }

    public synchronized void reset() {
        if (level != 0) {
            log.info("Chaos escalation reset from rung {}", level);
        }
        level = 0;
    }

    public synchronized int level() {
        return level;
    }
}
