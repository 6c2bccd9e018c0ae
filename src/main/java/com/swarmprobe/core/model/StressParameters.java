package com.swarmprobe.core.model;

/**
 * Current stress applied to the target, as persisted in {@link LoopState}.
 */
public record StressParameters(
    StressLevel level,
    int memberCount,
    long cycleDelayMs,
    boolean chaosEnabled
) {

    public StressParameters withMemberCount(int count) {
        return new StressParameters(level, count, cycleDelayMs, chaosEnabled);
    }

    public StressParameters withCycleDelayMs(long delayMs) {
        return new StressParameters(level, memberCount, delayMs, chaosEnabled);
    }

    public StressParameters withChaosEnabled(boolean enabled) {
        return new StressParameters(level, memberCount, cycleDelayMs, enabled);
    }
}
