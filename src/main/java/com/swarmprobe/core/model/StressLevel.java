package com.swarmprobe.core.model;

/**
 * Coarse stress setting chosen on the command line. Scales the member cycle delay.
 */
public enum StressLevel {
    LOW(2.0),
    MEDIUM(1.0),
    HIGH(0.5);

    private final double delayFactor;

    StressLevel(double delayFactor) {
        this.delayFactor = delayFactor;
    }

    public long scaleDelayMs(long baseDelayMs) {
        return Math.max(50, Math.round(baseDelayMs * delayFactor));
    }

    public static StressLevel fromKey(String key) {
        return StressLevel.valueOf(key.trim().toUpperCase());
    }
}
