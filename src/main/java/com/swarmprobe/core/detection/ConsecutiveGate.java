package com.swarmprobe.core.detection;

/**
 * Opens after {@code required} consecutive violations and stays open while they continue.
 * Any negative evaluation resets the count.
 */
public final class ConsecutiveGate implements ViolationGate {

    private final int required;
    private int count;

    public ConsecutiveGate(int required) {
        if (required <= 0) {
            throw new IllegalArgumentException("required must be positive: " + required);
        }
        this.required = required;
    }

    @Override
    public boolean record(boolean violated) {
        if (!violated) {
            count = 0;
            return false;
        }
        count++;
        return count >= required;
    }

    @Override
    public void reset() {
        count = 0;
    }

    public int count() {
        return count;
    }
}
