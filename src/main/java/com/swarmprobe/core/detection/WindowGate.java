package com.swarmprobe.core.detection;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Opens when at least {@code required} of the last {@code window} evaluations violated.
 */
public final class WindowGate implements ViolationGate {

    private final int required;
    private final int window;
    private final Deque<Boolean> recent = new ArrayDeque<>();

    public WindowGate(int required, int window) {
        if (required <= 0 || window < required) {
            throw new IllegalArgumentException("need 0 < required <= window, got " + required + " of " + window);
        }
        this.required = required;
        this.window = window;
    }

    @Override
    public boolean record(boolean violated) {
        recent.addLast(violated);
        if (recent.size() > window) {
            recent.removeFirst();
        }
        if (!violated) {
            return false;
        }
        long hits = recent.stream().filter(Boolean::booleanValue).count();
        return hits >= required;
    }

    @Override
    public void reset() {
        recent.clear();
    }
}
