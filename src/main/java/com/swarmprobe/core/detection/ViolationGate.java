package com.swarmprobe.core.detection;

/**
 * Decides when repeated violations are strong enough to surface.
 */
public interface ViolationGate {

    /**
     * Records one evaluation.
     *
     * @return true when the detector should fire this cycle
     */
    boolean record(boolean violated);

    void reset();
}
