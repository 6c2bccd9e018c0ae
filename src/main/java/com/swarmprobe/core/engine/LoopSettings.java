package com.swarmprobe.core.engine;

import com.swarmprobe.core.model.StressParameters;

import java.time.Duration;

/**
 * Orchestrator timings and the stress the run starts with.
 */
public record LoopSettings(
    StressParameters stress,
    long issueCheckIntervalMs,
    int escalateAfterCycles,
    Duration shutdownTimeout
) {
}
