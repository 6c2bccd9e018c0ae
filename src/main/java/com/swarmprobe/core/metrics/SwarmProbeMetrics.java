package com.swarmprobe.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for swarm runs.
 */
@Service
public class SwarmProbeMetrics {

    private final MeterRegistry registry;

    public SwarmProbeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordApiCall(String endpoint, boolean success, long ms) {
        Timer.builder("swarmprobe.api.duration")
                .tag("endpoint", endpoint)
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAction(String category) {
        Counter.builder("swarmprobe.actions.total")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordCycleDuration(long ms) {
        Timer.builder("swarmprobe.cycle.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDetection(String detector, boolean fresh) {
        Counter.builder("swarmprobe.detections.total")
                .tag("detector", detector)
                .tag("fresh", String.valueOf(fresh))
                .register(registry)
                .increment();
    }

    public void recordDetectorFailure(String detector) {
        Counter.builder("swarmprobe.detector.failures")
                .description("Detector evaluations that threw")
                .tag("detector", detector)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "created", "duplicate", "dry_run" or "failed"
     */
    public void recordIssue(String area, String outcome) {
        Counter.builder("swarmprobe.issues.total")
                .tag("area", area)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementEscalations(int rung) {
        Counter.builder("swarmprobe.escalations.total")
                .tag("rung", String.valueOf(rung))
                .register(registry)
                .increment();
    }

    public void recordMemberRetired(String role) {
        Counter.builder("swarmprobe.members.retired")
                .tag("role", role)
                .register(registry)
                .increment();
    }

    public void recordReregistration(boolean success) {
        Counter.builder("swarmprobe.members.reregistrations")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordSwarmSize(int members) {
        DistributionSummary.builder("swarmprobe.swarm.size")
                .description("Active members per orchestrator cycle")
                .register(registry)
                .record(members);
    }
}
