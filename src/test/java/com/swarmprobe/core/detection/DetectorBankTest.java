package com.swarmprobe.core.detection;

import com.swarmprobe.core.metrics.SwarmProbeMetrics;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.Severity;
import com.swarmprobe.core.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DetectorBank}.
 */
class DetectorBankTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private SimpleMeterRegistry registry;
    private SwarmProbeMetrics metrics;
    private FingerprintStore fingerprints;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SwarmProbeMetrics(registry);
        fingerprints = new FingerprintStore(new MutableClock(NOW), Duration.ofMinutes(30));
    }

    private static SwarmSnapshot snapshot(long cycle) {
        return new SwarmSnapshot(NOW, cycle, List.of());
    }

    private static Finding finding(String detector, String key) {
        var issue = new Issue(IssueArea.SYNC, detector + " fired", detector, "expected", "observed",
                List.of("step"), Severity.MINOR, Frequency.SOMETIMES, IssueEvidence.of(List.of(), List.of(), List.of()));
        return new Finding(issue, key);
    }

    /** Fires on every evaluation and counts how often it ran. */
    private static final class AlwaysFires implements Detector {
        private final String name;
        private final ViolationGate gate;
        int evaluations;

        AlwaysFires(String name, ViolationGate gate) {
            this.name = name;
            this.gate = gate;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ViolationGate newGate() {
            return gate;
        }

        @Override
        public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
            evaluations++;
            return Optional.of(finding(name, "k"));
        }
    }

    private static final class Quiet implements Detector {
        int evaluations;

        @Override
        public String name() {
            return "quiet";
        }

        @Override
        public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
            evaluations++;
            return Optional.empty();
        }
    }

    @Test
    @DisplayName("returns the fresh finding of a firing detector")
    void freshFinding() {
        var bank = new DetectorBank(List.of(new AlwaysFires("a", new ImmediateGate())), fingerprints,
                new Random(1), metrics);

        var detection = bank.scan(snapshot(1));

        assertTrue(detection.freshFinding().isPresent());
        assertEquals("a", detection.fresh().issue().detector());
        assertEquals(1.0, registry.counter("swarmprobe.detections.total", "detector", "a", "fresh", "true").count());
    }

    @Test
    @DisplayName("stops at the first fresh finding")
    void stopsAtFirstFinding() {
        var first = new AlwaysFires("a", new ImmediateGate());
        var second = new AlwaysFires("b", new ImmediateGate());
        var bank = new DetectorBank(List.of(first, second), fingerprints, new Random(3), metrics);

        bank.scan(snapshot(1));

        assertEquals(1, first.evaluations + second.evaluations);
    }

    @Test
    @DisplayName("gated detector fires only once its gate opens")
    void gateHoldsBackFirstViolation() {
        var bank = new DetectorBank(List.of(new AlwaysFires("a", new ConsecutiveGate(2))), fingerprints,
                new Random(1), metrics);

        assertTrue(bank.scan(snapshot(1)).freshFinding().isEmpty());
        assertTrue(bank.scan(snapshot(2)).freshFinding().isPresent());
    }

    @Test
    @DisplayName("finding cooling down is suppressed with the original reference")
    void coolingDownSuppressed() {
        var detector = new AlwaysFires("a", new ImmediateGate());
        fingerprints.record(finding("a", "k").fingerprint(), "17");
        var bank = new DetectorBank(List.of(detector), fingerprints, new Random(1), metrics);

        var detection = bank.scan(snapshot(1));

        assertTrue(detection.freshFinding().isEmpty());
        assertEquals(1, detection.suppressed().size());
        assertEquals("17", detection.suppressed().get(0).reference());
    }

    @Test
    @DisplayName("a throwing detector is skipped and counted")
    void throwingDetectorSkipped() {
        Detector broken = new Detector() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
                throw new IllegalStateException("boom");
            }
        };
        var quiet = new Quiet();
        var bank = new DetectorBank(List.of(broken, quiet), fingerprints, new Random(1), metrics);

        var detection = bank.scan(snapshot(1));

        assertSame(CycleDetection.NONE, detection);
        assertEquals(1, quiet.evaluations);
        assertEquals(1.0, registry.counter("swarmprobe.detector.failures", "detector", "broken").count());
    }

    @Test
    @DisplayName("same seed reproduces the same detector order")
    void seededOrderIsReproducible() {
        assertEquals(firingOrder(11), firingOrder(11));
    }

    private List<String> firingOrder(long seed) {
        var detectors = new ArrayList<Detector>();
        for (String name : List.of("a", "b", "c", "d", "e")) {
            detectors.add(new AlwaysFires(name, new ImmediateGate()));
        }
        var bank = new DetectorBank(detectors, new FingerprintStore(new MutableClock(NOW), Duration.ofMinutes(30)),
                new Random(seed), metrics);
        var order = new ArrayList<String>();
        for (int cycle = 1; cycle <= 10; cycle++) {
            order.add(bank.scan(snapshot(cycle)).fresh().issue().detector());
        }
        return order;
    }

    @Test
    void detectorNamesInRegistrationOrder() {
        var bank = new DetectorBank(List.of(new AlwaysFires("a", new ImmediateGate()), new Quiet()),
                fingerprints, new Random(1), metrics);

        assertEquals(List.of("a", "quiet"), bank.detectorNames());
    }
}
