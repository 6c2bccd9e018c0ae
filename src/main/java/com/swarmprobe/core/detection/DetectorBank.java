package com.swarmprobe.core.detection;

import com.swarmprobe.core.metrics.SwarmProbeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Runs every detector over a snapshot in a fresh random order each cycle, stopping at the
 * first finding that passes its gate and is not cooling down.
 * <p>
 * The order comes from a seedable {@link Random}, so a fixed seed reproduces the same
 * sequence of permutations. A detector that throws is logged and skipped.
 */
public class DetectorBank {

    private static final Logger log = LoggerFactory.getLogger(DetectorBank.class);

    private final Map<Detector, ViolationGate> gates = new LinkedHashMap<>();
    private final FingerprintStore fingerprints;
    private final Random random;
    private final SwarmProbeMetrics metrics;

    public DetectorBank(List<Detector> detectors, FingerprintStore fingerprints, Random random,
                        SwarmProbeMetrics metrics) {
        for (Detector detector : detectors) {
            gates.put(detector, detector.newGate());
        }
        this.fingerprints = fingerprints;
        this.random = random;
        this.metrics = metrics;
    }

    public synchronized CycleDetection scan(SwarmSnapshot snapshot) {
        var order = permutation();
        var suppressed = new ArrayList<SuppressedHit>();

        for (Detector detector : order) {
            Finding finding;
            try {
                finding = detector.evaluate(snapshot).orElse(null);
            } catch (RuntimeException e) {
                log.error("Detector {} failed on cycle {}", detector.name(), snapshot.cycle(), e);
                metrics.recordDetectorFailure(detector.name());
                continue;
            }

            if (!gates.get(detector).record(finding != null) || finding == null) {
                continue;
            }

            var fingerprint = finding.fingerprint();
            if (fingerprints.isCoolingDown(fingerprint)) {
                log.debug("Detector {} re-observed {} inside cooldown", detector.name(), fingerprint);
                metrics.recordDetection(detector.name(), false);
                suppressed.add(new SuppressedHit(finding, fingerprints.reference(fingerprint).orElse(null)));
                continue;
            }

            log.info("Detector {} fired: {}", detector.name(), finding.issue().title());
            metrics.recordDetection(detector.name(), true);
            return new CycleDetection(finding, suppressed);
        }
        return suppressed.isEmpty() ? CycleDetection.NONE : new CycleDetection(null, suppressed);
    }

    public List<String> detectorNames() {
        return gates.keySet().stream().map(Detector::name).toList();
    }

    private List<Detector> permutation() {
        var order = new ArrayList<>(gates.keySet());
        Collections.shuffle(order, random);
        return order;
    }
}
