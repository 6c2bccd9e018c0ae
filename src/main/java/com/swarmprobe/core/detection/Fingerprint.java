package com.swarmprobe.core.detection;

/**
 * Deduplication key for a detected anomaly.
 *
 * @param key detector-specific key evidence, e.g. a member id or a bucket
 */
public record Fingerprint(String area, String detector, String key) {

    @Override
    public String toString() {
        return area + "/" + detector + "/" + key;
    }
}
