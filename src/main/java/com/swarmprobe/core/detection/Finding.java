package com.swarmprobe.core.detection;

import com.swarmprobe.core.model.Issue;

/**
 * A detector's positive evaluation.
 *
 * @param issue       the issue to report
 * @param keyEvidence stable key identifying this instance of the anomaly
 */
public record Finding(Issue issue, String keyEvidence) {

    public Fingerprint fingerprint() {
        return new Fingerprint(issue.area(), issue.detector(), keyEvidence);
    }
}
