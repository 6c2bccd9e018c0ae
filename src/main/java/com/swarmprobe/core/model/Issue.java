package com.swarmprobe.core.model;

import java.util.List;

/**
 * A detected anomaly, ready to be reported. Immutable once created.
 *
 * @param area               area tag, see {@link IssueArea}
 * @param title              short human title without tags
 * @param detector           name of the detector that produced it
 * @param expectedBehavior   what should have happened
 * @param observedBehavior   what the swarm saw instead
 * @param reproductionSteps  ordered steps
 * @param severity           impact
 * @param frequency          how often the condition is expected to reproduce
 * @param evidence           supporting evidence
 */
public record Issue(
    String area,
    String title,
    String detector,
    String expectedBehavior,
    String observedBehavior,
    List<String> reproductionSteps,
    Severity severity,
    Frequency frequency,
    IssueEvidence evidence
) {
    public Issue {
        reproductionSteps = List.copyOf(reproductionSteps);
    }
}
