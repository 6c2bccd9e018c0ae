package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Two consecutive successful event polls by the same member are further apart than the
 * allowed gap.
 */
public class EventPollingGapDetector implements Detector {

    public static final String NAME = "event-polling-gap";

    private final SwarmProbeProperties.Detection config;

    public EventPollingGapDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        return snapshot.registered().stream()
                .filter(m -> m.lastPollSuccessAt() != null && m.previousPollSuccessAt() != null)
                .filter(m -> gapMs(m) > config.getPollGapMs())
                .min(Comparator.comparing(MemberSnapshot::memberId))
                .map(this::toFinding);
    }

    private static long gapMs(MemberSnapshot member) {
        return Duration.between(member.previousPollSuccessAt(), member.lastPollSuccessAt()).toMillis();
    }

    private Finding toFinding(MemberSnapshot member) {
        var issue = new Issue(
                IssueArea.AIC,
                "Event polling gap for " + member.memberId(),
                NAME,
                "Members should poll events at least every %ds".formatted(config.getPollGapMs() / 1000),
                "%dms passed between successful polls (cursor %s)".formatted(gapMs(member), member.eventCursor()),
                List.of("Register a member and poll events regularly",
                        "Measure the time between successful polls"),
                Severity.MINOR,
                Frequency.RARE,
                IssueEvidence.of(List.of(member.memberId()),
                                List.of(member.previousPollSuccessAt(), member.lastPollSuccessAt()),
                                List.of())
                        .withHttpFailure(member.lastError())
                        .withStateTable(DetectorSupport.rows(member)));
        return new Finding(issue, member.memberId());
    }
}
