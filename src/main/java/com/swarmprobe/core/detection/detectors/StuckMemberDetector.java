package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.ConsecutiveGate;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.detection.ViolationGate;
import com.swarmprobe.core.model.ApiCallRecord;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A member has had no successful call for the idle threshold while most of its recent
 * calls fail.
 */
public class StuckMemberDetector implements Detector {

    public static final String NAME = "stuck-member";

    private final SwarmProbeProperties.Detection config;

    public StuckMemberDetector(SwarmProbeProperties.Detection config) {
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ViolationGate newGate() {
        return new ConsecutiveGate(2);
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        return snapshot.registered().stream()
                .sorted(Comparator.comparing(MemberSnapshot::memberId))
                .filter(m -> isStuck(m, snapshot.capturedAt()))
                .findFirst()
                .map(m -> toFinding(m, snapshot.capturedAt()));
    }

    private boolean isStuck(MemberSnapshot member, Instant now) {
        var since = idleSince(member);
        if (since == null) {
            return false;
        }
        return Duration.between(since, now).toMillis() >= config.getStuckIdleMs()
                && member.recentFailureRate(config.getStuckCallWindow()) >= config.getStuckFailureRate();
    }

    private static Instant idleSince(MemberSnapshot member) {
        if (member.lastSuccessfulActionAt() != null) {
            return member.lastSuccessfulActionAt();
        }
        return member.apiCalls().isEmpty() ? null : member.apiCalls().get(0).timestamp();
    }

    private Finding toFinding(MemberSnapshot member, Instant now) {
        long idleSec = Duration.between(idleSince(member), now).toSeconds();
        double rate = member.recentFailureRate(config.getStuckCallWindow());
        var recent = member.apiCalls().subList(Math.max(0, member.apiCalls().size() - 5), member.apiCalls().size());
        var logs = recent.stream().map(StuckMemberDetector::describe).toList();
        var issue = new Issue(
                IssueArea.PERFORMANCE,
                "Member " + member.memberId() + " appears stuck",
                NAME,
                "Members should be able to perform actions continuously",
                "No successful action for %ds; %s of recent calls failed".formatted(
                        idleSec, DetectorSupport.fmt(rate)),
                List.of("Spawn a member in the world",
                        "Let it cycle through its role behaviour",
                        "Watch for calls that keep failing with no success in between"),
                Severity.MINOR,
                Frequency.RARE,
                IssueEvidence.of(List.of(member.memberId()), List.of(idleSince(member), now), logs)
                        .withHttpFailure(member.lastError())
                        .withStateTable(DetectorSupport.rows(member)));
        return new Finding(issue, member.memberId());
    }

    private static String describe(ApiCallRecord call) {
        return "%s %s %s (HTTP %s, %s)".formatted(call.timestamp(), call.endpoint(),
                call.success() ? "ok" : "failed", call.httpStatus(), call.errorCode());
    }
}
