package com.swarmprobe.core.reporting;

import com.swarmprobe.core.model.ErrorDetail;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.MemberStateRow;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Renders issues and re-observation comments as GitHub-flavoured markdown.
 */
public class IssueBodyFormatter {

    private final BuildInfo buildInfo;
    private final Clock clock;
    private final int logTailLines;
    private final String targetUrl;
    private final String roomId;

    public IssueBodyFormatter(BuildInfo buildInfo, Clock clock, int logTailLines, String targetUrl, String roomId) {
        this.buildInfo = buildInfo;
        this.clock = clock;
        this.logTailLines = logTailLines;
        this.targetUrl = targetUrl;
        this.roomId = roomId;
    }

    public String body(Issue issue) {
        var evidence = issue.evidence();
        var sb = new StringBuilder();

        sb.append("## Build Info\n");
        sb.append("- Commit SHA: ").append(buildInfo.commitSha()).append('\n');
        sb.append("- Timestamp: ").append(clock.instant()).append('\n');
        sb.append("- Java: ").append(buildInfo.javaVersion()).append(" on ").append(buildInfo.osName()).append("\n\n");

        sb.append("## Environment\n");
        sb.append("- Target: ").append(targetUrl).append('\n');
        sb.append("- Room: ").append(roomId).append('\n');
        sb.append("- Members involved: ").append(String.join(", ", evidence.memberIds())).append('\n');
        sb.append("- Detector: ").append(issue.detector()).append("\n\n");

        sb.append("## Bug Description\n\n");
        sb.append("### Expected Behavior\n").append(issue.expectedBehavior()).append("\n\n");
        sb.append("### Observed Behavior\n").append(issue.observedBehavior()).append("\n\n");

        sb.append("## Reproduction Steps\n");
        var steps = issue.reproductionSteps();
        for (int i = 0; i < steps.size(); i++) {
            sb.append(i + 1).append(". ").append(steps.get(i)).append('\n');
        }
        sb.append('\n');

        sb.append("## Metadata\n");
        sb.append("- Frequency: ").append(issue.frequency().label()).append('\n');
        sb.append("- Severity: ").append(issue.severity().label()).append("\n\n");

        if (evidence.httpFailure() != null) {
            appendHttpFailure(sb, evidence.httpFailure());
        }
        if (!evidence.stateTable().isEmpty()) {
            appendStateTable(sb, evidence.stateTable());
        }
        if (evidence.coverageSummary() != null) {
            sb.append("## API Coverage\n").append(evidence.coverageSummary()).append("\n\n");
        }

        sb.append("## Evidence\n");
        if (!evidence.timestamps().isEmpty()) {
            sb.append("Timestamps: ");
            sb.append(String.join(", ", evidence.timestamps().stream().map(Object::toString).toList()));
            sb.append("\n\n");
        }
        sb.append("```\n");
        for (String line : tail(evidence.logs())) {
            sb.append(line).append('\n');
        }
        sb.append("```\n\n");
        sb.append("---\n*Automatically generated by SwarmProbe*\n");
        return sb.toString();
    }

    public String reobservedComment(Issue issue) {
        return "Re-observed at %s by `%s`.\n\n%s\n\nMembers: %s".formatted(
                clock.instant(), issue.detector(), issue.observedBehavior(),
                String.join(", ", issue.evidence().memberIds()));
    }

    private List<String> tail(List<String> logs) {
        return logs.size() <= logTailLines ? logs : logs.subList(logs.size() - logTailLines, logs.size());
    }

    private static void appendHttpFailure(StringBuilder sb, ErrorDetail failure) {
        sb.append("## HTTP Failure\n");
        sb.append("| Endpoint | Class | Status | Code | Message | At |\n");
        sb.append("|---|---|---|---|---|---|\n");
        sb.append("| ").append(failure.endpoint())
                .append(" | ").append(failure.errorClass())
                .append(" | ").append(failure.httpStatus() == null ? "-" : failure.httpStatus())
                .append(" | ").append(failure.code() == null ? "-" : failure.code())
                .append(" | ").append(cell(failure.message()))
                .append(" | ").append(failure.occurredAt())
                .append(" |\n\n");
    }

    private static void appendStateTable(StringBuilder sb, List<MemberStateRow> rows) {
        sb.append("## Member State\n");
        sb.append("| Member | Role | Phase | Position | Entities | Facilities | Errors | Last action |\n");
        sb.append("|---|---|---|---|---|---|---|---|\n");
        for (MemberStateRow row : rows) {
            sb.append("| ").append(row.memberId())
                    .append(" | ").append(row.role().key())
                    .append(" | ").append(row.phase())
                    .append(" | ").append(String.format(Locale.ROOT, "(%.0f, %.0f)",
                            row.position().x(), row.position().y()))
                    .append(" | ").append(row.entityCount())
                    .append(" | ").append(row.facilityCount())
                    .append(" | ").append(row.errorCount())
                    .append(" | ").append(cell(row.lastAction()))
                    .append(" |\n");
        }
        sb.append('\n');
    }

    private static String cell(String text) {
        return text == null ? "-" : text.replace("|", "\\|").replace("\n", " ");
    }
}
