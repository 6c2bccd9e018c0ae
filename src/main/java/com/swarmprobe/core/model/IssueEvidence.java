package com.swarmprobe.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Evidence bundle attached to an {@link Issue}.
 *
 * @param memberIds       identities of the members involved
 * @param timestamps      relevant observation times
 * @param logs            free-text log lines, oldest first
 * @param httpFailure     structured failure of the call that triggered the issue (nullable)
 * @param stateTable      per-member state rows (may be empty)
 * @param coverageSummary endpoint coverage text (nullable)
 */
public record IssueEvidence(
    List<String> memberIds,
    List<Instant> timestamps,
    List<String> logs,
    ErrorDetail httpFailure,
    List<MemberStateRow> stateTable,
    String coverageSummary
) {
    public IssueEvidence {
        memberIds = List.copyOf(memberIds);
        timestamps = List.copyOf(timestamps);
        logs = List.copyOf(logs);
        stateTable = stateTable == null ? List.of() : List.copyOf(stateTable);
    }

    public static IssueEvidence of(List<String> memberIds, List<Instant> timestamps, List<String> logs) {
        return new IssueEvidence(memberIds, timestamps, logs, null, List.of(), null);
    }

    public IssueEvidence withHttpFailure(ErrorDetail detail) {
        return new IssueEvidence(memberIds, timestamps, logs, detail, stateTable, coverageSummary);
    }

    public IssueEvidence withStateTable(List<MemberStateRow> rows) {
        return new IssueEvidence(memberIds, timestamps, logs, httpFailure, rows, coverageSummary);
    }

    public IssueEvidence withCoverageSummary(String summary) {
        return new IssueEvidence(memberIds, timestamps, logs, httpFailure, stateTable, summary);
    }
}
