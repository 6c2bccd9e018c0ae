package com.swarmprobe.core.reporting;

import java.util.List;

/**
 * Minimal issue tracker contract: list open issues by label, create, comment.
 * All methods throw {@link TrackerException} on failure.
 */
public interface IssueTracker {

    List<TrackedIssue> listOpenIssues(String label);

    TrackedIssue createIssue(String title, String body, List<String> labels);

    void addComment(String reference, String body);

    /** Lightweight reachability probe used by the health check. */
    boolean reachable();

    String describe();
}
