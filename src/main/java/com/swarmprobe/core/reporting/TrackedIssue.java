package com.swarmprobe.core.reporting;

import java.util.List;

/**
 * An open issue as listed by the tracker.
 *
 * @param reference tracker reference used for comments (the issue number on GitHub)
 * @param url       browser URL, may be empty
 */
public record TrackedIssue(String reference, String title, List<String> labels, String url) {

    public TrackedIssue {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
