package com.swarmprobe.core.reporting;

import com.swarmprobe.core.metrics.SwarmProbeMetrics;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Files detected issues on the tracker, commenting on an open duplicate instead of
 * creating a new one. Tracker failures are logged and reported as an empty result.
 */
public class IssueReporter {

    private static final Logger log = LoggerFactory.getLogger(IssueReporter.class);

    public static final String TITLE_PREFIX = "[Resident-Agent]";

    private final IssueTracker tracker;
    private final IssueBodyFormatter formatter;
    private final SwarmProbeMetrics metrics;
    private final Clock clock;
    private final String markerLabel;
    private final double similarityThreshold;
    private final boolean dryRun;

    public IssueReporter(IssueTracker tracker, IssueBodyFormatter formatter, SwarmProbeMetrics metrics,
                         Clock clock, String markerLabel, double similarityThreshold, boolean dryRun) {
        this.tracker = tracker;
        this.formatter = formatter;
        this.metrics = metrics;
        this.clock = clock;
        this.markerLabel = markerLabel;
        this.similarityThreshold = similarityThreshold;
        this.dryRun = dryRun;
    }

    public static String title(Issue issue) {
        return TITLE_PREFIX + "[" + issue.area() + "] " + issue.title();
    }

    public List<String> labels(Issue issue) {
        return List.of(markerLabel, IssueArea.label(issue.area()), issue.severity().label().toLowerCase());
    }

    public Optional<ReportOutcome> report(Issue issue) {
        var title = title(issue);
        var body = formatter.body(issue);

        if (dryRun) {
            log.info("[dry-run] Would create issue '{}' with labels {}\n{}", title, labels(issue), body);
            metrics.recordIssue(issue.area(), "dry_run");
            return Optional.of(new ReportOutcome("dry-run-" + clock.millis(), true));
        }

        try {
            var duplicate = tracker.listOpenIssues(markerLabel).stream()
                    .filter(open -> TitleNormalizer.isDuplicate(title, issue.area(), open, similarityThreshold))
                    .findFirst();
            if (duplicate.isPresent()) {
                var ref = duplicate.get().reference();
                log.info("Issue '{}' duplicates open #{} '{}', commenting", title, ref, duplicate.get().title());
                tracker.addComment(ref, formatter.reobservedComment(issue));
                metrics.recordIssue(issue.area(), "duplicate");
                return Optional.of(new ReportOutcome(ref, false));
            }

            var created = tracker.createIssue(title, body, labels(issue));
            metrics.recordIssue(issue.area(), "created");
            return Optional.of(new ReportOutcome(created.reference(), true));
        } catch (TrackerException e) {
            log.error("Failed to report issue '{}': {}", title, e.getMessage());
            metrics.recordIssue(issue.area(), "failed");
            return Optional.empty();
        }
    }

    /**
     * Comments on an already filed issue that the swarm has seen again.
     */
    public void reobserved(String reference, Issue issue) {
        if (dryRun || reference == null || reference.startsWith("dry-run-")) {
            log.info("[dry-run] Would comment on {} for '{}'", reference, title(issue));
            return;
        }
        try {
            tracker.addComment(reference, formatter.reobservedComment(issue));
        } catch (TrackerException e) {
            log.error("Failed to comment on #{}: {}", reference, e.getMessage());
        }
    }

    public boolean isDryRun() {
        return dryRun;
    }
}
