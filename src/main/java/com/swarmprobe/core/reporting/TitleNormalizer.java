package com.swarmprobe.core.reporting;

import com.swarmprobe.core.model.IssueArea;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Title normalization and duplicate matching against open tracker issues.
 */
public final class TitleNormalizer {

    private TitleNormalizer() {}

    /** Strips bracketed tags, lowercases, and collapses non-alphanumerics to single spaces. */
    public static String normalize(String title) {
        return title.replaceAll("\\[[^\\]]*\\]", " ")
                .toLowerCase()
                .replaceAll("[^a-z0-9]+", " ")
                .trim();
    }

    public static Set<String> tokens(String normalized) {
        if (normalized.isEmpty()) {
            return Set.of();
        }
        return Arrays.stream(normalized.split(" ")).collect(Collectors.toSet());
    }

    public static double tokenSimilarity(String a, String b) {
        var ta = tokens(a);
        var tb = tokens(b);
        if (ta.isEmpty() && tb.isEmpty()) {
            return 0.0;
        }
        var union = new HashSet<>(ta);
        union.addAll(tb);
        var common = new HashSet<>(ta);
        common.retainAll(tb);
        return (double) common.size() / union.size();
    }

    /**
     * A candidate duplicates an open issue when either normalized title contains the other,
     * or the open issue carries the same area label and the token similarity reaches
     * {@code threshold}.
     */
    public static boolean isDuplicate(String candidateTitle, String area, TrackedIssue existing, double threshold) {
        var candidate = normalize(candidateTitle);
        var other = normalize(existing.title());
        if (candidate.isEmpty() || other.isEmpty()) {
            return false;
        }
        if (candidate.contains(other) || other.contains(candidate)) {
            return true;
        }
        return existing.labels().contains(IssueArea.label(area))
                && tokenSimilarity(candidate, other) >= threshold;
    }
}
