package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.MemberStateRow;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

final class DetectorSupport {

    private DetectorSupport() {}

    static List<MemberStateRow> rows(Collection<MemberSnapshot> members) {
        return members.stream().map(MemberStateRow::of).toList();
    }

    static List<MemberStateRow> rows(MemberSnapshot... members) {
        return rows(List.of(members));
    }

    static long millisBetween(Instant a, Instant b) {
        return Math.abs(Duration.between(a, b).toMillis());
    }

    static String fmt(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    /** 1 - |A ∩ B| / |A ∪ B|, or 0 when both sets are empty. */
    static double jaccardDistance(Set<String> a, Set<String> b) {
        var union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        var intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return 1.0 - (double) intersection.size() / union.size();
    }

    static String pairKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
