package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.behavior.CandidateLabels;
import com.swarmprobe.core.behavior.RoleCatalog;
import com.swarmprobe.core.behavior.RoleProfile;
import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.ConsecutiveGate;
import com.swarmprobe.core.detection.Detector;
import com.swarmprobe.core.detection.Finding;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.detection.ViolationGate;
import com.swarmprobe.core.model.Frequency;
import com.swarmprobe.core.model.Issue;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.IssueEvidence;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.model.Severity;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A member's recent actions barely overlap with what its role prefers.
 * <p>
 * Only preferred keys the member actually had the chance to act on count. The expected
 * distribution is the role preference normalized over those keys; the actual one is the
 * share of recent actions attributed to each key. Overlap is the histogram intersection.
 * Members with no eligible key are not evaluated.
 */
public class RoleComplianceDetector implements Detector {

    public static final String NAME = "role-compliance";

    private final SwarmProbeProperties.Detection config;
    private final RoleCatalog catalog;

    public RoleComplianceDetector(SwarmProbeProperties.Detection config, RoleCatalog catalog) {
        this.config = config;
        this.catalog = catalog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ViolationGate newGate() {
        return new ConsecutiveGate(3);
    }

    @Override
    public Optional<Finding> evaluate(SwarmSnapshot snapshot) {
        var members = snapshot.registered().stream()
                .filter(m -> m.actionLabels().size() >= config.getComplianceMinActions())
                .sorted(Comparator.comparing(MemberSnapshot::memberId))
                .toList();
        for (MemberSnapshot member : members) {
            var profile = catalog.profile(member.role());
            var expected = expected(member, profile);
            if (expected.isEmpty()) {
                continue;
            }
            var actual = actual(member, profile, expected);
            double overlap = overlap(expected, actual);
            if (overlap < config.getComplianceMinOverlap()) {
                return Optional.of(toFinding(member, expected, actual, overlap));
            }
        }
        return Optional.empty();
    }

    Map<String, Double> expected(MemberSnapshot member, RoleProfile profile) {
        var eligible = new TreeMap<String, Double>();
        for (String key : new TreeSet<>(profile.preferredKeys())) {
            if (member.opportunityCounts().getOrDefault(key, 0) >= config.getComplianceMinOpportunity()) {
                eligible.put(key, profile.preferences().get(key));
            }
        }
        double total = eligible.values().stream().mapToDouble(Double::doubleValue).sum();
        eligible.replaceAll((k, v) -> v / total);
        return eligible;
    }

    static Map<String, Double> actual(MemberSnapshot member, RoleProfile profile, Map<String, Double> expected) {
        var counts = new TreeMap<String, Double>();
        var labels = member.actionLabels();
        for (String label : labels) {
            for (String key : CandidateLabels.preferenceKeys(label)) {
                if (profile.preferences().containsKey(key)) {
                    if (expected.containsKey(key)) {
                        counts.merge(key, 1.0, Double::sum);
                    }
                    break;
                }
            }
        }
        counts.replaceAll((k, v) -> v / labels.size());
        return counts;
    }

    static double overlap(Map<String, Double> expected, Map<String, Double> actual) {
        double sum = 0.0;
        for (var entry : expected.entrySet()) {
            sum += Math.min(entry.getValue(), actual.getOrDefault(entry.getKey(), 0.0));
        }
        return sum;
    }

    private Finding toFinding(MemberSnapshot member, Map<String, Double> expected, Map<String, Double> actual,
                              double overlap) {
        var issue = new Issue(
                IssueArea.SOCIAL,
                "Member %s is not acting like a %s".formatted(member.memberId(), member.role().key()),
                NAME,
                "A %s should mostly do %s".formatted(member.role().key(), String.join(", ", expected.keySet())),
                "Overlap between preferred and actual actions is %s (minimum %s)".formatted(
                        DetectorSupport.fmt(overlap), DetectorSupport.fmt(config.getComplianceMinOverlap())),
                List.of("Spawn a " + member.role().key() + " member",
                        "Let it run until it has had several chances to act on its preferences",
                        "Compare its recent actions with the role's preferences"),
                Severity.MINOR,
                Frequency.SOMETIMES,
                IssueEvidence.of(List.of(member.memberId()), List.of(member.capturedAt()),
                                List.of("Expected: " + format(expected),
                                        "Actual: " + format(actual),
                                        "Recent actions: " + String.join(", ", member.actionLabels())))
                        .withStateTable(DetectorSupport.rows(member)));
        return new Finding(issue, member.role().key() + "/" + member.memberId());
    }

    private static String format(Map<String, Double> distribution) {
        var parts = new StringBuilder();
        distribution.forEach((k, v) -> {
            if (parts.length() > 0) {
                parts.append(", ");
            }
            parts.append(k).append('=').append(DetectorSupport.fmt(v));
        });
        return parts.toString();
    }
}
