package com.swarmprobe.core.detection.detectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swarmprobe.core.behavior.RoleCatalog;
import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.MemberRole;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.support.Members;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.swarmprobe.core.support.Members.T0;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the detectors judging how members choose actions.
 */
class BehaviorDetectorsTest {

    private static RoleCatalog catalog;

    private final SwarmProbeProperties.Detection config = new SwarmProbeProperties.Detection();

    @BeforeAll
    static void loadCatalog() {
        catalog = RoleCatalog.load(new ObjectMapper());
    }

    private static SwarmSnapshot snapshot(MemberSnapshot... members) {
        return new SwarmSnapshot(T0, 5, List.of(members));
    }

    // -- role compliance -------------------------------------------------

    @Nested
    @DisplayName("RoleComplianceDetector")
    class RoleCompliance {

        private final RoleComplianceDetector detector = new RoleComplianceDetector(config, catalog);

        private Members worker(List<String> labels) {
            return Members.member("w1").role(MemberRole.WORKER)
                    .opportunity("kanban_terminal", 5)
                    .opportunity("whiteboard", 5)
                    .labels(labels);
        }

        @Test
        @DisplayName("worker that only chats despite work opportunities -> finding")
        void offRoleWorker() {
            var member = worker(Collections.nCopies(10, "chat:global")).build();

            var finding = detector.evaluate(snapshot(member)).orElseThrow();

            assertEquals(IssueArea.SOCIAL, finding.issue().area());
            assertEquals("worker/w1", finding.keyEvidence());
        }

        @Test
        @DisplayName("worker using the kanban terminal is compliant")
        void compliantWorker() {
            var member = worker(Collections.nCopies(10, "interact:kanban_terminal:use")).build();

            assertTrue(detector.evaluate(snapshot(member)).isEmpty());
        }

        @Test
        @DisplayName("expected distribution only covers preferred keys with enough opportunity")
        void expectedDistribution() {
            var member = worker(List.of()).opportunity("printer", 2).build();

            var expected = detector.expected(member, catalog.profile(MemberRole.WORKER));

            assertEquals(List.of("kanban_terminal", "whiteboard"), new ArrayList<>(expected.keySet()));
            assertEquals(1.0, expected.values().stream().mapToDouble(Double::doubleValue).sum(), 1e-9);
        }

        @Test
        @DisplayName("overlap is the sum of the per-key minimums")
        void overlap() {
            double overlap = RoleComplianceDetector.overlap(
                    Map.of("a", 0.5, "b", 0.5), Map.of("a", 0.2, "b", 0.9));

            assertEquals(0.7, overlap, 1e-9);
        }

        @Test
        @DisplayName("too few actions -> not judged")
        void tooFewActions() {
            var member = worker(Collections.nCopies(9, "chat:global")).build();

            assertTrue(detector.evaluate(snapshot(member)).isEmpty());
        }
    }

    // -- decision entropy ------------------------------------------------

    @Nested
    @DisplayName("LowDecisionEntropyDetector")
    class DecisionEntropy {

        private final LowDecisionEntropyDetector detector = new LowDecisionEntropyDetector(config);

        @Test
        @DisplayName("ten identical actions -> finding")
        void repetitive() {
            var member = Members.member("a1").labels(Collections.nCopies(10, "wander")).build();

            var finding = detector.evaluate(snapshot(member)).orElseThrow();

            assertEquals(IssueArea.AIC, finding.issue().area());
        }

        @Test
        @DisplayName("three distinct actions in the window -> nothing")
        void varied() {
            var labels = new ArrayList<>(Collections.nCopies(8, "wander"));
            labels.add("observe");
            labels.add("chat:global");
            var member = Members.member("a1").labels(labels).build();

            assertTrue(detector.evaluate(snapshot(member)).isEmpty());
        }
    }

    // -- idle despite opportunity ----------------------------------------

    @Nested
    @DisplayName("IdleDespiteOpportunityDetector")
    class IdleDespiteOpportunity {

        private final IdleDespiteOpportunityDetector detector = new IdleDespiteOpportunityDetector(config);

        @Test
        @DisplayName("in range for 31s with no interaction -> finding")
        void idleWorker() {
            var member = Members.member("w1").role(MemberRole.WORKER).inRangeSince(T0.minusSeconds(31)).build();

            var finding = detector.evaluate(snapshot(member)).orElseThrow();

            assertEquals(IssueArea.INTERACTABLES, finding.issue().area());
        }

        @Test
        @DisplayName("a recent interaction clears it")
        void recentInteraction() {
            var member = Members.member("w1").role(MemberRole.WORKER)
                    .inRangeSince(T0.minusSeconds(40))
                    .lastInteractionAt(T0.minusSeconds(5))
                    .build();

            assertTrue(detector.evaluate(snapshot(member)).isEmpty());
        }

        @Test
        @DisplayName("passive roles are never flagged")
        void passiveRole() {
            var member = Members.member("afk").role(MemberRole.AFK).inRangeSince(T0.minusSeconds(300)).build();

            assertTrue(detector.evaluate(snapshot(member)).isEmpty());
        }
    }

    // -- candidate starvation --------------------------------------------

    @Nested
    @DisplayName("CandidateStarvationDetector")
    class Starvation {

        private final CandidateStarvationDetector detector = new CandidateStarvationDetector(config);

        @Test
        @DisplayName("ten empty observations in a row -> movement finding")
        void starving() {
            var member = Members.member("a1").starvedCycles(10).build();

            var finding = detector.evaluate(snapshot(member)).orElseThrow();

            assertEquals(IssueArea.MOVEMENT, finding.issue().area());
        }

        @Test
        void belowThreshold() {
            assertTrue(detector.evaluate(snapshot(Members.member("a1").starvedCycles(9).build())).isEmpty());
        }
    }

    @Test
    @DisplayName("standard set has fourteen uniquely named detectors")
    void standardSet() {
        var detectors = StandardDetectors.create(config, catalog);

        assertEquals(14, detectors.size());
        assertEquals(14, detectors.stream().map(d -> d.name()).distinct().count());
    }
}
