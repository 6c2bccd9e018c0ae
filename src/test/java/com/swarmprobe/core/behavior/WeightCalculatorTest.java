package com.swarmprobe.core.behavior;

import com.swarmprobe.core.client.WorldApi;
import com.swarmprobe.core.model.MemberRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link WeightCalculator}.
 */
class WeightCalculatorTest {

    private static final double DELTA = 1e-9;

    private final WeightCalculator calculator = new WeightCalculator();

    private static final RoleProfile PROFILE = new RoleProfile(MemberRole.WORKER,
            Map.of("wander", 2.0, "whiteboard", 2.5), List.of(), List.of());

    private static SelectionContext context(List<String> recent, MissionStep step, boolean starving,
                                            Set<String> failing, boolean highEntropy) {
        return new SelectionContext(PROFILE, recent, step, starving, failing, highEntropy);
    }

    private static SelectionContext plain(List<String> recent) {
        return context(recent, null, false, Set.of(), false);
    }

    // -- novelty ---------------------------------------------------------

    @Nested
    @DisplayName("novelty")
    class Novelty {

        @Test
        @DisplayName("multiplier is 1.0, 0.7, 0.4, then 0.1 by occurrences in the window")
        void multipliersByOccurrence() {
            assertEquals(1.0, calculator.novelty("wander", plain(List.of())), DELTA);
            assertEquals(0.7, calculator.novelty("wander", plain(List.of("wander"))), DELTA);
            assertEquals(0.4, calculator.novelty("wander", plain(Collections.nCopies(2, "wander"))), DELTA);
            assertEquals(0.1, calculator.novelty("wander", plain(Collections.nCopies(3, "wander"))), DELTA);
            assertEquals(0.1, calculator.novelty("wander", plain(Collections.nCopies(7, "wander"))), DELTA);
        }

        @Test
        @DisplayName("other labels in the window do not count")
        void otherLabelsIgnored() {
            assertEquals(1.0, calculator.novelty("wander", plain(List.of("observe", "chat:global"))), DELTA);
        }
    }

    // -- mission boost ---------------------------------------------------

    @Nested
    @DisplayName("mission boost")
    class MissionBoost {

        private final MissionStep step = new MissionStep("interact:whiteboard:", "interact", 2);

        @Test
        @DisplayName("no mission -> 1.0")
        void noMission() {
            assertEquals(1.0, calculator.missionBoost("wander", CandidateCategory.WANDER, null), DELTA);
        }

        @Test
        @DisplayName("prefix match on the label -> 3.0")
        void exactMatch() {
            assertEquals(3.0, calculator.missionBoost("interact:whiteboard:write", CandidateCategory.INTERACT, step),
                    DELTA);
        }

        @Test
        @DisplayName("same category only -> 1.5")
        void categoryMatch() {
            assertEquals(1.5, calculator.missionBoost("interact:printer:print", CandidateCategory.INTERACT, step),
                    DELTA);
        }

        @Test
        @DisplayName("anything else -> 0.6")
        void otherAction() {
            assertEquals(0.6, calculator.missionBoost("wander", CandidateCategory.WANDER, step), DELTA);
        }
    }

    // -- combined weight -------------------------------------------------

    @Test
    @DisplayName("weight is preference times novelty times mission boost")
    void combinedWeight() {
        var step = new MissionStep("wander", "wander", 1);
        var ctx = context(List.of("wander"), step, false, Set.of(), false);

        double weight = calculator.weigh("wander", CandidateCategory.WANDER, PROFILE.lookup("wander", null), ctx);

        assertEquals(2.0 * 0.7 * 3.0, weight, DELTA);
    }

    @Test
    @DisplayName("starving members weight wander five times higher")
    void starvationBoostsWander() {
        var ctx = context(List.of(), null, true, Set.of(), false);

        double wander = calculator.weigh("wander", CandidateCategory.WANDER, PROFILE.lookup("wander", null), ctx);
        double observe = calculator.weigh("observe", CandidateCategory.OBSERVE, PROFILE.lookup("observe", null), ctx);

        assertEquals(2.0 * 5.0, wander, DELTA);
        assertEquals(RoleProfile.EPSILON, observe, DELTA);
    }

    @Test
    @DisplayName("candidates calling a failing endpoint are backed off")
    void errorBackoff() {
        var ctx = context(List.of(), null, false, Set.of(WorldApi.MOVE_TO), false);

        double wander = calculator.weigh("wander", CandidateCategory.WANDER, PROFILE.lookup("wander", null), ctx);

        assertEquals(2.0 * 0.2, wander, DELTA);
    }

    @Test
    @DisplayName("high entropy blends the preference toward uniform")
    void highEntropyBlends() {
        var ctx = context(List.of(), null, false, Set.of(), true);

        double wander = calculator.weigh("wander", CandidateCategory.WANDER, PROFILE.lookup("wander", null), ctx);

        assertEquals((2.0 + 1.0) / 2.0, wander, DELTA);
    }
}
