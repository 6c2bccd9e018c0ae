package com.swarmprobe.core.detection.detectors;

import com.swarmprobe.core.config.SwarmProbeProperties;
import com.swarmprobe.core.detection.DetectorBank;
import com.swarmprobe.core.detection.FingerprintStore;
import com.swarmprobe.core.detection.SwarmSnapshot;
import com.swarmprobe.core.metrics.SwarmProbeMetrics;
import com.swarmprobe.core.model.ChatObservation;
import com.swarmprobe.core.model.IssueArea;
import com.swarmprobe.core.model.MemberSnapshot;
import com.swarmprobe.core.support.Members;
import com.swarmprobe.core.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static com.swarmprobe.core.support.Members.T0;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ChatMismatchDetector}.
 */
class ChatMismatchDetectorTest {

    private final ChatMismatchDetector detector = new ChatMismatchDetector(new SwarmProbeProperties.Detection());

    private static ChatObservation global(String sender, String text, int secondOffset) {
        return new ChatObservation(sender, text, "global", T0.plusSeconds(secondOffset));
    }

    private static MemberSnapshot observer(String id, long observedOffsetMs, ChatObservation... messages) {
        var builder = Members.member(id)
                .chatWindow(T0.minusSeconds(60), T0.plusMillis(observedOffsetMs));
        for (ChatObservation m : messages) {
            builder.chat(m);
        }
        return builder.build();
    }

    private static SwarmSnapshot snapshot(long cycle, MemberSnapshot... members) {
        return new SwarmSnapshot(T0.plusSeconds(1), cycle, List.of(members));
    }

    @Test
    @DisplayName("disjoint views of the broadcast channel are a mismatch")
    void disjointViews() {
        var a = observer("a1", 0, global("x", "hi", -10), global("y", "yo", -5));
        var b = observer("b1", 500, global("z", "other", -8));

        var finding = detector.evaluate(snapshot(1, a, b)).orElseThrow();

        assertEquals(IssueArea.CHAT, finding.issue().area());
        assertEquals("global", finding.keyEvidence());
        assertEquals(List.of("a1", "b1"), finding.issue().evidence().memberIds());
    }

    @Test
    @DisplayName("mostly overlapping views are not a mismatch")
    void overlappingViews() {
        var a = observer("a1", 0, global("x", "hi", -10), global("y", "yo", -5));
        var b = observer("b1", 500, global("x", "hi", -10), global("y", "yo", -5), global("z", "new", -1));

        assertTrue(detector.evaluate(snapshot(1, a, b)).isEmpty());
    }

    @Test
    @DisplayName("observations too far apart in time are not compared")
    void skewTooLarge() {
        var a = observer("a1", 0, global("x", "hi", -10));
        var b = observer("b1", 6_000, global("z", "other", -8));

        assertTrue(detector.evaluate(snapshot(1, a, b)).isEmpty());
    }

    @Test
    @DisplayName("messages on other channels are ignored")
    void otherChannelsIgnored() {
        var a = observer("a1", 0, new ChatObservation("x", "psst", "whisper", T0.minusSeconds(3)));
        var b = observer("b1", 0);

        assertTrue(detector.evaluate(snapshot(1, a, b)).isEmpty());
    }

    @Test
    @DisplayName("through the bank, fires on the second consecutive cycle")
    void firesOnSecondCycle() {
        var bank = bank();
        var a = observer("a1", 0, global("x", "hi", -10));
        var b = observer("b1", 200, global("z", "other", -8));
        var a2 = observer("a1", 1_000, global("x", "hi", -10));
        var b2 = observer("b1", 1_200, global("z", "other", -8));

        assertTrue(bank.scan(snapshot(1, a, b)).freshFinding().isEmpty());
        assertTrue(bank.scan(snapshot(2, a2, b2)).freshFinding().isPresent());
    }

    @Test
    @DisplayName("the same pair of chat observations counts only once")
    void staleObservationsCountOnce() {
        var bank = bank();
        var a = observer("a1", 0, global("x", "hi", -10));
        var b = observer("b1", 200, global("z", "other", -8));

        assertTrue(bank.scan(snapshot(1, a, b)).freshFinding().isEmpty());
        assertTrue(bank.scan(snapshot(2, a, b)).freshFinding().isEmpty());
    }

    private DetectorBank bank() {
        var clock = new MutableClock(T0);
        return new DetectorBank(List.of(detector), new FingerprintStore(clock, Duration.ofMinutes(30)),
                new Random(1), new SwarmProbeMetrics(new SimpleMeterRegistry()));
    }
}
