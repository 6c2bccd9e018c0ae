package com.swarmprobe.core.detection;

import com.swarmprobe.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link FingerprintStore}.
 */
class FingerprintStoreTest {

    private static final Fingerprint DESYNC = new Fingerprint("Sync", "position-desync", "npc-1");

    private MutableClock clock;
    private FingerprintStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new FingerprintStore(clock, Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("recorded fingerprint cools down until the TTL passes")
    void cooldownLastsForTtl() {
        store.record(DESYNC, "42");

        assertTrue(store.isCoolingDown(DESYNC));
        clock.advance(Duration.ofMinutes(29));
        assertTrue(store.isCoolingDown(DESYNC));
        clock.advance(Duration.ofMinutes(1));
        assertFalse(store.isCoolingDown(DESYNC));
    }

    @Test
    @DisplayName("reference is available only while cooling down")
    void referenceWhileCooling() {
        store.record(DESYNC, "42");

        assertEquals(Optional.of("42"), store.reference(DESYNC));
        clock.advance(Duration.ofHours(1));
        assertEquals(Optional.empty(), store.reference(DESYNC));
    }

    @Test
    @DisplayName("fingerprints differing only in key are independent")
    void keysAreIndependent() {
        store.record(DESYNC, "42");

        assertFalse(store.isCoolingDown(new Fingerprint("Sync", "position-desync", "npc-2")));
    }

    @Test
    @DisplayName("purge drops expired entries")
    void purgeExpired() {
        store.record(DESYNC, "42");
        clock.advance(Duration.ofMinutes(10));
        store.record(new Fingerprint("Chat", "chat-mismatch", "global"), "43");

        clock.advance(Duration.ofMinutes(25));
        store.purgeExpired();

        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("recording again restarts the cooldown")
    void rerecordRestarts() {
        store.record(DESYNC, "42");
        clock.advance(Duration.ofMinutes(20));
        store.record(DESYNC, "42");
        clock.advance(Duration.ofMinutes(20));

        assertTrue(store.isCoolingDown(DESYNC));
    }
}
