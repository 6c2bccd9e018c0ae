package com.swarmprobe.core.client;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TxIdsTest {

    private final TxIds txIds = new TxIds(Clock.fixed(Instant.ofEpochMilli(1700000000000L), ZoneOffset.UTC));

    @Test
    void shapeCarriesMillisAndSequence() {
        assertTrue(txIds.next().matches("tx_1700000000000_1_[0-9a-f]{6}"));
        assertTrue(txIds.next().matches("tx_1700000000000_2_[0-9a-f]{6}"));
    }

    @Test
    void distinctUnderFixedClock() {
        var seen = new HashSet<String>();
        IntStream.range(0, 1000).forEach(i -> assertTrue(seen.add(txIds.next())));
    }
}
