package com.swarmprobe.core.client;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Idempotency tokens for mutating calls, shaped {@code tx_<millis>_<seq>_<hex>}.
 * The sequence makes every token issued by one generator distinct.
 */
public final class TxIds {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public TxIds(Clock clock) {
        this.clock = clock;
    }

    public String next() {
        int suffix = ThreadLocalRandom.current().nextInt(0x1000000);
        return "tx_%d_%d_%06x".formatted(clock.millis(), sequence.incrementAndGet(), suffix);
    }
}
