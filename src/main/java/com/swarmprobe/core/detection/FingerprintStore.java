package com.swarmprobe.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cooldown store: a fingerprint recorded at time T suppresses new issues for the same
 * fingerprint until T + TTL. The tracker reference is kept so re-observations can be
 * commented on the original issue.
 */
public class FingerprintStore {

    private static final Logger log = LoggerFactory.getLogger(FingerprintStore.class);

    private record Entry(Instant expiresAt, String reference) {}

    private final Clock clock;
    private final Duration ttl;
    private final ConcurrentHashMap<Fingerprint, Entry> entries = new ConcurrentHashMap<>();

    public FingerprintStore(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public void record(Fingerprint fingerprint, String reference) {
        var expiry = clock.instant().plus(ttl);
        entries.put(fingerprint, new Entry(expiry, reference));
        log.debug("Fingerprint {} cooling down until {}", fingerprint, expiry);
    }

    public boolean isCoolingDown(Fingerprint fingerprint) {
        return active(fingerprint).isPresent();
    }

    /**
     * Reference of the issue filed for this fingerprint, while its cooldown lasts. Empty
     * when the fingerprint is not cooling down or was recorded without a reference.
     */
    public Optional<String> reference(Fingerprint fingerprint) {
        return active(fingerprint).map(Entry::reference);
    }

    public void purgeExpired() {
        var now = clock.instant();
        entries.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
    }

    public int size() {
        return entries.size();
    }

    private Optional<Entry> active(Fingerprint fingerprint) {
        var entry = entries.get(fingerprint);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(fingerprint, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }
}
