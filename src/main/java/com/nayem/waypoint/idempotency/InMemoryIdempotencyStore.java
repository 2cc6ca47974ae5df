package com.nayem.waypoint.idempotency;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of IdempotencyStore.
 * <p>
 * Suitable for:
 * - Development and testing
 * - Single-instance deployments
 * </p>
 * <p>
 * Note: records are lost on restart. Expired keys are dropped when read.
 * </p>
 */
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Map<String, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration defaultTtl;

    public InMemoryIdempotencyStore() {
        this(Clock.systemUTC(), Duration.ZERO);
    }

    public InMemoryIdempotencyStore(Clock clock, Duration defaultTtl) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    @Override
    public boolean exists(String key) {
        Entry entry = store.get(key);
        if (entry == null) {
            return false;
        }
        if (entry.isExpired(clock.instant())) {
            store.remove(key, entry);
            return false;
        }
        return true;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
        store.put(key, new Entry(value, expiresAt));
    }

    @Override
    public void markProcessed(String key) {
        set(key, "true", defaultTtl);
    }

    /**
     * Clears all records. Useful for testing.
     */
    public void clear() {
        store.clear();
    }

    /**
     * Returns the current number of stored keys, expired ones included.
     */
    public int size() {
        return store.size();
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
