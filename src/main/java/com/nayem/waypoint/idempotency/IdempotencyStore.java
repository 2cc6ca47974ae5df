package com.nayem.waypoint.idempotency;

import java.time.Duration;

/**
 * Key-value store recording processed events.
 * <p>
 * The check ({@link #exists}) and the mark ({@link #markProcessed}) are
 * separate calls and are not atomic together: two concurrent attempts sharing
 * an event identifier can both pass the check before either marks. An
 * implementation that needs exactly-once must add a compare-and-set of its
 * own.
 * </p>
 */
public interface IdempotencyStore {

    /**
     * Whether the key was recorded. Implementations backed by a remote store
     * return false when the store cannot be reached.
     */
    boolean exists(String key);

    /**
     * Stores {@code value} under {@code key}.
     *
     * @param ttl retention, or {@link Duration#ZERO} to keep the key forever
     */
    void set(String key, String value, Duration ttl);

    /**
     * Records the key as processed using the store's default retention.
     */
    default void markProcessed(String key) {
        set(key, "true", Duration.ZERO);
    }
}
