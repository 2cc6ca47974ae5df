package com.nayem.waypoint.idempotency;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryIdempotencyStoreTest {

    @Test
    void testMarkThenExists() {
        InMemoryIdempotencyStore store = new InMemoryIdempotencyStore();

        assertFalse(store.exists("evt-1"));
        store.markProcessed("evt-1");

        assertTrue(store.exists("evt-1"));
        assertFalse(store.exists("evt-2"));
    }

    @Test
    void testEntriesExpireAfterTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2023-09-07T10:00:00Z"));
        InMemoryIdempotencyStore store = new InMemoryIdempotencyStore(clock, Duration.ofHours(24));

        store.markProcessed("evt-1");
        clock.advance(Duration.ofHours(23));
        assertTrue(store.exists("evt-1"));

        clock.advance(Duration.ofHours(1));
        assertFalse(store.exists("evt-1"));
        assertEquals(0, store.size());
    }

    @Test
    void testZeroTtlNeverExpires() {
        MutableClock clock = new MutableClock(Instant.parse("2023-09-07T10:00:00Z"));
        InMemoryIdempotencyStore store = new InMemoryIdempotencyStore(clock, Duration.ZERO);

        store.set("evt-1", "true", Duration.ZERO);
        clock.advance(Duration.ofDays(365));

        assertTrue(store.exists("evt-1"));
    }

    @Test
    void testClear() {
        InMemoryIdempotencyStore store = new InMemoryIdempotencyStore();
        store.markProcessed("evt-1");
        store.markProcessed("evt-2");

        store.clear();

        assertEquals(0, store.size());
        assertFalse(store.exists("evt-1"));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
