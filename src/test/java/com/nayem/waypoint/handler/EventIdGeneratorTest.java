package com.nayem.waypoint.handler;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class EventIdGeneratorTest {

    private static final Clock SEPT_7 = Clock.fixed(Instant.parse("2023-09-07T10:15:30Z"), ZoneOffset.UTC);

    @Test
    void testDigestOfTargetStateAndUtcDate() {
        EventIdGenerator generator = new EventIdGenerator(SEPT_7);

        assertEquals("dc0c109dad96710b046d7e9a22d1dc88d072aa9afed63bfe0f17ad110a6c5027",
                generator.generate("Active"));
    }

    @Test
    void testSameDayAndStateGiveSameId() {
        EventIdGenerator morning = new EventIdGenerator(
                Clock.fixed(Instant.parse("2023-09-07T00:00:01Z"), ZoneOffset.UTC));
        EventIdGenerator evening = new EventIdGenerator(
                Clock.fixed(Instant.parse("2023-09-07T23:59:59Z"), ZoneOffset.UTC));

        assertEquals(morning.generate("Active"), evening.generate("Active"));
    }

    @Test
    void testDifferentDayOrStateGiveDifferentIds() {
        EventIdGenerator nextDay = new EventIdGenerator(
                Clock.fixed(Instant.parse("2023-09-08T10:15:30Z"), ZoneOffset.UTC));
        EventIdGenerator generator = new EventIdGenerator(SEPT_7);

        assertEquals("6e8a36ec83055eb93a35861a2cd176b6ee0d829f004057333bf18f367b816e50",
                nextDay.generate("Active"));
        assertEquals("82bbabef9ff2acbf1daf8ba15dc856e95bd8a2f0d69902ab5cdff7e9204335b7",
                generator.generate("Closed"));
    }

    @Test
    void testDateIsTakenInUtcRegardlessOfClockZone() {
        // 2023-09-07T23:30Z is already Sept 8th in Tokyo
        Clock tokyo = Clock.fixed(Instant.parse("2023-09-07T23:30:00Z"), ZoneId.of("Asia/Tokyo"));

        assertEquals(new EventIdGenerator(SEPT_7).generate("Active"), new EventIdGenerator(tokyo).generate("Active"));
    }
}
