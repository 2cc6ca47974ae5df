package com.nayem.waypoint.handler;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * Derives event identifiers as the SHA-256 hex digest of the target state name
 * followed by the current UTC date ({@code yyyy-MM-dd}). Attempts on the same
 * day for the same target state share an identifier.
 */
public class EventIdGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

    private final Clock clock;

    public EventIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public EventIdGenerator() {
        this(Clock.systemUTC());
    }

    public String generate(String targetState) {
        String day = LocalDate.now(clock.withZone(ZoneOffset.UTC)).format(DAY);
        return sha256Hex(targetState + day);
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
