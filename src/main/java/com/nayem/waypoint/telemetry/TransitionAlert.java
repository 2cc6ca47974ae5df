package com.nayem.waypoint.telemetry;

import java.time.Instant;

/**
 * Notice sent to an {@link AlertPublisher}.
 */
public record TransitionAlert(
        Severity severity,
        String eventId,
        String fromState,
        String toState,
        String message,
        Instant timestamp) {

    public enum Severity {
        INFO,
        CRITICAL
    }

    public static TransitionAlert info(String eventId, String from, String to, String message, Instant at) {
        return new TransitionAlert(Severity.INFO, eventId, from, to, message, at);
    }

    public static TransitionAlert critical(String eventId, String from, String to, String message, Instant at) {
        return new TransitionAlert(Severity.CRITICAL, eventId, from, to, message, at);
    }
}
