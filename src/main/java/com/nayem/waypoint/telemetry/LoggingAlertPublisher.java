package com.nayem.waypoint.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes alerts to the log. Critical alerts go out at ERROR so they reach
 * whatever watches the application log.
 */
public class LoggingAlertPublisher implements AlertPublisher {

    private static final Logger log = LoggerFactory.getLogger(LoggingAlertPublisher.class);

    @Override
    public void publish(TransitionAlert alert) {
        if (alert.severity() == TransitionAlert.Severity.CRITICAL) {
            log.error("ALERT [{}] eventId={} {} -> {}: {}", alert.severity(), alert.eventId(),
                    alert.fromState(), alert.toState(), alert.message());
        } else {
            log.info("Alert [{}] eventId={} {} -> {}: {}", alert.severity(), alert.eventId(),
                    alert.fromState(), alert.toState(), alert.message());
        }
    }
}
