package com.nayem.waypoint.telemetry;

/**
 * Sink for transition alerts. Implementations should not block for long; a
 * slow publisher stalls the transition that calls it.
 */
@FunctionalInterface
public interface AlertPublisher {

    void publish(TransitionAlert alert);
}
