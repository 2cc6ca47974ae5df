package com.nayem.waypoint.events;

/**
 * A message-bus connection able to carry serialized domain events.
 */
public interface EventTransport {

    /**
     * Short name used in logs, e.g. {@code redis-stream}.
     */
    String name();

    void send(String payload);
}
