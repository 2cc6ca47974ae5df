package com.nayem.waypoint.core;

/**
 * Base class for every failed transition attempt.
 */
public class TransitionException extends RuntimeException {

    private final String fromState;
    private final String toState;
    private final String eventId;

    public TransitionException(String message, String fromState, String toState, String eventId) {
        this(message, fromState, toState, eventId, null);
    }

    public TransitionException(String message, String fromState, String toState, String eventId,
            Throwable cause) {
        super(message, cause);
        this.fromState = fromState;
        this.toState = toState;
        this.eventId = eventId;
    }

    public String getFromState() {
        return fromState;
    }

    public String getToState() {
        return toState;
    }

    public String getEventId() {
        return eventId;
    }
}
