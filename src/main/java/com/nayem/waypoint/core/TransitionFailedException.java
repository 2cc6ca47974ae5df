package com.nayem.waypoint.core;

/**
 * A handler failed and every executed handler rolled back cleanly. The object
 * keeps its original state; the caller may retry or abandon.
 */
public class TransitionFailedException extends TransitionException {

    private final String failedHandler;

    public TransitionFailedException(String fromState, String toState, String eventId, String failedHandler,
            Throwable cause) {
        super(String.format("Transition from %s to %s failed at handler %s (eventId=%s)",
                fromState, toState, failedHandler, eventId), fromState, toState, eventId, cause);
        this.failedHandler = failedHandler;
    }

    public String getFailedHandler() {
        return failedHandler;
    }
}
