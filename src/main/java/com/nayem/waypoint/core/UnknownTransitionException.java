package com.nayem.waypoint.core;

/**
 * No chain is registered for the requested {@code (from, to)} pair. The state
 * object is left untouched.
 */
public class UnknownTransitionException extends TransitionException {

    public UnknownTransitionException(String fromState, String toState, String eventId) {
        super(String.format("No transition registered from %s to %s", fromState, toState),
                fromState, toState, eventId);
    }
}
