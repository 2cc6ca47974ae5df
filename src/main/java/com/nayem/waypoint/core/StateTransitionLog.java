package com.nayem.waypoint.core;

import java.time.Instant;

/**
 * One completed move of a state object.
 */
public record StateTransitionLog(
        String eventId,
        String fromState,
        String toState,
        Instant timestamp) {
}
