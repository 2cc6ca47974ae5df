package com.nayem.waypoint.handler;

import java.util.List;

/**
 * Explicit tag carried by every handler. Matching for substitution compares
 * tags by value, independent of the implementing class.
 */
public enum HandlerKind {

    EVENT_ID,
    CHECK_PROCESSED,
    TELEMETRY,
    ALERTING,
    MARK_PROCESSED,

    /**
     * Caller-supplied step appended after the default slots, before the
     * terminal dedup mark.
     */
    CUSTOM;

    /**
     * Default slots that precede appended custom handlers, in chain order.
     */
    public static final List<HandlerKind> LEADING_SLOTS = List.of(EVENT_ID, CHECK_PROCESSED, TELEMETRY, ALERTING);

    public boolean isDefaultSlot() {
        return this != CUSTOM;
    }
}
