package com.nayem.waypoint.core;

/**
 * State names the engine itself relies on.
 */
public final class States {

    /**
     * Terminal state forced onto an object whose rollback failed. Leaving it
     * requires operator action.
     */
    public static final String MANUAL_REVIEW = "ManualReview";

    private States() {
    }
}
