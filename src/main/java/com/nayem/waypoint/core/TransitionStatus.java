package com.nayem.waypoint.core;

/**
 * Lifecycle of a single transition attempt.
 */
public enum TransitionStatus {

    /**
     * Attempt requested, chain not yet entered.
     */
    PENDING,

    /**
     * Handlers are executing.
     */
    RUNNING,

    /**
     * Every handler succeeded and the object moved to the target state.
     */
    SUCCEEDED,

    /**
     * A handler failed and every executed handler was rolled back.
     */
    ROLLED_BACK,

    /**
     * A rollback failed; the object was forced into manual review.
     */
    UNRECOVERABLE
}
