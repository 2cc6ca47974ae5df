package com.nayem.waypoint.core;

/**
 * A rollback failed after a handler failure. The object has been forced into
 * {@link States#MANUAL_REVIEW} and needs an operator.
 */
public class RollbackFailedException extends TransitionException {

    private final String failedHandler;
    private final String rollbackHandler;

    public RollbackFailedException(String fromState, String toState, String eventId, String failedHandler,
            String rollbackHandler, Throwable cause) {
        super(String.format(
                "Rollback of %s failed after %s failed during transition from %s to %s (eventId=%s), moved to %s",
                rollbackHandler, failedHandler, fromState, toState, eventId, States.MANUAL_REVIEW),
                fromState, toState, eventId, cause);
        this.failedHandler = failedHandler;
        this.rollbackHandler = rollbackHandler;
    }

    public String getFailedHandler() {
        return failedHandler;
    }

    public String getRollbackHandler() {
        return rollbackHandler;
    }
}
