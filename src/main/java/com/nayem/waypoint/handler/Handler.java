package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;

/**
 * One step of a transition chain with symmetric execute and rollback
 * operations.
 * <p>
 * The state machine walks the chain: it calls {@link #handle} on each node, and
 * moves to {@link #next()} only when the result is
 * {@link HandlerResult#CONTINUE}. Handlers must never change the object's
 * state; only the state machine does that.
 * </p>
 * <p>
 * A handler instance belongs to one chain. Registering the same instance in two
 * transitions relinks it and corrupts the first chain.
 * </p>
 */
public interface Handler {

    /**
     * Tag used to match a custom handler against the default slot it replaces.
     * Custom handlers that should be appended instead return
     * {@link HandlerKind#CUSTOM}.
     */
    HandlerKind kind();

    /**
     * Name used in logs and exceptions.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Runs the step.
     *
     * @param object      the object being transitioned
     * @param targetState the state the object is moving to
     * @return how the walk should continue
     */
    HandlerResult handle(StateObject object, String targetState);

    /**
     * Undoes the step after a later handler failed.
     *
     * @return false if the step could not be undone
     */
    boolean rollback(StateObject object, String targetState);

    void setNext(Handler next);

    Handler next();
}
