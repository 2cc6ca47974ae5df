package com.nayem.waypoint.persistence;

import com.nayem.waypoint.core.StateObject;

import java.util.Optional;

/**
 * Commits state objects keyed by their event identifier.
 * <p>
 * The engine never calls this; callers commit explicitly once a transition
 * has concluded.
 * </p>
 */
public interface StateObjectRepository {

    /**
     * @throws IllegalStateException if the object has no event identifier yet
     */
    void commit(StateObject object);

    Optional<StateObject> findByEventId(String eventId);

    static String requireEventId(StateObject object) {
        if (!object.hasEventId()) {
            throw new IllegalStateException("Cannot commit a StateObject without an eventId (state="
                    + object.getState() + ")");
        }
        return object.getEventId();
    }
}
