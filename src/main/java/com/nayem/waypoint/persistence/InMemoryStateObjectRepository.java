package com.nayem.waypoint.persistence;

import com.nayem.waypoint.core.StateObject;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of StateObjectRepository.
 * <p>
 * Keeps serialized copies, so later changes to a committed object are not
 * visible until it is committed again.
 * </p>
 */
public class InMemoryStateObjectRepository implements StateObjectRepository {

    private final Map<String, byte[]> store = new ConcurrentHashMap<>();
    private final StateObjectSerializer serializer;

    public InMemoryStateObjectRepository(StateObjectSerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public void commit(StateObject object) {
        store.put(StateObjectRepository.requireEventId(object), serializer.serialize(object));
    }

    @Override
    public Optional<StateObject> findByEventId(String eventId) {
        return Optional.ofNullable(store.get(eventId)).map(serializer::deserialize);
    }

    /**
     * Returns the current number of committed objects.
     */
    public int size() {
        return store.size();
    }
}
