package com.nayem.waypoint.persistence;

import com.nayem.waypoint.core.StateObject;

/**
 * Byte-oriented encoding of a {@link StateObject} with the fields
 * {@code data}, {@code state} and {@code event_id}.
 */
public interface StateObjectSerializer {

    byte[] serialize(StateObject object);

    /**
     * @throws StateSerializationException if the bytes are not a valid
     *                                     document
     */
    StateObject deserialize(byte[] bytes);
}
