package com.nayem.waypoint.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.waypoint.core.StateObject;

import java.io.IOException;

/**
 * JSON encoding through Jackson.
 */
public class JacksonStateObjectSerializer implements StateObjectSerializer {

    private final ObjectMapper objectMapper;

    public JacksonStateObjectSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JacksonStateObjectSerializer() {
        this(new ObjectMapper());
    }

    @Override
    public byte[] serialize(StateObject object) {
        try {
            return objectMapper.writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            throw new StateSerializationException("Failed to serialize StateObject", e);
        }
    }

    @Override
    public StateObject deserialize(byte[] bytes) {
        try {
            return objectMapper.readValue(bytes, StateObject.class);
        } catch (IOException e) {
            throw new StateSerializationException("Failed to deserialize StateObject", e);
        }
    }
}
