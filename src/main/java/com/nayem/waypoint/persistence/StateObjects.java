package com.nayem.waypoint.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.waypoint.core.StateObject;

import java.util.Map;

/**
 * Conversions between typed payloads and the open {@code data} document.
 */
public final class StateObjects {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private StateObjects() {
    }

    /**
     * Creates a state object whose data is the JSON view of {@code payload}.
     *
     * @throws StateSerializationException if the payload is not an object
     */
    public static StateObject fromValue(Object payload, String initialState, ObjectMapper objectMapper) {
        try {
            return new StateObject(objectMapper.convertValue(payload, DOCUMENT), initialState);
        } catch (IllegalArgumentException e) {
            throw new StateSerializationException("Payload cannot be encoded as a document", e);
        }
    }

    /**
     * Replaces the object's data with the JSON view of {@code payload}.
     */
    public static void encodeData(StateObject object, Object payload, ObjectMapper objectMapper) {
        try {
            Map<String, Object> document = objectMapper.convertValue(payload, DOCUMENT);
            object.getData().clear();
            object.getData().putAll(document);
        } catch (IllegalArgumentException e) {
            throw new StateSerializationException("Payload cannot be encoded as a document", e);
        }
    }

    /**
     * Reads the object's data as {@code type}.
     */
    public static <T> T dataAs(StateObject object, Class<T> type, ObjectMapper objectMapper) {
        try {
            return objectMapper.convertValue(object.getData(), type);
        } catch (IllegalArgumentException e) {
            throw new StateSerializationException("Data cannot be decoded as " + type.getName(), e);
        }
    }
}
