package com.nayem.waypoint.persistence;

/**
 * A state object could not be encoded or decoded.
 */
public class StateSerializationException extends RuntimeException {

    public StateSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
