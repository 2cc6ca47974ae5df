package com.nayem.waypoint.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The mutable business entity moved between states by a {@link StateMachine}.
 * <p>
 * {@code state} is only changed by the state machine, once, at the end of a
 * successful transition (or forced to {@link States#MANUAL_REVIEW} when a
 * rollback fails). {@code eventId} stays empty until the identity handler
 * assigns it and is then stable for the rest of the attempt.
 * </p>
 */
public class StateObject {

    private final Map<String, Object> data;
    private String state;
    private String eventId;

    public StateObject(Map<String, Object> data, String initialState) {
        this(data, initialState, "");
    }

    @JsonCreator
    public StateObject(@JsonProperty("data") Map<String, Object> data,
            @JsonProperty("state") String state,
            @JsonProperty("event_id") String eventId) {
        this.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        this.state = state;
        this.eventId = eventId != null ? eventId : "";
    }

    @JsonProperty("data")
    public Map<String, Object> getData() {
        return data;
    }

    @JsonProperty("state")
    public String getState() {
        return state;
    }

    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }

    public boolean hasEventId() {
        return !eventId.isEmpty();
    }

    /**
     * Assigns the event identifier for the current attempt.
     */
    public void setEventId(String eventId) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
    }

    // Only the state machine moves the state.
    void setState(String state) {
        this.state = state;
    }

    /**
     * Shorthand for {@code machine.transition(this, targetState)}.
     */
    public void transitionTo(StateMachine machine, String targetState) {
        machine.transition(this, targetState);
    }

    @Override
    public String toString() {
        return "StateObject{state='" + state + "', eventId='" + eventId + "', data=" + data + '}';
    }
}
