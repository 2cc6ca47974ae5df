package com.nayem.waypoint.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Emits domain events through exactly one configured transport.
 * <p>
 * Configuring a transport while another is active replaces it and logs a
 * warning. Emitting with no transport logs a warning and drops the event.
 * </p>
 */
public class DomainEventEmitter {

    private static final Logger log = LoggerFactory.getLogger(DomainEventEmitter.class);

    private final ObjectMapper objectMapper;
    private final AtomicReference<EventTransport> transport = new AtomicReference<>();

    public DomainEventEmitter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws NullPointerException if {@code newTransport} is null; use
     *                              {@link #clear()} to remove the transport
     */
    public void configure(EventTransport newTransport) {
        Objects.requireNonNull(newTransport, "transport");
        EventTransport previous = transport.getAndSet(newTransport);
        if (previous != null && previous != newTransport) {
            log.warn("Overwriting existing event transport {} with {}", previous.name(), newTransport.name());
        }
    }

    public void clear() {
        transport.set(null);
    }

    public Optional<EventTransport> getTransport() {
        return Optional.ofNullable(transport.get());
    }

    /**
     * Serializes and sends the event.
     *
     * @return false if no transport is configured
     * @throws IllegalArgumentException if the event cannot be serialized
     */
    public boolean emit(Object event) {
        EventTransport active = transport.get();
        if (active == null) {
            log.warn("No event transport set, unable to emit {}", event.getClass().getSimpleName());
            return false;
        }
        String payload;
        try {
            payload = event instanceof String s ? s : objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event " + event.getClass().getName(), e);
        }
        active.send(payload);
        log.debug("Emitted {} via {}", event.getClass().getSimpleName(), active.name());
        return true;
    }
}
