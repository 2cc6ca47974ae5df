package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns a derived event identifier when the object has none yet.
 */
public class EventIdHandler extends AbstractHandler {

    private static final Logger log = LoggerFactory.getLogger(EventIdHandler.class);

    private final EventIdGenerator generator;

    public EventIdHandler(EventIdGenerator generator) {
        this.generator = generator;
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.EVENT_ID;
    }

    @Override
    public HandlerResult handle(StateObject object, String targetState) {
        if (!object.hasEventId()) {
            object.setEventId(generator.generate(targetState));
            log.debug("Assigned eventId {} for target state {}", object.getEventId(), targetState);
        }
        return proceed();
    }
}
