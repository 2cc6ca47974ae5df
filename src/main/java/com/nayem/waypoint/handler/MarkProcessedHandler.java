package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;
import com.nayem.waypoint.idempotency.IdempotencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Terminal handler: records the event as processed and completes the chain.
 * It never has a successor.
 */
public class MarkProcessedHandler extends AbstractHandler {

    private static final Logger log = LoggerFactory.getLogger(MarkProcessedHandler.class);

    private final IdempotencyStore store;

    public MarkProcessedHandler(IdempotencyStore store) {
        this.store = store;
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.MARK_PROCESSED;
    }

    @Override
    public HandlerResult handle(StateObject object, String targetState) {
        if (object.hasEventId()) {
            store.markProcessed(object.getEventId());
        } else {
            log.warn("No eventId on object moving {} -> {}, nothing to mark", object.getState(), targetState);
        }
        return HandlerResult.COMPLETE;
    }

    @Override
    public void setNext(Handler next) {
        if (next != null) {
            log.debug("Ignoring successor {} of terminal handler", next.name());
        }
    }

    @Override
    public Handler next() {
        return null;
    }
}
