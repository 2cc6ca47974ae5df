package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;
import com.nayem.waypoint.idempotency.IdempotencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ends the pipeline successfully, without further side effects, when the
 * event was already processed.
 */
public class CheckProcessedHandler extends AbstractHandler {

    private static final Logger log = LoggerFactory.getLogger(CheckProcessedHandler.class);

    private final IdempotencyStore store;

    public CheckProcessedHandler(IdempotencyStore store) {
        this.store = store;
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.CHECK_PROCESSED;
    }

    @Override
    public HandlerResult handle(StateObject object, String targetState) {
        if (!object.hasEventId()) {
            log.debug("No eventId on object in state {}, skipping dedup check", object.getState());
            return proceed();
        }
        if (store.exists(object.getEventId())) {
            log.info("Event {} already processed, replaying transition {} -> {} as no-op",
                    object.getEventId(), object.getState(), targetState);
            return HandlerResult.COMPLETE;
        }
        return proceed();
    }
}
