package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class keeping the successor link.
 */
public abstract class AbstractHandler implements Handler {

    private static final Logger log = LoggerFactory.getLogger(AbstractHandler.class);

    private Handler next;

    @Override
    public void setNext(Handler next) {
        this.next = next;
    }

    @Override
    public Handler next() {
        return next;
    }

    /**
     * Nothing to undo by default.
     */
    @Override
    public boolean rollback(StateObject object, String targetState) {
        return true;
    }

    /**
     * Hands over to the successor. At the end of the chain only a
     * {@link HandlerKind#MARK_PROCESSED} handler completes; any other handler
     * fails, so a truncated pipeline is never reported as a success.
     */
    protected HandlerResult proceed() {
        if (next == null) {
            if (kind() == HandlerKind.MARK_PROCESSED) {
                return HandlerResult.COMPLETE;
            }
            log.warn("Handler {} has no successor and is not terminal, failing the chain", name());
            return HandlerResult.FAILED;
        }
        return HandlerResult.CONTINUE;
    }
}
