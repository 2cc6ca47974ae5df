package com.nayem.waypoint.handler;

import java.util.List;

/**
 * Linking helpers for handler chains.
 */
public final class HandlerChains {

    private HandlerChains() {
    }

    /**
     * Links the handlers in the given order and returns the head. The last
     * handler's successor is cleared.
     *
     * @throws IllegalArgumentException if no handler is given
     */
    public static Handler link(List<? extends Handler> handlers) {
        if (handlers.isEmpty()) {
            throw new IllegalArgumentException("Cannot link an empty chain");
        }
        for (int i = 0; i < handlers.size() - 1; i++) {
            handlers.get(i).setNext(handlers.get(i + 1));
        }
        handlers.get(handlers.size() - 1).setNext(null);
        return handlers.get(0);
    }

    public static Handler link(Handler... handlers) {
        return link(List.of(handlers));
    }
}
