package com.nayem.waypoint.core;

import com.nayem.waypoint.handler.Handler;

import java.util.ArrayList;
import java.util.List;

/**
 * A registered, directed pipeline from one named state to another.
 *
 * @param from  source state name
 * @param to    target state name
 * @param chain head of the linked handler chain
 */
public record Transition(String from, String to, Handler chain) {

    public TransitionKey key() {
        return new TransitionKey(from, to);
    }

    /**
     * The chain's handlers in link order.
     */
    public List<Handler> handlers() {
        List<Handler> handlers = new ArrayList<>();
        for (Handler h = chain; h != null; h = h.next()) {
            handlers.add(h);
        }
        return handlers;
    }

    /**
     * Exact-match lookup key; there is no wildcard or state-group matching.
     */
    public record TransitionKey(String from, String to) {

        @Override
        public String toString() {
            return from + "->" + to;
        }
    }
}
