package com.nayem.waypoint.core;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps {@code (from, to)} pairs to their pre-built chains.
 * <p>
 * Written during startup, read during steady state. Registering a pair again
 * replaces the previous chain. Callers must finish registration before
 * executing transitions on the same pair.
 * </p>
 */
public class TransitionRegistry {

    private final Map<Transition.TransitionKey, Transition> transitions = new ConcurrentHashMap<>();

    /**
     * Stores the transition, returning the one it replaced if any.
     */
    public Optional<Transition> register(Transition transition) {
        return Optional.ofNullable(transitions.put(transition.key(), transition));
    }

    public Optional<Transition> find(String from, String to) {
        return Optional.ofNullable(transitions.get(new Transition.TransitionKey(from, to)));
    }

    public boolean contains(String from, String to) {
        return transitions.containsKey(new Transition.TransitionKey(from, to));
    }

    public Collection<Transition> all() {
        return List.copyOf(transitions.values());
    }

    public int size() {
        return transitions.size();
    }
}
