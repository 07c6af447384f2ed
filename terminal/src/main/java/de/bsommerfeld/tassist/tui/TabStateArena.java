package de.bsommerfeld.tassist.tui;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * States of all open tabs whose kind uses state type {@code S}, keyed by tab
 * id. One arena per state type is kept as a context resource.
 */
public final class TabStateArena<S> {

    private final Map<Integer, S> states = new HashMap<>();

    public void insert(int tabId, S state) {
        if (state == null) {
            throw new IllegalArgumentException("tab state must not be null");
        }
        states.put(tabId, state);
    }

    /**
     * @throws IllegalStateException if the tab has no state here; the session
     *                               creates state before the first use of an
     *                               id, so a miss is a programming error
     */
    public S get(int tabId) {
        S state = states.get(tabId);
        if (state == null) {
            throw new IllegalStateException("no tab state for tab " + tabId);
        }
        return state;
    }

    public void replace(int tabId, S state) {
        get(tabId);
        insert(tabId, state);
    }

    public Optional<S> remove(int tabId) {
        return Optional.ofNullable(states.remove(tabId));
    }

    public boolean contains(int tabId) {
        return states.containsKey(tabId);
    }

    public Set<Integer> tabIds() {
        return Set.copyOf(states.keySet());
    }

    public int size() {
        return states.size();
    }
}
