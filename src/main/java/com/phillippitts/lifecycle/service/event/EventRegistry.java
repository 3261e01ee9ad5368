package com.phillippitts.lifecycle.service.event;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe map of event type to handler set. A type whose last handler is removed
 * disappears from the map.
 */
final class EventRegistry {

    private final Map<String, Set<RegisteredHandler<?>>> handlers = new ConcurrentHashMap<>();

    /**
     * @return true if the handler was added, false if it was already registered
     */
    boolean register(String eventType, RegisteredHandler<?> handler) {
        boolean[] added = new boolean[1];
        handlers.compute(eventType, (type, set) -> {
            Set<RegisteredHandler<?>> target = set != null ? set : ConcurrentHashMap.newKeySet();
            added[0] = target.add(handler);
            return target;
        });
        return added[0];
    }

    /**
     * @return true if the handler was registered and has been removed
     */
    boolean unregister(String eventType, EventHandler<?> handler) {
        boolean[] removed = new boolean[1];
        handlers.computeIfPresent(eventType, (type, set) -> {
            removed[0] = set.removeIf(registered -> registered.wraps(handler));
            return set.isEmpty() ? null : set;
        });
        return removed[0];
    }

    List<RegisteredHandler<?>> handlersFor(String eventType) {
        Set<RegisteredHandler<?>> set = handlers.get(eventType);
        return set == null ? List.of() : List.copyOf(set);
    }
}
