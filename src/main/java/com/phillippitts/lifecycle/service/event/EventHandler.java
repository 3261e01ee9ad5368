package com.phillippitts.lifecycle.service.event;

import com.phillippitts.lifecycle.domain.LifecycleEvent;
import com.phillippitts.lifecycle.domain.ValidationResult;

/**
 * Handler registered with the {@link EventDispatcher} for one event type.
 *
 * <p>Handlers are identified by reference: registering the same instance twice for a type
 * is a no-op.
 *
 * @param <E> event type handled
 */
public interface EventHandler<E extends LifecycleEvent> {

    /**
     * Checks whether this handler accepts the event. Runs for every handler of the type
     * before any handler's {@link #handle} is called.
     */
    ValidationResult validate(E event);

    /**
     * Processes the event. Only called after every handler of the type accepted it.
     *
     * @throws Exception if processing fails; the dispatch as a whole then fails
     */
    void handle(E event) throws Exception;
}
