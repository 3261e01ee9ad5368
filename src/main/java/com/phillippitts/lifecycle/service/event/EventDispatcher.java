package com.phillippitts.lifecycle.service.event;

import com.phillippitts.lifecycle.domain.LifecycleEvent;

/**
 * Routes typed events to the handlers registered for their type.
 *
 * <p>Dispatch is two-phase: all handlers validate, then (only if all accepted) all handle.
 * Both phases fan out concurrently and {@link #emit} returns once every handler settled.
 */
public interface EventDispatcher {

    /**
     * Registers a handler for an event type. Events of the type that are not instances of
     * {@code eventClass} fail the handler's validation.
     */
    <E extends LifecycleEvent> void on(String eventType, Class<E> eventClass, EventHandler<? super E> handler);

    void off(String eventType, EventHandler<?> handler);

    /**
     * Delivers the event.
     *
     * @throws com.phillippitts.lifecycle.exception.StatusValidationException if any handler
     *         rejected the event; no handler ran
     * @throws com.phillippitts.lifecycle.exception.HandlerExecutionException if a handler failed;
     *         handlers that already completed are not rolled back
     */
    void emit(LifecycleEvent event);

    int handlerCount(String eventType);
}
