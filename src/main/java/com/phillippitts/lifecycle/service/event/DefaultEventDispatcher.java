package com.phillippitts.lifecycle.service.event;

import com.phillippitts.lifecycle.domain.LifecycleEvent;
import com.phillippitts.lifecycle.domain.ValidationResult;
import com.phillippitts.lifecycle.exception.StatusValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Default {@link EventDispatcher} fanning out on an injected executor.
 *
 * <p>Emitting an event type with no handlers logs a warning and returns. If any handler's
 * validation fails, the dispatch is rejected with a {@link StatusValidationException}
 * listing every error and warning, and no handler runs.
 */
public class DefaultEventDispatcher implements EventDispatcher {

    private static final Logger LOG = LogManager.getLogger(DefaultEventDispatcher.class);

    private final EventRegistry registry = new EventRegistry();
    private final Executor executor;

    public DefaultEventDispatcher(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public <E extends LifecycleEvent> void on(String eventType, Class<E> eventClass,
                                              EventHandler<? super E> handler) {
        requireType(eventType);
        Objects.requireNonNull(eventClass, "eventClass");
        Objects.requireNonNull(handler, "handler");
        if (registry.register(eventType, new RegisteredHandler<>(eventClass, handler))) {
            LOG.debug("Registered handler {} for event type {}", handler.getClass().getSimpleName(), eventType);
        }
    }

    @Override
    public void off(String eventType, EventHandler<?> handler) {
        requireType(eventType);
        Objects.requireNonNull(handler, "handler");
        if (registry.unregister(eventType, handler)) {
            LOG.debug("Unregistered handler {} for event type {}", handler.getClass().getSimpleName(), eventType);
        }
    }

    @Override
    public void emit(LifecycleEvent event) {
        Objects.requireNonNull(event, "event");
        List<RegisteredHandler<?>> registered = registry.handlersFor(event.type());
        if (registered.isEmpty()) {
            LOG.warn("No handlers registered for event type: {}", event.type());
            return;
        }

        TwoPhaseDispatch dispatch = new TwoPhaseDispatch(event, registered, executor);
        ValidationResult validation = dispatch.validateAll();
        if (!validation.valid()) {
            List<String> problems = new ArrayList<>(validation.errors());
            problems.addAll(validation.warnings());
            throw new StatusValidationException(
                    "Event validation failed for " + event.type() + ": " + String.join("; ", problems),
                    problems);
        }

        dispatch.handleAll();
        LOG.info("Processed event {} ({}) with {} handler(s) in {} ms validation",
                event.type(), event.id(), registered.size(), validation.durationMs());
    }

    @Override
    public int handlerCount(String eventType) {
        return registry.handlersFor(eventType).size();
    }

    private static void requireType(String eventType) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType must not be blank");
        }
    }
}
