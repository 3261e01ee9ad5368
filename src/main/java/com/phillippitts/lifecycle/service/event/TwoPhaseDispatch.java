package com.phillippitts.lifecycle.service.event;

import com.phillippitts.lifecycle.domain.LifecycleEvent;
import com.phillippitts.lifecycle.domain.ValidationResult;
import com.phillippitts.lifecycle.exception.HandlerExecutionException;
import com.phillippitts.lifecycle.util.TimeUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * One validate-then-handle round for a single event.
 *
 * <p>{@link #handleAll()} is only reachable after {@link #validateAll()} reported the event
 * valid for every handler.
 */
final class TwoPhaseDispatch {

    private final LifecycleEvent event;
    private final List<RegisteredHandler<?>> handlers;
    private final Executor executor;
    private ValidationResult validation;

    TwoPhaseDispatch(LifecycleEvent event, List<RegisteredHandler<?>> handlers, Executor executor) {
        this.event = event;
        this.handlers = List.copyOf(handlers);
        this.executor = executor;
    }

    /**
     * Runs every handler's validation concurrently, waits for all, and merges the results.
     */
    ValidationResult validateAll() {
        long start = System.nanoTime();
        List<CompletableFuture<ValidationResult>> futures = new ArrayList<>(handlers.size());
        for (RegisteredHandler<?> handler : handlers) {
            futures.add(CompletableFuture.supplyAsync(() -> validateOne(handler), executor));
        }
        List<ValidationResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ValidationResult> future : futures) {
            results.add(future.join());
        }
        long durationMs = TimeUtils.elapsedMillis(start);
        validation = ValidationResult.merge(results, "event-dispatcher", durationMs);
        return validation;
    }

    /**
     * Runs every handler concurrently and waits for all of them.
     *
     * @throws IllegalStateException if validation did not run or did not pass
     * @throws HandlerExecutionException wrapping the first handler failure
     */
    void handleAll() {
        if (validation == null || !validation.valid()) {
            throw new IllegalStateException("handleAll() requires a successful validateAll()");
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(handlers.size());
        for (RegisteredHandler<?> handler : handlers) {
            futures.add(CompletableFuture.runAsync(() -> handleOne(handler), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HandlerExecutionException hee) {
                throw hee;
            }
            throw new HandlerExecutionException(
                    "Handler failed for event " + event.type() + " (" + event.id() + ")", cause);
        }
    }

    private ValidationResult validateOne(RegisteredHandler<?> handler) {
        try {
            ValidationResult result = handler.validate(event);
            if (result == null) {
                return ValidationResult.invalid(handler.name(),
                        "Handler returned no validation result");
            }
            return result;
        } catch (RuntimeException e) {
            return ValidationResult.invalid(handler.name(),
                    "Handler validation threw: " + e.getMessage());
        }
    }

    private void handleOne(RegisteredHandler<?> handler) {
        try {
            handler.handle(event);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }
}
