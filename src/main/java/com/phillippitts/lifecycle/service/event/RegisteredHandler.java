package com.phillippitts.lifecycle.service.event;

import com.phillippitts.lifecycle.domain.LifecycleEvent;
import com.phillippitts.lifecycle.domain.ValidationResult;

import java.util.Objects;

/**
 * A handler together with the event class it accepts. Equality is the identity of the
 * wrapped handler, so registering the same instance twice stays a no-op.
 */
final class RegisteredHandler<E extends LifecycleEvent> {

    private final Class<E> eventClass;
    private final EventHandler<? super E> delegate;

    RegisteredHandler(Class<E> eventClass, EventHandler<? super E> delegate) {
        this.eventClass = Objects.requireNonNull(eventClass, "eventClass");
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    ValidationResult validate(LifecycleEvent event) {
        if (!eventClass.isInstance(event)) {
            return ValidationResult.invalid(name(), "Handler expects " + eventClass.getSimpleName()
                    + " but received " + event.getClass().getSimpleName());
        }
        return delegate.validate(eventClass.cast(event));
    }

    void handle(LifecycleEvent event) throws Exception {
        delegate.handle(eventClass.cast(event));
    }

    boolean wraps(EventHandler<?> handler) {
        return delegate == handler;
    }

    String name() {
        return delegate.getClass().getSimpleName();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RegisteredHandler<?> other && other.delegate == delegate;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(delegate);
    }
}
