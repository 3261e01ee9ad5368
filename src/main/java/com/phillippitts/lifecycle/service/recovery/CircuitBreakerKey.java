package com.phillippitts.lifecycle.service.recovery;

import com.phillippitts.lifecycle.exception.ErrorKind;
import com.phillippitts.lifecycle.exception.LifecycleException;

import java.util.Objects;

/**
 * Breakers are keyed by error kind and originating component.
 */
public record CircuitBreakerKey(ErrorKind kind, String component) {

    public CircuitBreakerKey {
        Objects.requireNonNull(kind, "kind");
        component = component == null || component.isBlank() ? LifecycleException.UNKNOWN_COMPONENT : component;
    }

    public static CircuitBreakerKey of(LifecycleException error) {
        return new CircuitBreakerKey(error.getKind(), error.getComponent());
    }

    @Override
    public String toString() {
        return kind.wireName() + ":" + component;
    }
}
