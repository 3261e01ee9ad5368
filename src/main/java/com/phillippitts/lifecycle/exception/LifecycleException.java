package com.phillippitts.lifecycle.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base exception for all lifecycle-core errors.
 *
 * <p>Every failure surfaced by the coordinators carries an {@link ErrorKind}, the component
 * it originated from, and a small context map. The recovery engine keys its decisions
 * (retry, circuit breaking) on the kind and component.
 */
public class LifecycleException extends RuntimeException {

    public static final String UNKNOWN_COMPONENT = "unknown";

    private final ErrorKind kind;
    private final String component;
    private final Map<String, Object> context;

    public LifecycleException(String message) {
        this(ErrorKind.UNKNOWN_ERROR, message, null, Map.of(), null);
    }

    public LifecycleException(ErrorKind kind, String message) {
        this(kind, message, null, Map.of(), null);
    }

    public LifecycleException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, Map.of(), cause);
    }

    public LifecycleException(ErrorKind kind, String message, String component,
                              Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.component = component == null || component.isBlank() ? UNKNOWN_COMPONENT : component;
        this.context = context == null || context.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getComponent() {
        return component;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
