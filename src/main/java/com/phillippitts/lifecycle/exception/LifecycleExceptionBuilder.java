package com.phillippitts.lifecycle.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link LifecycleException} with kind, component and context metadata.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw LifecycleExceptionBuilder.create("Tool call failed")
 *         .kind(ErrorKind.NETWORK_ERROR)
 *         .component("search-tool")
 *         .cause(ioException)
 *         .metadata("attempt", 2)
 *         .build();
 * </pre>
 *
 * <p>Metadata is stored in the exception's context map and appended to the message as
 * {@code message (key1=val1, key2=val2)}.
 */
public final class LifecycleExceptionBuilder {

    private final String message;
    private ErrorKind kind = ErrorKind.UNKNOWN_ERROR;
    private String component;
    private Throwable cause;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private LifecycleExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static LifecycleExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new LifecycleExceptionBuilder(message);
    }

    public LifecycleExceptionBuilder kind(ErrorKind kind) {
        if (kind != null) {
            this.kind = kind;
        }
        return this;
    }

    public LifecycleExceptionBuilder component(String component) {
        this.component = component;
        return this;
    }

    public LifecycleExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata entry. Null keys or values are ignored.
     */
    public LifecycleExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, value);
        }
        return this;
    }

    public LifecycleException build() {
        return new LifecycleException(kind, buildDetailedMessage(), component, metadata, cause);
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, Object> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
