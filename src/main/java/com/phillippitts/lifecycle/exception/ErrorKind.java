package com.phillippitts.lifecycle.exception;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Taxonomy of error kinds understood by the recovery engine.
 *
 * <p>Each constant carries the wire name used in logs, metric tags and circuit-breaker keys
 * (for example {@code NetworkError}).
 */
public enum ErrorKind {
    VALIDATION_ERROR("ValidationError"),
    EXECUTION_ERROR("ExecutionError"),
    INITIALIZATION_ERROR("InitializationError"),
    STATE_ERROR("StateError"),
    COGNITIVE_ERROR("CognitiveError"),
    NETWORK_ERROR("NetworkError"),
    RESOURCE_ERROR("ResourceError"),
    CONFIGURATION_ERROR("ConfigurationError"),
    AUTHENTICATION_ERROR("AuthenticationError"),
    PERMISSION_ERROR("PermissionError"),
    NOT_FOUND_ERROR("NotFoundError"),
    TIMEOUT_ERROR("TimeoutError"),
    RATE_LIMIT_ERROR("RateLimitError"),
    SYSTEM_ERROR("SystemError"),
    TASK_ERROR("TaskError"),
    AGENT_ERROR("AgentError"),
    LOCK_ERROR("LockError"),
    STORAGE_ERROR("StorageError"),
    CIRCUIT_BREAKER_ERROR("CircuitBreakerError"),
    UNKNOWN_ERROR("UnknownError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Returns true for transient kinds that are worth retrying.
     */
    public boolean isRetryable() {
        return this == NETWORK_ERROR || this == TIMEOUT_ERROR || this == RATE_LIMIT_ERROR;
    }

    /**
     * Resolves a kind from its wire name or constant name, case-insensitively.
     *
     * @param name wire name ({@code NetworkError}) or constant name ({@code NETWORK_ERROR})
     * @return matching kind, or empty if nothing matches
     */
    public static Optional<ErrorKind> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(kind -> kind.wireName.equalsIgnoreCase(trimmed)
                        || kind.name().equals(trimmed.toUpperCase(Locale.ROOT)))
                .findFirst();
    }
}
