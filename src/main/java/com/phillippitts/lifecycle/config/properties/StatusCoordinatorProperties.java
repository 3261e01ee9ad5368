package com.phillippitts.lifecycle.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

/**
 * Typed properties for the status coordinator ({@code lifecycle.status.*}).
 */
@Validated
@ConfigurationProperties(prefix = "lifecycle.status")
public class StatusCoordinatorProperties {

    /**
     * Upper bound for a validator to answer, in milliseconds.
     */
    @Positive
    private final long validationTimeoutMs;

    /**
     * When false, transitions of the same entity are serialized.
     */
    private final boolean allowConcurrentTransitions;

    /**
     * Upper bound for waiting on another transition of the same entity, in milliseconds.
     */
    @Positive
    private final long lockTimeoutMs;

    private final boolean enableHistory;

    @Positive
    private final int maxHistoryLength;

    /**
     * Initial status overrides keyed by entity kind (task, workflow, model-session, ...).
     */
    private final Map<String, String> initialStatuses;

    /**
     * Extra transition rules keyed by entity kind, each written as {@code FROM->TO}.
     */
    private final Map<String, List<String>> transitions;

    @ConstructorBinding
    public StatusCoordinatorProperties(Long validationTimeoutMs,
                                       Boolean allowConcurrentTransitions,
                                       Long lockTimeoutMs,
                                       Boolean enableHistory,
                                       Integer maxHistoryLength,
                                       Map<String, String> initialStatuses,
                                       Map<String, List<String>> transitions) {
        this.validationTimeoutMs = validationTimeoutMs == null ? 5000L : validationTimeoutMs;
        this.allowConcurrentTransitions = allowConcurrentTransitions != null && allowConcurrentTransitions;
        this.lockTimeoutMs = lockTimeoutMs == null ? 10_000L : lockTimeoutMs;
        this.enableHistory = enableHistory == null || enableHistory;
        this.maxHistoryLength = maxHistoryLength == null ? 1000 : maxHistoryLength;
        this.initialStatuses = initialStatuses == null ? Map.of() : Map.copyOf(initialStatuses);
        this.transitions = transitions == null ? Map.of() : Map.copyOf(transitions);
    }

    /**
     * Defaults: 5s validation timeout, serialized transitions with a 10s lock wait, history of
     * 1000 entries.
     */
    public StatusCoordinatorProperties() {
        this(null, null, null, null, null, null, null);
    }

    public long getValidationTimeoutMs() {
        return validationTimeoutMs;
    }

    public boolean isAllowConcurrentTransitions() {
        return allowConcurrentTransitions;
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public boolean isEnableHistory() {
        return enableHistory;
    }

    public int getMaxHistoryLength() {
        return maxHistoryLength;
    }

    public Map<String, String> getInitialStatuses() {
        return initialStatuses;
    }

    public Map<String, List<String>> getTransitions() {
        return transitions;
    }
}
