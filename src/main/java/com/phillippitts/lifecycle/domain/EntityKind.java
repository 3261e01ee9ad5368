package com.phillippitts.lifecycle.domain;

import com.phillippitts.lifecycle.domain.status.AgentStatus;
import com.phillippitts.lifecycle.domain.status.FeedbackStatus;
import com.phillippitts.lifecycle.domain.status.MessageStatus;
import com.phillippitts.lifecycle.domain.status.ModelSessionStatus;
import com.phillippitts.lifecycle.domain.status.StatusType;
import com.phillippitts.lifecycle.domain.status.TaskStatus;
import com.phillippitts.lifecycle.domain.status.WorkflowStatus;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Categories of lifecycle-managed entities.
 *
 * <p>Each kind owns a closed status enumeration, a status new entities start in, and the
 * status an entity is moved to when an error is attributed to it.
 */
public enum EntityKind {
    AGENT("agent", AgentStatus.class, AgentStatus.INITIAL, AgentStatus.AGENTIC_LOOP_ERROR),
    TASK("task", TaskStatus.class, TaskStatus.PENDING, TaskStatus.ERROR),
    WORKFLOW("workflow", WorkflowStatus.class, WorkflowStatus.INITIAL, WorkflowStatus.ERRORED),
    MESSAGE("message", MessageStatus.class, MessageStatus.INITIAL, MessageStatus.ERROR),
    FEEDBACK("feedback", FeedbackStatus.class, FeedbackStatus.PENDING, FeedbackStatus.ERROR),
    MODEL_SESSION("model-session", ModelSessionStatus.class,
            ModelSessionStatus.INITIALIZING, ModelSessionStatus.ERROR);

    private final String key;
    private final Class<? extends StatusType> statusType;
    private final StatusType initialStatus;
    private final StatusType errorStatus;

    EntityKind(String key, Class<? extends StatusType> statusType,
               StatusType initialStatus, StatusType errorStatus) {
        this.key = key;
        this.statusType = statusType;
        this.initialStatus = initialStatus;
        this.errorStatus = errorStatus;
    }

    /**
     * Lower-case key used in event types ({@code task.status.changed}), metric tags and
     * configuration maps.
     */
    public String key() {
        return key;
    }

    public StatusType initialStatus() {
        return initialStatus;
    }

    public StatusType errorStatus() {
        return errorStatus;
    }

    public List<StatusType> statuses() {
        return List.of(statusType.getEnumConstants());
    }

    public boolean owns(StatusType status) {
        return status != null && statusType.isInstance(status);
    }

    /**
     * Looks up a status of this kind by name, case-insensitively.
     *
     * @param name status name such as {@code DOING}
     * @return the status, or empty if this kind has no status with that name
     */
    public Optional<StatusType> statusOf(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return statuses().stream()
                .filter(status -> status.name().equals(normalized))
                .findFirst();
    }

    /**
     * Resolves a kind from a configuration key. Accepts {@code model-session},
     * {@code modelsession}, {@code model_session} and {@code MODEL_SESSION} alike, since
     * relaxed property binding may strip the separator from map keys.
     */
    public static Optional<EntityKind> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(key);
        return Arrays.stream(values())
                .filter(kind -> normalize(kind.key).equals(normalized))
                .findFirst();
    }

    private static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
    }
}
