package com.phillippitts.lifecycle.domain;

import com.phillippitts.lifecycle.domain.status.StatusType;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a requested status transition.
 *
 * <p>{@code entityId}, {@code operation} and {@code startTime} are mandatory for a transition
 * to be attempted, but the record itself accepts nulls so the coordinator can reject a
 * malformed context with a validation error instead of a {@link NullPointerException}.
 * Kind and both statuses are required at construction.
 *
 * @param entityKind kind of the entity being moved
 * @param entityId id of the entity being moved
 * @param currentStatus status the entity is in
 * @param targetStatus status the entity should move to
 * @param operation name of the operation requesting the transition
 * @param phase phase of the transition
 * @param startTime when the operation started
 * @param duration time from start to completion, set once the transition is done
 * @param metadata free-form metadata, never null
 * @param errorContext error details when moving into an error status
 * @param resourceSnapshot resource usage captured with the request
 * @param performanceSnapshot performance figures captured with the request
 */
public record TransitionContext(EntityKind entityKind,
                                String entityId,
                                StatusType currentStatus,
                                StatusType targetStatus,
                                String operation,
                                TransitionPhase phase,
                                Instant startTime,
                                Duration duration,
                                Map<String, Object> metadata,
                                ErrorContext errorContext,
                                ResourceSnapshot resourceSnapshot,
                                PerformanceSnapshot performanceSnapshot) {

    public TransitionContext {
        Objects.requireNonNull(entityKind, "entityKind");
        Objects.requireNonNull(currentStatus, "currentStatus");
        Objects.requireNonNull(targetStatus, "targetStatus");
        phase = phase == null ? TransitionPhase.PRE_EXECUTION : phase;
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Builder builder(EntityKind entityKind) {
        return new Builder(entityKind);
    }

    public TransitionContext withPhase(TransitionPhase newPhase) {
        return new TransitionContext(entityKind, entityId, currentStatus, targetStatus, operation,
                newPhase, startTime, duration, metadata, errorContext, resourceSnapshot, performanceSnapshot);
    }

    public TransitionContext withDuration(Duration newDuration) {
        return new TransitionContext(entityKind, entityId, currentStatus, targetStatus, operation,
                phase, startTime, newDuration, metadata, errorContext, resourceSnapshot, performanceSnapshot);
    }

    public TransitionContext withErrorContext(ErrorContext newErrorContext) {
        return new TransitionContext(entityKind, entityId, currentStatus, targetStatus, operation,
                phase, startTime, duration, metadata, newErrorContext, resourceSnapshot, performanceSnapshot);
    }

    /**
     * Fluent builder. Only the entity kind, current and target statuses are required.
     */
    public static final class Builder {
        private final EntityKind entityKind;
        private String entityId;
        private StatusType currentStatus;
        private StatusType targetStatus;
        private String operation;
        private TransitionPhase phase = TransitionPhase.PRE_EXECUTION;
        private Instant startTime;
        private Duration duration;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private ErrorContext errorContext;
        private ResourceSnapshot resourceSnapshot;
        private PerformanceSnapshot performanceSnapshot;

        private Builder(EntityKind entityKind) {
            this.entityKind = Objects.requireNonNull(entityKind, "entityKind");
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder from(StatusType currentStatus) {
            this.currentStatus = currentStatus;
            return this;
        }

        public Builder to(StatusType targetStatus) {
            this.targetStatus = targetStatus;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder phase(TransitionPhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (key != null && value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder metadata(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::metadata);
            }
            return this;
        }

        public Builder errorContext(ErrorContext errorContext) {
            this.errorContext = errorContext;
            return this;
        }

        public Builder resourceSnapshot(ResourceSnapshot resourceSnapshot) {
            this.resourceSnapshot = resourceSnapshot;
            return this;
        }

        public Builder performanceSnapshot(PerformanceSnapshot performanceSnapshot) {
            this.performanceSnapshot = performanceSnapshot;
            return this;
        }

        public TransitionContext build() {
            return new TransitionContext(entityKind, entityId, currentStatus, targetStatus, operation,
                    phase, startTime, duration, metadata, errorContext, resourceSnapshot, performanceSnapshot);
        }
    }
}
