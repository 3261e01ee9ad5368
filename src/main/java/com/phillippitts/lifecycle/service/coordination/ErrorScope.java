package com.phillippitts.lifecycle.service.coordination;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.status.StatusType;

import java.util.Objects;

/**
 * Identifies who failed and what they were doing.
 *
 * @param entityKind kind of the entity that owns the failing operation
 * @param entityId id of that entity
 * @param currentStatus status the entity is known to be in, or null to look it up
 * @param component component name used for circuit breaking
 * @param operation operation that failed
 */
public record ErrorScope(EntityKind entityKind,
                         String entityId,
                         StatusType currentStatus,
                         String component,
                         String operation) {

    public ErrorScope {
        Objects.requireNonNull(entityKind, "entityKind");
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must not be blank");
        }
        if (currentStatus != null && !entityKind.owns(currentStatus)) {
            throw new IllegalArgumentException(currentStatus + " is not a " + entityKind.key() + " status");
        }
        operation = operation == null || operation.isBlank() ? "unknown" : operation;
    }

    public static ErrorScope of(EntityKind kind, String entityId, String component, String operation) {
        return new ErrorScope(kind, entityId, null, component, operation);
    }

    public ErrorScope withStatus(StatusType status) {
        return new ErrorScope(entityKind, entityId, status, component, operation);
    }

    String describe() {
        return entityKind.key() + ":" + entityId + "/" + operation;
    }
}
