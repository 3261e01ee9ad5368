package com.phillippitts.lifecycle.domain;

import com.phillippitts.lifecycle.domain.status.StatusType;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Published after a transition has been validated.
 *
 * <p>The id is a name-based UUID over {@code kind:entityId:timestampMillis}, so replaying the
 * same transition at the same instant yields the same id.
 */
public record StatusChangeEvent(String id,
                                Instant timestamp,
                                EntityKind entityKind,
                                String entityId,
                                StatusType from,
                                StatusType to,
                                ValidationResult validationResult,
                                Map<String, Object> metadata) implements LifecycleEvent {

    public static final String TYPE_SUFFIX = ".status.changed";

    public StatusChangeEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(entityKind, "entityKind");
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static StatusChangeEvent of(EntityKind kind, String entityId, StatusType from, StatusType to,
                                       ValidationResult validationResult, Map<String, Object> metadata,
                                       Instant timestamp) {
        return new StatusChangeEvent(idFor(kind, entityId, timestamp), timestamp, kind, entityId,
                from, to, validationResult, metadata);
    }

    /**
     * Event type under which status changes of the given kind are dispatched.
     */
    public static String typeFor(EntityKind kind) {
        return kind.key() + TYPE_SUFFIX;
    }

    static String idFor(EntityKind kind, String entityId, Instant timestamp) {
        String name = kind.key() + ":" + entityId + ":" + timestamp.toEpochMilli();
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }

    @Override
    public String type() {
        return typeFor(entityKind);
    }
}
