package com.phillippitts.lifecycle.service.metrics;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.StatusChangeEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generic metric record handed to a {@link MetricsSink}.
 *
 * @param domain area of the runtime
 * @param type what is measured
 * @param value measured value; milliseconds for transitions, 1 for counted events
 * @param timestamp when the measurement was taken
 * @param metadata dimensions; only the low-cardinality ones become meter tags
 */
public record MetricEvent(MetricDomain domain,
                          MetricType type,
                          double value,
                          Instant timestamp,
                          Map<String, Object> metadata) {

    public static final String ENTITY_KIND = "entityKind";
    public static final String ENTITY_ID = "entityId";
    public static final String FROM = "from";
    public static final String TO = "to";
    public static final String REASON = "reason";

    public MetricEvent {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static MetricEvent transition(StatusChangeEvent event, Duration duration) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ENTITY_KIND, event.entityKind());
        metadata.put(ENTITY_ID, event.entityId());
        metadata.put(FROM, event.from().name());
        metadata.put(TO, event.to().name());
        return new MetricEvent(MetricDomain.STATUS, MetricType.STATE_TRANSITION,
                duration.toNanos() / 1_000_000.0, event.timestamp(), metadata);
    }

    public static MetricEvent transitionFailure(EntityKind kind, String entityId, String reason, Instant at) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ENTITY_KIND, kind);
        if (entityId != null) {
            metadata.put(ENTITY_ID, entityId);
        }
        metadata.put(REASON, reason);
        return new MetricEvent(MetricDomain.STATUS, MetricType.ERROR, 1.0, at, metadata);
    }
}
