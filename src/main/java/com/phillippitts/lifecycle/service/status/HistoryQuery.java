package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.status.StatusType;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Filter for {@link StatusHistory#query}. Null fields do not filter.
 *
 * @param entityKind kind to look at (required)
 * @param entityId single entity, or null for all entities of the kind
 * @param from inclusive lower bound on the transition timestamp
 * @param to inclusive upper bound on the transition timestamp
 * @param statuses target statuses to keep, empty for all
 * @param limit maximum number of entries, 0 for no limit
 */
public record HistoryQuery(EntityKind entityKind,
                           String entityId,
                           Instant from,
                           Instant to,
                           Set<StatusType> statuses,
                           int limit) {

    public HistoryQuery {
        Objects.requireNonNull(entityKind, "entityKind");
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
    }

    public static HistoryQuery forKind(EntityKind kind) {
        return new HistoryQuery(kind, null, null, null, Set.of(), 0);
    }

    public HistoryQuery entityId(String id) {
        return new HistoryQuery(entityKind, id, from, to, statuses, limit);
    }

    public HistoryQuery between(Instant start, Instant end) {
        return new HistoryQuery(entityKind, entityId, start, end, statuses, limit);
    }

    public HistoryQuery statuses(StatusType... wanted) {
        return new HistoryQuery(entityKind, entityId, from, to, Set.copyOf(Arrays.asList(wanted)), limit);
    }

    public HistoryQuery limit(int max) {
        return new HistoryQuery(entityKind, entityId, from, to, statuses, max);
    }

    boolean matches(StatusHistoryEntry entry) {
        if (entry.entityKind() != entityKind) {
            return false;
        }
        if (entityId != null && !entityId.equals(entry.entityId())) {
            return false;
        }
        if (from != null && entry.timestamp().isBefore(from)) {
            return false;
        }
        if (to != null && entry.timestamp().isAfter(to)) {
            return false;
        }
        return statuses.isEmpty() || statuses.contains(entry.to());
    }
}
