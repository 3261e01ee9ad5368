package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.StatusChangeEvent;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.status.StatusType;
import com.phillippitts.lifecycle.exception.ErrorKind;
import com.phillippitts.lifecycle.exception.LifecycleException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory record of completed transitions.
 *
 * <p>Keeps two views: the most recent status change events across all entities, and a
 * per-entity list of {@link StatusHistoryEntry} used for queries and analysis. Each list is
 * capped at {@code maxLength} with oldest-first eviction, and at most {@code maxLength}
 * entities are tracked; recording for a new entity beyond that drops the entity whose last
 * transition is the oldest.
 */
public class StatusHistory {

    private static final int TOP_TRANSITIONS = 5;
    private static final double PERCENTILE = 0.95;

    private final int maxLength;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<StatusChangeEvent> recent = new ArrayDeque<>();
    private final Map<String, Deque<StatusHistoryEntry>> byEntity;

    public StatusHistory(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be > 0");
        }
        this.maxLength = maxLength;
        this.byEntity = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Deque<StatusHistoryEntry>> eldest) {
                return size() > maxLength;
            }
        };
    }

    public void record(StatusChangeEvent event, TransitionContext context) {
        StatusHistoryEntry entry = StatusHistoryEntry.from(event, context);
        lock.lock();
        try {
            append(recent, event);
            append(byEntity.computeIfAbsent(key(event.entityKind(), event.entityId()), k -> new ArrayDeque<>()),
                    entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Most recent events across all entities, oldest first.
     */
    public List<StatusChangeEvent> recent() {
        lock.lock();
        try {
            return List.copyOf(recent);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entries matching the query, newest first.
     */
    public List<StatusHistoryEntry> query(HistoryQuery query) {
        List<StatusHistoryEntry> matches = new ArrayList<>();
        lock.lock();
        try {
            for (Deque<StatusHistoryEntry> entries : byEntity.values()) {
                for (StatusHistoryEntry entry : entries) {
                    if (query.matches(entry)) {
                        matches.add(entry);
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        matches.sort(Comparator.comparing(StatusHistoryEntry::timestamp).reversed());
        if (query.limit() > 0 && matches.size() > query.limit()) {
            return List.copyOf(matches.subList(0, query.limit()));
        }
        return List.copyOf(matches);
    }

    /**
     * Summarizes every recorded transition of a kind.
     *
     * @throws LifecycleException with kind {@code NotFoundError} if nothing was recorded
     */
    public HistoryAnalysis analyze(EntityKind kind) {
        return analyze(HistoryQuery.forKind(kind));
    }

    /**
     * Summarizes the transitions matching a query.
     *
     * @throws LifecycleException with kind {@code NotFoundError} if nothing matches
     */
    public HistoryAnalysis analyze(HistoryQuery query) {
        List<StatusHistoryEntry> entries = new ArrayList<>(query(query));
        if (entries.isEmpty()) {
            throw new LifecycleException(ErrorKind.NOT_FOUND_ERROR,
                    "No history entries found for entity kind " + query.entityKind().key());
        }
        entries.sort(Comparator.comparing(StatusHistoryEntry::timestamp));

        Set<StatusType> unique = new LinkedHashSet<>();
        Map<List<StatusType>, Long> pairCounts = new LinkedHashMap<>();
        long totalDuration = 0;
        long errors = 0;
        List<Long> durations = new ArrayList<>(entries.size());
        for (StatusHistoryEntry entry : entries) {
            unique.add(entry.from());
            unique.add(entry.to());
            pairCounts.merge(List.of(entry.from(), entry.to()), 1L, Long::sum);
            totalDuration += entry.durationMs();
            durations.add(entry.durationMs());
            if (entry.error()) {
                errors++;
            }
        }

        List<HistoryAnalysis.TransitionCount> common = pairCounts.entrySet().stream()
                .sorted(Map.Entry.<List<StatusType>, Long>comparingByValue().reversed())
                .limit(TOP_TRANSITIONS)
                .map(e -> new HistoryAnalysis.TransitionCount(e.getKey().get(0), e.getKey().get(1), e.getValue()))
                .toList();

        int total = entries.size();
        return new HistoryAnalysis(query.entityKind(),
                entries.get(0).timestamp(),
                entries.get(total - 1).timestamp(),
                total,
                unique,
                (double) totalDuration / total,
                (double) errors / total,
                common,
                percentile(durations, PERCENTILE));
    }

    public void clear() {
        lock.lock();
        try {
            recent.clear();
            byEntity.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears entries of one kind, or of one entity when {@code entityId} is non-null.
     */
    public void clear(EntityKind kind, String entityId) {
        lock.lock();
        try {
            if (entityId != null) {
                byEntity.remove(key(kind, entityId));
                recent.removeIf(e -> e.entityKind() == kind && entityId.equals(e.entityId()));
            } else {
                byEntity.keySet().removeIf(k -> k.startsWith(kind.key() + ":"));
                recent.removeIf(e -> e.entityKind() == kind);
            }
        } finally {
            lock.unlock();
        }
    }

    public int maxLength() {
        return maxLength;
    }

    int trackedEntities() {
        lock.lock();
        try {
            return byEntity.size();
        } finally {
            lock.unlock();
        }
    }

    private <T> void append(Deque<T> deque, T value) {
        deque.addLast(value);
        while (deque.size() > maxLength) {
            deque.removeFirst();
        }
    }

    static long percentile(List<Long> values, double percentile) {
        List<Long> sorted = new ArrayList<>(values);
        sorted.sort(null);
        int rank = (int) Math.ceil(percentile * sorted.size());
        return sorted.get(Math.max(0, rank - 1));
    }

    private static String key(EntityKind kind, String entityId) {
        return kind.key() + ":" + entityId;
    }
}
