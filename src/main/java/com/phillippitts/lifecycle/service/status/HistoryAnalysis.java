package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.status.StatusType;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Aggregate view over the recorded transitions of one entity kind.
 */
public record HistoryAnalysis(EntityKind entityKind,
                              Instant periodStart,
                              Instant periodEnd,
                              int totalTransitions,
                              Set<StatusType> uniqueStatuses,
                              double averageDurationMs,
                              double errorRate,
                              List<TransitionCount> mostCommonTransitions,
                              long p95DurationMs) {

    public HistoryAnalysis {
        uniqueStatuses = Set.copyOf(uniqueStatuses);
        mostCommonTransitions = List.copyOf(mostCommonTransitions);
    }

    /**
     * How often a particular from/to pair occurred.
     */
    public record TransitionCount(StatusType from, StatusType to, long count) {
    }
}
