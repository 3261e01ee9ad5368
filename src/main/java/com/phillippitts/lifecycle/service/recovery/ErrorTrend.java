package com.phillippitts.lifecycle.service.recovery;

import com.phillippitts.lifecycle.exception.ErrorKind;

import java.time.Instant;
import java.util.Set;

/**
 * How often one error kind has occurred since it was first seen.
 *
 * @param kind error kind
 * @param count occurrences
 * @param firstOccurrence first time seen
 * @param lastOccurrence latest time seen
 * @param frequencyPerMinute count over the minutes since the first occurrence (at least one)
 * @param impactLevel level derived from frequency and affected components
 * @param affectedComponents components that reported this kind
 */
public record ErrorTrend(ErrorKind kind,
                         long count,
                         Instant firstOccurrence,
                         Instant lastOccurrence,
                         double frequencyPerMinute,
                         ImpactLevel impactLevel,
                         Set<String> affectedComponents) {

    public ErrorTrend {
        affectedComponents = Set.copyOf(affectedComponents);
    }
}
