package com.phillippitts.lifecycle.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time performance figures attached to error transitions.
 *
 * @param executionTimeMs time spent in the failing operation so far
 * @param throughput completed operations per second
 * @param errorRate failed operations as a fraction of all operations (0-1)
 * @param timestamp when the snapshot was taken
 */
public record PerformanceSnapshot(long executionTimeMs, double throughput, double errorRate, Instant timestamp) {

    public PerformanceSnapshot {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public PerformanceSnapshot withExecutionTime(long executionTimeMs) {
        return new PerformanceSnapshot(executionTimeMs, throughput, errorRate, timestamp);
    }
}
