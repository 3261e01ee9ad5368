package com.phillippitts.lifecycle.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time resource usage of the running process.
 *
 * @param cpuUsage CPU usage in percent (0-100)
 * @param memoryUsage heap usage in percent of the maximum heap (0-100)
 * @param heapUsedBytes heap bytes in use
 * @param timestamp when the snapshot was taken
 */
public record ResourceSnapshot(double cpuUsage, double memoryUsage, long heapUsedBytes, Instant timestamp) {

    public ResourceSnapshot {
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
