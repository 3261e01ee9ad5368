package com.phillippitts.lifecycle.testutil;

import com.phillippitts.lifecycle.domain.PerformanceSnapshot;
import com.phillippitts.lifecycle.domain.ResourceSnapshot;
import com.phillippitts.lifecycle.service.metrics.ResourceSnapshotProvider;

import java.time.Clock;

/**
 * Resource provider reporting fixed CPU and memory percentages.
 */
public class FixedResourceSnapshotProvider implements ResourceSnapshotProvider {

    private final Clock clock;
    private volatile double cpuPercent;
    private volatile double memoryPercent;

    public FixedResourceSnapshotProvider(Clock clock, double cpuPercent, double memoryPercent) {
        this.clock = clock;
        this.cpuPercent = cpuPercent;
        this.memoryPercent = memoryPercent;
    }

    public FixedResourceSnapshotProvider(Clock clock) {
        this(clock, 10.0, 20.0);
    }

    public void setCpuPercent(double cpuPercent) {
        this.cpuPercent = cpuPercent;
    }

    @Override
    public ResourceSnapshot getInitialResourceMetrics() {
        return new ResourceSnapshot(cpuPercent, memoryPercent, 1024L, clock.instant());
    }

    @Override
    public PerformanceSnapshot getInitialPerformanceMetrics() {
        return new PerformanceSnapshot(0L, 0.0, 0.0, clock.instant());
    }
}
