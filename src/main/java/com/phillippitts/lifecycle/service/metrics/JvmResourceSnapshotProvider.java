package com.phillippitts.lifecycle.service.metrics;

import com.phillippitts.lifecycle.domain.PerformanceSnapshot;
import com.phillippitts.lifecycle.domain.ResourceSnapshot;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;

/**
 * Reads resource usage from the platform MX beans.
 *
 * <p>CPU usage is approximated from the system load average divided by the processor count
 * and reported as 0 where the platform has no load average. Performance snapshots start as
 * a zero baseline; callers fill in execution time.
 */
public class JvmResourceSnapshotProvider implements ResourceSnapshotProvider {

    private final Clock clock;
    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

    public JvmResourceSnapshotProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ResourceSnapshot getInitialResourceMetrics() {
        MemoryUsage heap = memory.getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        double memoryPercent = max > 0 ? 100.0 * heap.getUsed() / max : 0.0;
        return new ResourceSnapshot(cpuPercent(), memoryPercent, heap.getUsed(), clock.instant());
    }

    @Override
    public PerformanceSnapshot getInitialPerformanceMetrics() {
        return new PerformanceSnapshot(0L, 0.0, 0.0, clock.instant());
    }

    private double cpuPercent() {
        double load = os.getSystemLoadAverage();
        if (load < 0) {
            return 0.0;
        }
        return Math.min(100.0, 100.0 * load / Math.max(1, os.getAvailableProcessors()));
    }
}
