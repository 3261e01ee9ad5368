package com.phillippitts.lifecycle.service.metrics;

import com.phillippitts.lifecycle.domain.PerformanceSnapshot;
import com.phillippitts.lifecycle.domain.ResourceSnapshot;

/**
 * Supplies the resource and performance snapshots attached to error transitions and used by
 * impact assessment.
 */
public interface ResourceSnapshotProvider {

    ResourceSnapshot getInitialResourceMetrics();

    PerformanceSnapshot getInitialPerformanceMetrics();
}
