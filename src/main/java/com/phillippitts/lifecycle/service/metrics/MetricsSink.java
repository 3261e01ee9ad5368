package com.phillippitts.lifecycle.service.metrics;

/**
 * Destination for generic metric events emitted by the status coordinator.
 */
@FunctionalInterface
public interface MetricsSink {

    void trackMetric(MetricEvent event);
}
