package com.phillippitts.lifecycle.service.metrics;

/**
 * Area of the runtime a metric event belongs to.
 */
public enum MetricDomain {
    STATUS,
    RECOVERY,
    SYSTEM
}
