package com.phillippitts.lifecycle.service.metrics;

public enum MetricType {
    STATE_TRANSITION,
    ERROR,
    LATENCY,
    RESOURCE
}
