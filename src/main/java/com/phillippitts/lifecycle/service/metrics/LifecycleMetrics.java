package com.phillippitts.lifecycle.service.metrics;

import com.phillippitts.lifecycle.domain.EntityKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Centralized Micrometer instrumentation for lifecycle-core.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Status transition latency per entity kind</li>
 *   <li>Rejected or failed transitions per entity kind and reason</li>
 *   <li>Recovery outcomes per strategy</li>
 *   <li>Handled errors per error kind</li>
 * </ul>
 *
 * <p>Tags are restricted to low-cardinality values. Entity ids never become tags.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public class LifecycleMetrics {

    static final String METRIC_PREFIX = "lifecycle";

    private final MeterRegistry registry;

    public LifecycleMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a transition took from operation start to completion.
     *
     * @param kind entity kind
     * @param durationNanos duration in nanoseconds
     */
    public void recordTransition(EntityKind kind, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".status.transition")
                .description("Time from operation start to completed status transition")
                .tag("entity", kind.key())
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param kind entity kind
     * @param reason failure reason (validation, timeout, subscriber, ...)
     */
    public void incrementTransitionFailure(EntityKind kind, String reason) {
        Counter.builder(METRIC_PREFIX + ".status.transition.failure")
                .description("Number of rejected or failed status transitions")
                .tag("entity", kind.key())
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param strategy recovery strategy wire name (retry, circuitBreaker, fallback, none)
     * @param success whether recovery succeeded
     */
    public void recordRecovery(String strategy, boolean success) {
        Counter.builder(METRIC_PREFIX + ".recovery")
                .description("Number of recovery attempts by strategy and outcome")
                .tag("strategy", strategy)
                .tag("success", Boolean.toString(success))
                .register(registry)
                .increment();
    }

    public void incrementError(String errorKind) {
        Counter.builder(METRIC_PREFIX + ".errors")
                .description("Number of errors routed through recovery")
                .tag("kind", errorKind)
                .register(registry)
                .increment();
    }
}
