package com.phillippitts.lifecycle.service.metrics;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.StatusChangeEvent;
import com.phillippitts.lifecycle.domain.ValidationResult;
import com.phillippitts.lifecycle.domain.status.AgentStatus;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerMetricsSinkTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private SimpleMeterRegistry registry;
    private MicrometerMetricsSink sink;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        sink = new MicrometerMetricsSink(new LifecycleMetrics(registry), registry);
    }

    @Test
    void routesTransitionsToTimer() {
        StatusChangeEvent event = StatusChangeEvent.of(EntityKind.AGENT, "agent-1", AgentStatus.INITIAL,
                AgentStatus.THINKING, ValidationResult.valid("t"), Map.of(), NOW);

        sink.trackMetric(MetricEvent.transition(event, Duration.ofMillis(15)));

        assertThat(registry.find("lifecycle.status.transition").tag("entity", "agent").timer().totalTime(
                TimeUnit.MILLISECONDS)).isEqualTo(15.0);
    }

    @Test
    void routesTransitionFailuresToCounter() {
        sink.trackMetric(MetricEvent.transitionFailure(EntityKind.MESSAGE, "m-1", "dispatch", NOW));

        assertThat(registry.find("lifecycle.status.transition.failure")
                .tags("entity", "message", "reason", "dispatch").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsOtherEventsAsGenericSummary() {
        sink.trackMetric(new MetricEvent(MetricDomain.SYSTEM, MetricType.RESOURCE, 42.0, NOW, Map.of("host", "a")));

        DistributionSummary summary = registry.find("lifecycle.metric")
                .tags("domain", "system", "type", "resource").summary();
        assertThat(summary).isNotNull();
        assertThat(summary.totalAmount()).isEqualTo(42.0);
    }

    @Test
    void neverTagsWithEntityIds() {
        sink.trackMetric(MetricEvent.transitionFailure(EntityKind.TASK, "task-123", "validation", NOW));

        assertThat(registry.getMeters()).allSatisfy(meter ->
                assertThat(meter.getId().getTags()).noneMatch(tag -> tag.getValue().equals("task-123")));
    }
}
