package com.phillippitts.lifecycle.service.metrics;

import com.phillippitts.lifecycle.domain.EntityKind;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * {@link MetricsSink} translating generic metric events into Micrometer meters.
 *
 * <p>Transitions and transition failures go through {@link LifecycleMetrics}; anything else
 * becomes a {@code lifecycle.metric} distribution summary tagged with domain and type.
 * High-cardinality metadata such as entity ids is only written to the debug log.
 */
public class MicrometerMetricsSink implements MetricsSink {

    private static final Logger LOG = LogManager.getLogger(MicrometerMetricsSink.class);

    private final LifecycleMetrics metrics;
    private final MeterRegistry registry;

    public MicrometerMetricsSink(LifecycleMetrics metrics, MeterRegistry registry) {
        this.metrics = metrics;
        this.registry = registry;
    }

    @Override
    public void trackMetric(MetricEvent event) {
        Object kind = event.metadata().get(MetricEvent.ENTITY_KIND);
        if (event.type() == MetricType.STATE_TRANSITION && kind instanceof EntityKind entityKind) {
            metrics.recordTransition(entityKind, (long) (event.value() * 1_000_000L));
        } else if (event.type() == MetricType.ERROR && kind instanceof EntityKind entityKind) {
            Object reason = event.metadata().getOrDefault(MetricEvent.REASON, "unknown");
            metrics.incrementTransitionFailure(entityKind, String.valueOf(reason));
        } else {
            DistributionSummary.builder(LifecycleMetrics.METRIC_PREFIX + ".metric")
                    .description("Generic lifecycle metric events")
                    .tag("domain", event.domain().name().toLowerCase(Locale.ROOT))
                    .tag("type", event.type().name().toLowerCase(Locale.ROOT))
                    .register(registry)
                    .record(event.value());
        }
        LOG.debug("Tracked metric {}/{} value={} metadata={}",
                event.domain(), event.type(), event.value(), event.metadata());
    }
}
