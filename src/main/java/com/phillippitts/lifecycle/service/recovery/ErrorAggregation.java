package com.phillippitts.lifecycle.service.recovery;

import com.phillippitts.lifecycle.domain.ResourceSnapshot;
import com.phillippitts.lifecycle.exception.ErrorKind;
import com.phillippitts.lifecycle.exception.LifecycleException;
import com.phillippitts.lifecycle.service.metrics.ResourceSnapshotProvider;
import com.phillippitts.lifecycle.util.TimeUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Running totals of handled errors: per kind, per component, trend and impact per kind.
 *
 * <p>Updated once per handled error. All updates and reads happen under one lock, so a
 * {@link Summary} is always internally consistent.
 */
public class ErrorAggregation {

    private final Clock clock;
    private final ResourceSnapshotProvider resources;
    private final ReentrantLock lock = new ReentrantLock();

    private long totalErrors;
    private final Map<ErrorKind, Long> errorsByKind = new EnumMap<>(ErrorKind.class);
    private final Map<String, Long> errorsByComponent = new HashMap<>();
    private final Map<ErrorKind, TrendAccumulator> trends = new EnumMap<>(ErrorKind.class);
    private final Map<ErrorKind, ErrorImpact> impacts = new EnumMap<>(ErrorKind.class);

    public ErrorAggregation(Clock clock, ResourceSnapshotProvider resources) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.resources = Objects.requireNonNull(resources, "resources");
    }

    /**
     * Consistent copy of the aggregation.
     */
    public record Summary(long totalErrors,
                          Map<ErrorKind, Long> errorsByKind,
                          Map<String, Long> errorsByComponent,
                          Map<ErrorKind, ErrorTrend> trends,
                          Map<ErrorKind, ErrorImpact> impacts,
                          Instant timestamp) {

        public Summary {
            errorsByKind = Map.copyOf(errorsByKind);
            errorsByComponent = Map.copyOf(errorsByComponent);
            trends = Map.copyOf(trends);
            impacts = Map.copyOf(impacts);
        }
    }

    public void record(LifecycleException error) {
        Instant now = clock.instant();
        ResourceSnapshot snapshot = resources.getInitialResourceMetrics();
        lock.lock();
        try {
            totalErrors++;
            errorsByKind.merge(error.getKind(), 1L, Long::sum);
            errorsByComponent.merge(error.getComponent(), 1L, Long::sum);
            TrendAccumulator trend = trends.computeIfAbsent(error.getKind(), k -> new TrendAccumulator(k, now));
            trend.add(error.getComponent(), now);
            impacts.put(error.getKind(),
                    ErrorImpact.assess(trend.frequency(), snapshot.cpuUsage(), snapshot.memoryUsage()));
        } finally {
            lock.unlock();
        }
    }

    public Map<ErrorKind, ErrorTrend> trends() {
        lock.lock();
        try {
            Map<ErrorKind, ErrorTrend> copy = new EnumMap<>(ErrorKind.class);
            trends.forEach((kind, acc) -> copy.put(kind, acc.toTrend()));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    public Map<ErrorKind, ErrorImpact> impacts() {
        lock.lock();
        try {
            return new EnumMap<>(impacts);
        } finally {
            lock.unlock();
        }
    }

    public Summary summary() {
        lock.lock();
        try {
            return new Summary(totalErrors, errorsByKind, errorsByComponent, trends(), impacts(), clock.instant());
        } finally {
            lock.unlock();
        }
    }

    private static final class TrendAccumulator {
        private final ErrorKind kind;
        private final Instant first;
        private Instant last;
        private long count;
        private final Set<String> components = new LinkedHashSet<>();

        TrendAccumulator(ErrorKind kind, Instant first) {
            this.kind = kind;
            this.first = first;
            this.last = first;
        }

        void add(String component, Instant at) {
            count++;
            last = at;
            components.add(component);
        }

        double frequency() {
            return count / TimeUtils.minutesAtLeastOne(first, last);
        }

        ErrorTrend toTrend() {
            double frequency = frequency();
            return new ErrorTrend(kind, count, first, last, frequency,
                    ImpactLevel.ofTrend(frequency, components.size()), components);
        }
    }
}
