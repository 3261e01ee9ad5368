package com.phillippitts.lifecycle.service.recovery;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Failure counters per {@link CircuitBreakerKey}.
 *
 * <p>Every update is a single atomic {@code compute} on the key, so concurrent failures for
 * the same key are never lost. A state is created on the first failure and removed when the
 * breaker resets.
 */
public class CircuitBreakerRegistry {

    private static final Logger LOG = LogManager.getLogger(CircuitBreakerRegistry.class);

    private final ConcurrentMap<CircuitBreakerKey, CircuitBreakerState> states = new ConcurrentHashMap<>();

    /**
     * Outcome of {@link #evaluate}.
     *
     * @param open true if calls for the key are currently refused
     * @param failureCount failures counted including this one
     * @param resetIn time left until the breaker lets a probe through; zero when closed
     */
    public record Decision(boolean open, int failureCount, Duration resetIn) {
    }

    public int failureCount(CircuitBreakerKey key) {
        CircuitBreakerState state = states.get(key);
        return state == null ? 0 : state.failureCount();
    }

    public Optional<CircuitBreakerState> state(CircuitBreakerKey key) {
        return Optional.ofNullable(states.get(key));
    }

    public Map<CircuitBreakerKey, CircuitBreakerState> snapshot() {
        return Map.copyOf(states);
    }

    /**
     * Counts one failure for the key.
     */
    public CircuitBreakerState recordFailure(CircuitBreakerKey key, Instant now) {
        return states.compute(key, (k, prev) ->
                new CircuitBreakerState(prev == null ? 1 : prev.failureCount() + 1, now));
    }

    /**
     * Counts a failure and decides whether the breaker is open.
     *
     * <p>The breaker is open when the count reaches {@code threshold} and the previous failure
     * happened less than {@code resetTimeout} ago. Once the reset window has passed the
     * counter is cleared and the call is let through.
     */
    public Decision evaluate(CircuitBreakerKey key, Instant now, int threshold, Duration resetTimeout) {
        Decision[] decision = new Decision[1];
        states.compute(key, (k, prev) -> {
            int failures = (prev == null ? 0 : prev.failureCount()) + 1;
            Duration elapsed = prev == null || prev.lastFailure() == null
                    ? Duration.ZERO
                    : Duration.between(prev.lastFailure(), now);
            if (failures >= threshold && elapsed.compareTo(resetTimeout) < 0) {
                decision[0] = new Decision(true, failures, resetTimeout.minus(elapsed));
                return new CircuitBreakerState(failures, now);
            }
            if (failures >= threshold) {
                decision[0] = new Decision(false, 0, Duration.ZERO);
                return null;
            }
            decision[0] = new Decision(false, failures, Duration.ZERO);
            return new CircuitBreakerState(failures, now);
        });
        if (!decision[0].open() && decision[0].failureCount() == 0) {
            LOG.info("Circuit breaker {} reset after quiet period", key);
        }
        return decision[0];
    }

    public void reset(CircuitBreakerKey key) {
        states.remove(key);
    }
}
