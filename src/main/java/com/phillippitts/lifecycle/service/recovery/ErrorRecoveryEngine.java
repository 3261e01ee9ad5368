package com.phillippitts.lifecycle.service.recovery;

import com.phillippitts.lifecycle.config.properties.ErrorRecoveryProperties;
import com.phillippitts.lifecycle.exception.CircuitBreakerOpenException;
import com.phillippitts.lifecycle.exception.ErrorKind;
import com.phillippitts.lifecycle.exception.LifecycleException;
import com.phillippitts.lifecycle.service.metrics.LifecycleMetrics;
import com.phillippitts.lifecycle.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides how to recover from an error and carries the recovery out.
 *
 * <p>Strategies are tried in a fixed order:
 * <ol>
 *   <li><b>Circuit breaker</b> when the breaker for (kind, component) has reached the failure
 *       threshold: either refuses with {@link CircuitBreakerOpenException} or, once the reset
 *       window has passed, resets the counter and lets the call through.</li>
 *   <li><b>Retry</b> for transient kinds (network, timeout, rate limit): up to
 *       {@code maxRetries} attempts, each preceded by an exponential backoff wait.</li>
 *   <li><b>Fallback</b> when a fallback handler is configured.</li>
 *   <li><b>None</b> otherwise.</li>
 * </ol>
 *
 * <p>Every handled error is added to the {@link ErrorAggregation}, whatever the outcome.
 * Errors whose recovery failed count towards their breaker.
 */
public class ErrorRecoveryEngine {

    private static final Logger LOG = LogManager.getLogger(ErrorRecoveryEngine.class);

    private final ErrorRecoveryProperties props;
    private final RecoveryAction fallbackHandler;
    private final CircuitBreakerRegistry breakers;
    private final ErrorAggregation aggregation;
    private final LifecycleMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;

    public ErrorRecoveryEngine(ErrorRecoveryProperties props,
                               RecoveryAction fallbackHandler,
                               CircuitBreakerRegistry breakers,
                               ErrorAggregation aggregation,
                               LifecycleMetrics metrics,
                               Sleeper sleeper,
                               Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.fallbackHandler = fallbackHandler;
        this.breakers = Objects.requireNonNull(breakers, "breakers");
        this.aggregation = Objects.requireNonNull(aggregation, "aggregation");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * True if the error is of a retryable kind or its breaker has reached the threshold.
     */
    public boolean canHandle(LifecycleException error) {
        return error.getKind().isRetryable() || breakerTripped(error);
    }

    public RecoveryResult handle(LifecycleException error, String context) {
        return handle(error, context, null);
    }

    /**
     * Recovers from an error.
     *
     * @param error error to recover from
     * @param context free-form description of where the error happened, used in logs
     * @param operation operation to retry for retryable errors; the fallback handler is
     *                  retried when null
     * @return outcome; never throws for a failed recovery
     */
    public RecoveryResult handle(LifecycleException error, String context, RecoveryAction operation) {
        Objects.requireNonNull(error, "error");
        long start = System.nanoTime();
        RecoveryResult result;
        try {
            if (breakerTripped(error)) {
                result = handleCircuitBreaker(error, start);
            } else if (error.getKind().isRetryable()) {
                result = handleRetry(error, context, operation != null ? operation : fallbackHandler, start);
            } else if (fallbackHandler != null) {
                fallbackHandler.recover(error);
                result = RecoveryResult.succeeded(RecoveryStrategy.FALLBACK, 1, elapsed(start));
            } else {
                result = RecoveryResult.failed(RecoveryStrategy.NONE, 1, elapsed(start), error);
            }
        } catch (Exception recoveryError) {
            LOG.error("Error recovery failed for {} in {}: {}", error.getKind().wireName(), context,
                    LogSanitizer.truncate(recoveryError.getMessage()));
            result = RecoveryResult.failed(RecoveryStrategy.NONE, 0, elapsed(start), error);
        } finally {
            aggregation.record(error);
        }

        if (!result.success() && result.strategy() != RecoveryStrategy.CIRCUIT_BREAKER) {
            breakers.recordFailure(CircuitBreakerKey.of(error), clock.instant());
        }
        metrics.recordRecovery(result.strategy().wireName(), result.success());
        metrics.incrementError(error.getKind().wireName());
        LOG.info("Recovery for {} ({}) finished: strategy={}, success={}, attempts={}",
                error.getKind().wireName(), error.getComponent(), result.strategy().wireName(),
                result.success(), result.attempts());
        return result;
    }

    /**
     * Counts a failure for the error's breaker without attempting recovery.
     */
    public void recordFailure(LifecycleException error) {
        breakers.recordFailure(CircuitBreakerKey.of(error), clock.instant());
    }

    public Map<ErrorKind, ErrorTrend> getErrorTrends() {
        return aggregation.trends();
    }

    public Map<ErrorKind, ErrorImpact> getErrorImpacts() {
        return aggregation.impacts();
    }

    public ErrorAggregation.Summary getErrorAggregation() {
        return aggregation.summary();
    }

    public Optional<CircuitBreakerState> getCircuitBreakerState(ErrorKind kind, String component) {
        return breakers.state(new CircuitBreakerKey(kind, component));
    }

    private boolean breakerTripped(LifecycleException error) {
        return breakers.failureCount(CircuitBreakerKey.of(error))
                >= props.getCircuitBreaker().getFailureThreshold();
    }

    private RecoveryResult handleCircuitBreaker(LifecycleException error, long start) {
        ErrorRecoveryProperties.CircuitBreaker config = props.getCircuitBreaker();
        CircuitBreakerKey key = CircuitBreakerKey.of(error);
        CircuitBreakerRegistry.Decision decision = breakers.evaluate(key, clock.instant(),
                config.getFailureThreshold(), config.resetTimeout());
        if (decision.open()) {
            LOG.warn("Circuit breaker open for {} ({} failures, reset in {} ms)", key,
                    decision.failureCount(), decision.resetIn().toMillis());
            return RecoveryResult.failed(RecoveryStrategy.CIRCUIT_BREAKER, 1, elapsed(start),
                    new CircuitBreakerOpenException(key.component(), decision.failureCount(),
                            decision.resetIn().toMillis(), error));
        }
        return RecoveryResult.succeeded(RecoveryStrategy.CIRCUIT_BREAKER, 1, elapsed(start));
    }

    private RecoveryResult handleRetry(LifecycleException error, String context, RecoveryAction action,
                                       long start) {
        if (action == null) {
            LOG.warn("No operation to retry for {} in {}; giving up", error.getKind().wireName(), context);
            return RecoveryResult.failed(RecoveryStrategy.RETRY, 0, elapsed(start), error);
        }
        ErrorRecoveryProperties.Retry config = props.getRetry();
        LifecycleException lastError = error;
        int attempts = 0;
        while (attempts < config.getMaxRetries()) {
            attempts++;
            try {
                sleeper.sleep(config.delayBeforeAttempt(attempts));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Retry of {} interrupted after {} attempt(s)", error.getKind().wireName(), attempts - 1);
                return RecoveryResult.failed(RecoveryStrategy.RETRY, attempts - 1, elapsed(start), lastError);
            }
            try {
                action.recover(error);
                return RecoveryResult.succeeded(RecoveryStrategy.RETRY, attempts, elapsed(start));
            } catch (Exception e) {
                lastError = e instanceof LifecycleException le
                        ? le
                        : new LifecycleException(error.getKind(), e.getMessage(), error.getComponent(),
                        Map.of("attempt", attempts), e);
                LOG.debug("Retry attempt {}/{} for {} failed: {}", attempts, config.getMaxRetries(),
                        error.getKind().wireName(), LogSanitizer.truncate(e.getMessage()));
            }
        }
        return RecoveryResult.failed(RecoveryStrategy.RETRY, attempts, elapsed(start), lastError);
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
