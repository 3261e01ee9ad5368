package com.phillippitts.lifecycle.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the error recovery engine ({@code lifecycle.recovery.*}).
 *
 * <p>Both sections are always present; missing values fall back to the defaults
 * (3 retries starting at 1s doubling each time, breaker opening at 5 failures for 60s).
 */
@Validated
@ConfigurationProperties(prefix = "lifecycle.recovery")
public class ErrorRecoveryProperties {

    @Valid
    @NotNull
    private final Retry retry;

    @Valid
    @NotNull
    private final CircuitBreaker circuitBreaker;

    @ConstructorBinding
    public ErrorRecoveryProperties(Retry retry, CircuitBreaker circuitBreaker) {
        this.retry = retry == null ? new Retry(null, null, null) : retry;
        this.circuitBreaker = circuitBreaker == null ? new CircuitBreaker(null, null) : circuitBreaker;
    }

    public static ErrorRecoveryProperties defaults() {
        return new ErrorRecoveryProperties(null, null);
    }

    public Retry getRetry() {
        return retry;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    /**
     * Exponential backoff settings. The wait before attempt {@code n} (1-based) is
     * {@code initialDelayMs * backoffFactor^(n-1)}.
     */
    public static class Retry {

        @Min(0)
        private final int maxRetries;

        @Min(0)
        private final long initialDelayMs;

        @DecimalMin("1.0")
        private final double backoffFactor;

        public Retry(Integer maxRetries, Long initialDelayMs, Double backoffFactor) {
            this.maxRetries = maxRetries == null ? 3 : maxRetries;
            this.initialDelayMs = initialDelayMs == null ? 1000L : initialDelayMs;
            this.backoffFactor = backoffFactor == null ? 2.0 : backoffFactor;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public Duration delayBeforeAttempt(int attempt) {
            return Duration.ofMillis(Math.round(initialDelayMs * Math.pow(backoffFactor, attempt - 1)));
        }
    }

    public static class CircuitBreaker {

        @Positive
        private final int failureThreshold;

        @Positive
        private final long resetTimeoutMs;

        public CircuitBreaker(Integer failureThreshold, Long resetTimeoutMs) {
            this.failureThreshold = failureThreshold == null ? 5 : failureThreshold;
            this.resetTimeoutMs = resetTimeoutMs == null ? 60_000L : resetTimeoutMs;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public long getResetTimeoutMs() {
            return resetTimeoutMs;
        }

        public Duration resetTimeout() {
            return Duration.ofMillis(resetTimeoutMs);
        }
    }
}
