package com.phillippitts.lifecycle.service.recovery;

import java.time.Instant;

/**
 * Failures counted for one breaker and the time of the latest one.
 */
public record CircuitBreakerState(int failureCount, Instant lastFailure) {
}
