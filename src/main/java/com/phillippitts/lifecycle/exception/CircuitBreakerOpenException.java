package com.phillippitts.lifecycle.exception;

import java.util.Map;

/**
 * Reported by the recovery engine when the breaker for an error kind and component is open.
 *
 * <p>{@link #getResetInMillis()} tells callers how long until the next probe is allowed.
 */
public class CircuitBreakerOpenException extends LifecycleException {

    private final int failureCount;
    private final long resetInMillis;

    public CircuitBreakerOpenException(String component, int failureCount, long resetInMillis,
                                       LifecycleException originalError) {
        super(ErrorKind.CIRCUIT_BREAKER_ERROR,
                "Circuit breaker open for " + component + " (failures=" + failureCount
                        + ", resetInMs=" + resetInMillis + ")",
                component,
                Map.of("failureCount", failureCount, "resetInMillis", resetInMillis),
                originalError);
        this.failureCount = failureCount;
        this.resetInMillis = resetInMillis;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public long getResetInMillis() {
        return resetInMillis;
    }
}
