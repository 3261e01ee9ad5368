package com.phillippitts.lifecycle.domain;

import com.phillippitts.lifecycle.exception.LifecycleException;

import java.util.Objects;

/**
 * Error details attached to a transition that moves an entity into its error status.
 *
 * @param error normalized error
 * @param recoverable whether the recovery engine claims it can handle the error
 * @param retryCount retries already spent on the failing operation
 * @param failureReason short human-readable reason
 * @param recommendedAction suggested next step for operators, may be null
 */
public record ErrorContext(LifecycleException error,
                           boolean recoverable,
                           int retryCount,
                           String failureReason,
                           String recommendedAction) {

    public ErrorContext {
        Objects.requireNonNull(error, "error");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        if (failureReason == null) {
            failureReason = error.getMessage();
        }
    }
}
