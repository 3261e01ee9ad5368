package com.phillippitts.lifecycle.service.recovery;

import com.phillippitts.lifecycle.exception.LifecycleException;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one {@link ErrorRecoveryEngine#handle} call.
 *
 * @param success whether the error was recovered from
 * @param strategy strategy that was applied
 * @param attempts attempts made (retries, or 1 for fallback/none)
 * @param duration wall time spent recovering
 * @param error last error when recovery failed, null on success
 */
public record RecoveryResult(boolean success,
                             RecoveryStrategy strategy,
                             int attempts,
                             Duration duration,
                             LifecycleException error) {

    public RecoveryResult {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(duration, "duration");
    }

    static RecoveryResult succeeded(RecoveryStrategy strategy, int attempts, Duration duration) {
        return new RecoveryResult(true, strategy, attempts, duration, null);
    }

    static RecoveryResult failed(RecoveryStrategy strategy, int attempts, Duration duration,
                                 LifecycleException error) {
        return new RecoveryResult(false, strategy, attempts, duration, error);
    }

    public Optional<LifecycleException> failure() {
        return Optional.ofNullable(error);
    }
}
