package com.phillippitts.lifecycle.service.coordination;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.ErrorContext;
import com.phillippitts.lifecycle.domain.PerformanceSnapshot;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.TransitionPhase;
import com.phillippitts.lifecycle.domain.status.StatusType;
import com.phillippitts.lifecycle.exception.LifecycleException;
import com.phillippitts.lifecycle.service.metrics.ResourceSnapshotProvider;
import com.phillippitts.lifecycle.service.recovery.ErrorRecoveryEngine;
import com.phillippitts.lifecycle.service.recovery.RecoveryResult;
import com.phillippitts.lifecycle.service.status.StatusCoordinator;
import com.phillippitts.lifecycle.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Entry point for errors raised by managed operations.
 *
 * <p>For every error it:
 * <ol>
 *   <li>normalizes it to a {@link LifecycleException}</li>
 *   <li>moves the owning entity into its error status through the {@link StatusCoordinator},
 *       attaching resource and performance snapshots (a failure here is logged and does
 *       not stop recovery)</li>
 *   <li>runs the {@link ErrorRecoveryEngine}</li>
 *   <li>updates the recovery counters</li>
 *   <li>rethrows the error if recovery failed</li>
 * </ol>
 */
public class ErrorCoordinator {

    private static final Logger LOG = LogManager.getLogger(ErrorCoordinator.class);

    private final StatusCoordinator statusCoordinator;
    private final ErrorRecoveryEngine recoveryEngine;
    private final ResourceSnapshotProvider resources;
    private final Clock clock;

    private final Object statsLock = new Object();
    private long attempts;
    private long successes;
    private long failures;

    public ErrorCoordinator(StatusCoordinator statusCoordinator,
                            ErrorRecoveryEngine recoveryEngine,
                            ResourceSnapshotProvider resources,
                            Clock clock) {
        this.statusCoordinator = Objects.requireNonNull(statusCoordinator, "statusCoordinator");
        this.recoveryEngine = Objects.requireNonNull(recoveryEngine, "recoveryEngine");
        this.resources = Objects.requireNonNull(resources, "resources");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Routes an error through status marking and recovery.
     *
     * @return the successful recovery result
     * @throws LifecycleException the normalized error when recovery failed; the recovery
     *         engine's own error, if different, is attached as suppressed
     */
    public RecoveryResult handleError(Throwable error, ErrorScope scope) {
        Objects.requireNonNull(scope, "scope");
        Instant startedAt = clock.instant();
        LifecycleException normalized = ErrorNormalizer.normalize(error, scope.component(),
                Map.of("operation", scope.operation(), "entityId", scope.entityId()));

        markErrored(normalized, scope, startedAt);

        RecoveryResult result = recoveryEngine.handle(normalized, scope.describe());
        recordOutcome(result.success());

        if (result.success()) {
            LOG.info("Recovered {} {} from {} via {} after {} attempt(s)", scope.entityKind().key(),
                    scope.entityId(), normalized.getKind().wireName(), result.strategy().wireName(),
                    result.attempts());
            return result;
        }

        LOG.error("Recovery failed for {} {} ({}): {}", scope.entityKind().key(), scope.entityId(),
                normalized.getKind().wireName(), LogSanitizer.truncate(normalized.getMessage()));
        result.failure()
                .filter(recoveryError -> recoveryError != normalized)
                .ifPresent(normalized::addSuppressed);
        throw normalized;
    }

    /**
     * Runs a managed operation and routes its failure through {@link #handleError}.
     *
     * @return the operation's result, or empty if it failed and recovery succeeded
     * @throws LifecycleException if the operation failed and recovery did not succeed
     */
    public <T> Optional<T> execute(ErrorScope scope, Callable<T> operation) {
        Objects.requireNonNull(operation, "operation");
        try {
            return Optional.ofNullable(operation.call());
        } catch (Exception e) {
            handleError(e, scope);
            return Optional.empty();
        }
    }

    public RecoveryStats getRecoveryStats() {
        synchronized (statsLock) {
            return RecoveryStats.of(attempts, successes, failures);
        }
    }

    private void markErrored(LifecycleException error, ErrorScope scope, Instant startedAt) {
        EntityKind kind = scope.entityKind();
        String entityId = scope.entityId();
        StatusType errorStatus = kind.errorStatus();
        StatusType current = scope.currentStatus() != null
                ? scope.currentStatus()
                : statusCoordinator.getLastKnownStatus(kind, entityId).orElse(statusCoordinator.getInitialStatus(kind));
        if (current == errorStatus) {
            LOG.debug("{} {} already in {}", kind.key(), entityId, errorStatus);
            return;
        }

        boolean recoverable = recoveryEngine.canHandle(error);
        PerformanceSnapshot performance = resources.getInitialPerformanceMetrics()
                .withExecutionTime(Duration.between(startedAt, clock.instant()).toMillis());
        TransitionContext context = TransitionContext.builder(kind)
                .entityId(entityId)
                .from(current)
                .to(errorStatus)
                .operation("error:" + scope.operation())
                .phase(TransitionPhase.PRE_EXECUTION)
                .startTime(startedAt)
                .errorContext(new ErrorContext(error, recoverable, 0,
                        LogSanitizer.truncate(error.getMessage()),
                        recoverable ? "Automatic recovery will be attempted" : "Manual intervention required"))
                .resourceSnapshot(resources.getInitialResourceMetrics())
                .performanceSnapshot(performance)
                .metadata("errorKind", error.getKind().wireName())
                .metadata("component", error.getComponent())
                .build();
        try {
            statusCoordinator.transition(context);
        } catch (LifecycleException e) {
            LOG.warn("Could not move {} {} from {} to {}: {}", kind.key(), entityId, current, errorStatus,
                    LogSanitizer.truncate(e.getMessage()));
        }
    }

    private void recordOutcome(boolean success) {
        synchronized (statsLock) {
            attempts++;
            if (success) {
                successes++;
            } else {
                failures++;
            }
        }
    }
}
