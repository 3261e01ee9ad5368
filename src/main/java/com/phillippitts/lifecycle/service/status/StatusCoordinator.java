package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.config.properties.StatusCoordinatorProperties;
import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.ErrorContext;
import com.phillippitts.lifecycle.domain.StatusChangeEvent;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.TransitionPhase;
import com.phillippitts.lifecycle.domain.ValidationResult;
import com.phillippitts.lifecycle.domain.status.StatusType;
import com.phillippitts.lifecycle.exception.ErrorKind;
import com.phillippitts.lifecycle.exception.HandlerExecutionException;
import com.phillippitts.lifecycle.exception.LifecycleException;
import com.phillippitts.lifecycle.exception.StatusValidationException;
import com.phillippitts.lifecycle.exception.ValidationTimeoutException;
import com.phillippitts.lifecycle.service.event.EventDispatcher;
import com.phillippitts.lifecycle.service.metrics.MetricEvent;
import com.phillippitts.lifecycle.service.metrics.MetricsSink;
import com.phillippitts.lifecycle.util.LogSanitizer;
import com.phillippitts.lifecycle.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single authority for status transitions of every entity kind.
 *
 * <p>A successful {@link #transition} runs these steps in order:
 * <ol>
 *   <li>validate (bounded by the validation timeout)</li>
 *   <li>build the {@link StatusChangeEvent}</li>
 *   <li>publish it through the {@link EventDispatcher}</li>
 *   <li>record history and the transition metric</li>
 *   <li>forward it to the report sink (best effort)</li>
 *   <li>notify the kind's subscribers concurrently</li>
 *   <li>invoke the synchronous change listener</li>
 * </ol>
 *
 * <p>A subscriber failure makes {@code transition} throw even though the event was already
 * published; consumers must tolerate that.
 *
 * <p>Unless concurrent transitions are allowed, steps 1 to 4 of transitions of the same entity
 * are serialized with a per-entity lock. Reporting, subscribers and the change listener run
 * after the lock is released, so they may transition the same entity again. An event handler
 * that does so waits at most {@code lockTimeoutMs} and then fails with {@code LockError}.
 * Unrelated entities never block each other. A lock entry lives only while some thread holds
 * or waits for it.
 *
 * <p>Thread-safe.
 */
public class StatusCoordinator {

    private static final Logger LOG = LogManager.getLogger(StatusCoordinator.class);

    static final String MDC_ENTITY_KIND = "entityKind";
    static final String MDC_ENTITY_ID = "entityId";

    private final StatusCoordinatorProperties props;
    private final StatusValidator validator;
    private final EventDispatcher dispatcher;
    private final MetricsSink metricsSink;
    private final StatusReportSink reportSink;
    private final StatusChangeListener onChange;
    private final StatusHistory history;
    private final Executor subscriberExecutor;
    private final Clock clock;

    private final Map<EntityKind, StatusType> initialStatuses;
    private final ConcurrentMap<String, StatusType> statusSyncMap = new ConcurrentHashMap<>();
    private final ConcurrentMap<EntityKind, Set<StatusChangeSubscriber>> subscribers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, EntityLock> entityLocks = new ConcurrentHashMap<>();

    public StatusCoordinator(StatusCoordinatorProperties props,
                             StatusValidator validator,
                             EventDispatcher dispatcher,
                             MetricsSink metricsSink,
                             StatusReportSink reportSink,
                             StatusChangeListener onChange,
                             Executor subscriberExecutor,
                             Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.metricsSink = Objects.requireNonNull(metricsSink, "metricsSink");
        this.reportSink = Objects.requireNonNull(reportSink, "reportSink");
        this.onChange = onChange == null ? StatusChangeListener.NO_OP : onChange;
        this.subscriberExecutor = Objects.requireNonNull(subscriberExecutor, "subscriberExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.history = new StatusHistory(props.getMaxHistoryLength());
        this.initialStatuses = resolveInitialStatuses(props.getInitialStatuses());
        LOG.info("StatusCoordinator initialized (validationTimeoutMs={}, concurrentTransitions={}, "
                        + "lockTimeoutMs={}, history={})", props.getValidationTimeoutMs(),
                props.isAllowConcurrentTransitions(), props.getLockTimeoutMs(), props.isEnableHistory());
    }

    /**
     * Validates and applies a transition.
     *
     * @param context transition request; {@code entityId}, {@code operation} and
     *                {@code startTime} are mandatory
     * @return true once every step completed
     * @throws StatusValidationException if the context is malformed or the validator rejected it
     * @throws ValidationTimeoutException if the validator did not answer in time
     * @throws HandlerExecutionException if an event handler or a subscriber failed
     * @throws LifecycleException with kind {@code LockError} if another transition of the same
     *         entity held the lock for longer than {@code lockTimeoutMs}
     */
    public boolean transition(TransitionContext context) {
        Objects.requireNonNull(context, "context");
        requireMandatoryFields(context);

        String outerKind = ThreadContext.get(MDC_ENTITY_KIND);
        String outerId = ThreadContext.get(MDC_ENTITY_ID);
        ThreadContext.put(MDC_ENTITY_KIND, context.entityKind().key());
        ThreadContext.put(MDC_ENTITY_ID, context.entityId());
        try {
            StatusChangeEvent event = props.isAllowConcurrentTransitions()
                    ? apply(context)
                    : applyLocked(context);
            notifyObservers(context, event);
            return true;
        } finally {
            restoreMdc(MDC_ENTITY_KIND, outerKind);
            restoreMdc(MDC_ENTITY_ID, outerId);
        }
    }

    // Nested transitions started by subscribers may run on the caller's thread.
    private static void restoreMdc(String key, String previous) {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }

    /**
     * Idempotent status sync: does nothing if the last synced status of the entity already
     * equals {@code status}. Otherwise stores {@code status} first, then transitions from the
     * previously synced status (or the kind's initial status).
     */
    public void syncStatus(EntityKind kind, String entityId, StatusType status,
                           ErrorContext errorContext, Map<String, ?> metadata) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        if (entityId == null || entityId.isBlank()) {
            throw new StatusValidationException("Entity ID is required");
        }
        StatusType previous = statusSyncMap.put(lockKey(kind, entityId), status);
        if (previous == status) {
            LOG.debug("Status of {} {} already {}; skipping sync", kind.key(), entityId, status);
            return;
        }
        TransitionContext context = TransitionContext.builder(kind)
                .entityId(entityId)
                .from(previous != null ? previous : getInitialStatus(kind))
                .to(status)
                .operation("sync")
                .startTime(clock.instant())
                .errorContext(errorContext)
                .metadata(metadata)
                .build();
        transition(context);
    }

    /**
     * Runs the validator, bounded by the validation timeout. On timeout the validator's
     * future is cancelled and abandoned.
     *
     * @throws ValidationTimeoutException if the validator did not answer in time
     */
    public ValidationResult validateTransition(TransitionContext context) {
        long timeoutMs = props.getValidationTimeoutMs();
        long start = System.nanoTime();
        CompletableFuture<ValidationResult> pending = validator.validateTransition(context);
        try {
            ValidationResult result = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
            long durationMs = TimeUtils.elapsedMillis(start);
            if (result == null) {
                return ValidationResult.invalid("status-coordinator", "Validator returned no result")
                        .withDuration(durationMs);
            }
            return result.durationMs() > 0 ? result : result.withDuration(durationMs);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new ValidationTimeoutException(
                    "Status validation timed out after " + timeoutMs + " ms", timeoutMs);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new LifecycleException(ErrorKind.SYSTEM_ERROR, "Interrupted while validating transition", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LifecycleException le) {
                throw le;
            }
            throw new StatusValidationException("Validator failed: " + LogSanitizer.truncate(cause.getMessage()),
                    List.of(String.valueOf(cause.getMessage())));
        }
    }

    /**
     * Registers a subscriber for status changes of one kind.
     *
     * @return handle whose {@code unsubscribe()} is idempotent
     */
    public Subscription subscribe(EntityKind kind, StatusChangeSubscriber subscriber) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(subscriber, "subscriber");
        subscribers.computeIfAbsent(kind, k -> ConcurrentHashMap.newKeySet()).add(subscriber);
        return () -> subscribers.computeIfPresent(kind, (k, set) -> {
            set.remove(subscriber);
            return set.isEmpty() ? null : set;
        });
    }

    public int subscriberCount(EntityKind kind) {
        Set<StatusChangeSubscriber> set = subscribers.get(kind);
        return set == null ? 0 : set.size();
    }

    public Optional<StatusType> getLastKnownStatus(EntityKind kind, String entityId) {
        return Optional.ofNullable(statusSyncMap.get(lockKey(kind, entityId)));
    }

    public StatusType getInitialStatus(EntityKind kind) {
        return initialStatuses.get(kind);
    }

    /**
     * Most recent status change events, oldest first. Empty when history is disabled.
     */
    public List<StatusChangeEvent> getHistory() {
        return history.recent();
    }

    public void clearHistory() {
        history.clear();
    }

    public StatusHistory history() {
        return history;
    }

    int lockCount() {
        return entityLocks.size();
    }

    private StatusChangeEvent applyLocked(TransitionContext context) {
        String key = lockKey(context.entityKind(), context.entityId());
        EntityLock entry = entityLocks.compute(key, (k, existing) -> {
            EntityLock target = existing != null ? existing : new EntityLock();
            target.users++;
            return target;
        });
        boolean acquired;
        try {
            acquired = entry.lock.tryLock(props.getLockTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            releaseEntry(key);
            Thread.currentThread().interrupt();
            throw new LifecycleException(ErrorKind.LOCK_ERROR, "Interrupted while waiting for " + key, e);
        }
        if (!acquired) {
            releaseEntry(key);
            trackFailure(context, "lock");
            throw new LifecycleException(ErrorKind.LOCK_ERROR, "Timed out after " + props.getLockTimeoutMs()
                    + " ms waiting for another transition of " + key, "status-coordinator",
                    Map.of("entity", key), null);
        }
        try {
            return apply(context);
        } finally {
            entry.lock.unlock();
            releaseEntry(key);
        }
    }

    private void releaseEntry(String key) {
        entityLocks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
    }

    private StatusChangeEvent apply(TransitionContext context) {
        EntityKind kind = context.entityKind();
        TransitionContext executing = context.withPhase(TransitionPhase.EXECUTION);

        ValidationResult validation;
        try {
            validation = validateTransition(executing);
        } catch (ValidationTimeoutException e) {
            trackFailure(context, "timeout");
            LOG.warn("Validation of {} transition {} -> {} timed out after {} ms", kind.key(),
                    context.currentStatus(), context.targetStatus(), e.getTimeoutMs());
            throw e;
        } catch (LifecycleException e) {
            trackFailure(context, "validator");
            throw e;
        }
        if (!validation.valid()) {
            trackFailure(context, "validation");
            throw new StatusValidationException("Invalid " + kind.key() + " transition "
                    + context.currentStatus() + " -> " + context.targetStatus() + ": "
                    + String.join("; ", validation.errors()), validation.errors());
        }

        Instant now = clock.instant();
        Duration duration = Duration.between(context.startTime(), now);
        StatusChangeEvent event = StatusChangeEvent.of(kind, context.entityId(), context.currentStatus(),
                context.targetStatus(), validation, eventMetadata(context, duration), now);

        try {
            dispatcher.emit(event);
        } catch (LifecycleException e) {
            trackFailure(context, "dispatch");
            throw e;
        }

        if (props.isEnableHistory()) {
            history.record(event, executing.withPhase(TransitionPhase.POST_EXECUTION).withDuration(duration));
        }
        metricsSink.trackMetric(MetricEvent.transition(event, duration));
        LOG.info("Transitioned {} {} from {} to {} in {} ms", kind.key(), context.entityId(),
                event.from(), event.to(), duration.toMillis());
        return event;
    }

    private void notifyObservers(TransitionContext context, StatusChangeEvent event) {
        publishReport(event);
        try {
            notifySubscribers(event);
        } catch (HandlerExecutionException e) {
            trackFailure(context, "subscriber");
            LOG.error("Subscriber failed after {} transition {} -> {}: {}", event.entityKind().key(),
                    event.from(), event.to(), LogSanitizer.truncate(e.getCause().getMessage()));
            throw e;
        }
        onChange.onStatusChange(event);
    }

    private void requireMandatoryFields(TransitionContext context) {
        List<String> missing = new ArrayList<>();
        if (context.entityId() == null || context.entityId().isBlank()) {
            missing.add("Entity ID is required");
        }
        if (context.operation() == null || context.operation().isBlank()) {
            missing.add("Operation is required");
        }
        if (context.startTime() == null) {
            missing.add("Start time is required");
        }
        if (!missing.isEmpty()) {
            trackFailure(context, "malformed");
            throw new StatusValidationException("Invalid transition context: " + String.join("; ", missing),
                    missing);
        }
    }

    private void notifySubscribers(StatusChangeEvent event) {
        Set<StatusChangeSubscriber> current = subscribers.get(event.entityKind());
        if (current == null || current.isEmpty()) {
            return;
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(current.size());
        for (StatusChangeSubscriber subscriber : List.copyOf(current)) {
            futures.add(CompletableFuture.runAsync(() -> subscriber.onStatusChange(event), subscriberExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new HandlerExecutionException("Status subscriber failed for event " + event.id(), cause);
        }
    }

    private void publishReport(StatusChangeEvent event) {
        try {
            reportSink.report(event);
        } catch (RuntimeException e) {
            LOG.warn("Status report sink failed for event {}: {}", event.id(), LogSanitizer.truncate(e.getMessage()));
        }
    }

    private void trackFailure(TransitionContext context, String reason) {
        metricsSink.trackMetric(MetricEvent.transitionFailure(context.entityKind(), context.entityId(), reason,
                clock.instant()));
    }

    private static Map<String, Object> eventMetadata(TransitionContext context, Duration duration) {
        Map<String, Object> metadata = new LinkedHashMap<>(context.metadata());
        metadata.put("operation", context.operation());
        metadata.put("durationMs", duration.toMillis());
        if (context.errorContext() != null) {
            metadata.put("errorKind", context.errorContext().error().getKind().wireName());
        }
        return metadata;
    }

    private static Map<EntityKind, StatusType> resolveInitialStatuses(Map<String, String> overrides) {
        Map<EntityKind, StatusType> resolved = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            resolved.put(kind, kind.initialStatus());
        }
        overrides.forEach((key, name) -> {
            EntityKind kind = EntityKind.fromKey(key)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown entity kind: " + key));
            StatusType status = kind.statusOf(name).orElseThrow(() -> new IllegalArgumentException(
                    "Unknown " + kind.key() + " status: " + name));
            resolved.put(kind, status);
        });
        return resolved;
    }

    private static String lockKey(EntityKind kind, String entityId) {
        return kind.key() + ":" + entityId;
    }

    /**
     * Lock plus the number of threads holding or waiting for it; only mutated inside
     * {@code entityLocks.compute}.
     */
    private static final class EntityLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
