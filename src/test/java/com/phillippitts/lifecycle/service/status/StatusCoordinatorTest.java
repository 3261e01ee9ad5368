package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.config.properties.StatusCoordinatorProperties;
import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.ErrorContext;
import com.phillippitts.lifecycle.domain.StatusChangeEvent;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.ValidationResult;
import com.phillippitts.lifecycle.domain.status.StatusType;
import com.phillippitts.lifecycle.domain.status.TaskStatus;
import com.phillippitts.lifecycle.domain.status.WorkflowStatus;
import com.phillippitts.lifecycle.exception.ErrorKind;
import com.phillippitts.lifecycle.exception.HandlerExecutionException;
import com.phillippitts.lifecycle.exception.LifecycleException;
import com.phillippitts.lifecycle.exception.StatusValidationException;
import com.phillippitts.lifecycle.service.event.DefaultEventDispatcher;
import com.phillippitts.lifecycle.service.event.EventHandler;
import com.phillippitts.lifecycle.service.metrics.MetricEvent;
import com.phillippitts.lifecycle.service.metrics.MetricType;
import com.phillippitts.lifecycle.testutil.MutableClock;
import com.phillippitts.lifecycle.testutil.SyncExecutor;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class StatusCoordinatorTest {

    private MutableClock clock;
    private DefaultEventDispatcher dispatcher;
    private List<MetricEvent> metrics;
    private List<StatusChangeEvent> reports;
    private List<String> steps;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        dispatcher = new DefaultEventDispatcher(new SyncExecutor());
        metrics = new CopyOnWriteArrayList<>();
        reports = new CopyOnWriteArrayList<>();
        steps = new CopyOnWriteArrayList<>();
    }

    @Test
    void shouldApplyValidTransitionAndRecordHistory() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        RecordingHandler handler = new RecordingHandler();
        dispatcher.on(StatusChangeEvent.typeFor(EntityKind.TASK), StatusChangeEvent.class, handler);

        boolean applied = coordinator.transition(task("task-1", TaskStatus.TODO, TaskStatus.DOING));

        assertThat(applied).isTrue();
        assertThat(handler.events).singleElement().satisfies(e -> {
            assertThat(e.from()).isEqualTo(TaskStatus.TODO);
            assertThat(e.to()).isEqualTo(TaskStatus.DOING);
            assertThat(e.metadata()).containsEntry("operation", "start");
        });
        assertThat(coordinator.getHistory()).hasSize(1);
        assertThat(reports).hasSize(1);
        assertThat(metrics).extracting(MetricEvent::type).containsExactly(MetricType.STATE_TRANSITION);
    }

    @Test
    void shouldRejectMalformedContextWithoutCallingValidator() {
        StatusValidator validator = mock(StatusValidator.class);
        StatusCoordinator coordinator = new StatusCoordinator(new StatusCoordinatorProperties(), validator,
                dispatcher, metrics::add, reports::add, null, new SyncExecutor(), clock);
        TransitionContext missingId = TransitionContext.builder(EntityKind.TASK)
                .from(TaskStatus.TODO)
                .to(TaskStatus.DOING)
                .operation("start")
                .startTime(clock.instant())
                .build();

        assertThatThrownBy(() -> coordinator.transition(missingId))
                .isInstanceOf(StatusValidationException.class)
                .satisfies(e -> assertThat(((StatusValidationException) e).getErrors())
                        .containsExactly("Entity ID is required"));

        verifyNoInteractions(validator);
        assertThat(metrics).singleElement()
                .satisfies(m -> assertThat(m.metadata()).containsEntry(MetricEvent.REASON, "malformed"));
    }

    @Test
    void shouldListEveryMissingField() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        TransitionContext empty = TransitionContext.builder(EntityKind.TASK)
                .from(TaskStatus.TODO)
                .to(TaskStatus.DOING)
                .build();

        assertThatThrownBy(() -> coordinator.transition(empty))
                .isInstanceOf(StatusValidationException.class)
                .satisfies(e -> assertThat(((StatusValidationException) e).getErrors()).containsExactly(
                        "Entity ID is required", "Operation is required", "Start time is required"));
    }

    @Test
    void shouldRejectTransitionNotInRuleTable() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        RecordingHandler handler = new RecordingHandler();
        dispatcher.on(StatusChangeEvent.typeFor(EntityKind.TASK), StatusChangeEvent.class, handler);

        assertThatThrownBy(() -> coordinator.transition(task("task-1", TaskStatus.TODO, TaskStatus.DONE)))
                .isInstanceOf(StatusValidationException.class)
                .hasMessageContaining("TODO -> DONE");

        assertThat(handler.events).isEmpty();
        assertThat(coordinator.getHistory()).isEmpty();
        assertThat(metrics).singleElement()
                .satisfies(m -> assertThat(m.metadata()).containsEntry(MetricEvent.REASON, "validation"));
    }

    @Test
    void shouldAllowEnteringErrorStatusFromAnyStatus() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        ErrorContext error = new ErrorContext(new LifecycleException(ErrorKind.NETWORK_ERROR, "down"),
                true, 0, null, "retry");
        TransitionContext context = TransitionContext.builder(EntityKind.WORKFLOW)
                .entityId("wf-1")
                .from(WorkflowStatus.INITIAL)
                .to(WorkflowStatus.ERRORED)
                .operation("run")
                .startTime(clock.instant())
                .errorContext(error)
                .build();

        assertThat(coordinator.transition(context)).isTrue();
        assertThat(coordinator.getHistory()).singleElement()
                .satisfies(e -> assertThat(e.metadata()).containsEntry("errorKind", "NetworkError"));
    }

    @Test
    void shouldRunStepsInOrder() {
        StatusCoordinator coordinator = new StatusCoordinator(new StatusCoordinatorProperties(), validator(),
                dispatcher, m -> steps.add("metric"), e -> steps.add("report"), e -> steps.add("listener"),
                new SyncExecutor(), clock);
        dispatcher.on(StatusChangeEvent.typeFor(EntityKind.TASK), StatusChangeEvent.class, new RecordingHandler() {
            @Override
            public void handle(StatusChangeEvent event) {
                steps.add("dispatch");
            }
        });
        coordinator.subscribe(EntityKind.TASK, e -> steps.add("subscriber"));

        coordinator.transition(task("task-1", TaskStatus.PENDING, TaskStatus.TODO));

        assertThat(steps).containsExactly("dispatch", "metric", "report", "subscriber", "listener");
    }

    @Test
    void shouldFailWhenSubscriberThrowsAfterPublishing() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        RecordingHandler handler = new RecordingHandler();
        dispatcher.on(StatusChangeEvent.typeFor(EntityKind.TASK), StatusChangeEvent.class, handler);
        coordinator.subscribe(EntityKind.TASK, e -> {
            throw new IllegalStateException("subscriber broke");
        });

        assertThatThrownBy(() -> coordinator.transition(task("task-1", TaskStatus.TODO, TaskStatus.DOING)))
                .isInstanceOf(HandlerExecutionException.class)
                .hasRootCauseMessage("subscriber broke");

        assertThat(handler.events).hasSize(1);
        assertThat(coordinator.getHistory()).hasSize(1);
        assertThat(metrics).anySatisfy(m -> assertThat(m.metadata()).containsEntry(MetricEvent.REASON, "subscriber"));
    }

    @Test
    void shouldOnlyNotifySubscribersOfMatchingKind() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        List<StatusChangeEvent> taskEvents = new ArrayList<>();
        List<StatusChangeEvent> workflowEvents = new ArrayList<>();
        coordinator.subscribe(EntityKind.TASK, taskEvents::add);
        coordinator.subscribe(EntityKind.WORKFLOW, workflowEvents::add);

        coordinator.transition(task("task-1", TaskStatus.PENDING, TaskStatus.TODO));

        assertThat(taskEvents).hasSize(1);
        assertThat(workflowEvents).isEmpty();
    }

    @Test
    void shouldUnsubscribeIdempotently() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        List<StatusChangeEvent> received = new ArrayList<>();
        Subscription subscription = coordinator.subscribe(EntityKind.TASK, received::add);

        subscription.unsubscribe();
        subscription.unsubscribe();
        coordinator.transition(task("task-1", TaskStatus.PENDING, TaskStatus.TODO));

        assertThat(coordinator.subscriberCount(EntityKind.TASK)).isZero();
        assertThat(received).isEmpty();
    }

    @Test
    void shouldSwallowReportSinkFailure() {
        StatusCoordinator coordinator = new StatusCoordinator(new StatusCoordinatorProperties(), validator(),
                dispatcher, metrics::add, e -> {
                    throw new IllegalStateException("sink offline");
                }, null, new SyncExecutor(), clock);

        assertThat(coordinator.transition(task("task-1", TaskStatus.PENDING, TaskStatus.TODO))).isTrue();
        assertThat(coordinator.getHistory()).hasSize(1);
    }

    @Test
    void shouldSyncStatusIdempotently() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());

        coordinator.syncStatus(EntityKind.TASK, "task-1", TaskStatus.TODO, null, Map.of());
        coordinator.syncStatus(EntityKind.TASK, "task-1", TaskStatus.TODO, null, Map.of());
        coordinator.syncStatus(EntityKind.TASK, "task-1", TaskStatus.DOING, null, Map.of("by", "agent-7"));

        List<StatusChangeEvent> history = coordinator.getHistory();
        assertThat(history).extracting(StatusChangeEvent::from)
                .containsExactly(TaskStatus.PENDING, TaskStatus.TODO);
        assertThat(history).extracting(StatusChangeEvent::to)
                .containsExactly(TaskStatus.TODO, TaskStatus.DOING);
        assertThat(history.get(1).metadata()).containsEntry("by", "agent-7").containsEntry("operation", "sync");
        assertThat(coordinator.getLastKnownStatus(EntityKind.TASK, "task-1")).contains(TaskStatus.DOING);
    }

    @Test
    void shouldBoundHistoryLength() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties(null, null, null, true, 3, null, null));

        for (int i = 0; i < 5; i++) {
            coordinator.transition(task("task-" + i, TaskStatus.PENDING, TaskStatus.TODO));
        }

        assertThat(coordinator.getHistory()).extracting(StatusChangeEvent::entityId)
                .containsExactly("task-2", "task-3", "task-4");

        coordinator.clearHistory();
        assertThat(coordinator.getHistory()).isEmpty();
    }

    @Test
    void shouldSkipHistoryWhenDisabled() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties(null, null, null, false, null, null, null));

        coordinator.transition(task("task-1", TaskStatus.PENDING, TaskStatus.TODO));

        assertThat(coordinator.getHistory()).isEmpty();
        assertThat(reports).hasSize(1);
    }

    @Test
    void shouldExposeEntityInThreadContextDuringTransition() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        List<String> seen = new ArrayList<>();
        coordinator.subscribe(EntityKind.TASK, e -> {
            seen.add(ThreadContext.get(StatusCoordinator.MDC_ENTITY_KIND));
            seen.add(ThreadContext.get(StatusCoordinator.MDC_ENTITY_ID));
        });

        coordinator.transition(task("task-9", TaskStatus.PENDING, TaskStatus.TODO));

        assertThat(seen).containsExactly("task", "task-9");
        assertThat(ThreadContext.get(StatusCoordinator.MDC_ENTITY_ID)).isNull();
    }

    @Test
    void shouldMeasureDurationFromStartTime() {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        TransitionContext context = task("task-1", TaskStatus.PENDING, TaskStatus.TODO);
        clock.advance(Duration.ofMillis(250));

        coordinator.transition(context);

        assertThat(coordinator.getHistory().get(0).metadata()).containsEntry("durationMs", 250L);
        assertThat(metrics.get(0).value()).isEqualTo(250.0);
    }

    @Test
    void shouldResolveConfiguredInitialStatus() {
        StatusCoordinator coordinator = coordinator(
                new StatusCoordinatorProperties(null, null, null, null, null, Map.of("task", "todo"), null));

        assertThat(coordinator.getInitialStatus(EntityKind.TASK)).isEqualTo(TaskStatus.TODO);
        assertThat(coordinator.getInitialStatus(EntityKind.WORKFLOW)).isEqualTo(WorkflowStatus.INITIAL);
    }

    @Test
    void shouldRejectUnknownInitialStatus() {
        StatusCoordinatorProperties props =
                new StatusCoordinatorProperties(null, null, null, null, null, Map.of("task", "SLEEPING"), null);

        assertThatThrownBy(() -> coordinator(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("SLEEPING");
    }

    @Test
    void shouldTreatNullValidatorResultAsInvalid() {
        StatusCoordinator coordinator = new StatusCoordinator(new StatusCoordinatorProperties(),
                ctx -> CompletableFuture.completedFuture(null), dispatcher, metrics::add, reports::add, null,
                new SyncExecutor(), clock);

        assertThatThrownBy(() -> coordinator.transition(task("task-1", TaskStatus.PENDING, TaskStatus.TODO)))
                .isInstanceOf(StatusValidationException.class)
                .hasMessageContaining("Validator returned no result");
    }

    @Test
    void shouldWrapValidatorCrash() {
        StatusCoordinator coordinator = new StatusCoordinator(new StatusCoordinatorProperties(),
                ctx -> CompletableFuture.failedFuture(new IllegalStateException("rules unavailable")),
                dispatcher, metrics::add, reports::add, null, new SyncExecutor(), clock);

        assertThatThrownBy(() -> coordinator.transition(task("task-1", TaskStatus.PENDING, TaskStatus.TODO)))
                .isInstanceOf(StatusValidationException.class)
                .hasMessageContaining("rules unavailable");
        assertThat(metrics).singleElement()
                .satisfies(m -> assertThat(m.metadata()).containsEntry(MetricEvent.REASON, "validator"));
    }

    @Test
    void shouldSerializeTransitionsOfSameEntity() throws Exception {
        StatusCoordinator coordinator = coordinator(new StatusCoordinatorProperties());
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        dispatcher.on(StatusChangeEvent.typeFor(EntityKind.TASK), StatusChangeEvent.class, new RecordingHandler() {
            @Override
            public void handle(StatusChangeEvent event) throws Exception {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                Thread.sleep(5);
                inFlight.decrementAndGet();
            }
        });

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<Boolean>> futures = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> coordinator.transition(task("task-1", TaskStatus.PENDING, TaskStatus.TODO)), callers));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }

        assertThat(maxInFlight.get()).isEqualTo(1);
        assertThat(coordinator.lockCount()).isZero();
    }

    private StatusCoordinator coordinator(StatusCoordinatorProperties props) {
        return new StatusCoordinator(props, validator(), dispatcher, metrics::add, reports::add, null,
                new SyncExecutor(), clock);
    }

    private static StatusValidator validator() {
        return new RuleBasedStatusValidator(TransitionRules.defaults(), new SyncExecutor());
    }

    private TransitionContext task(String id, StatusType from, StatusType to) {
        return TransitionContext.builder(EntityKind.TASK)
                .entityId(id)
                .from(from)
                .to(to)
                .operation("start")
                .startTime(clock.instant())
                .build();
    }

    static class RecordingHandler implements EventHandler<StatusChangeEvent> {
        final List<StatusChangeEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public ValidationResult validate(StatusChangeEvent event) {
            return ValidationResult.valid("recording");
        }

        @Override
        public void handle(StatusChangeEvent event) throws Exception {
            events.add(event);
        }
    }
}
