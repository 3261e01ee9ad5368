package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.config.properties.StatusCoordinatorProperties;
import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.ValidationResult;
import com.phillippitts.lifecycle.domain.status.TaskStatus;
import com.phillippitts.lifecycle.exception.ValidationTimeoutException;
import com.phillippitts.lifecycle.service.event.DefaultEventDispatcher;
import com.phillippitts.lifecycle.service.metrics.MetricEvent;
import com.phillippitts.lifecycle.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatusCoordinatorTimeoutTest {

    private ExecutorService validationPool;

    @BeforeEach
    void setUp() {
        validationPool = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        validationPool.shutdownNow();
    }

    @Test
    void shouldTimeOutSlowValidatorPromptly() {
        List<MetricEvent> metrics = new CopyOnWriteArrayList<>();
        StatusValidator slow = ctx -> CompletableFuture.supplyAsync(() -> {
            sleepQuietly(200);
            return ValidationResult.valid("slow");
        }, validationPool);
        StatusCoordinator coordinator = new StatusCoordinator(
                new StatusCoordinatorProperties(50L, null, null, null, null, null, null), slow,
                new DefaultEventDispatcher(new SyncExecutor()), metrics::add, e -> { }, null,
                new SyncExecutor(), Clock.systemUTC());
        TransitionContext context = TransitionContext.builder(EntityKind.TASK)
                .entityId("task-1")
                .from(TaskStatus.TODO)
                .to(TaskStatus.DOING)
                .operation("start")
                .startTime(Instant.now())
                .build();

        long start = System.nanoTime();
        assertThatThrownBy(() -> coordinator.transition(context))
                .isInstanceOf(ValidationTimeoutException.class)
                .hasMessage("Status validation timed out after 50 ms");
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertThat(elapsedMs).isLessThan(180);
        assertThat(coordinator.getHistory()).isEmpty();
        assertThat(metrics).singleElement()
                .satisfies(m -> assertThat(m.metadata()).containsEntry(MetricEvent.REASON, "timeout"));
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
