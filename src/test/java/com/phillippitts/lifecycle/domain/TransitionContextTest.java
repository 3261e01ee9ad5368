package com.phillippitts.lifecycle.domain;

import com.phillippitts.lifecycle.domain.status.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransitionContextTest {

    @Test
    void builderDefaultsPhaseAndCopiesMetadata() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("attempt", 1);

        TransitionContext ctx = TransitionContext.builder(EntityKind.TASK)
                .entityId("t1")
                .from(TaskStatus.TODO)
                .to(TaskStatus.DOING)
                .operation("start")
                .startTime(Instant.EPOCH)
                .metadata(metadata)
                .build();
        metadata.put("attempt", 2);

        assertThat(ctx.phase()).isEqualTo(TransitionPhase.PRE_EXECUTION);
        assertThat(ctx.metadata()).containsEntry("attempt", 1);
    }

    @Test
    void withersReturnModifiedCopies() {
        TransitionContext ctx = TransitionContext.builder(EntityKind.TASK)
                .entityId("t1").from(TaskStatus.TODO).to(TaskStatus.DOING).build();

        TransitionContext done = ctx.withPhase(TransitionPhase.POST_EXECUTION).withDuration(Duration.ofMillis(5));

        assertThat(ctx.phase()).isEqualTo(TransitionPhase.PRE_EXECUTION);
        assertThat(ctx.duration()).isNull();
        assertThat(done.phase()).isEqualTo(TransitionPhase.POST_EXECUTION);
        assertThat(done.duration()).isEqualTo(Duration.ofMillis(5));
    }

    @Test
    void allowsMissingMandatoryFieldsSoCoordinatorCanRejectThem() {
        TransitionContext ctx = TransitionContext.builder(EntityKind.TASK)
                .from(TaskStatus.TODO).to(TaskStatus.DOING).build();

        assertThat(ctx.entityId()).isNull();
        assertThat(ctx.operation()).isNull();
        assertThat(ctx.startTime()).isNull();
    }

    @Test
    void requiresStatuses() {
        assertThatThrownBy(() -> TransitionContext.builder(EntityKind.TASK).entityId("t1").build())
                .isInstanceOf(NullPointerException.class);
    }
}
