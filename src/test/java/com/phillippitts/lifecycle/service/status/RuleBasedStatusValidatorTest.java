package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.TransitionPhase;
import com.phillippitts.lifecycle.domain.ValidationResult;
import com.phillippitts.lifecycle.domain.status.MessageStatus;
import com.phillippitts.lifecycle.domain.status.StatusType;
import com.phillippitts.lifecycle.domain.status.TaskStatus;
import com.phillippitts.lifecycle.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedStatusValidatorTest {

    private final RuleBasedStatusValidator validator =
            new RuleBasedStatusValidator(TransitionRules.defaults(), new SyncExecutor());

    @Test
    void acceptsPermittedTransition() {
        ValidationResult result = validator.validateTransition(
                ctx(EntityKind.MESSAGE, MessageStatus.QUEUED, MessageStatus.PROCESSING, TransitionPhase.EXECUTION))
                .join();

        assertThat(result.valid()).isTrue();
        assertThat(result.validatorName()).isEqualTo("rule-based");
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void rejectsTransitionOutsideRuleTable() {
        ValidationResult result = validator.validateTransition(
                ctx(EntityKind.MESSAGE, MessageStatus.INITIAL, MessageStatus.CLEARED, TransitionPhase.EXECUTION))
                .join();

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Invalid message transition from INITIAL to CLEARED");
    }

    @Test
    void rejectsPostExecutionPhase() {
        ValidationResult result = validator.check(
                ctx(EntityKind.TASK, TaskStatus.TODO, TaskStatus.DOING, TransitionPhase.POST_EXECUTION));

        assertThat(result.valid()).isFalse();
        assertThat(result.errors()).containsExactly("Invalid transition phase: POST_EXECUTION");
    }

    @Test
    void exposesAvailableTransitions() {
        assertThat(validator.getAvailableTransitions(EntityKind.MESSAGE, MessageStatus.PROCESSED))
                .contains(MessageStatus.RETRIEVING, MessageStatus.CLEARING, MessageStatus.ERROR);
    }

    private static TransitionContext ctx(EntityKind kind, StatusType from, StatusType to, TransitionPhase phase) {
        return TransitionContext.builder(kind)
                .entityId("m-1")
                .from(from)
                .to(to)
                .operation("test")
                .phase(phase)
                .startTime(Instant.EPOCH)
                .build();
    }
}
