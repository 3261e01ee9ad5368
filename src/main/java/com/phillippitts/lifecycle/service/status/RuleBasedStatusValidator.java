package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.EntityKind;
import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.TransitionPhase;
import com.phillippitts.lifecycle.domain.ValidationResult;
import com.phillippitts.lifecycle.domain.status.StatusType;
import com.phillippitts.lifecycle.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link StatusValidator} backed by a {@link TransitionRules} table.
 *
 * <p>Checks, in order: the phase allows validation, both statuses belong to the context's
 * entity kind, and the pair is permitted by the rule table. All failures are collected.
 */
public class RuleBasedStatusValidator implements StatusValidator {

    private static final Logger LOG = LogManager.getLogger(RuleBasedStatusValidator.class);
    static final String NAME = "rule-based";
    private static final Set<TransitionPhase> VALIDATING_PHASES =
            EnumSet.of(TransitionPhase.PRE_EXECUTION, TransitionPhase.EXECUTION);

    private final TransitionRules rules;
    private final Executor executor;

    public RuleBasedStatusValidator(TransitionRules rules, Executor executor) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletableFuture<ValidationResult> validateTransition(TransitionContext context) {
        return CompletableFuture.supplyAsync(() -> check(context), executor);
    }

    /**
     * Statuses reachable in one step from {@code from}, ignoring rule guards.
     */
    public Set<StatusType> getAvailableTransitions(EntityKind kind, StatusType from) {
        return rules.availableTransitions(kind, from);
    }

    ValidationResult check(TransitionContext context) {
        long start = System.nanoTime();
        List<String> errors = new ArrayList<>();
        EntityKind kind = context.entityKind();

        if (!VALIDATING_PHASES.contains(context.phase())) {
            errors.add("Invalid transition phase: " + context.phase());
        }
        if (!kind.owns(context.currentStatus())) {
            errors.add("Status " + context.currentStatus() + " is not a valid " + kind.key() + " status");
        }
        if (!kind.owns(context.targetStatus())) {
            errors.add("Status " + context.targetStatus() + " is not a valid " + kind.key() + " status");
        }
        if (errors.isEmpty() && !rules.permits(context)) {
            errors.add("Invalid " + kind.key() + " transition from " + context.currentStatus()
                    + " to " + context.targetStatus());
        }

        long durationMs = TimeUtils.elapsedMillis(start);
        if (!errors.isEmpty()) {
            LOG.debug("Rejected {} transition {} -> {}: {}", kind.key(),
                    context.currentStatus(), context.targetStatus(), errors);
        }
        return new ValidationResult(errors.isEmpty(), errors, List.of(), NAME, durationMs);
    }
}
