package com.phillippitts.lifecycle.service.status;

import com.phillippitts.lifecycle.domain.TransitionContext;
import com.phillippitts.lifecycle.domain.ValidationResult;

import java.util.concurrent.CompletableFuture;

/**
 * Decides whether a transition may proceed.
 *
 * <p>Validation is asynchronous; the coordinator waits for the result no longer than its
 * validation timeout and abandons the future afterwards.
 */
@FunctionalInterface
public interface StatusValidator {

    CompletableFuture<ValidationResult> validateTransition(TransitionContext context);
}
