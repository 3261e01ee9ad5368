package com.phillippitts.lifecycle.exception;

import java.util.List;

/**
 * Thrown when a transition context is malformed or a validator rejects a transition.
 *
 * <p>Carries every validation error that was collected, so callers can report all of them
 * at once instead of the first.
 */
public class StatusValidationException extends LifecycleException {

    private final List<String> errors;

    public StatusValidationException(String message) {
        this(message, List.of(message));
    }

    public StatusValidationException(String message, List<String> errors) {
        super(ErrorKind.VALIDATION_ERROR, message);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
