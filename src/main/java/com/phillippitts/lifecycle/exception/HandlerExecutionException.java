package com.phillippitts.lifecycle.exception;

/**
 * Thrown when an event handler or a status subscriber fails during fan-out.
 *
 * <p>Side effects of handlers that already ran are not rolled back.
 */
public class HandlerExecutionException extends LifecycleException {

    public HandlerExecutionException(String message, Throwable cause) {
        super(ErrorKind.EXECUTION_ERROR, message, cause);
    }
}
