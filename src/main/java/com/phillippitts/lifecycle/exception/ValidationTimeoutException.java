package com.phillippitts.lifecycle.exception;

/**
 * Thrown when a status validator does not answer within the configured validation timeout.
 */
public class ValidationTimeoutException extends LifecycleException {

    private final long timeoutMs;

    public ValidationTimeoutException(String message, long timeoutMs) {
        super(ErrorKind.TIMEOUT_ERROR, message);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
