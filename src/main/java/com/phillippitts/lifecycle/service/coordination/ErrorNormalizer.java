package com.phillippitts.lifecycle.service.coordination;

import com.phillippitts.lifecycle.exception.ErrorKind;
import com.phillippitts.lifecycle.exception.LifecycleException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary throwables to {@link LifecycleException}.
 *
 * <p>Lifecycle exceptions pass through unchanged. Wrappers from the concurrency utilities
 * are unwrapped first. Everything else is wrapped with a kind derived from its type and
 * keeps the original as cause.
 */
public final class ErrorNormalizer {

    private ErrorNormalizer() {}

    public static LifecycleException normalize(Throwable error, String component, Map<String, ?> context) {
        if (error == null) {
            return new LifecycleException(ErrorKind.UNKNOWN_ERROR, "Unknown error (null)", component, context, null);
        }
        Throwable unwrapped = unwrap(error);
        if (unwrapped instanceof LifecycleException lifecycle) {
            return lifecycle;
        }
        String message = unwrapped.getMessage() != null
                ? unwrapped.getMessage()
                : unwrapped.getClass().getSimpleName();
        return new LifecycleException(kindOf(unwrapped), message, component, context, unwrapped);
    }

    static ErrorKind kindOf(Throwable error) {
        if (error instanceof SocketTimeoutException || error instanceof TimeoutException) {
            return ErrorKind.TIMEOUT_ERROR;
        }
        if (error instanceof IOException) {
            return ErrorKind.NETWORK_ERROR;
        }
        if (error instanceof IllegalArgumentException) {
            return ErrorKind.VALIDATION_ERROR;
        }
        if (error instanceof IllegalStateException) {
            return ErrorKind.STATE_ERROR;
        }
        if (error instanceof Error) {
            return ErrorKind.SYSTEM_ERROR;
        }
        return ErrorKind.UNKNOWN_ERROR;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
