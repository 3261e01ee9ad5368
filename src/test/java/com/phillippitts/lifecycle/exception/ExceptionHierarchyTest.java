package com.phillippitts.lifecycle.exception;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allExceptionsExtendLifecycleException() {
        assertThat(new StatusValidationException("bad")).isInstanceOf(LifecycleException.class);
        assertThat(new ValidationTimeoutException("slow", 50)).isInstanceOf(LifecycleException.class);
        assertThat(new HandlerExecutionException("boom", new IllegalStateException()))
                .isInstanceOf(LifecycleException.class);
        assertThat(new CircuitBreakerOpenException("db", 5, 100, new LifecycleException("x")))
                .isInstanceOf(LifecycleException.class);
        assertThat(new LifecycleException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void subclassesCarryTheirErrorKind() {
        assertThat(new StatusValidationException("bad").getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(new ValidationTimeoutException("slow", 50).getKind()).isEqualTo(ErrorKind.TIMEOUT_ERROR);
        assertThat(new HandlerExecutionException("boom", null).getKind()).isEqualTo(ErrorKind.EXECUTION_ERROR);
        assertThat(new CircuitBreakerOpenException("db", 5, 100, null).getKind())
                .isEqualTo(ErrorKind.CIRCUIT_BREAKER_ERROR);
    }

    @Test
    void componentDefaultsToUnknown() {
        LifecycleException e = new LifecycleException(ErrorKind.NETWORK_ERROR, "down", null, null, null);

        assertThat(e.getComponent()).isEqualTo("unknown");
        assertThat(e.getContext()).isEmpty();
    }

    @Test
    void validationExceptionKeepsAllErrors() {
        StatusValidationException e = new StatusValidationException("invalid", List.of("a", "b"));

        assertThat(e.getErrors()).containsExactly("a", "b");
    }

    @Test
    void circuitBreakerExceptionExposesResetTimeAndCause() {
        LifecycleException original = new LifecycleException(ErrorKind.NETWORK_ERROR, "down");
        CircuitBreakerOpenException e = new CircuitBreakerOpenException("search", 6, 750, original);

        assertThat(e.getResetInMillis()).isEqualTo(750);
        assertThat(e.getFailureCount()).isEqualTo(6);
        assertThat(e.getComponent()).isEqualTo("search");
        assertThat(e.getCause()).isSameAs(original);
    }

    @Test
    void retryableKindsAreTransientOnes() {
        assertThat(ErrorKind.NETWORK_ERROR.isRetryable()).isTrue();
        assertThat(ErrorKind.TIMEOUT_ERROR.isRetryable()).isTrue();
        assertThat(ErrorKind.RATE_LIMIT_ERROR.isRetryable()).isTrue();
        assertThat(ErrorKind.VALIDATION_ERROR.isRetryable()).isFalse();
        assertThat(ErrorKind.SYSTEM_ERROR.isRetryable()).isFalse();
    }

    @Test
    void kindsResolveFromWireNames() {
        assertThat(ErrorKind.fromWireName("NetworkError")).contains(ErrorKind.NETWORK_ERROR);
        assertThat(ErrorKind.fromWireName("rate_limit_error")).contains(ErrorKind.RATE_LIMIT_ERROR);
        assertThat(ErrorKind.fromWireName("Nope")).isEmpty();
    }
}
