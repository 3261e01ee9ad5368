package com.phillippitts.lifecycle.service.health;

import com.phillippitts.lifecycle.config.properties.ErrorRecoveryProperties;
import com.phillippitts.lifecycle.exception.ErrorKind;
import com.phillippitts.lifecycle.service.coordination.ErrorCoordinator;
import com.phillippitts.lifecycle.service.coordination.RecoveryStats;
import com.phillippitts.lifecycle.service.recovery.CircuitBreakerKey;
import com.phillippitts.lifecycle.service.recovery.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecoveryHealthIndicatorTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private CircuitBreakerRegistry breakers;
    private RecoveryHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        breakers = new CircuitBreakerRegistry();
        ErrorCoordinator coordinator = mock(ErrorCoordinator.class);
        when(coordinator.getRecoveryStats()).thenReturn(new RecoveryStats(4, 3, 1, 0.75));
        ErrorRecoveryProperties props = new ErrorRecoveryProperties(null,
                new ErrorRecoveryProperties.CircuitBreaker(2, null));
        indicator = new RecoveryHealthIndicator(breakers, coordinator, props);
    }

    @Test
    void upWhenNoBreakerTripped() {
        breakers.recordFailure(new CircuitBreakerKey(ErrorKind.NETWORK_ERROR, "search"), NOW);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("trackedBreakers", 1)
                .containsEntry("recoveryAttempts", 4L)
                .containsEntry("recoverySuccessRate", 0.75);
    }

    @Test
    void degradedWhenBreakerReachesThreshold() {
        CircuitBreakerKey key = new CircuitBreakerKey(ErrorKind.RATE_LIMIT_ERROR, "llm");
        breakers.recordFailure(key, NOW);
        breakers.recordFailure(key, NOW);

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
        assertThat(health.getDetails()).containsEntry("trippedBreakers", List.of("RateLimitError:llm"));
    }
}
