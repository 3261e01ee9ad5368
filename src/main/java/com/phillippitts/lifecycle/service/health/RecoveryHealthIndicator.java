package com.phillippitts.lifecycle.service.health;

import com.phillippitts.lifecycle.config.properties.ErrorRecoveryProperties;
import com.phillippitts.lifecycle.service.coordination.ErrorCoordinator;
import com.phillippitts.lifecycle.service.coordination.RecoveryStats;
import com.phillippitts.lifecycle.service.recovery.CircuitBreakerKey;
import com.phillippitts.lifecycle.service.recovery.CircuitBreakerRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Health indicator for error recovery.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: no circuit breaker has reached its failure threshold</li>
 *   <li>DEGRADED: at least one breaker is tripped</li>
 * </ul>
 *
 * <p>Details include the tripped breakers and the recovery success rate.
 */
@Component
public class RecoveryHealthIndicator implements HealthIndicator {

    private final CircuitBreakerRegistry breakers;
    private final ErrorCoordinator errorCoordinator;
    private final ErrorRecoveryProperties props;

    public RecoveryHealthIndicator(CircuitBreakerRegistry breakers,
                                   ErrorCoordinator errorCoordinator,
                                   ErrorRecoveryProperties props) {
        this.breakers = breakers;
        this.errorCoordinator = errorCoordinator;
        this.props = props;
    }

    @Override
    public Health health() {
        int threshold = props.getCircuitBreaker().getFailureThreshold();
        List<String> tripped = breakers.snapshot().entrySet().stream()
                .filter(e -> e.getValue().failureCount() >= threshold)
                .map(Map.Entry::getKey)
                .map(CircuitBreakerKey::toString)
                .sorted()
                .toList();
        RecoveryStats stats = errorCoordinator.getRecoveryStats();

        Health.Builder builder = tripped.isEmpty()
                ? Health.up().withDetail("status", "No tripped circuit breakers")
                : Health.status("DEGRADED").withDetail("status", "Circuit breakers tripped");
        return builder
                .withDetail("trippedBreakers", tripped)
                .withDetail("trackedBreakers", breakers.snapshot().size())
                .withDetail("recoveryAttempts", stats.attempts())
                .withDetail("recoverySuccessRate", stats.recoverySuccessRate())
                .build();
    }
}
