package com.phillippitts.lifecycle.service.recovery;

import com.phillippitts.lifecycle.exception.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerRegistryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Duration RESET = Duration.ofSeconds(60);

    private final CircuitBreakerRegistry registry = new CircuitBreakerRegistry();
    private final CircuitBreakerKey key = new CircuitBreakerKey(ErrorKind.NETWORK_ERROR, "search");

    @Test
    void staysClosedBelowThreshold() {
        CircuitBreakerRegistry.Decision decision = registry.evaluate(key, T0, 3, RESET);

        assertThat(decision.open()).isFalse();
        assertThat(decision.failureCount()).isEqualTo(1);
        assertThat(registry.failureCount(key)).isEqualTo(1);
    }

    @Test
    void opensAtThresholdWithinResetWindow() {
        registry.recordFailure(key, T0);
        registry.recordFailure(key, T0.plusSeconds(10));

        CircuitBreakerRegistry.Decision decision = registry.evaluate(key, T0.plusSeconds(20), 3, RESET);

        assertThat(decision.open()).isTrue();
        assertThat(decision.failureCount()).isEqualTo(3);
        assertThat(decision.resetIn()).isEqualTo(Duration.ofSeconds(50));
    }

    @Test
    void resetsAfterQuietPeriod() {
        registry.recordFailure(key, T0);
        registry.recordFailure(key, T0);
        registry.recordFailure(key, T0);

        CircuitBreakerRegistry.Decision decision = registry.evaluate(key, T0.plus(RESET), 3, RESET);

        assertThat(decision.open()).isFalse();
        assertThat(decision.failureCount()).isZero();
        assertThat(registry.state(key)).isEmpty();
    }

    @Test
    void keysAreIndependent() {
        CircuitBreakerKey other = new CircuitBreakerKey(ErrorKind.NETWORK_ERROR, "email");
        registry.recordFailure(key, T0);

        assertThat(registry.failureCount(other)).isZero();
        assertThat(registry.snapshot()).containsOnlyKeys(key);
        assertThat(key).hasToString("NetworkError:search");
    }

    @Test
    void blankComponentFallsBackToUnknown() {
        assertThat(new CircuitBreakerKey(ErrorKind.TIMEOUT_ERROR, " ").component()).isEqualTo("unknown");
    }

    @Test
    void concurrentFailuresAreNeverLost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(CompletableFuture.runAsync(() -> registry.recordFailure(key, T0), pool));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.failureCount(key)).isEqualTo(200);
    }

    @Test
    void resetRemovesState() {
        registry.recordFailure(key, T0);

        registry.reset(key);

        assertThat(registry.failureCount(key)).isZero();
    }
}
