package com.phillippitts.lifecycle.service.recovery;

/**
 * Strategy the recovery engine applied to an error.
 */
public enum RecoveryStrategy {
    RETRY("retry"),
    CIRCUIT_BREAKER("circuitBreaker"),
    FALLBACK("fallback"),
    NONE("none");

    private final String wireName;

    RecoveryStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
