package com.demo.gateway.breaker;

/**
 * Immutable breaker thresholds.
 *
 * @param failureThreshold consecutive failed logical calls that open the circuit
 * @param successThreshold consecutive half-open successes that close it again
 * @param openDurationMs   how long the circuit rejects calls before probing
 */
public record CircuitBreakerConfig(int failureThreshold, int successThreshold, long openDurationMs) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final long DEFAULT_OPEN_DURATION_MS = 30_000;

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, was " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1, was " + successThreshold);
        }
        if (openDurationMs <= 0) {
            throw new IllegalArgumentException("openDurationMs must be > 0, was " + openDurationMs);
        }
    }

    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(DEFAULT_FAILURE_THRESHOLD, DEFAULT_SUCCESS_THRESHOLD,
            DEFAULT_OPEN_DURATION_MS);
    }
}
