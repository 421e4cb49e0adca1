package com.demo.gateway.breaker;

/**
 * Point-in-time view of a breaker, as returned by {@code getStatus()}.
 *
 * @param nextAttemptAt epoch millis of the next permitted probe, 0 when none is scheduled
 * @param remainingMs   {@code max(0, nextAttemptAt - now)}
 */
public record CircuitStatus(
    String name,
    CircuitState state,
    int failureCount,
    int successCount,
    long nextAttemptAt,
    long remainingMs
) {
}
