package com.demo.gateway.breaker;

import com.demo.gateway.observability.StandardError;

/**
 * Immutable snapshot of a breaker. Held in an AtomicReference and replaced
 * wholesale by compare-and-set, so counters and state always move together.
 */
final class BreakerState {

    private static final BreakerState INITIAL = new BreakerState(CircuitState.CLOSED, 0, 0, 0L, null);

    final CircuitState state;
    final int failureCount;
    final int successCount;
    /** Epoch millis; 0 when no attempt time is scheduled. */
    final long nextAttemptAt;
    final StandardError lastError;

    private BreakerState(CircuitState state, int failureCount, int successCount,
                         long nextAttemptAt, StandardError lastError) {
        this.state = state;
        this.failureCount = failureCount;
        this.successCount = successCount;
        this.nextAttemptAt = nextAttemptAt;
        this.lastError = lastError;
    }

    static BreakerState closed() {
        return INITIAL;
    }

    BreakerState withFailure(StandardError error) {
        return new BreakerState(CircuitState.CLOSED, failureCount + 1, 0, 0L, error);
    }

    BreakerState withFailureCountCleared() {
        return new BreakerState(CircuitState.CLOSED, 0, 0, 0L, lastError);
    }

    BreakerState withSuccess() {
        return new BreakerState(CircuitState.HALF_OPEN, failureCount, successCount + 1, nextAttemptAt, lastError);
    }

    BreakerState withLastError(StandardError error) {
        return new BreakerState(state, failureCount, successCount, nextAttemptAt, error);
    }

    BreakerState toOpen(long nextAttemptAt, StandardError error) {
        return new BreakerState(CircuitState.OPEN, failureCount, 0, nextAttemptAt, error);
    }

    BreakerState toHalfOpen() {
        return new BreakerState(CircuitState.HALF_OPEN, failureCount, 0, nextAttemptAt, lastError);
    }

    BreakerState toClosed() {
        return new BreakerState(CircuitState.CLOSED, 0, 0, 0L, lastError);
    }
}
