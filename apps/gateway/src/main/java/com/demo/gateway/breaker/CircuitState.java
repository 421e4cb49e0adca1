package com.demo.gateway.breaker;

/**
 * Circuit breaker states.
 *
 * <ul>
 *   <li>CLOSED -> OPEN: consecutive failures reach failureThreshold</li>
 *   <li>OPEN -> HALF_OPEN: first call after openDurationMs elapsed</li>
 *   <li>HALF_OPEN -> CLOSED: successThreshold consecutive successes</li>
 *   <li>HALF_OPEN -> OPEN: any failure</li>
 * </ul>
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    /**
     * Numeric code for the breaker state gauge (0=closed, 1=open, 2=half-open).
     */
    public int gaugeCode() {
        return switch (this) {
            case CLOSED -> 0;
            case OPEN -> 1;
            case HALF_OPEN -> 2;
        };
    }
}
