package com.demo.gateway.breaker;

import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.observability.StandardError;

import java.time.Duration;

/**
 * Side-effect hooks for telemetry. Implementations must not assume they run
 * on any particular thread; an exception thrown here is logged and ignored.
 */
public interface CircuitBreakerObserver {

    CircuitBreakerObserver NOOP = new CircuitBreakerObserver() {
    };

    default void onStateChange(String dependency, CircuitState from, CircuitState to) {
    }

    /**
     * One call per logical call, rejections included.
     */
    default void onOutcome(String dependency, CallOutcome<?> outcome, Duration elapsed) {
    }

    default void onRetry(String dependency, int retryNumber, StandardError error, Duration wait) {
    }
}
