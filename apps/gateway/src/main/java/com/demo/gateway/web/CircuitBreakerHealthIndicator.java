package com.demo.gateway.web;

import com.demo.gateway.breaker.CircuitBreaker;
import com.demo.gateway.breaker.CircuitBreakerRegistry;
import com.demo.gateway.breaker.CircuitState;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * {@code /actuator/health} contributor: one detail per breaker, DEGRADED while
 * any of them is OPEN. The gateway keeps serving (fallbacks, other providers),
 * so an open circuit is never reported DOWN.
 */
@Component("circuitBreakers")
public class CircuitBreakerHealthIndicator extends AbstractHealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "At least one circuit breaker is open");

    private final CircuitBreakerRegistry registry;

    public CircuitBreakerHealthIndicator(CircuitBreakerRegistry registry) {
        super("Circuit breaker health check failed");
        this.registry = registry;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) {
        boolean anyOpen = false;
        for (CircuitBreaker breaker : registry.getAll()) {
            CircuitState state = breaker.getState();
            builder.withDetail(breaker.getName(), state.name());
            anyOpen |= state == CircuitState.OPEN;
        }
        builder.status(anyOpen ? DEGRADED : Status.UP);
    }
}
