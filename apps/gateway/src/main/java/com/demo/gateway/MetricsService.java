package com.demo.gateway;

import com.demo.gateway.breaker.CircuitBreakerObserver;
import com.demo.gateway.breaker.CircuitState;
import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.observability.ErrorKind;
import com.demo.gateway.observability.StandardError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics and logging for outbound calls, fed by the breaker observer hooks.
 * Exposes metrics via /actuator/prometheus endpoint.
 */
public class MetricsService implements CircuitBreakerObserver {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final MeterRegistry registry;
    private final ConcurrentMap<String, AtomicInteger> breakerStates = new ConcurrentHashMap<>();

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Register the state gauge of a dependency before its first transition,
     * so a healthy breaker reports 0 rather than nothing.
     */
    public void registerDependency(String dependency) {
        breakerState(dependency);
    }

    public int getBreakerStateCode(String dependency) {
        return breakerState(dependency).get();
    }

    @Override
    public void onStateChange(String dependency, CircuitState from, CircuitState to) {
        breakerState(dependency).set(to.gaugeCode());

        Counter.builder("gateway_breaker_transitions_total")
                .description("Circuit breaker state transitions")
                .tag("dependency", dependency)
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();

        if (to == CircuitState.OPEN) {
            logger.warn("Circuit breaker {} state {} -> {} ({})", dependency, from, to, to.gaugeCode());
        } else {
            logger.info("Circuit breaker {} state {} -> {} ({})", dependency, from, to, to.gaugeCode());
        }
    }

    @Override
    public void onOutcome(String dependency, CallOutcome<?> outcome, Duration elapsed) {
        ErrorKind kind = outcome.errorKind();
        String kindLabel = kind != null ? kind.name() : "NONE";

        Counter.builder("gateway_outbound_calls_total")
                .description("Logical outbound calls by result")
                .tag("dependency", dependency)
                .tag("result", outcome.resultLabel())
                .tag("kind", kindLabel)
                .register(registry)
                .increment();

        Timer.builder("gateway_outbound_latency_ms")
                .description("Latency of logical outbound calls, retries included")
                .tag("dependency", dependency)
                .serviceLevelObjectives(
                        Duration.ofMillis(50),
                        Duration.ofMillis(100),
                        Duration.ofMillis(500),
                        Duration.ofMillis(1000),
                        Duration.ofMillis(5000),
                        Duration.ofMillis(15000)
                )
                .register(registry)
                .record(elapsed);

        // A rejection is the breaker doing its job, not a fresh incident.
        if (kind == ErrorKind.CIRCUIT_OPEN) {
            logger.debug("Call to {} rejected: {}", dependency, outcome.error().message());
        } else if (outcome.isFailure()) {
            logger.warn("Call to {} failed: {} ({}ms) {}", dependency, kind, elapsed.toMillis(),
                    outcome.error().message());
        }
    }

    @Override
    public void onRetry(String dependency, int retryNumber, StandardError error, Duration wait) {
        Counter.builder("gateway_outbound_retries_total")
                .description("Physical retries inside logical calls")
                .tag("dependency", dependency)
                .tag("kind", error.kind().name())
                .register(registry)
                .increment();
    }

    private AtomicInteger breakerState(String dependency) {
        return breakerStates.computeIfAbsent(dependency, name -> {
            AtomicInteger state = new AtomicInteger(CircuitState.CLOSED.gaugeCode());
            // Gauge for circuit breaker state (0=closed, 1=open, 2=half-open)
            Gauge.builder("gateway_breaker_state", state, AtomicInteger::get)
                    .description("Circuit breaker state per dependency")
                    .tag("dependency", name)
                    .register(registry);
            return state;
        });
    }
}
