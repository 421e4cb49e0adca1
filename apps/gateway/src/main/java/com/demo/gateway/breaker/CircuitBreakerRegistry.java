package com.demo.gateway.breaker;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One {@link CircuitBreaker} per dependency name, created on first use and
 * kept for the process lifetime. Nothing is persisted.
 */
public class CircuitBreakerRegistry {

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final CircuitBreakerObserver observer;

    public CircuitBreakerRegistry(Clock clock, CircuitBreakerObserver observer) {
        this.clock = clock;
        this.observer = observer;
    }

    /**
     * Returns the breaker for {@code name}, creating it with {@code config} if
     * absent. A later call with a different config gets the existing breaker.
     */
    public CircuitBreaker circuitBreaker(String name, CircuitBreakerConfig config) {
        return breakers.computeIfAbsent(name, key -> new CircuitBreaker(key, config, clock, observer));
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public Collection<CircuitBreaker> getAll() {
        return List.copyOf(breakers.values());
    }
}
