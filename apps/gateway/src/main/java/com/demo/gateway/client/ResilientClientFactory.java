package com.demo.gateway.client;

import com.demo.gateway.breaker.CircuitBreaker;
import com.demo.gateway.breaker.CircuitBreakerObserver;
import com.demo.gateway.breaker.CircuitBreakerRegistry;
import com.demo.gateway.config.ServiceConfig;
import com.demo.gateway.observability.ErrorClassifier;
import com.demo.gateway.retry.RetryDecisionPolicy;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Builds a {@link ResilientClient} bound to the registry's breaker for a
 * dependency, so every adapter of the same dependency shares one breaker.
 */
public class ResilientClientFactory {

    private final CircuitBreakerRegistry registry;
    private final RetryDecisionPolicy retryDecisionPolicy;
    private final ErrorClassifier classifier;
    private final ScheduledExecutorService scheduler;
    private final CircuitBreakerObserver observer;

    public ResilientClientFactory(CircuitBreakerRegistry registry,
                                  RetryDecisionPolicy retryDecisionPolicy,
                                  ErrorClassifier classifier,
                                  ScheduledExecutorService scheduler,
                                  CircuitBreakerObserver observer) {
        this.registry = registry;
        this.retryDecisionPolicy = retryDecisionPolicy;
        this.classifier = classifier;
        this.scheduler = scheduler;
        this.observer = observer;
    }

    public ResilientClient create(String dependency, ServiceConfig config) {
        CircuitBreaker breaker = registry.circuitBreaker(dependency, config.circuitBreakerConfig());
        return new ResilientClient(breaker, config.retryPolicy(), retryDecisionPolicy, classifier,
                scheduler, observer, config.timeoutMs());
    }
}
