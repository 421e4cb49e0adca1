package com.demo.gateway.client;

import com.demo.gateway.breaker.CircuitBreaker;
import com.demo.gateway.breaker.CircuitBreakerObserver;
import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.observability.ErrorClassifier;
import com.demo.gateway.retry.RetryDecisionPolicy;
import com.demo.gateway.retry.RetryPolicy;
import com.demo.gateway.transport.TransportResponse;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded retry-with-backoff around one logical call, reported to the breaker
 * as a single outcome.
 *
 * <p>Layering: {@code circuitBreaker.execute(() -> retry(attempt))}. The retry
 * loop runs INSIDE the breaker, so the breaker counters see one outcome per
 * logical call and internal retries are invisible to them. An OPEN breaker
 * rejects before the first attempt, so a rejected call never retries.
 *
 * <p>Each physical attempt is bounded by {@code attemptTimeoutMs}; a timed-out
 * attempt is classified as a retryable NETWORK_ERROR. Backoff waits are
 * scheduled on {@code scheduler}; no thread sleeps.
 */
public class ResilientClient {
    private static final Logger logger = LoggerFactory.getLogger(ResilientClient.class);

    private final CircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final RetryDecisionPolicy retryDecisionPolicy;
    private final ErrorClassifier classifier;
    private final ScheduledExecutorService scheduler;
    private final CircuitBreakerObserver observer;
    private final long attemptTimeoutMs;

    public ResilientClient(CircuitBreaker circuitBreaker,
                           RetryPolicy retryPolicy,
                           RetryDecisionPolicy retryDecisionPolicy,
                           ErrorClassifier classifier,
                           ScheduledExecutorService scheduler,
                           CircuitBreakerObserver observer,
                           long attemptTimeoutMs) {
        if (attemptTimeoutMs <= 0) {
            throw new IllegalArgumentException("attemptTimeoutMs must be > 0, was " + attemptTimeoutMs);
        }
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
        this.retryDecisionPolicy = retryDecisionPolicy;
        this.classifier = classifier;
        this.scheduler = scheduler;
        this.observer = observer != null ? observer : CircuitBreakerObserver.NOOP;
        this.attemptTimeoutMs = attemptTimeoutMs;
    }

    public CompletableFuture<CallOutcome<TransportResponse>> call(Supplier<? extends CompletionStage<TransportResponse>> requestFn) {
        return call(requestFn, retryPolicy.maxRetries());
    }

    /**
     * @param requestFn one physical attempt; invoked at most {@code retries + 1} times
     * @param retries   retries allowed after the first attempt
     */
    public CompletableFuture<CallOutcome<TransportResponse>> call(Supplier<? extends CompletionStage<TransportResponse>> requestFn,
                                                                  int retries) {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0, was " + retries);
        }
        return circuitBreaker.execute(() -> attemptWithRetry(requestFn, retries));
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private CompletionStage<CallOutcome<TransportResponse>> attemptWithRetry(
            Supplier<? extends CompletionStage<TransportResponse>> requestFn, int retries) {
        String dependency = circuitBreaker.getName();

        // maxAttempts counts the first attempt; the interval function gets the 1-based retry number.
        RetryConfig config = RetryConfig.<CallOutcome<TransportResponse>>custom()
                .maxAttempts(retries + 1)
                .intervalFunction(retryPolicy.intervalFunction(retries))
                .retryOnResult(retryDecisionPolicy::shouldRetry)
                .build();
        Retry retry = Retry.of(dependency + "-retry", config);

        retry.getEventPublisher().onRetry(event -> logger.warn(
                "Retrying call to {} (retry {}/{}) after {}ms",
                dependency, event.getNumberOfRetryAttempts(), retries, event.getWaitInterval().toMillis()));

        AtomicInteger attempts = new AtomicInteger();
        return retry.executeCompletionStage(scheduler,
                () -> attempt(requestFn, dependency, retries, attempts.incrementAndGet()));
    }

    private CompletionStage<CallOutcome<TransportResponse>> attempt(
            Supplier<? extends CompletionStage<TransportResponse>> requestFn, String dependency,
            int retries, int attemptNumber) {
        CompletableFuture<TransportResponse> response;
        try {
            response = requestFn.get().toCompletableFuture().copy()
                    .orTimeout(attemptTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(CallOutcome.failure(classifier.classify(e)));
        }

        return response.handle((result, throwable) -> {
            CallOutcome<TransportResponse> outcome;
            if (throwable != null) {
                outcome = CallOutcome.failure(classifier.classify(throwable));
            } else if (result.isSuccessful()) {
                outcome = CallOutcome.success(result, result.status());
            } else {
                outcome = CallOutcome.failure(classifier.classifyStatus(result.status(), result.body()));
            }
            if (attemptNumber <= retries && retryDecisionPolicy.shouldRetry(outcome)) {
                reportRetry(dependency, attemptNumber, outcome, retries);
            }
            return outcome;
        });
    }

    private void reportRetry(String dependency, int retryNumber, CallOutcome<TransportResponse> outcome, int retries) {
        try {
            observer.onRetry(dependency, retryNumber, outcome.error(),
                    Duration.ofMillis(retryPolicy.backoffMillis(retries, retryNumber)));
        } catch (RuntimeException e) {
            logger.warn("Retry observer failed for {}", dependency, e);
        }
    }
}
