package com.demo.gateway.breaker;

import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.observability.ErrorKind;
import com.demo.gateway.observability.StandardError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Per-dependency circuit breaker counting consecutive failed logical calls.
 *
 * <pre>
 *     CLOSED ──(failureThreshold consecutive failures)──> OPEN
 *        ^                                                 │
 *        │                                       (openDurationMs elapsed,
 *  (successThreshold                               next call probes)
 *   successes)                                             │
 *        │                                                 v
 *        └──────────────────── HALF_OPEN <─────────────────┘
 *                                  │
 *                            (any failure)
 *                                  └──────> OPEN
 * </pre>
 *
 * <p>State lives in one immutable {@link BreakerState} behind an
 * {@link AtomicReference}; every transition is a compare-and-set, so concurrent
 * callers observing an expired OPEN circuit produce a single HALF_OPEN
 * transition.
 *
 * <p>The wrapped operation reports a {@link CallOutcome}; the breaker never
 * completes exceptionally. An operation that throws, or whose stage fails, is
 * recorded as an UNKNOWN_ERROR failure.
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitBreakerObserver observer;
    private final AtomicReference<BreakerState> stateRef = new AtomicReference<>(BreakerState.closed());

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC(), CircuitBreakerObserver.NOOP);
    }

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock, CircuitBreakerObserver observer) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.observer = observer != null ? observer : CircuitBreakerObserver.NOOP;
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    /**
     * Run {@code operation} unless the circuit is open.
     *
     * <p>Cancelling the returned future does not cancel the operation: it still
     * completes and its outcome is still recorded.
     */
    public <T> CompletableFuture<CallOutcome<T>> execute(Supplier<? extends CompletionStage<CallOutcome<T>>> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        long startedAt = clock.millis();

        BreakerState admitted = acquirePermission(startedAt);
        if (admitted.state == CircuitState.OPEN) {
            CallOutcome<T> rejected = CallOutcome.failure(
                StandardError.circuitOpen(name, Math.max(0, admitted.nextAttemptAt - startedAt), admitted.lastError));
            notifyOutcome(rejected, startedAt);
            return CompletableFuture.completedFuture(rejected);
        }

        CompletableFuture<CallOutcome<T>> recorded = invoke(operation).handle((outcome, throwable) -> {
            CallOutcome<T> result;
            if (throwable != null) {
                result = CallOutcome.failure(unexpected(throwable));
            } else if (outcome == null) {
                result = CallOutcome.failure(StandardError.of(ErrorKind.UNKNOWN_ERROR,
                    "Operation completed without an outcome", false));
            } else {
                result = outcome;
            }
            record(result);
            notifyOutcome(result, startedAt);
            return result;
        });
        return recorded.copy();
    }

    public CircuitState getState() {
        return stateRef.get().state;
    }

    public CircuitStatus getStatus() {
        BreakerState current = stateRef.get();
        long remaining = Math.max(0, current.nextAttemptAt - clock.millis());
        return new CircuitStatus(name, current.state, current.failureCount, current.successCount,
            current.nextAttemptAt, remaining);
    }

    /**
     * Manual override: CLOSED with both counters zeroed, whatever the prior state.
     */
    public void reset() {
        BreakerState previous = stateRef.getAndSet(BreakerState.closed());
        notifyStateChange(previous.state, CircuitState.CLOSED);
    }

    private <T> CompletableFuture<CallOutcome<T>> invoke(Supplier<? extends CompletionStage<CallOutcome<T>>> operation) {
        try {
            CompletionStage<CallOutcome<T>> stage = operation.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Operation returned no stage"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private BreakerState acquirePermission(long now) {
        while (true) {
            BreakerState current = stateRef.get();
            if (current.state != CircuitState.OPEN || now < current.nextAttemptAt) {
                return current;
            }
            BreakerState halfOpen = current.toHalfOpen();
            if (stateRef.compareAndSet(current, halfOpen)) {
                notifyStateChange(CircuitState.OPEN, CircuitState.HALF_OPEN);
                return halfOpen;
            }
        }
    }

    private void record(CallOutcome<?> outcome) {
        if (outcome.success()) {
            onSuccess();
        } else {
            onFailure(outcome.error());
        }
    }

    private void onSuccess() {
        while (true) {
            BreakerState current = stateRef.get();
            BreakerState next;
            switch (current.state) {
                case CLOSED:
                    if (current.failureCount == 0) {
                        return;
                    }
                    next = current.withFailureCountCleared();
                    break;
                case HALF_OPEN:
                    next = current.successCount + 1 >= config.successThreshold()
                        ? current.toClosed()
                        : current.withSuccess();
                    break;
                default:
                    // Late success from a call admitted before the circuit opened.
                    return;
            }
            if (stateRef.compareAndSet(current, next)) {
                notifyStateChange(current.state, next.state);
                return;
            }
        }
    }

    private void onFailure(StandardError error) {
        while (true) {
            BreakerState current = stateRef.get();
            BreakerState next;
            switch (current.state) {
                case CLOSED:
                    next = current.withFailure(error);
                    if (next.failureCount >= config.failureThreshold()) {
                        next = next.toOpen(clock.millis() + config.openDurationMs(), error);
                    }
                    break;
                case HALF_OPEN:
                    next = current.toOpen(clock.millis() + config.openDurationMs(), error);
                    break;
                default:
                    next = current.withLastError(error);
                    break;
            }
            if (stateRef.compareAndSet(current, next)) {
                notifyStateChange(current.state, next.state);
                return;
            }
        }
    }

    private static StandardError unexpected(Throwable throwable) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
            ? throwable.getCause()
            : throwable;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new StandardError(ErrorKind.UNKNOWN_ERROR, message, false, null,
            Map.of("exception", cause.getClass().getSimpleName()));
    }

    private void notifyStateChange(CircuitState from, CircuitState to) {
        if (from == to) {
            return;
        }
        try {
            observer.onStateChange(name, from, to);
        } catch (RuntimeException e) {
            logger.warn("Circuit breaker observer failed on state change {} -> {} for {}", from, to, name, e);
        }
    }

    private void notifyOutcome(CallOutcome<?> outcome, long startedAt) {
        try {
            observer.onOutcome(name, outcome, Duration.ofMillis(Math.max(0, clock.millis() - startedAt)));
        } catch (RuntimeException e) {
            logger.warn("Circuit breaker observer failed on outcome for {}", name, e);
        }
    }
}
