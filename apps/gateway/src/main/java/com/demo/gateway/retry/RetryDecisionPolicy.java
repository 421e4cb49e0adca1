package com.demo.gateway.retry;

import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.observability.ErrorKind;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Retry Decision Policy: classifier-based retry gating.
 *
 * <p>resilience4j {@code Retry} decides on results through a predicate; this
 * policy turns a classified {@link CallOutcome} into that decision.
 *
 * <ul>
 *   <li>Successes and fallbacks are never retried</li>
 *   <li>CIRCUIT_OPEN is never retried, whatever the error says</li>
 *   <li>Everything else follows {@code StandardError.retryable()}</li>
 * </ul>
 *
 * Used by: ResilientClient ({@code RetryConfig.retryOnResult()} predicate)
 */
@Component
public class RetryDecisionPolicy {

    public boolean shouldRetry(@Nullable CallOutcome<?> outcome) {
        if (outcome == null || outcome.success() || outcome.error() == null) {
            return false;
        }
        if (outcome.error().kind() == ErrorKind.CIRCUIT_OPEN) {
            return false;
        }
        return outcome.error().retryable();
    }
}
