package com.demo.gateway.retry;

import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.observability.ErrorKind;
import com.demo.gateway.observability.StandardError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryDecisionPolicy.
 *
 * - retryable classifications (NETWORK_ERROR, 429, 502-504) → retry
 * - CIRCUIT_OPEN → NO retry, whatever its retryable flag says
 * - success, fallback and terminal classifications → NO retry
 */
class RetryDecisionPolicyTest {

    private RetryDecisionPolicy policy;

    @BeforeEach
    void setup() {
        policy = new RetryDecisionPolicy();
    }

    @Test
    void testNull_NoRetry() {
        assertFalse(policy.shouldRetry(null));
    }

    @Test
    void testSuccess_NoRetry() {
        assertFalse(policy.shouldRetry(CallOutcome.success("ok", 200)), "Success case should not retry");
    }

    @Test
    void testFallback_NoRetry() {
        CallOutcome<String> fallback = CallOutcome.fallback("stub",
            StandardError.of(ErrorKind.SERVICE_UNAVAILABLE, "down", true));

        assertFalse(policy.shouldRetry(fallback), "A fallback is a success and must not be retried");
    }

    @Test
    void testNetworkError_Retryable() {
        assertTrue(policy.shouldRetry(failure(ErrorKind.NETWORK_ERROR, true)));
    }

    @Test
    void testRateLimited_Retryable() {
        assertTrue(policy.shouldRetry(failure(ErrorKind.RATE_LIMITED, true)));
    }

    @Test
    void testNotFound_NotRetryable() {
        assertFalse(policy.shouldRetry(failure(ErrorKind.NOT_FOUND, false)),
            "404 is terminal; retrying cannot change the answer");
    }

    @Test
    void testCircuitOpen_NeverRetried() {
        // Even a mislabelled rejection must not loop against an open breaker.
        assertFalse(policy.shouldRetry(failure(ErrorKind.CIRCUIT_OPEN, true)));
    }

    private static CallOutcome<Object> failure(ErrorKind kind, boolean retryable) {
        return CallOutcome.failure(StandardError.of(kind, kind.name(), retryable));
    }
}
