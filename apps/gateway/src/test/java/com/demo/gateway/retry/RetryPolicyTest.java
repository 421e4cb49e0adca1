package com.demo.gateway.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void testDefaults() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(2, policy.maxRetries());
        assertEquals(1000, policy.baseBackoffMs());
    }

    @Test
    void testFullBudget_LinearBackoff() {
        RetryPolicy policy = new RetryPolicy(2, 100);

        assertEquals(100, policy.backoffMillis(2, 1));
        assertEquals(200, policy.backoffMillis(2, 2));
    }

    @Test
    void testReducedBudget_ContinuesTheSequence() {
        RetryPolicy policy = new RetryPolicy(3, 100);

        // A call started with one retry left waits as the last retry of a full run would.
        assertEquals(300, policy.backoffMillis(1, 1));
    }

    @Test
    void testMoreRetriesThanDefault_NeverBelowOneUnit() {
        RetryPolicy policy = new RetryPolicy(1, 100);

        assertEquals(100, policy.backoffMillis(4, 1));
        assertEquals(100, policy.backoffMillis(4, 3));
        assertEquals(100, policy.backoffMillis(4, 4));
    }

    @Test
    void testIntervalFunction_MatchesBackoff() {
        RetryPolicy policy = new RetryPolicy(2, 50);

        assertEquals(50L, policy.intervalFunction(2).apply(1));
        assertEquals(100L, policy.intervalFunction(2).apply(2));
    }

    @Test
    void testInvalidValues_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, 100));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(2, 0));
    }
}
