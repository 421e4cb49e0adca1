package com.demo.gateway.retry;

import io.github.resilience4j.core.IntervalFunction;

/**
 * Bounded retry with linearly increasing backoff.
 *
 * <p>A logical call started with {@code retries} remaining waits
 * {@code baseBackoffMs * (maxRetries - retries + k)} before its k-th retry, so a
 * call using the full budget waits base, 2*base, 3*base...
 *
 * @param maxRetries    default number of retries after the first attempt
 * @param baseBackoffMs backoff unit in milliseconds
 */
public record RetryPolicy(int maxRetries, long baseBackoffMs) {

    public static final int DEFAULT_MAX_RETRIES = 2;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1000;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        if (baseBackoffMs <= 0) {
            throw new IllegalArgumentException("baseBackoffMs must be > 0, was " + baseBackoffMs);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_BACKOFF_MS);
    }

    /**
     * Wait before the {@code retryNumber}-th retry (1-based) of a call that
     * started with {@code retries} remaining. Never less than one backoff unit,
     * also when a caller passes more retries than the policy default.
     */
    public long backoffMillis(int retries, int retryNumber) {
        long multiplier = Math.max(1, (long) maxRetries - retries + retryNumber);
        return baseBackoffMs * multiplier;
    }

    /**
     * resilience4j interval function for one logical call. resilience4j passes
     * the number of attempts made so far, which is the 1-based retry number.
     */
    public IntervalFunction intervalFunction(int retries) {
        return retryNumber -> backoffMillis(retries, retryNumber);
    }
}
