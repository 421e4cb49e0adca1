package com.demo.gateway.observability;

import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Normalized failure of an outbound call. No transport-library exception type
 * survives past the classifier; callers only ever see this value.
 *
 * @param kind       taxonomy entry
 * @param message    human readable message, provider message when available
 * @param retryable  whether the failure is transient and safe to retry
 * @param httpStatus provider status, null when no response was received
 * @param details    optional diagnostic fields (url, method, remainingMs...)
 */
public record StandardError(
    ErrorKind kind,
    String message,
    boolean retryable,
    @Nullable Integer httpStatus,
    @Nullable Map<String, Object> details
) {

    public StandardError {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        details = details == null ? null : Map.copyOf(details);
    }

    public static StandardError of(ErrorKind kind, String message, boolean retryable) {
        return new StandardError(kind, message, retryable, null, null);
    }

    /**
     * Credential absent locally. Reported as a 401 so callers treat it like a
     * provider rejection, but it never reaches the provider.
     */
    public static StandardError missingCredential(String dependency) {
        return new StandardError(ErrorKind.UNAUTHORIZED,
            "No credential configured for " + dependency, false, 401,
            Map.of("dependency", dependency));
    }

    public static StandardError circuitOpen(String dependency, long remainingMs, @Nullable StandardError lastError) {
        String suffix = lastError != null ? ": " + lastError.message() : "";
        return new StandardError(ErrorKind.CIRCUIT_OPEN,
            "Service unavailable - circuit breaker open for " + dependency + suffix,
            false, 503, Map.of("dependency", dependency, "remainingMs", remainingMs));
    }

    public StandardError withDetails(Map<String, Object> extra) {
        Map<String, Object> merged = new HashMap<>();
        if (details != null) {
            merged.putAll(details);
        }
        merged.putAll(extra);
        return new StandardError(kind, message, retryable, httpStatus, merged);
    }
}
