package com.demo.gateway.config;

import com.demo.gateway.breaker.CircuitBreakerConfig;
import com.demo.gateway.retry.RetryPolicy;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Everything an adapter needs to reach one provider.
 *
 * @param credential     API key or token; blank or null means "not configured"
 * @param defaultHeaders extra headers sent on every request
 */
public record ServiceConfig(
    String baseUrl,
    @Nullable String credential,
    long timeoutMs,
    RetryPolicy retryPolicy,
    CircuitBreakerConfig circuitBreakerConfig,
    boolean fallbackEnabled,
    Map<String, String> defaultHeaders
) {

    public ServiceConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl must not be blank");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0, was " + timeoutMs);
        }
        if (retryPolicy == null || circuitBreakerConfig == null) {
            throw new IllegalArgumentException("retryPolicy and circuitBreakerConfig are required");
        }
        defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
    }

    public boolean hasCredential() {
        return credential != null && !credential.isBlank();
    }
}
