package com.demo.gateway.observability;

/**
 * Fixed error taxonomy for outbound provider calls.
 * Used as the 'kind' label in gateway_outbound_calls_total.
 */
public enum ErrorKind {
    CIRCUIT_OPEN,            // Breaker rejected the call, provider not contacted
    NETWORK_ERROR,           // No status: connection reset, I/O failure, attempt timeout
    BAD_REQUEST,             // 400
    UNAUTHORIZED,            // 401, or credential missing locally
    FORBIDDEN,               // 403
    NOT_FOUND,               // 404
    RATE_LIMITED,            // 429
    INTERNAL_SERVER_ERROR,   // 500
    BAD_GATEWAY,             // 502
    SERVICE_UNAVAILABLE,     // 503
    GATEWAY_TIMEOUT,         // 504
    UNKNOWN_ERROR            // Anything else
}
