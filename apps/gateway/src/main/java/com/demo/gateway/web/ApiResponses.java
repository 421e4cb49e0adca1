package com.demo.gateway.web;

import com.demo.gateway.observability.CallOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps an outcome onto an HTTP response. The outcome itself is always the body.
 */
final class ApiResponses {

    private ApiResponses() {
    }

    static <T> ResponseEntity<CallOutcome<T>> toResponse(CallOutcome<T> outcome) {
        return ResponseEntity.status(statusOf(outcome)).body(outcome);
    }

    static HttpStatus statusOf(CallOutcome<?> outcome) {
        if (outcome.success()) {
            return HttpStatus.OK;
        }
        switch (outcome.errorKind()) {
            case CIRCUIT_OPEN:
            case SERVICE_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case BAD_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case RATE_LIMITED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case NETWORK_ERROR:
            case GATEWAY_TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            default:
                // the provider rejected us or broke; either way an upstream fault
                return HttpStatus.BAD_GATEWAY;
        }
    }
}
