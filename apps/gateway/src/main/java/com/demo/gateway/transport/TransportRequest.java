package com.demo.gateway.transport;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * @param method    HTTP method name, upper case
 * @param url       absolute URL
 * @param headers   request headers
 * @param body      serialized body, null for body-less requests
 * @param timeoutMs bound for this single attempt
 */
public record TransportRequest(
    String method,
    String url,
    Map<String, String> headers,
    @Nullable String body,
    long timeoutMs
) {

    public TransportRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
