package com.demo.gateway.transport;

/**
 * A physical attempt failed before any HTTP status was received
 * (connection refused or reset, DNS failure, broken stream).
 */
public class TransportException extends RuntimeException {

    private final String url;

    public TransportException(String message, String url, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
