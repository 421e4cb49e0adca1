package com.demo.gateway.transport;

public record TransportResponse(int status, String body) {

    public TransportResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
