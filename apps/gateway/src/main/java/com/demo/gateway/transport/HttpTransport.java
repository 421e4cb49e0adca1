package com.demo.gateway.transport;

import java.util.concurrent.CompletionStage;

/**
 * One physical HTTP exchange. Any received status, 2xx or not, completes the
 * stage normally; the stage completes exceptionally only when no status was
 * received ({@link TransportException}, {@link java.util.concurrent.TimeoutException}).
 */
@FunctionalInterface
public interface HttpTransport {

    CompletionStage<TransportResponse> send(TransportRequest request);
}
