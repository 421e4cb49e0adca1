package com.demo.gateway.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link HttpTransport} over a reactive {@link WebClient}. No thread waits on
 * the network. {@link WebClientRequestException} is translated to
 * {@link TransportException} here so no WebClient type leaves this class.
 */
public class WebClientHttpTransport implements HttpTransport {
    private static final Logger logger = LoggerFactory.getLogger(WebClientHttpTransport.class);

    private final WebClient webClient;

    public WebClientHttpTransport(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public CompletableFuture<TransportResponse> send(TransportRequest request) {
        WebClient.RequestBodySpec spec = webClient
                .method(HttpMethod.valueOf(request.method()))
                .uri(request.url())
                .headers(headers -> request.headers().forEach(headers::set));

        WebClient.RequestHeadersSpec<?> exchange = request.body() != null
                ? spec.bodyValue(request.body())
                : spec;

        return exchange
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new TransportResponse(response.rawStatusCode(), body)))
                .timeout(Duration.ofMillis(request.timeoutMs()))
                .onErrorMap(WebClientRequestException.class, e -> {
                    logger.debug("Transport failure {} {}: {}", request.method(), request.url(), e.getMessage());
                    return new TransportException(e.getMessage(), request.url(), e.getCause() != null ? e.getCause() : e);
                })
                .toFuture();
    }
}
