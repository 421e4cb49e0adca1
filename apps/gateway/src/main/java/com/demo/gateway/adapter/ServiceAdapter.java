package com.demo.gateway.adapter;

import com.demo.gateway.breaker.CircuitStatus;
import com.demo.gateway.client.ResilientClient;
import com.demo.gateway.client.ResilientClientFactory;
import com.demo.gateway.config.ServiceConfig;
import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.observability.ErrorKind;
import com.demo.gateway.observability.StandardError;
import com.demo.gateway.transport.HttpTransport;
import com.demo.gateway.transport.TransportRequest;
import com.demo.gateway.transport.TransportResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class of every provider adapter.
 *
 * <p>Order of checks for each request:
 * <ol>
 *   <li>Credential present? If not, UNAUTHORIZED immediately. Neither the
 *       breaker nor the retry loop is touched, so missing configuration never
 *       consumes failure budget.</li>
 *   <li>{@link ResilientClient#call}: breaker gate, then bounded retries.</li>
 *   <li>Decode the 2xx body into the adapter's payload type.</li>
 *   <li>{@link #withFallback}: only subclasses that enable it substitute a
 *       tagged payload once the live path is exhausted.</li>
 * </ol>
 *
 * <p>Nothing here throws past the adapter; every path ends in a {@link CallOutcome}.
 */
public abstract class ServiceAdapter {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final ServiceConfig config;
    private final HttpTransport transport;
    private final ResilientClient client;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean missingCredentialLogged = new AtomicBoolean(false);

    protected ServiceAdapter(String name,
                             ServiceConfig config,
                             HttpTransport transport,
                             ResilientClientFactory clientFactory,
                             ObjectMapper objectMapper) {
        this.name = name;
        this.config = config;
        this.transport = transport;
        this.client = clientFactory.create(name, config);
        this.objectMapper = objectMapper;
    }

    public String getName() {
        return name;
    }

    public boolean isConfigured() {
        return config.hasCredential();
    }

    public CircuitStatus getCircuitStatus() {
        return client.getCircuitBreaker().getStatus();
    }

    public void resetCircuit() {
        client.getCircuitBreaker().reset();
        logger.info("[{}] Circuit breaker manually reset", name);
    }

    /**
     * Authorization headers for the credential. Bearer token unless overridden.
     */
    protected Map<String, String> authorizationHeaders(String credential) {
        return Map.of("Authorization", "Bearer " + credential);
    }

    protected <T> CompletableFuture<CallOutcome<T>> post(String path, Object body, Function<JsonNode, T> decoder) {
        return send("POST", path, body, decoder);
    }

    protected <T> CompletableFuture<CallOutcome<T>> get(String path, Function<JsonNode, T> decoder) {
        return send("GET", path, null, decoder);
    }

    /**
     * Replace a failure with {@code fallbackPayload} when fallback is enabled for
     * this provider and the failure means the live path is exhausted: the
     * breaker is open, or a retryable error outlived every retry.
     */
    protected <T> CallOutcome<T> withFallback(CallOutcome<T> outcome, Supplier<T> fallbackPayload) {
        if (outcome.success() || !config.fallbackEnabled() || !isExhausted(outcome.error())) {
            return outcome;
        }
        logger.warn("[{}] Serving fallback payload after {}: {}", name, outcome.error().kind(),
            outcome.error().message());
        return CallOutcome.fallback(fallbackPayload.get(), outcome.error());
    }

    static boolean isExhausted(@Nullable StandardError error) {
        return error != null && (error.kind() == ErrorKind.CIRCUIT_OPEN || error.retryable());
    }

    private <T> CompletableFuture<CallOutcome<T>> send(String method, String path, @Nullable Object body,
                                                       Function<JsonNode, T> decoder) {
        if (!isConfigured()) {
            if (missingCredentialLogged.compareAndSet(false, true)) {
                logger.warn("[{}] No credential configured; calls fail with UNAUTHORIZED until one is set", name);
            }
            return CompletableFuture.completedFuture(CallOutcome.failure(StandardError.missingCredential(name)));
        }

        TransportRequest request;
        try {
            request = buildRequest(method, path, body);
        } catch (JsonProcessingException e) {
            logger.error("[{}] Cannot serialize request body for {} {}", name, method, path, e);
            return CompletableFuture.completedFuture(CallOutcome.failure(
                StandardError.of(ErrorKind.BAD_REQUEST, "Request body could not be serialized", false)));
        }

        if (logger.isDebugEnabled()) {
            logger.debug("[{}] {} {} body={}", name, method, request.url(),
                body == null ? "-" : LogSanitizer.redact(objectMapper.valueToTree(body)));
        }

        return client.call(() -> transport.send(request))
            .thenApply(outcome -> decode(outcome, method, request.url(), decoder));
    }

    private TransportRequest buildRequest(String method, String path, @Nullable Object body)
            throws JsonProcessingException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Accept", "application/json");
        headers.putAll(config.defaultHeaders());
        headers.putAll(authorizationHeaders(config.credential()));

        String payload = body != null ? objectMapper.writeValueAsString(body) : null;
        return new TransportRequest(method, url(path), headers, payload, config.timeoutMs());
    }

    private String url(String path) {
        String base = config.baseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }

    private <T> CallOutcome<T> decode(CallOutcome<TransportResponse> outcome, String method, String url,
                                      Function<JsonNode, T> decoder) {
        if (outcome.isFailure()) {
            StandardError error = outcome.error();
            if (error.kind() != ErrorKind.CIRCUIT_OPEN) {
                error = error.withDetails(Map.of("method", method, "url", url));
            }
            return CallOutcome.failure(error);
        }
        TransportResponse response = outcome.data();
        try {
            JsonNode root = objectMapper.readTree(response.body());
            return CallOutcome.success(decoder.apply(root), response.status());
        } catch (JsonProcessingException | RuntimeException e) {
            logger.error("[{}] Malformed response from {} {} (status {})", name, method, url, response.status(), e);
            return CallOutcome.failure(new StandardError(ErrorKind.UNKNOWN_ERROR,
                "Malformed response from " + name, false, response.status(),
                Map.of("method", method, "url", url)));
        }
    }
}
