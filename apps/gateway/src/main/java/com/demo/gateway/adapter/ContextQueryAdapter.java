package com.demo.gateway.adapter;

import com.demo.gateway.client.ResilientClientFactory;
import com.demo.gateway.config.ServiceConfig;
import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.transport.HttpTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Contextual language queries against Perplexity's chat completions API.
 * No fallback: an invented answer is worse than an explicit error.
 */
public class ContextQueryAdapter extends ServiceAdapter {

    public static final String NAME = "perplexity";

    private final String model;

    public ContextQueryAdapter(ServiceConfig config,
                               HttpTransport transport,
                               ResilientClientFactory clientFactory,
                               ObjectMapper objectMapper,
                               String model) {
        super(NAME, config, transport, clientFactory, objectMapper);
        this.model = model;
    }

    public CompletableFuture<CallOutcome<LanguageResult>> query(LanguageRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", request.query())));
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : 500);
        body.put("temperature", request.temperature() != null ? request.temperature() : 0.7);

        return post("/chat/completions", body, this::toResult);
    }

    private LanguageResult toResult(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new IllegalStateException("Completion has no message content");
        }
        return new LanguageResult(content.asText(), root.path("model").asText(model));
    }
}
