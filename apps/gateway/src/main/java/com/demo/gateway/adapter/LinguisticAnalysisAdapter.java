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
 * Linguistic analysis through the Anthropic Messages API.
 */
public class LinguisticAnalysisAdapter extends ServiceAdapter {

    public static final String NAME = "anthropic";

    static final String API_VERSION = "2023-06-01";

    private static final String SYSTEM_PROMPT = "You provide detailed linguistic analysis, contextual "
        + "understanding and precise semantic exploration. Give thorough, educational answers that help "
        + "users understand language nuances.";

    private final String model;

    public LinguisticAnalysisAdapter(ServiceConfig config,
                                     HttpTransport transport,
                                     ResilientClientFactory clientFactory,
                                     ObjectMapper objectMapper,
                                     String model) {
        super(NAME, config, transport, clientFactory, objectMapper);
        this.model = model;
    }

    @Override
    protected Map<String, String> authorizationHeaders(String credential) {
        return Map.of("x-api-key", credential, "anthropic-version", API_VERSION);
    }

    public CompletableFuture<CallOutcome<LanguageResult>> analyze(LanguageRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("system", SYSTEM_PROMPT);
        body.put("messages", List.of(Map.of("role", "user", "content", request.query())));
        body.put("max_tokens", request.maxTokens() != null ? request.maxTokens() : 1000);
        body.put("temperature", request.temperature() != null ? request.temperature() : 0.5);

        return post("/v1/messages", body, this::toResult);
    }

    private LanguageResult toResult(JsonNode root) {
        // content[0].text is empty for a response that only carries tool calls
        String text = root.path("content").path(0).path("text").asText("");
        return new LanguageResult(text, root.path("model").asText(model));
    }
}
