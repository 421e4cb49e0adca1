package com.demo.gateway.adapter;

import com.demo.gateway.client.ResilientClientFactory;
import com.demo.gateway.config.ServiceConfig;
import com.demo.gateway.observability.CallOutcome;
import com.demo.gateway.transport.HttpTransport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Creative word suggestions from Grok.
 *
 * <p>Fallback payload: {@value #FALLBACK_COUNT} generated suggestions cycling
 * through the suggestion types, identical for identical words.
 */
public class SuggestionAdapter extends ServiceAdapter {

    public static final String NAME = "grok";

    static final int FALLBACK_COUNT = 10;

    private static final List<String> TYPES = List.of("synonym", "antonym", "related", "rhyme", "creative");

    private final String model;

    public SuggestionAdapter(ServiceConfig config,
                             HttpTransport transport,
                             ResilientClientFactory clientFactory,
                             ObjectMapper objectMapper,
                             String model) {
        super(NAME, config, transport, clientFactory, objectMapper);
        this.model = model;
    }

    public CompletableFuture<CallOutcome<SuggestionResult>> getSuggestions(SuggestionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("word", request.word());
        body.put("count", request.count() != null ? request.count() : 10);
        body.put("creativity", request.creativity() != null ? request.creativity() : 0.7);
        body.put("include_synonyms", true);
        body.put("include_antonyms", true);
        body.put("include_related", true);
        body.put("model", model);

        return this.<SuggestionResult>post("/api/suggestions", body, root -> toResult(root, request.word()))
            .thenApply(outcome -> withFallback(outcome, () -> fallbackSuggestions(request.word())));
    }

    /**
     * Raw word information; the payload is passed through untouched.
     */
    public CompletableFuture<CallOutcome<JsonNode>> getWordInfo(String word) {
        return get("/api/wordinfo/" + UriUtils.encodePathSegment(word, StandardCharsets.UTF_8), node -> node);
    }

    SuggestionResult fallbackSuggestions(String word) {
        List<WordSuggestion> suggestions = new ArrayList<>(FALLBACK_COUNT);
        for (int i = 0; i < FALLBACK_COUNT; i++) {
            String type = TYPES.get(i % TYPES.size());
            suggestions.add(new WordSuggestion(word + "-" + type + "-" + (i + 1), type,
                1.0 - (double) i / FALLBACK_COUNT,
                "Placeholder suggestion " + (i + 1) + " for " + word));
        }
        return new SuggestionResult(suggestions, "fallback", word);
    }

    private SuggestionResult toResult(JsonNode root, String requestedWord) {
        JsonNode items = root.path("suggestions");
        if (!items.isArray()) {
            throw new IllegalStateException("Response has no suggestions array");
        }
        List<WordSuggestion> suggestions = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            suggestions.add(new WordSuggestion(
                item.path("word").asText(),
                item.path("type").asText("related"),
                item.path("score").asDouble(0.0),
                item.path("definition").asText("")));
        }
        JsonNode metadata = root.path("metadata");
        return new SuggestionResult(suggestions,
            metadata.path("model").asText(model),
            metadata.path("requestedWord").asText(requestedWord));
    }
}
