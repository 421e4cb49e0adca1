package com.demo.gateway.web;

import com.demo.gateway.adapter.ContextQueryAdapter;
import com.demo.gateway.adapter.ImageGenerationAdapter;
import com.demo.gateway.adapter.ImageRequest;
import com.demo.gateway.adapter.ImageResult;
import com.demo.gateway.adapter.LanguageRequest;
import com.demo.gateway.adapter.LanguageResult;
import com.demo.gateway.adapter.LinguisticAnalysisAdapter;
import com.demo.gateway.adapter.SuggestionAdapter;
import com.demo.gateway.adapter.SuggestionRequest;
import com.demo.gateway.adapter.SuggestionResult;
import com.demo.gateway.observability.CallOutcome;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api")
public class WordController {
    private static final Logger logger = LoggerFactory.getLogger(WordController.class);

    private final ImageGenerationAdapter imageAdapter;
    private final SuggestionAdapter suggestionAdapter;
    private final ContextQueryAdapter contextQueryAdapter;
    private final LinguisticAnalysisAdapter analysisAdapter;

    public WordController(ImageGenerationAdapter imageAdapter,
                          SuggestionAdapter suggestionAdapter,
                          ContextQueryAdapter contextQueryAdapter,
                          LinguisticAnalysisAdapter analysisAdapter) {
        this.imageAdapter = imageAdapter;
        this.suggestionAdapter = suggestionAdapter;
        this.contextQueryAdapter = contextQueryAdapter;
        this.analysisAdapter = analysisAdapter;
    }

    @PostMapping("/generate-image")
    public CompletableFuture<ResponseEntity<CallOutcome<ImageResult>>> generateImage(@RequestBody ImageRequest request) {
        requireText(request.prompt(), "prompt");
        logger.info("Handling /api/generate-image request (style={})", request.style());
        return imageAdapter.generateImage(request).thenApply(ApiResponses::toResponse);
    }

    @PostMapping("/suggestions")
    public CompletableFuture<ResponseEntity<CallOutcome<SuggestionResult>>> suggestions(@RequestBody SuggestionRequest request) {
        requireText(request.word(), "word");
        logger.info("Handling /api/suggestions request for '{}'", request.word());
        return suggestionAdapter.getSuggestions(request).thenApply(ApiResponses::toResponse);
    }

    @GetMapping("/word-info/{word}")
    public CompletableFuture<ResponseEntity<CallOutcome<JsonNode>>> wordInfo(@PathVariable String word) {
        return suggestionAdapter.getWordInfo(word).thenApply(ApiResponses::toResponse);
    }

    @PostMapping("/query")
    public CompletableFuture<ResponseEntity<CallOutcome<LanguageResult>>> query(@RequestBody LanguageRequest request) {
        requireText(request.query(), "query");
        logger.info("Handling /api/query request");
        return contextQueryAdapter.query(request).thenApply(ApiResponses::toResponse);
    }

    @PostMapping("/analyze")
    public CompletableFuture<ResponseEntity<CallOutcome<LanguageResult>>> analyze(@RequestBody LanguageRequest request) {
        requireText(request.query(), "query");
        logger.info("Handling /api/analyze request");
        return analysisAdapter.analyze(request).thenApply(ApiResponses::toResponse);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " is required");
        }
    }
}
