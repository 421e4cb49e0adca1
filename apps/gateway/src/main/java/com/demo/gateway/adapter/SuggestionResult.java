package com.demo.gateway.adapter;

import java.util.List;

public record SuggestionResult(List<WordSuggestion> suggestions, String model, String requestedWord) {

    public SuggestionResult {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
