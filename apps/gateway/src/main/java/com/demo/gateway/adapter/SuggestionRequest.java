package com.demo.gateway.adapter;

import org.springframework.lang.Nullable;

/**
 * @param creativity 0..1
 */
public record SuggestionRequest(String word, @Nullable Integer count, @Nullable Double creativity) {
}
