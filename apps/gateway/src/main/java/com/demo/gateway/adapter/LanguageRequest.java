package com.demo.gateway.adapter;

import org.springframework.lang.Nullable;

public record LanguageRequest(String query, @Nullable Integer maxTokens, @Nullable Double temperature) {
}
