package com.demo.gateway.adapter;

import org.springframework.lang.Nullable;

/**
 * @param style         minimalist, artistic, realistic or educational; minimalist when null
 * @param enhancePrompt append style and quality keywords; true when null
 */
public record ImageRequest(
    String prompt,
    @Nullable Integer width,
    @Nullable Integer height,
    @Nullable String style,
    @Nullable Boolean enhancePrompt
) {
}
