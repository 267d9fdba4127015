package com.ai.catalogqa.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified evidence item handed to answer synthesis and returned to the caller.
 * Only {@link #text()} is read by synthesis; every other field is caller-facing metadata.
 */
public record ContextItem(
        ContextType type,
        String id,
        String title,
        String text,
        Double score,
        String source,
        Map<String, Object> metadata) {

    public ContextItem {
        if (type == null) {
            throw new IllegalArgumentException("Context item type is required");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Context item source is required");
        }
        text = text == null ? "" : text;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasText() {
        return !text.isEmpty();
    }
}
