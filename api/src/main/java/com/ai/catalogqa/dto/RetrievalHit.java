package com.ai.catalogqa.dto;

import java.util.Map;

/**
 * Result of a vector store query.
 * The score is backend-local (distance for the remote store, lexical overlap
 * for the in-memory store) and must never be compared across backends.
 */
public record RetrievalHit(
        String id,
        Double score,
        Map<String, Object> payload) {

    public RetrievalHit {
        payload = payload == null ? Map.of() : payload;
    }

    public String text() {
        Object text = payload.get("text");
        return text == null ? "" : String.valueOf(text);
    }
}
