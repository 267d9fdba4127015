package com.ai.catalogqa.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One chunk of a source document, ready to be upserted into a vector store.
 * Carries every non-text field of the source record unchanged.
 */
public record ChunkRecord(
        String text,
        String sourceDocId,
        int sectionIndex,
        Map<String, Object> metadata) {

    public ChunkRecord {
        if (text == null) {
            throw new IllegalArgumentException("Chunk text must not be null");
        }
        if (sectionIndex < 0) {
            throw new IllegalArgumentException("sectionIndex must be >= 0, was " + sectionIndex);
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Flatten into the property map stored by a vector store: carried metadata,
     * then {@code text}, {@code doc_id} and {@code section_index}.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>(metadata);
        payload.put("text", text);
        if (sourceDocId != null) {
            payload.put("doc_id", sourceDocId);
        }
        payload.put("section_index", sectionIndex);
        return payload;
    }
}
