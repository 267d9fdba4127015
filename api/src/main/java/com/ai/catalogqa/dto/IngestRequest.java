package com.ai.catalogqa.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for ingesting knowledge base documents.
 * Each document is a free-form map with a {@code text} field plus arbitrary metadata.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IngestRequest(
        @NotNull List<Map<String, Object>> documents) {
}
