package com.ai.catalogqa.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for a RAG query with optional structured catalog filters.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryRequest(
        @NotBlank String question,
        @JsonAlias("top_k") @Min(1) Integer topK,
        String brand,
        String category,
        String tag,
        String size) {
    public QueryRequest {
        if (topK == null) {
            topK = 5;
        }
    }

    public ProductFilters filters() {
        return new ProductFilters(brand, category, tag, size);
    }
}
