package com.ai.catalogqa.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A catalog product as stored in the product JSONL file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Product(
        @JsonProperty("product_id") String productId,
        String name,
        String brand,
        String category,
        String materials,
        String description,
        String care,
        double price,
        List<String> sizes,
        String color,
        List<String> tags) {
    public Product {
        sizes = sizes == null ? List.of() : List.copyOf(sizes);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
