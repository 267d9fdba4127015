package com.ai.catalogqa.dto;

/**
 * Exact-match catalog filters. Blank values are treated as absent.
 */
public record ProductFilters(
        String brand,
        String category,
        String tag,
        String size) {

    public static ProductFilters none() {
        return new ProductFilters(null, null, null, null);
    }

    public boolean hasAny() {
        return notBlank(brand) || notBlank(category) || notBlank(tag) || notBlank(size);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
