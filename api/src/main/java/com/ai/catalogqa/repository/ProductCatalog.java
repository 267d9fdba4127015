package com.ai.catalogqa.repository;

import com.ai.catalogqa.dto.Product;
import com.ai.catalogqa.dto.ProductFilters;

import java.util.List;
import java.util.Optional;

/**
 * Read-only product catalog lookups. Implementations throw
 * {@link com.ai.catalogqa.exception.CatalogUnavailableException} when no catalog is loaded.
 */
public interface ProductCatalog {

    Optional<Product> get(String productId);

    /**
     * Exact, case-insensitive filter match plus an optional substring query
     * over name, description, materials, care and brand.
     */
    List<Product> search(ProductFilters filters, String query);

    default List<Product> search(ProductFilters filters) {
        return search(filters, null);
    }

    /**
     * Free-text lookup keyed on a raw question, in relevance order.
     */
    List<Product> lookupFromText(String text);
}
