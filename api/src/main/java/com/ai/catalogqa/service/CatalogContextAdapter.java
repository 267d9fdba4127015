package com.ai.catalogqa.service;

import com.ai.catalogqa.dto.ContextItem;
import com.ai.catalogqa.dto.ContextType;
import com.ai.catalogqa.dto.Product;
import com.ai.catalogqa.dto.ProductFilters;
import com.ai.catalogqa.exception.CatalogUnavailableException;
import com.ai.catalogqa.repository.ProductCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reshapes catalog matches into product context items.
 * A missing catalog yields no product context rather than an error.
 */
@Service
public class CatalogContextAdapter {

    private static final Logger log = LoggerFactory.getLogger(CatalogContextAdapter.class);
    public static final int MAX_PRODUCTS = 3;
    static final String SOURCE = "catalog";

    private final ProductCatalog catalog;
    private final AtomicBoolean unavailableLogged = new AtomicBoolean();

    public CatalogContextAdapter(ProductCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Exact filter search when any filter is set, free-text lookup on the question otherwise.
     * At most {@link #MAX_PRODUCTS} items, in catalog order.
     */
    public List<ContextItem> findProductContext(String question, ProductFilters filters) {
        List<Product> matches;
        try {
            if (filters != null && filters.hasAny()) {
                matches = catalog.search(filters);
            } else {
                matches = catalog.lookupFromText(question);
            }
        } catch (CatalogUnavailableException e) {
            if (unavailableLogged.compareAndSet(false, true)) {
                log.warn("[CatalogContextAdapter] Product catalog unavailable, omitting product context: {}",
                        e.getMessage());
            } else {
                log.debug("[CatalogContextAdapter] Product catalog unavailable: {}", e.getMessage());
            }
            return List.of();
        }

        return matches.stream()
                .limit(MAX_PRODUCTS)
                .map(CatalogContextAdapter::toContextItem)
                .toList();
    }

    static ContextItem toContextItem(Product product) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("brand", product.brand());
        metadata.put("category", product.category());
        metadata.put("price", product.price());
        if (product.color() != null) {
            metadata.put("color", product.color());
        }
        metadata.put("sizes", product.sizes());
        metadata.put("tags", product.tags());
        if (product.description() != null) {
            metadata.put("description", product.description());
        }
        return new ContextItem(ContextType.PRODUCT, product.productId(), product.name(), summarize(product), null,
                SOURCE, metadata);
    }

    static String summarize(Product product) {
        String sizes = product.sizes().isEmpty() ? "N/A" : String.join(", ", product.sizes());
        String tags = product.tags().isEmpty() ? "None" : String.join(", ", product.tags());
        return "Brand: " + orNa(product.brand()) + "\n"
                + "Category: " + orNa(product.category()) + "\n"
                + "Materials: " + orNa(product.materials()) + "\n"
                + "Care: " + orNa(product.care()) + "\n"
                + "Sizes: " + sizes + "\n"
                + "Tags: " + tags;
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value;
    }
}
