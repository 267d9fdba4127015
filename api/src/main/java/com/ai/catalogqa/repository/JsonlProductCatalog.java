package com.ai.catalogqa.repository;

import com.ai.catalogqa.dto.Product;
import com.ai.catalogqa.dto.ProductFilters;
import com.ai.catalogqa.exception.CatalogUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * In-memory product catalog loaded once, on first use, from a JSON-lines file.
 */
@Repository
public class JsonlProductCatalog implements ProductCatalog {

    private static final Logger log = LoggerFactory.getLogger(JsonlProductCatalog.class);
    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9]+");
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "you", "your", "are", "have", "has", "any", "what", "which",
            "how", "should", "can", "does", "show", "options", "recommendations", "about", "that", "this");

    private final String configuredPath;
    private final ObjectMapper objectMapper;
    private volatile List<Product> products;

    public JsonlProductCatalog(@Value("${catalog.path:}") String configuredPath, ObjectMapper objectMapper) {
        this.configuredPath = configuredPath;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Product> get(String productId) {
        if (productId == null) {
            return Optional.empty();
        }
        return products().stream()
                .filter(p -> p.productId() != null && p.productId().equalsIgnoreCase(productId))
                .findFirst();
    }

    @Override
    public List<Product> search(ProductFilters filters, String query) {
        ProductFilters f = filters == null ? ProductFilters.none() : filters;
        String q = isBlank(query) ? null : query.toLowerCase(Locale.ROOT);
        return products().stream()
                .filter(p -> isBlank(f.brand()) || f.brand().equalsIgnoreCase(p.brand()))
                .filter(p -> isBlank(f.category()) || f.category().equalsIgnoreCase(p.category()))
                .filter(p -> isBlank(f.tag()) || p.tags().stream().anyMatch(f.tag()::equalsIgnoreCase))
                .filter(p -> isBlank(f.size()) || p.sizes().stream().anyMatch(f.size()::equalsIgnoreCase))
                .filter(p -> q == null || containsIgnoreCase(q, p.name(), p.description(), p.materials(),
                        p.care(), p.brand()))
                .toList();
    }

    /**
     * Whole-text substring matches come first; otherwise products are ranked by how many
     * distinct significant question terms appear in their searchable fields, ties in
     * catalog order.
     */
    @Override
    public List<Product> lookupFromText(String text) {
        if (isBlank(text)) {
            return List.of();
        }
        List<Product> exact = search(ProductFilters.none(), text.trim());
        if (!exact.isEmpty()) {
            return exact;
        }

        Set<String> terms = significantTerms(text);
        if (terms.isEmpty()) {
            return List.of();
        }
        record Match(Product product, int hits) {
        }
        List<Match> matches = new ArrayList<>();
        for (Product product : products()) {
            String haystack = searchableText(product);
            int hits = 0;
            for (String term : terms) {
                if (haystack.contains(term)) {
                    hits++;
                }
            }
            if (hits > 0) {
                matches.add(new Match(product, hits));
            }
        }
        matches.sort(Comparator.comparingInt(Match::hits).reversed());
        return matches.stream().map(Match::product).toList();
    }

    List<Product> products() {
        List<Product> loaded = products;
        if (loaded != null) {
            return loaded;
        }
        synchronized (this) {
            if (products == null) {
                products = load();
            }
            return products;
        }
    }

    private List<Product> load() {
        if (isBlank(configuredPath)) {
            throw new CatalogUnavailableException("catalog.path is not configured");
        }
        Path path = Path.of(configuredPath).toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new CatalogUnavailableException("Product data file not found at " + path);
        }

        List<Product> loaded = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    loaded.add(objectMapper.readValue(line, Product.class));
                } catch (IOException e) {
                    throw new CatalogUnavailableException(
                            "Invalid product record at " + path + ":" + lineNumber + ": " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new CatalogUnavailableException("Failed to read product data file " + path, e);
        }

        log.info("[JsonlProductCatalog] Loaded {} products from {}", loaded.size(), path);
        return List.copyOf(loaded);
    }

    private static Set<String> significantTerms(String text) {
        Set<String> terms = new LinkedHashSet<>();
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    private static String searchableText(Product p) {
        return String.join(" ",
                nullToEmpty(p.name()), nullToEmpty(p.description()), nullToEmpty(p.materials()),
                nullToEmpty(p.care()), nullToEmpty(p.brand()), nullToEmpty(p.category()),
                String.join(" ", p.tags()))
                .toLowerCase(Locale.ROOT);
    }

    private static boolean containsIgnoreCase(String needleLower, String... fields) {
        for (String field : fields) {
            if (field != null && field.toLowerCase(Locale.ROOT).contains(needleLower)) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
