package com.ai.catalogqa.controller;

import com.ai.catalogqa.dto.Product;
import com.ai.catalogqa.dto.ProductFilters;
import com.ai.catalogqa.repository.ProductCatalog;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final ProductCatalog productCatalog;

    public ProductController(ProductCatalog productCatalog) {
        this.productCatalog = productCatalog;
    }

    @GetMapping
    public List<Product> listProducts(
            @RequestParam(required = false) String brand,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) String size,
            @RequestParam(required = false) String query) {
        return productCatalog.search(new ProductFilters(brand, category, tag, size), query);
    }

    @GetMapping("/{productId}")
    public Product getProduct(@PathVariable String productId) {
        return productCatalog.get(productId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "PRODUCT_NOT_FOUND: No product with id '" + productId + "'"));
    }
}
