package com.ai.catalogqa.exception;

/**
 * Raised when the product catalog is not configured or cannot be loaded.
 */
public class CatalogUnavailableException extends RuntimeException {
    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
