package com.ai.catalogqa.exception;

/**
 * Raised when no vector store backend can be constructed or reached.
 */
public class VectorStoreUnavailableException extends RuntimeException {
    public VectorStoreUnavailableException(String message) {
        super(message);
    }

    public VectorStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
