package com.ai.catalogqa.exception;

/**
 * Raised when the language model call fails. Always absorbed by the orchestrator.
 */
public class SynthesisUnavailableException extends RuntimeException {
    public SynthesisUnavailableException(String message) {
        super(message);
    }

    public SynthesisUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
