package com.ai.catalogqa.tracing;

/**
 * Connects to an external tracing backend.
 */
@FunctionalInterface
public interface TraceBackendFactory {

    /**
     * @param endpoint normalized base endpoint of the backend, e.g. {@code http://phoenix:6006}
     * @throws RuntimeException when the backend is unreachable or registration fails
     */
    TraceBackend connect(String endpoint);
}
