package com.ai.catalogqa.tracing;

/**
 * A scoped tracing span. Closing ends the span; when no tracing backend is active
 * every operation is a no-op. Never throws.
 */
public interface SpanScope extends AutoCloseable {

    void setAttribute(String key, Object value);

    /**
     * Mark the span as failed. A {@link java.util.concurrent.CancellationException} or an
     * interrupted thread is recorded as a cancellation.
     */
    void recordError(Throwable error);

    /**
     * Trace id of the enclosing root span, or null outside of any root span.
     */
    String traceId();

    @Override
    void close();
}
