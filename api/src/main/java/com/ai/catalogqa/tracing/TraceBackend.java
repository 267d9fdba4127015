package com.ai.catalogqa.tracing;

import io.opentelemetry.api.trace.Tracer;

/**
 * A registered tracing backend: the tracer spans are created from, plus the hook
 * that flushes and releases the exporter.
 */
public record TraceBackend(Tracer tracer, Runnable shutdownHook) {

    public void shutdown() {
        if (shutdownHook != null) {
            shutdownHook.run();
        }
    }
}
