package com.ai.catalogqa.tracing;

/**
 * Correlation metadata for one top-level request, surfaced to clients.
 */
public record TraceHandle(String traceId, String traceUrl) {
}
