package com.ai.catalogqa.dto;

public record HealthResponse(
        String app,
        String version,
        boolean pipelineReady) {
}
