package com.ai.catalogqa.dto;

public record IngestResponse(int recordsIngested) {
}
