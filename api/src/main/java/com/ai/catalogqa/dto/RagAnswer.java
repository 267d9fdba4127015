package com.ai.catalogqa.dto;

import java.util.List;

public record RagAnswer(
        String answer,
        List<ContextItem> context,
        String traceId,
        String traceUrl) {
}
