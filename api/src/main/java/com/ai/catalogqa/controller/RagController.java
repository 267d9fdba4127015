package com.ai.catalogqa.controller;

import com.ai.catalogqa.dto.HealthResponse;
import com.ai.catalogqa.dto.IngestRequest;
import com.ai.catalogqa.dto.IngestResponse;
import com.ai.catalogqa.dto.QueryRequest;
import com.ai.catalogqa.dto.RagAnswer;
import com.ai.catalogqa.service.IngestionService;
import com.ai.catalogqa.service.RagOrchestrator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class RagController {

    private static final Logger log = LoggerFactory.getLogger(RagController.class);

    private final IngestionService ingestionService;
    private final RagOrchestrator ragOrchestrator;

    @Value("${app.name:Catalog QA Backend}")
    private String appName;

    @Value("${app.api-version:v1}")
    private String apiVersion;

    public RagController(IngestionService ingestionService, RagOrchestrator ragOrchestrator) {
        this.ingestionService = ingestionService;
        this.ragOrchestrator = ragOrchestrator;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", appName + " is running");
    }

    @GetMapping("/api/health")
    public HealthResponse health() {
        return new HealthResponse(appName, apiVersion, ingestionService.isReady());
    }

    /**
     * Chunk and store knowledge base documents.
     * POST /api/ingest
     */
    @PostMapping("/api/ingest")
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody IngestRequest request) {
        log.info("[RagController] Ingest request with {} documents", request.documents().size());
        int stored = ingestionService.ingest(request.documents());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new IngestResponse(stored));
    }

    /**
     * Answer a question from retrieved documents and catalog products.
     * POST /api/query
     */
    @PostMapping("/api/query")
    public RagAnswer query(@Valid @RequestBody QueryRequest request) {
        log.info("[RagController] Query request: question='{}', topK={}, filters={}",
                truncate(request.question(), 50), request.topK(), request.filters());
        return ragOrchestrator.run(request.question(), request.topK(), request.filters());
    }

    private String truncate(String text, int maxLength) {
        if (text == null) {
            return "null";
        }
        return text.length() > maxLength ? text.substring(0, maxLength) + "..." : text;
    }
}
