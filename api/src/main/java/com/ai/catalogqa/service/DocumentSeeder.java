package com.ai.catalogqa.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Ingests a JSON-lines document file once at start-up when {@code ingestion.seed-path} is set.
 * Failures are logged; the application keeps running.
 */
@Component
@ConditionalOnProperty(name = "ingestion.seed-path")
public class DocumentSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DocumentSeeder.class);
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final IngestionService ingestionService;
    private final ObjectMapper objectMapper;
    private final String seedPath;

    public DocumentSeeder(IngestionService ingestionService, ObjectMapper objectMapper,
            @Value("${ingestion.seed-path}") String seedPath) {
        this.ingestionService = ingestionService;
        this.objectMapper = objectMapper;
        this.seedPath = seedPath;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (seedPath == null || seedPath.isBlank()) {
            return;
        }
        try {
            List<Map<String, Object>> records = readJsonl(Path.of(seedPath));
            int stored = ingestionService.ingest(records);
            log.info("[DocumentSeeder] Seeded {} chunks from {} documents in {}", stored, records.size(), seedPath);
        } catch (IOException e) {
            log.error("[DocumentSeeder] Failed to read seed documents from {}: {}", seedPath, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[DocumentSeeder] Seeding from {} failed: {}", seedPath, e.getMessage());
        }
    }

    List<Map<String, Object>> readJsonl(Path path) throws IOException {
        List<Map<String, Object>> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    records.add(objectMapper.readValue(line, RECORD_TYPE));
                }
            }
        }
        return records;
    }
}
