package com.ai.catalogqa.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class DocumentSeederTest {

    @TempDir
    Path tempDir;

    @Mock
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testRun_IngestsEveryNonBlankLine() throws IOException {
        Path seed = tempDir.resolve("docs.jsonl");
        Files.writeString(seed, """
                {"doc_id":"care","text":"Wash cold"}

                {"doc_id":"returns","text":"Free returns within 30 days","title":"Returns"}
                """);
        DocumentSeeder seeder = new DocumentSeeder(ingestionService, new ObjectMapper(), seed.toString());

        seeder.run(new DefaultApplicationArguments());

        verify(ingestionService).ingest(List.of(
                Map.of("doc_id", "care", "text", "Wash cold"),
                Map.of("doc_id", "returns", "text", "Free returns within 30 days", "title", "Returns")));
    }

    @Test
    void testRun_MissingFileIsNotFatal() {
        DocumentSeeder seeder = new DocumentSeeder(ingestionService, new ObjectMapper(),
                tempDir.resolve("missing.jsonl").toString());

        assertDoesNotThrow(() -> seeder.run(new DefaultApplicationArguments()));
        verify(ingestionService, never()).ingest(anyList());
    }

    @Test
    void testRun_IngestionFailureIsNotFatal() throws IOException {
        Path seed = tempDir.resolve("docs.jsonl");
        Files.writeString(seed, "{\"text\":\"Wash cold\"}\n");
        when(ingestionService.ingest(anyList())).thenThrow(new IllegalStateException("store down"));
        DocumentSeeder seeder = new DocumentSeeder(ingestionService, new ObjectMapper(), seed.toString());

        assertDoesNotThrow(() -> seeder.run(new DefaultApplicationArguments()));
    }
}
