package com.ai.catalogqa.controller;

import com.ai.catalogqa.dto.ContextItem;
import com.ai.catalogqa.dto.ContextType;
import com.ai.catalogqa.dto.HealthResponse;
import com.ai.catalogqa.dto.IngestRequest;
import com.ai.catalogqa.dto.IngestResponse;
import com.ai.catalogqa.dto.ProductFilters;
import com.ai.catalogqa.dto.QueryRequest;
import com.ai.catalogqa.dto.RagAnswer;
import com.ai.catalogqa.exception.VectorStoreUnavailableException;
import com.ai.catalogqa.service.IngestionService;
import com.ai.catalogqa.service.RagOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class RagControllerThinTest {

    @Mock
    private IngestionService ingestionService;
    @Mock
    private RagOrchestrator ragOrchestrator;

    @InjectMocks
    private RagController ragController;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ReflectionTestUtils.setField(ragController, "appName", "Catalog QA Backend");
        ReflectionTestUtils.setField(ragController, "apiVersion", "v1");
    }

    @Test
    void testQuery_PassesQuestionTopKAndFilters() {
        QueryRequest request = new QueryRequest("Do you have a summer dress?", 3, null, "Dresses", null, "M");
        ContextItem product = new ContextItem(ContextType.PRODUCT, "EV-DR-001", "Linen Wrap Summer Dress",
                "Brand: EverVerde", null, "catalog", Map.of());
        when(ragOrchestrator.run(any(), anyInt(), any()))
                .thenReturn(new RagAnswer("Try the linen wrap dress.", List.of(product), "abc", null));

        RagAnswer answer = ragController.query(request);

        assertEquals("Try the linen wrap dress.", answer.answer());
        assertEquals(1, answer.context().size());
        verify(ragOrchestrator).run("Do you have a summer dress?", 3, new ProductFilters(null, "Dresses", null, "M"));
    }

    @Test
    void testQuery_DefaultTopKIsFive() {
        QueryRequest request = new QueryRequest("What is recycled wool?", null, null, null, null, null);
        when(ragOrchestrator.run(any(), anyInt(), any())).thenReturn(new RagAnswer("a", List.of(), "id", null));

        ragController.query(request);

        verify(ragOrchestrator).run(eq("What is recycled wool?"), eq(5), any());
    }

    @Test
    void testIngest_Returns202WithStoredCount() {
        IngestRequest request = new IngestRequest(List.of(Map.of("doc_id", "care", "text", "Wash cold")));
        when(ingestionService.ingest(request.documents())).thenReturn(1);

        ResponseEntity<IngestResponse> response = ragController.ingest(request);

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals(1, response.getBody().recordsIngested());
    }

    @Test
    void testIngest_StoreUnavailablePropagates() {
        IngestRequest request = new IngestRequest(List.of(Map.of("text", "Wash cold")));
        when(ingestionService.ingest(anyList())).thenThrow(new VectorStoreUnavailableException("no store"));

        assertThrows(VectorStoreUnavailableException.class, () -> ragController.ingest(request));
    }

    @Test
    void testHealth_ReportsPipelineReadiness() {
        when(ingestionService.isReady()).thenReturn(false);

        HealthResponse health = ragController.health();

        assertEquals("Catalog QA Backend", health.app());
        assertEquals("v1", health.version());
        assertFalse(health.pipelineReady());
        assertEquals("Catalog QA Backend is running", ragController.root().get("message"));
    }
}
