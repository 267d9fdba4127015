package com.ai.catalogqa;

import com.ai.catalogqa.tracing.TracingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "vectorstore.weaviate.enabled=false",
        "tracing.endpoint=",
        "llm.api-key=",
        "app.api-key=test-key",
        "catalog.path=src/test/resources/catalog/products.jsonl",
        "ingestion.seed-path="
})
@AutoConfigureMockMvc
public class CatalogQaApplicationTests {

    private static final String API_KEY = "X-API-Key";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TracingService tracingService;

    @Test
    void testHealthIsOpenAndPipelineReady() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pipelineReady").value(true))
                .andExpect(jsonPath("$.version").value("v1"));

        assertFalse(tracingService.isEnabled());
    }

    @Test
    void testQueryWithoutApiKeyIsRejected() throws Exception {
        mockMvc.perform(post("/api/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"linen\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_API_KEY"));
    }

    @Test
    void testIngestThenQueryReturnsDocumentContextAndTraceId() throws Exception {
        mockMvc.perform(post("/api/ingest")
                        .header(API_KEY, "test-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"documents":[{"doc_id":"linen-care","title":"Linen care",
                                  "text":"Wash linen garments cold and line dry them in the shade."}]}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.recordsIngested").value(1));

        mockMvc.perform(post("/api/query")
                        .header(API_KEY, "test-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"How do I wash linen garments?\",\"top_k\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer", startsWith("A language model is not available")))
                .andExpect(jsonPath("$.context[0].type").value("document"))
                .andExpect(jsonPath("$.context[0].title").value("Linen care"))
                .andExpect(jsonPath("$.traceId", matchesPattern("[0-9a-f]{32}")));
    }

    @Test
    void testProductsWithoutApiKeyGetJsonErrorAndRootStaysOpen() throws Exception {
        mockMvc.perform(get("/api/products"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_API_KEY"))
                .andExpect(jsonPath("$.path").value("/api/products"));

        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").exists());
    }

    @Test
    void testLargeTopKIsAccepted() throws Exception {
        mockMvc.perform(post("/api/query")
                        .header(API_KEY, "test-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"recycled wool\",\"top_k\":500}"))
                .andExpect(status().isOk());
    }

    @Test
    void testBlankQuestionIsInvalid() throws Exception {
        mockMvc.perform(post("/api/query")
                        .header(API_KEY, "test-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void testMalformedJsonIsInvalidPayload() throws Exception {
        mockMvc.perform(post("/api/query")
                        .header(API_KEY, "test-key")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PAYLOAD"));
    }

    @Test
    void testProductLookup() throws Exception {
        mockMvc.perform(get("/api/products/ev-dr-001").header(API_KEY, "test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Linen Wrap Summer Dress"))
                .andExpect(jsonPath("$.product_id").value("EV-DR-001"));

        mockMvc.perform(get("/api/products").param("category", "Dresses").header(API_KEY, "test-key"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(get("/api/products/unknown").header(API_KEY, "test-key"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PRODUCT_NOT_FOUND"));
    }
}
