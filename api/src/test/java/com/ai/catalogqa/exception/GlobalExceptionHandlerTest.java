package com.ai.catalogqa.exception;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.server.ResponseStatusException;

import static org.junit.jupiter.api.Assertions.*;

public class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    void testStoreUnavailable_Is503WithTraceId() {
        MDC.put("traceId", "0123456789abcdef0123456789abcdef");

        ResponseEntity<ApiError> response = handler.handleStoreUnavailable(
                new VectorStoreUnavailableException("Weaviate is down"), request("/api/ingest"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        ApiError error = response.getBody();
        assertNotNull(error);
        assertEquals("STORE_UNAVAILABLE", error.code());
        assertEquals("/api/ingest", error.path());
        assertEquals("0123456789abcdef0123456789abcdef", error.traceId());
        assertEquals("Weaviate is down", error.details().get("originalError"));
    }

    @Test
    void testCatalogUnavailable_Is503() {
        ResponseEntity<ApiError> response = handler.handleCatalogUnavailable(
                new CatalogUnavailableException("missing file"), request("/api/products"));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("CATALOG_UNAVAILABLE", response.getBody().code());
        assertNull(response.getBody().traceId());
    }

    @Test
    void testResponseStatus_CodeTakenFromReasonPrefix() {
        ResponseEntity<ApiError> response = handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.NOT_FOUND, "PRODUCT_NOT_FOUND: No product with id 'x'"),
                request("/api/products/x"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("PRODUCT_NOT_FOUND", response.getBody().code());
        assertEquals("Not Found", response.getBody().error());
    }

    @Test
    void testGeneric_Is500() {
        ResponseEntity<ApiError> response = handler.handleGeneric(new IllegalStateException("oops"), request("/"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_SERVER_ERROR", response.getBody().code());
    }

    private static ServletWebRequest request(String uri) {
        return new ServletWebRequest(new MockHttpServletRequest("POST", uri));
    }
}
