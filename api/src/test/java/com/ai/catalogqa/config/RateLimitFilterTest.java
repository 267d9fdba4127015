package com.ai.catalogqa.config;

import com.ai.catalogqa.service.RequestRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

public class RateLimitFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void testQueryOverBudget_RejectedWith429() throws Exception {
        RateLimitFilter filter = new RateLimitFilter(new RequestRateLimiter(1, 60), new ApiErrorWriter(objectMapper));

        MockHttpServletResponse first = send(filter, "POST", "/api/query", "client-key");
        MockHttpServletResponse second = send(filter, "POST", "/api/query", "client-key");

        assertEquals(200, first.getStatus());
        assertEquals(429, second.getStatus());
        assertEquals("RATE_LIMITED", objectMapper.readTree(second.getContentAsString()).path("code").asText());

        assertEquals(200, send(filter, "POST", "/api/query", "other-key").getStatus());
    }

    @Test
    void testReadsAreNotLimited() throws Exception {
        RateLimitFilter filter = new RateLimitFilter(new RequestRateLimiter(1, 60), new ApiErrorWriter(objectMapper));

        for (int i = 0; i < 3; i++) {
            assertEquals(200, send(filter, "GET", "/api/products", null).getStatus());
            assertEquals(200, send(filter, "GET", "/api/health", null).getStatus());
        }
    }

    @Test
    void testIdentity_FallsBackToClientAddress() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/ingest");
        request.setRemoteAddr("10.0.0.7");

        assertEquals("10.0.0.7", RateLimitFilter.identityOf(request));

        request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, "key-1");
        assertEquals("key-1", RateLimitFilter.identityOf(request));
    }

    private static MockHttpServletResponse send(RateLimitFilter filter, String method, String uri, String apiKey)
            throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        if (apiKey != null) {
            request.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, apiKey);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }
}
