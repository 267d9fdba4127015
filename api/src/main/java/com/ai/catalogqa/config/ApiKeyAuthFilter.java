package com.ai.catalogqa.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Rejects calls to the protected endpoints whose {@code X-API-Key} header does not match
 * {@code app.api-key}. Does nothing when no key is configured.
 */
public class ApiKeyAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyAuthFilter.class);
    public static final String API_KEY_HEADER = "X-API-Key";

    private final String apiKey;
    private final ApiErrorWriter errorWriter;

    ApiKeyAuthFilter(String apiKey, ApiErrorWriter errorWriter) {
        this.apiKey = apiKey;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (apiKey == null || apiKey.isBlank() || HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }
        return !isProtected(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String provided = request.getHeader(API_KEY_HEADER);
        if (provided == null || !MessageDigest.isEqual(
                provided.getBytes(StandardCharsets.UTF_8), apiKey.getBytes(StandardCharsets.UTF_8))) {
            log.warn("[ApiKeyAuthFilter] Rejected {} {} from {}: invalid or missing API key",
                    request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
            errorWriter.write(request, response, HttpStatus.UNAUTHORIZED, "INVALID_API_KEY",
                    "Missing or invalid API key");
            return;
        }
        chain.doFilter(request, response);
    }

    static boolean isProtected(String path) {
        return path.equals("/api/ingest")
                || path.equals("/api/query")
                || path.equals("/api/products")
                || path.startsWith("/api/products/");
    }
}
