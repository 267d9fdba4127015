package com.ai.catalogqa.config;

import com.ai.catalogqa.service.RequestRateLimiter;
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

/**
 * Applies the per-identity request budget to the ingest and query endpoints.
 * Identity is the API key header, else the client address.
 */
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final RequestRateLimiter rateLimiter;
    private final ApiErrorWriter errorWriter;

    RateLimitFilter(RequestRateLimiter rateLimiter, ApiErrorWriter errorWriter) {
        this.rateLimiter = rateLimiter;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!HttpMethod.POST.matches(request.getMethod())) {
            return true;
        }
        String path = request.getRequestURI();
        return !(path.equals("/api/ingest") || path.equals("/api/query"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String identity = identityOf(request);
        if (!rateLimiter.tryConsume(identity)) {
            log.warn("[RateLimitFilter] Rate limit exceeded for {} on {}", mask(identity), request.getRequestURI());
            errorWriter.write(request, response, HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED",
                    String.format("Rate limit exceeded: %d requests per %d seconds",
                            rateLimiter.getPerWindow(), rateLimiter.getWindow().toSeconds()));
            return;
        }
        chain.doFilter(request, response);
    }

    static String identityOf(HttpServletRequest request) {
        String apiKey = request.getHeader(ApiKeyAuthFilter.API_KEY_HEADER);
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey;
        }
        String address = request.getRemoteAddr();
        return address == null || address.isBlank() ? "anonymous" : address;
    }

    private static String mask(String identity) {
        return identity.length() <= 4 ? identity : identity.substring(0, 4) + "***";
    }
}
