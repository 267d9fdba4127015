package com.ai.catalogqa.service;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket per caller identity: {@code per-window} requests every {@code window-seconds}.
 */
@Component
public class RequestRateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final int perWindow;
    private final Duration window;

    public RequestRateLimiter(
            @Value("${app.rate-limit.per-window:60}") int perWindow,
            @Value("${app.rate-limit.window-seconds:60}") long windowSeconds) {
        if (perWindow <= 0 || windowSeconds <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Invalid rate limit: perWindow=%d, windowSeconds=%d", perWindow, windowSeconds));
        }
        this.perWindow = perWindow;
        this.window = Duration.ofSeconds(windowSeconds);
    }

    public boolean tryConsume(String identity) {
        String key = identity == null || identity.isBlank() ? "anonymous" : identity;
        Bucket bucket = buckets.computeIfAbsent(key, k -> newBucket());
        return bucket.tryConsume(1);
    }

    public int getPerWindow() {
        return perWindow;
    }

    public Duration getWindow() {
        return window;
    }

    private Bucket newBucket() {
        Refill refill = Refill.greedy(perWindow, window);
        Bandwidth limit = Bandwidth.classic(perWindow, refill);
        return Bucket.builder().addLimit(limit).build();
    }
}
