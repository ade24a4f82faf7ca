package org.example.dailyreport.ratelimit;

import jakarta.servlet.http.HttpServletResponse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";

    private RateLimitHeaders() {
    }

    /**
     * Builds the standard rate limit headers. {@code X-RateLimit-Reset} is in epoch seconds and
     * {@code Retry-After} is 0 for accepted calls.
     */
    public static Map<String, String> create(RateLimitResult result, RateLimitConfig config) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(LIMIT, String.valueOf(config.limit()));
        headers.put(REMAINING, String.valueOf(result.remaining()));
        headers.put(RESET, String.valueOf(ceilSeconds(result.resetAt())));
        headers.put(RETRY_AFTER, result.allowed() ? "0" : String.valueOf(ceilSeconds(result.resetIn())));
        return Collections.unmodifiableMap(headers);
    }

    public static void applyTo(Map<String, String> headers, HttpServletResponse response) {
        headers.forEach(response::setHeader);
    }

    private static long ceilSeconds(long millis) {
        return Math.floorDiv(millis + 999, 1000);
    }
}
