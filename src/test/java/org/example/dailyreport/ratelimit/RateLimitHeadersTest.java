package org.example.dailyreport.ratelimit;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RateLimitHeadersTest {

    private final RateLimitConfig config = new RateLimitConfig(60, 60_000);

    @Test
    void create_deniedResultCarriesRetryAfterInSeconds() {
        RateLimitResult result = new RateLimitResult(false, 0, 30_000, 1_767_225_630_000L);

        Map<String, String> headers = RateLimitHeaders.create(result, config);

        assertEquals("60", headers.get("X-RateLimit-Limit"));
        assertEquals("0", headers.get("X-RateLimit-Remaining"));
        assertEquals("1767225630", headers.get("X-RateLimit-Reset"));
        assertEquals("30", headers.get("Retry-After"));
    }

    @Test
    void create_allowedResultHasZeroRetryAfter() {
        RateLimitResult result = new RateLimitResult(true, 42, 30_000, 1_767_225_630_000L);

        Map<String, String> headers = RateLimitHeaders.create(result, config);

        assertEquals("42", headers.get("X-RateLimit-Remaining"));
        assertEquals("0", headers.get("Retry-After"));
    }

    @Test
    void create_roundsPartialSecondsUp() {
        RateLimitResult result = new RateLimitResult(false, 0, 1_001, 1_767_225_600_001L);

        Map<String, String> headers = RateLimitHeaders.create(result, config);

        assertEquals("1767225601", headers.get("X-RateLimit-Reset"));
        assertEquals("2", headers.get("Retry-After"));
    }

    @Test
    void create_keepsHeaderOrder() {
        RateLimitResult result = new RateLimitResult(true, 1, 500, 1_000L);

        assertEquals(
                List.of("X-RateLimit-Limit", "X-RateLimit-Remaining", "X-RateLimit-Reset", "Retry-After"),
                List.copyOf(RateLimitHeaders.create(result, config).keySet()));
    }

    @Test
    void applyTo_copiesHeadersToResponse() {
        MockHttpServletResponse response = new MockHttpServletResponse();
        RateLimitResult result = new RateLimitResult(false, 0, 4_500, 9_000L);

        RateLimitHeaders.applyTo(RateLimitHeaders.create(result, config), response);

        assertEquals("60", response.getHeader("X-RateLimit-Limit"));
        assertEquals("9", response.getHeader("X-RateLimit-Reset"));
        assertEquals("5", response.getHeader("Retry-After"));
    }
}
