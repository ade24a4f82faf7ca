package org.example.dailyreport.ratelimit;

/**
 * Fixed limits for the common endpoint classes. Operators and clients rely on these values.
 */
public enum RateLimitPreset {

    API("api", 60, 60_000L),
    SEARCH("search", 30, 60_000L),
    LOGIN("login", 5, 15 * 60_000L),
    PASSWORD_RESET("passwordReset", 3, 60 * 60_000L),
    UPLOAD("upload", 10, 60_000L);

    private final String limiterName;
    private final RateLimitConfig config;

    RateLimitPreset(String limiterName, int limit, long windowMs) {
        this.limiterName = limiterName;
        this.config = new RateLimitConfig(limit, windowMs);
    }

    public String limiterName() {
        return limiterName;
    }

    public RateLimitConfig config() {
        return config;
    }
}
