package org.example.dailyreport.ratelimit;

/**
 * Maximum number of accepted calls per key within one fixed window.
 *
 * @param limit    accepted calls per window, at least 1
 * @param windowMs window length in milliseconds, between 1 and {@link #MAX_WINDOW_MS}
 */
public record RateLimitConfig(int limit, long windowMs) {

    /** Keeps {@code now + windowMs} far from overflow. */
    public static final long MAX_WINDOW_MS = 366L * 24 * 60 * 60 * 1000;

    public RateLimitConfig {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1 but was " + limit);
        }
        if (windowMs < 1 || windowMs > MAX_WINDOW_MS) {
            throw new IllegalArgumentException(
                    "windowMs must be between 1 and " + MAX_WINDOW_MS + " but was " + windowMs);
        }
    }

    /**
     * Returns a copy where only the non-null arguments replace the current values.
     */
    public RateLimitConfig merge(Integer newLimit, Long newWindowMs) {
        return new RateLimitConfig(
                newLimit != null ? newLimit : limit,
                newWindowMs != null ? newWindowMs : windowMs);
    }
}
