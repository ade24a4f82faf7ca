package org.example.dailyreport.ratelimit;

/**
 * Outcome of a single {@link RateLimiter#check(String)} call.
 *
 * @param allowed   whether the call was accepted
 * @param remaining accepted calls left in the current window, never negative
 * @param resetIn   milliseconds until the current window ends
 * @param resetAt   epoch milliseconds at which the current window ends
 */
public record RateLimitResult(
        boolean allowed,
        int remaining,
        long resetIn,
        long resetAt
) {
}
