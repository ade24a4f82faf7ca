package org.example.dailyreport.ratelimit;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Entry point for request handlers: resolves the caller, picks the shared limiter and
 * formats the response headers. Handlers should not call {@link RateLimiter} directly.
 */
@Service
public class RateLimitGuard {

    private static final Logger log = LoggerFactory.getLogger(RateLimitGuard.class);

    private final RateLimiterRegistry registry;

    public RateLimitGuard(RateLimiterRegistry registry) {
        this.registry = registry;
    }

    public RateLimitCheck checkRateLimit(HttpServletRequest request, RateLimitPreset preset, @Nullable String keyPrefix) {
        return checkRateLimit(request, preset.limiterName(), preset.config(), keyPrefix);
    }

    public RateLimitCheck checkRateLimit(
            HttpServletRequest request,
            String limiterName,
            RateLimitConfig config,
            @Nullable String keyPrefix) {
        RateLimiter limiter = registry.getRateLimiter(limiterName, config);
        String clientIp = ClientIpResolver.getClientIp(request);
        String key = keyPrefix != null && !keyPrefix.isEmpty() ? keyPrefix + ":" + clientIp : clientIp;

        RateLimitResult result = limiter.check(key);
        if (result.allowed() && result.remaining() == 0) {
            // once per key and window: the call that uses up the limit
            log.info("Rate limit '{}' reached for key {} (resets in {} ms)", limiterName, key, result.resetIn());
        } else if (!result.allowed()) {
            log.debug("Rate limit '{}' denied key {} (retry in {} ms)", limiterName, key, result.resetIn());
        }

        return new RateLimitCheck(result, RateLimitHeaders.create(result, config));
    }
}
