package org.example.dailyreport.ratelimit;

import jakarta.annotation.PreDestroy;
import org.example.dailyreport.config.RateLimitProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one shared {@link RateLimiter} per logical name for the life of the registry.
 * <p>
 * The first caller for a name fixes its configuration. Later calls with a different
 * configuration get the existing limiter back unchanged, so callers must use one config per name.
 */
@Component
public class RateLimiterRegistry {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterRegistry.class);

    private final ConcurrentHashMap<String, RateLimiter> limiters = new ConcurrentHashMap<>();
    private final Set<String> mismatchWarned = ConcurrentHashMap.newKeySet();
    private final Clock clock;
    private final boolean cleanupEnabled;
    private final long cleanupIntervalMs;

    @Autowired
    public RateLimiterRegistry(RateLimitProperties properties) {
        this(Clock.systemUTC(), properties.getCleanup().isEnabled(), properties.getCleanup().getIntervalMs());
    }

    public RateLimiterRegistry(Clock clock, boolean cleanupEnabled, long cleanupIntervalMs) {
        this.clock = clock;
        this.cleanupEnabled = cleanupEnabled;
        this.cleanupIntervalMs = Math.max(1, cleanupIntervalMs);
    }

    public RateLimiter getRateLimiter(String name, RateLimitConfig config) {
        RateLimiter existing = limiters.get(name);
        if (existing != null) {
            warnOnConfigMismatch(name, existing, config);
            return existing;
        }

        return limiters.computeIfAbsent(name, ignored -> {
            RateLimiter limiter = new RateLimiter(config, clock);
            if (cleanupEnabled) {
                limiter.startCleanup(cleanupIntervalMs);
            }
            log.info("Created rate limiter '{}' (limit={}, windowMs={})", name, config.limit(), config.windowMs());
            return limiter;
        });
    }

    public RateLimiter getRateLimiterByPreset(RateLimitPreset preset) {
        return getRateLimiter(preset.limiterName(), preset.config());
    }

    public Optional<RateLimiter> find(String name) {
        return Optional.ofNullable(limiters.get(name));
    }

    public List<String> names() {
        return limiters.keySet().stream().sorted().toList();
    }

    @PreDestroy
    public void shutdown() {
        limiters.values().forEach(RateLimiter::stopCleanup);
        log.info("Stopped cleanup for {} rate limiters", limiters.size());
    }

    private void warnOnConfigMismatch(String name, RateLimiter existing, RateLimitConfig requested) {
        if (requested != null && !requested.equals(existing.getConfig()) && mismatchWarned.add(name)) {
            log.warn("Rate limiter '{}' already exists with {}; ignoring requested {}",
                    name, existing.getConfig(), requested);
        }
    }
}
