package org.example.dailyreport.controller;

import org.example.dailyreport.ratelimit.RateLimitConfig;
import org.example.dailyreport.ratelimit.RateLimiter;
import org.example.dailyreport.ratelimit.RateLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Operator view of the in-process rate limiters. Guarded by the admin API key.
 */
@RestController
@RequestMapping("/api/admin/rate-limits")
public class RateLimitAdminController {

    private static final Logger log = LoggerFactory.getLogger(RateLimitAdminController.class);

    private final RateLimiterRegistry registry;

    public RateLimitAdminController(RateLimiterRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<LimiterSnapshot> list() {
        return registry.names().stream()
                .flatMap(name -> registry.find(name).map(limiter -> snapshot(name, limiter)).stream())
                .toList();
    }

    @DeleteMapping("/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clear(@PathVariable String name) {
        requireLimiter(name).clear();
        log.info("Cleared all keys of rate limiter '{}'", name);
    }

    @DeleteMapping("/{name}/keys/{key}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void reset(@PathVariable String name, @PathVariable String key) {
        requireLimiter(name).reset(key);
        log.info("Reset key {} of rate limiter '{}'", key, name);
    }

    @PostMapping("/{name}/cleanup")
    public CleanupResult cleanup(@PathVariable String name) {
        RateLimiter limiter = requireLimiter(name);
        int removed = limiter.cleanup();
        return new CleanupResult(name, removed, limiter.getStoreSize());
    }

    private RateLimiter requireLimiter(String name) {
        return registry.find(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown rate limiter: " + name));
    }

    private LimiterSnapshot snapshot(String name, RateLimiter limiter) {
        RateLimitConfig config = limiter.getConfig();
        return new LimiterSnapshot(
                name,
                config.limit(),
                config.windowMs(),
                limiter.getStoreSize(),
                limiter.isCleanupRunning()
        );
    }

    public record LimiterSnapshot(
            String name,
            int limit,
            long windowMs,
            int trackedKeys,
            boolean cleanupRunning
    ) {
    }

    public record CleanupResult(String name, int removed, int trackedKeys) {}
}
