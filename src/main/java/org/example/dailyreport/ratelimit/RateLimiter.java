package org.example.dailyreport.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window in-memory rate limiter keyed by an opaque caller key.
 * <p>
 * Each key owns a counter anchored at the time of its first call. The counter resets once a full
 * window has elapsed, so a client may burst up to twice the limit across a window boundary.
 * State is local to this instance; separate processes never share counts.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    public static final long DEFAULT_CLEANUP_INTERVAL_MS = 60_000L;

    private final Clock clock;
    private final ConcurrentHashMap<String, WindowEntry> windows = new ConcurrentHashMap<>();
    private volatile RateLimitConfig config;

    private final Object cleanupLock = new Object();
    private ScheduledExecutorService cleanupExecutor;
    private ScheduledFuture<?> cleanupTask;

    public RateLimiter(RateLimitConfig config) {
        this(config, Clock.systemUTC());
    }

    public RateLimiter(RateLimitConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Counts a call for {@code key} and reports whether it fits in the current window.
     * A denied call does not increment the counter.
     */
    public RateLimitResult check(String key) {
        Objects.requireNonNull(key, "key");
        RateLimitConfig current = config;
        RateLimitResult[] outcome = new RateLimitResult[1];

        windows.compute(key, (ignored, entry) -> {
            long now = clock.millis();
            if (entry == null || now - entry.windowStart() >= current.windowMs()) {
                outcome[0] = new RateLimitResult(
                        true, current.limit() - 1, current.windowMs(), now + current.windowMs());
                return new WindowEntry(1, now);
            }

            long resetIn = current.windowMs() - (now - entry.windowStart());
            long resetAt = entry.windowStart() + current.windowMs();
            if (entry.count() >= current.limit()) {
                outcome[0] = new RateLimitResult(false, 0, resetIn, resetAt);
                return entry;
            }

            WindowEntry next = entry.increment();
            outcome[0] = new RateLimitResult(true, current.limit() - next.count(), resetIn, resetAt);
            return next;
        });

        return outcome[0];
    }

    public void reset(String key) {
        windows.remove(key);
    }

    public void clear() {
        windows.clear();
    }

    /**
     * Evicts every key whose window has fully elapsed. Keys are evicted one at a time so
     * concurrent {@link #check(String)} calls are never blocked for the whole scan.
     *
     * @return number of evicted keys
     */
    public int cleanup() {
        long windowMs = config.windowMs();
        int removed = 0;
        for (String key : windows.keySet()) {
            boolean[] expired = new boolean[1];
            windows.computeIfPresent(key, (ignored, entry) -> {
                if (clock.millis() - entry.windowStart() >= windowMs) {
                    expired[0] = true;
                    return null;
                }
                return entry;
            });
            if (expired[0]) {
                removed++;
            }
        }
        return removed;
    }

    public void startCleanup() {
        startCleanup(DEFAULT_CLEANUP_INTERVAL_MS);
    }

    /**
     * Schedules {@link #cleanup()} every {@code intervalMs}. No-op when already scheduled.
     */
    public void startCleanup(long intervalMs) {
        if (intervalMs < 1) {
            throw new IllegalArgumentException("intervalMs must be >= 1 but was " + intervalMs);
        }
        synchronized (cleanupLock) {
            if (cleanupTask != null) {
                return;
            }
            cleanupExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "rate-limit-cleanup");
                thread.setDaemon(true);
                return thread;
            });
            cleanupTask = cleanupExecutor.scheduleAtFixedRate(
                    this::runScheduledCleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
    }

    public void stopCleanup() {
        synchronized (cleanupLock) {
            if (cleanupTask == null) {
                return;
            }
            cleanupTask.cancel(false);
            cleanupExecutor.shutdownNow();
            cleanupTask = null;
            cleanupExecutor = null;
        }
    }

    public boolean isCleanupRunning() {
        synchronized (cleanupLock) {
            return cleanupTask != null;
        }
    }

    public RateLimitConfig getConfig() {
        return config;
    }

    /**
     * Replaces only the supplied fields of the current configuration.
     */
    public void setConfig(Integer limit, Long windowMs) {
        config = config.merge(limit, windowMs);
    }

    /**
     * Number of keys currently tracked. Diagnostics only.
     */
    public int getStoreSize() {
        return windows.size();
    }

    private void runScheduledCleanup() {
        try {
            int removed = cleanup();
            if (removed > 0) {
                log.debug("Rate limit cleanup evicted {} expired keys, {} remain", removed, windows.size());
            }
        } catch (RuntimeException e) {
            // an exception escaping here would cancel every later run
            log.warn("Rate limit cleanup failed", e);
        }
    }

    private record WindowEntry(int count, long windowStart) {

        private WindowEntry increment() {
            return new WindowEntry(count + 1, windowStart);
        }
    }
}
