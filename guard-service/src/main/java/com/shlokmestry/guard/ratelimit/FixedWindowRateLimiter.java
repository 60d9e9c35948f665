package com.shlokmestry.guard.ratelimit;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.shlokmestry.guard.config.AppProps;
import com.shlokmestry.guard.config.RateLimitProps;
import com.shlokmestry.guard.observability.RateLimitMetrics;
import com.shlokmestry.guard.ratelimit.storage.RateLimitEntry;
import com.shlokmestry.guard.ratelimit.storage.RateLimitStorage;

/**
 * Fixed-window request counter. Windows are aligned to multiples of {@code windowMs} since
 * the epoch, so up to twice the limit can pass around a window boundary.
 *
 * Storage failures never escape: they are answered according to the configured
 * {@link com.shlokmestry.guard.config.FailurePolicy}.
 */
@Service
public class FixedWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);
    static final String KEY_PREFIX = "ratelimit:";

    private final RateLimitStorage storage;
    private final Clock clock;
    private final RateLimitMetrics metrics;
    private final boolean failClosed;
    private final long failClosedRetryAfterSeconds;

    public FixedWindowRateLimiter(RateLimitStorage storage,
                                  RateLimitProps props,
                                  AppProps appProps,
                                  Clock clock,
                                  RateLimitMetrics metrics) {
        this.storage = storage;
        this.clock = clock;
        this.metrics = metrics;
        this.failClosed = props.failurePolicy().failsClosed(appProps.deploymentMode());
        this.failClosedRetryAfterSeconds = Math.max(1, props.failClosedRetryAfter().toSeconds());
    }

    /**
     * Counts one request for {@code identifier} and reports whether it is over the limit.
     * Every call consumes quota; use {@link #status} to look without counting.
     */
    public RateLimitResult check(String identifier, int limit, long windowMs) {
        requireValid(limit, windowMs);
        long now = clock.millis();
        long windowStart = windowStart(now, windowMs);
        long resetTime = windowStart + windowMs;

        final long count;
        try {
            count = storage.increment(key(identifier, windowStart), windowMs);
        } catch (Exception e) {
            return onStorageFailure("check", identifier, limit - 1, resetTime, e);
        }

        if (count > limit) {
            return new RateLimitResult(true, 0, resetTime, retryAfterSeconds(resetTime, now));
        }
        return new RateLimitResult(false, limit - count, resetTime, 0);
    }

    /**
     * Current state of {@code identifier}'s window without counting a request.
     */
    public RateLimitResult status(String identifier, int limit, long windowMs) {
        requireValid(limit, windowMs);
        long now = clock.millis();
        long windowStart = windowStart(now, windowMs);
        long resetTime = windowStart + windowMs;

        final RateLimitEntry entry;
        try {
            entry = storage.get(key(identifier, windowStart)).orElse(null);
        } catch (Exception e) {
            return onStorageFailure("status", identifier, limit, resetTime, e);
        }

        if (entry == null) {
            return new RateLimitResult(false, limit, resetTime, 0);
        }
        boolean limited = entry.count() >= limit;
        return new RateLimitResult(
                limited,
                Math.max(0, limit - entry.count()),
                resetTime,
                limited ? retryAfterSeconds(resetTime, now) : 0);
    }

    /**
     * Drops every window of {@code identifier}. Only the local store can enumerate keys;
     * remote counters are left to expire.
     *
     * @return number of entries removed
     */
    public int clear(String identifier) {
        try {
            int removed = storage.clearMatching(key -> isWindowOf(key, identifier));
            log.info("ratelimit clear identifier={} storage={} removed={}", identifier, storage.type(), removed);
            return removed;
        } catch (Exception e) {
            log.warn("ratelimit clear failed identifier={} storage={}", identifier, storage.type(), e);
            return 0;
        }
    }

    public String storageType() {
        return storage.type();
    }

    static String key(String identifier, long windowStart) {
        return KEY_PREFIX + identifier + ":" + windowStart;
    }

    /**
     * True for {@code ratelimit:{identifier}:{windowStart}} only, so clearing {@code a} leaves
     * {@code a:b} alone.
     */
    static boolean isWindowOf(String key, String identifier) {
        String prefix = KEY_PREFIX + identifier + ":";
        if (!key.startsWith(prefix) || key.length() == prefix.length()) {
            return false;
        }
        for (int i = prefix.length(); i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private RateLimitResult onStorageFailure(String operation, String identifier, long openRemaining,
                                             long resetTime, Exception e) {
        metrics.storageFailure(operation, failClosed);
        if (failClosed) {
            log.warn("ratelimit fail_closed operation={} identifier={} storage={}", operation, identifier, storage.type(), e);
            return new RateLimitResult(true, 0, resetTime, failClosedRetryAfterSeconds);
        }
        log.warn("ratelimit fail_open operation={} identifier={} storage={}", operation, identifier, storage.type(), e);
        return new RateLimitResult(false, Math.max(0, openRemaining), resetTime, 0);
    }

    private static long windowStart(long now, long windowMs) {
        return Math.floorDiv(now, windowMs) * windowMs;
    }

    private static long retryAfterSeconds(long resetTime, long now) {
        return Math.max(1, (long) Math.ceil((resetTime - now) / 1000.0));
    }

    private static void requireValid(int limit, long windowMs) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be positive");
        }
    }
}
