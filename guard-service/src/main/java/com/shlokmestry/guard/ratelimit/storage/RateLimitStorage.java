package com.shlokmestry.guard.ratelimit.storage;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Counter store behind the rate limiter. Implementations report failures as
 * {@link StorageException} and never retry internally.
 */
public interface RateLimitStorage {

    Optional<RateLimitEntry> get(String key);

    void set(String key, RateLimitEntry entry, long ttlMs);

    /**
     * Atomically adds one to the counter at {@code key}, creating it at 1 when absent. The key
     * expires {@code ttlMs} after the first increment.
     *
     * @return the count after this increment
     */
    long increment(String key, long ttlMs);

    /** {@code remote} or {@code local}. */
    String type();

    /**
     * Removes every key accepted by {@code keyFilter}. Stores that cannot enumerate keys leave
     * them to expire and return 0.
     */
    default int clearMatching(Predicate<String> keyFilter) {
        return 0;
    }
}
