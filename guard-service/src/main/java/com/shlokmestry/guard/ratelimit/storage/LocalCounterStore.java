package com.shlokmestry.guard.ratelimit.storage;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * In-process counters. Best effort only: nothing is shared between instances and all
 * counts are lost on restart.
 *
 * Updates to one key run inside {@link ConcurrentHashMap#compute}, which serializes
 * concurrent increments of that key. Each window schedules one removal at its expiry.
 */
public class LocalCounterStore implements RateLimitStorage, AutoCloseable {

    private final ConcurrentHashMap<String, RateLimitEntry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService expiryExecutor;

    public LocalCounterStore(Clock clock) {
        this.clock = clock;
        this.expiryExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ratelimit-local-expiry");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Optional<RateLimitEntry> get(String key) {
        RateLimitEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt() <= clock.millis()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void set(String key, RateLimitEntry entry, long ttlMs) {
        entries.put(key, entry);
        expiryExecutor.schedule(() -> entries.remove(key, entry), ttlMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public long increment(String key, long ttlMs) {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive");
        }
        long now = clock.millis();
        long windowStart = Math.floorDiv(now, ttlMs) * ttlMs;
        long expiresAt = windowStart + ttlMs;

        RateLimitEntry updated = entries.compute(key, (k, current) -> {
            if (current == null || current.expiresAt() <= now) {
                return new RateLimitEntry(1, windowStart, expiresAt);
            }
            return new RateLimitEntry(current.count() + 1, current.windowStart(), current.expiresAt());
        });

        if (updated.count() == 1) {
            scheduleExpiry(key, updated.windowStart(), updated.expiresAt() - now);
        }
        return updated.count();
    }

    @Override
    public String type() {
        return "local";
    }

    @Override
    public int clearMatching(Predicate<String> keyFilter) {
        int removed = 0;
        for (String key : entries.keySet()) {
            if (keyFilter.test(key) && entries.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    int size() {
        return entries.size();
    }

    @Override
    public void close() {
        expiryExecutor.shutdownNow();
    }

    private void scheduleExpiry(String key, long windowStart, long delayMs) {
        expiryExecutor.schedule(
                () -> entries.computeIfPresent(key, (k, current) -> current.windowStart() == windowStart ? null : current),
                Math.max(0, delayMs),
                TimeUnit.MILLISECONDS);
    }
}
