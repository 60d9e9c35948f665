package com.shlokmestry.guard.ratelimit.storage;

/**
 * Request count of one identifier in one window. {@code expiresAt = windowStart + windowMs}.
 */
public record RateLimitEntry(
        long count,
        long windowStart,
        long expiresAt
) {}
