package com.shlokmestry.guard.api;

import com.shlokmestry.guard.ratelimit.RateLimitResult;

public record CheckRateLimitResponse(
        boolean limited,
        long remaining,
        long resetTime,
        long retryAfterSeconds
) {
    static CheckRateLimitResponse from(RateLimitResult r) {
        return new CheckRateLimitResponse(r.limited(), r.remaining(), r.resetTime(), r.retryAfterSeconds());
    }
}
