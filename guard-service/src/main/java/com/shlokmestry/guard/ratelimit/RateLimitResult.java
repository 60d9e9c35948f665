package com.shlokmestry.guard.ratelimit;

/**
 * @param limited           whether the request must be rejected
 * @param remaining         requests left in the current window
 * @param resetTime         end of the current window, epoch millis
 * @param retryAfterSeconds seconds to wait before retrying; 0 when not limited
 */
public record RateLimitResult(
        boolean limited,
        long remaining,
        long resetTime,
        long retryAfterSeconds
) {}
