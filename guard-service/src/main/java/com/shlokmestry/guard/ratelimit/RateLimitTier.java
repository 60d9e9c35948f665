package com.shlokmestry.guard.ratelimit;

import java.time.Duration;

public enum RateLimitTier {
    API(100, Duration.ofMinutes(1)),
    AI(10, Duration.ofMinutes(1)),
    DEPLOYMENT(5, Duration.ofHours(1));

    private final int limit;
    private final Duration window;

    RateLimitTier(int limit, Duration window) {
        this.limit = limit;
        this.window = window;
    }

    public int limit() {
        return limit;
    }

    public long windowMs() {
        return window.toMillis();
    }

    public static RateLimitTier forPath(String path) {
        if (path == null) {
            return API;
        }
        if (path.contains("/generate") || path.contains("/recommend-stack")) {
            return AI;
        }
        if (path.contains("/deploy")) {
            return DEPLOYMENT;
        }
        return API;
    }
}
