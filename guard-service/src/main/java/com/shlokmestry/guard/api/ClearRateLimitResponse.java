package com.shlokmestry.guard.api;

public record ClearRateLimitResponse(
        String identifier,
        String storage,
        int removedEntries
) {}
