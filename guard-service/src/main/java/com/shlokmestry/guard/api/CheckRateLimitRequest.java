package com.shlokmestry.guard.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CheckRateLimitRequest(
        @NotBlank String identifier,    // e.g., user id or client address
        @NotNull @Min(0) Integer limit,  // requests allowed per window
        @NotNull @Min(1) Long windowMs
) {}
