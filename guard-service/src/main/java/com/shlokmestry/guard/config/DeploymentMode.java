package com.shlokmestry.guard.config;

import java.util.Locale;

public enum DeploymentMode {
    DEVELOPMENT,
    TEST,
    PRODUCTION;

    /**
     * Parses the value of {@code APP_ENV}. Unknown or empty values fall back to development;
     * {@code prod} is accepted as an alias for production.
     */
    public static DeploymentMode of(String value) {
        if (value == null || value.isBlank()) {
            return DEVELOPMENT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "prod", "production" -> PRODUCTION;
            case "test" -> TEST;
            default -> DEVELOPMENT;
        };
    }

    public boolean isProduction() {
        return this == PRODUCTION;
    }
}
