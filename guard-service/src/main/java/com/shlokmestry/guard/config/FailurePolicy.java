package com.shlokmestry.guard.config;

/**
 * What the rate limiter answers when its counter store fails.
 */
public enum FailurePolicy {
    /** Closed in production, open everywhere else. */
    AUTO,
    FAIL_OPEN,
    FAIL_CLOSED;

    public boolean failsClosed(DeploymentMode mode) {
        return switch (this) {
            case FAIL_CLOSED -> true;
            case FAIL_OPEN -> false;
            case AUTO -> mode.isProduction();
        };
    }
}
