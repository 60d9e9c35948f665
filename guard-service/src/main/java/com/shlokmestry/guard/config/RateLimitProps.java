package com.shlokmestry.guard.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.ratelimit")
public record RateLimitProps(
        Remote remote,
        FailurePolicy failurePolicy,
        Duration failClosedRetryAfter,
        List<String> excludedPaths
) {
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);
    private static final Duration DEFAULT_FAIL_CLOSED_RETRY_AFTER = Duration.ofSeconds(60);
    private static final List<String> DEFAULT_EXCLUDED_PATHS =
            List.of("/_next", "/static", "/api/health", "/api/auth", "/actuator");

    public RateLimitProps {
        if (remote == null) {
            remote = new Remote(null, null, null);
        }
        if (failurePolicy == null) {
            failurePolicy = FailurePolicy.AUTO;
        }
        if (failClosedRetryAfter == null || failClosedRetryAfter.isNegative() || failClosedRetryAfter.isZero()) {
            failClosedRetryAfter = DEFAULT_FAIL_CLOSED_RETRY_AFTER;
        }
        excludedPaths = excludedPaths == null ? DEFAULT_EXCLUDED_PATHS : List.copyOf(excludedPaths);
    }

    /**
     * Connection settings of the HTTP key-value service. Both url and token must be set
     * for the remote backend to be selected.
     */
    public record Remote(String url, String token, Duration timeout) {
        public Remote {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                timeout = DEFAULT_TIMEOUT;
            }
        }

        public boolean isConfigured() {
            return url != null && !url.isBlank() && token != null && !token.isBlank();
        }

        /** The url without trailing slashes. */
        public String normalizedUrl() {
            if (url == null) {
                return null;
            }
            String trimmed = url.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            return trimmed;
        }
    }
}
