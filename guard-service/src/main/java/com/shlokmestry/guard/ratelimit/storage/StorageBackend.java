package com.shlokmestry.guard.ratelimit.storage;

import com.shlokmestry.guard.config.ConfigurationException;
import com.shlokmestry.guard.config.DeploymentMode;
import com.shlokmestry.guard.config.RateLimitProps;

/**
 * Which counter store the service runs with, decided once at startup.
 */
public sealed interface StorageBackend permits StorageBackend.Remote, StorageBackend.Local {

    record Remote(RateLimitProps.Remote config) implements StorageBackend {}

    record Local() implements StorageBackend {}

    /**
     * Remote when url and token are both configured. Otherwise local, which production
     * refuses.
     *
     * @throws ConfigurationException in production without remote configuration
     */
    static StorageBackend resolve(RateLimitProps props, DeploymentMode mode) {
        RateLimitProps.Remote remote = props.remote();
        if (remote.isConfigured()) {
            return new Remote(remote);
        }
        if (mode.isProduction()) {
            throw new ConfigurationException(
                    "UPSTASH_REDIS_REST_URL and UPSTASH_REDIS_REST_TOKEN are required in production. "
                            + "In-memory rate limiting is not shared between instances.");
        }
        return new Local();
    }
}
