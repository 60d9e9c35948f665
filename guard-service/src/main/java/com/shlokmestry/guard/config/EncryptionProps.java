package com.shlokmestry.guard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param key       master key as 64 hex characters; validated on first cipher use
 * @param migration settings for the legacy token migration
 */
@ConfigurationProperties(prefix = "app.encryption")
public record EncryptionProps(
        String key,
        Migration migration
) {
    public EncryptionProps {
        if (migration == null) {
            migration = new Migration(false);
        }
    }

    public record Migration(boolean confirmed) {
    }
}
