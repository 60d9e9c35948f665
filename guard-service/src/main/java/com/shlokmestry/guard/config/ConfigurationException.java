package com.shlokmestry.guard.config;

/**
 * Fatal misconfiguration: a missing or malformed master key, or production mode
 * started without a shared counter store. Never recovered locally.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
