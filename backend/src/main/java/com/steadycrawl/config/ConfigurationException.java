package com.steadycrawl.config;

/**
 * Raised when a resilience setting is out of range. Always fatal at construction time.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }
}
