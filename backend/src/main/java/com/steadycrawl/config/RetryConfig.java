package com.steadycrawl.config;

import static com.steadycrawl.config.ConfigurationException.require;

import java.time.Duration;

public record RetryConfig(
    int maxRetries,
    Duration baseDelay,
    double backoffFactor,
    Duration maxDelay,
    boolean jitter
) {

    public RetryConfig {
        require(maxRetries >= 0, "maxRetries must be >= 0 but was " + maxRetries);
        require(baseDelay != null && !baseDelay.isNegative(), "baseDelay must be >= 0 but was " + baseDelay);
        require(backoffFactor >= 1.0 && Double.isFinite(backoffFactor),
            "backoffFactor must be >= 1 but was " + backoffFactor);
        require(maxDelay != null && maxDelay.compareTo(baseDelay) >= 0,
            "maxDelay must be >= baseDelay but was " + maxDelay);
    }

    public RetryConfig(int maxRetries, Duration baseDelay, double backoffFactor) {
        this(maxRetries, baseDelay, backoffFactor, defaultMaxDelay(baseDelay), false);
    }

    private static Duration defaultMaxDelay(Duration baseDelay) {
        Duration ceiling = Duration.ofSeconds(60);
        return baseDelay == null || baseDelay.compareTo(ceiling) <= 0 ? ceiling : baseDelay;
    }
}
