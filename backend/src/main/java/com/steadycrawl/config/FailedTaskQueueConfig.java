package com.steadycrawl.config;

import static com.steadycrawl.config.ConfigurationException.require;

import java.time.Duration;

/**
 * Scheduling of deferred work items. A task is exhausted once its attempt count exceeds {@code attemptCap}.
 */
public record FailedTaskQueueConfig(
    Duration baseDelay,
    double backoffFactor,
    Duration maxDelay,
    int attemptCap
) {

    public FailedTaskQueueConfig {
        require(baseDelay != null && !baseDelay.isNegative(), "failed task baseDelay must be >= 0 but was " + baseDelay);
        require(backoffFactor >= 1.0 && Double.isFinite(backoffFactor),
            "failed task backoffFactor must be >= 1 but was " + backoffFactor);
        require(maxDelay != null && maxDelay.compareTo(baseDelay) >= 0,
            "failed task maxDelay must be >= baseDelay but was " + maxDelay);
        require(attemptCap >= 0, "attemptCap must be >= 0 but was " + attemptCap);
    }
}
