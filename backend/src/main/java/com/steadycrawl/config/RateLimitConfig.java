package com.steadycrawl.config;

import static com.steadycrawl.config.ConfigurationException.require;

/**
 * Throughput ceiling for one middleware instance.
 *
 * @param maxRequestsPerSecond long-run call rate, refilled continuously
 * @param maxConcurrent        calls allowed in flight at once
 * @param burstSize            token bucket capacity; 1 means evenly spaced dispatch
 */
public record RateLimitConfig(double maxRequestsPerSecond, int maxConcurrent, int burstSize) {

    public RateLimitConfig {
        require(maxRequestsPerSecond > 0 && Double.isFinite(maxRequestsPerSecond),
            "maxRequestsPerSecond must be > 0 but was " + maxRequestsPerSecond);
        require(maxConcurrent > 0, "maxConcurrent must be > 0 but was " + maxConcurrent);
        require(burstSize >= 1, "burstSize must be >= 1 but was " + burstSize);
    }

    public RateLimitConfig(double maxRequestsPerSecond, int maxConcurrent) {
        this(maxRequestsPerSecond, maxConcurrent, 1);
    }
}
