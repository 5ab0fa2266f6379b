package com.steadycrawl.config;

import static com.steadycrawl.config.ConfigurationException.require;

import java.time.Duration;

/**
 * @param halfOpenMaxCalls trial calls admitted per HALF_OPEN episode, never fewer than successThreshold
 * @param perTarget        one breaker per host when true, a single shared breaker otherwise
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration recoveryTimeout,
    int successThreshold,
    int halfOpenMaxCalls,
    boolean perTarget
) {

    public CircuitBreakerConfig {
        require(failureThreshold > 0, "failureThreshold must be > 0 but was " + failureThreshold);
        require(recoveryTimeout != null && !recoveryTimeout.isNegative() && !recoveryTimeout.isZero(),
            "recoveryTimeout must be > 0 but was " + recoveryTimeout);
        require(successThreshold > 0, "successThreshold must be > 0 but was " + successThreshold);
        require(halfOpenMaxCalls >= successThreshold,
            "halfOpenMaxCalls must be >= successThreshold (" + successThreshold + ") but was " + halfOpenMaxCalls);
    }

    public CircuitBreakerConfig(int failureThreshold, Duration recoveryTimeout, int successThreshold) {
        this(failureThreshold, recoveryTimeout, successThreshold, successThreshold, true);
    }
}
