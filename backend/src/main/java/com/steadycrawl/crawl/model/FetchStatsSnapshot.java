package com.steadycrawl.crawl.model;

import com.steadycrawl.crawl.http.CircuitState;

import java.util.Map;

/**
 * Point-in-time copy of the middleware counters. {@code circuitState} is the worst state over all targets.
 */
public record FetchStatsSnapshot(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    long retriedRequests,
    long circuitOpenRejections,
    long rateLimitDelays,
    long proxyFailures,
    long abortedRequests,
    int activeConcurrency,
    CircuitState circuitState,
    Map<String, CircuitState> circuitStates
) {
    public FetchStatsSnapshot {
        circuitStates = circuitStates == null ? Map.of() : Map.copyOf(circuitStates);
    }
}
