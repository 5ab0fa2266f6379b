package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.model.FetchStatsSnapshot;

import java.util.Map;

/**
 * Mutable counters owned by one {@link FetchMiddleware}; read through {@link #snapshot}.
 */
class FetchStats {
    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long retriedRequests;
    private long circuitOpenRejections;
    private long proxyFailures;
    private long abortedRequests;

    synchronized void recordRequest() {
        totalRequests++;
    }

    synchronized void recordSuccess() {
        successfulRequests++;
    }

    synchronized void recordFailure() {
        failedRequests++;
    }

    synchronized void recordRetry() {
        retriedRequests++;
    }

    synchronized void recordCircuitOpen() {
        circuitOpenRejections++;
    }

    synchronized void recordProxyFailure() {
        proxyFailures++;
    }

    synchronized void recordAborted() {
        abortedRequests++;
    }

    synchronized void reset() {
        totalRequests = 0;
        successfulRequests = 0;
        failedRequests = 0;
        retriedRequests = 0;
        circuitOpenRejections = 0;
        proxyFailures = 0;
        abortedRequests = 0;
    }

    synchronized FetchStatsSnapshot snapshot(
        long rateLimitDelays,
        int activeConcurrency,
        Map<String, CircuitState> circuitStates
    ) {
        return new FetchStatsSnapshot(
            totalRequests,
            successfulRequests,
            failedRequests,
            retriedRequests,
            circuitOpenRejections,
            rateLimitDelays,
            proxyFailures,
            abortedRequests,
            activeConcurrency,
            worstOf(circuitStates),
            circuitStates
        );
    }

    private static CircuitState worstOf(Map<String, CircuitState> states) {
        CircuitState worst = CircuitState.CLOSED;
        for (CircuitState state : states.values()) {
            if (state == CircuitState.OPEN) {
                return CircuitState.OPEN;
            }
            if (state == CircuitState.HALF_OPEN) {
                worst = CircuitState.HALF_OPEN;
            }
        }
        return worst;
    }
}
