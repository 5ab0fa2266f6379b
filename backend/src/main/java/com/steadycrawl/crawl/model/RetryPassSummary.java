package com.steadycrawl.crawl.model;

import java.time.Instant;

/**
 * Outcome of one retry scheduler pass over the due tasks.
 */
public record RetryPassSummary(
    Instant startedAt,
    Instant finishedAt,
    int dispatched,
    int resolved,
    int rescheduled,
    int exhausted,
    int skippedCircuitOpen
) {
    public static RetryPassSummary empty(Instant at) {
        return new RetryPassSummary(at, at, 0, 0, 0, 0, 0);
    }
}
