package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.util.ReasonCodeClassifier;

import java.time.Instant;

/**
 * Rejected before any network attempt. Callers should come back after {@link #retryAfter()}.
 */
public class CircuitOpenException extends FetchException {
    private final String target;
    private final Instant retryAfter;

    public CircuitOpenException(String url, String target, Instant retryAfter) {
        super(url, 0, "circuit_open target=" + target + " retry_after=" + retryAfter, null);
        this.target = target;
        this.retryAfter = retryAfter;
    }

    public String target() {
        return target;
    }

    public Instant retryAfter() {
        return retryAfter;
    }

    @Override
    public boolean isRetriable() {
        return false;
    }

    @Override
    public boolean countsAsBreakerFailure() {
        return false;
    }

    @Override
    public String reasonCode() {
        return ReasonCodeClassifier.CIRCUIT_OPEN;
    }
}
