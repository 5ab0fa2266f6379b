package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.util.ReasonCodeClassifier;

/**
 * The caller's overall deadline elapsed. The interrupted attempt does not count against the circuit breaker.
 */
public class FetchTimeoutException extends FetchException {
    public FetchTimeoutException(String url, String message) {
        super(url, 0, message, null);
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
        return ReasonCodeClassifier.DEADLINE_EXCEEDED;
    }
}
