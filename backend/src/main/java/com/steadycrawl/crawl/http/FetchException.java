package com.steadycrawl.crawl.http;

/**
 * Base of every failure surfaced by {@link FetchMiddleware}. Subclasses decide whether a retry may help
 * and whether the failure counts against the target's circuit breaker.
 */
public abstract class FetchException extends RuntimeException {
    private final String url;
    private final int statusCode;

    protected FetchException(String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public String url() {
        return url;
    }

    /**
     * HTTP status of the failed response, or 0 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }

    public abstract boolean isRetriable();

    public abstract boolean countsAsBreakerFailure();

    /**
     * Short stable code used in logs and in the failed-task queue.
     */
    public abstract String reasonCode();
}
