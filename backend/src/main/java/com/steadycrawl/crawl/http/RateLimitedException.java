package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.util.ReasonCodeClassifier;

public class RateLimitedException extends FetchException {
    public RateLimitedException(String url, String message) {
        super(url, 429, message, null);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }

    @Override
    public boolean countsAsBreakerFailure() {
        return true;
    }

    @Override
    public String reasonCode() {
        return ReasonCodeClassifier.HTTP_429_RATE_LIMIT;
    }
}
