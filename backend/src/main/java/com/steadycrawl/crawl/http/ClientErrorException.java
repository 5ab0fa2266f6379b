package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.util.ReasonCodeClassifier;

/**
 * 4xx other than 429. The request itself is wrong, so retrying or tripping the breaker would not help.
 */
public class ClientErrorException extends FetchException {
    public ClientErrorException(String url, int statusCode, String message) {
        super(url, statusCode, message, null);
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
        return ReasonCodeClassifier.fromHttpStatus(statusCode());
    }
}
