package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.util.ReasonCodeClassifier;

public class TransientNetworkException extends FetchException {
    private final String reasonCode;

    public TransientNetworkException(String url, String reasonCode, String message, Throwable cause) {
        super(url, 0, message, cause);
        this.reasonCode = reasonCode == null ? ReasonCodeClassifier.NETWORK_ERROR : reasonCode;
    }

    @Override
    public boolean isRetriable() {
        return ReasonCodeClassifier.isRetryable(reasonCode);
    }

    @Override
    public boolean countsAsBreakerFailure() {
        return true;
    }

    @Override
    public String reasonCode() {
        return reasonCode;
    }
}
