package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.util.ReasonCodeClassifier;

public class ServerErrorException extends FetchException {
    public ServerErrorException(String url, int statusCode, String message) {
        super(url, statusCode, message, null);
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
        return ReasonCodeClassifier.HTTP_5XX;
    }
}
