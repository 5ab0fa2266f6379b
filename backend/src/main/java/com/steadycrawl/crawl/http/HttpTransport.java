package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.model.FetchRequest;
import com.steadycrawl.crawl.model.HttpFetchResult;

import java.io.IOException;
import java.time.Duration;

/**
 * Performs exactly one network call. Any HTTP response, error statuses included, is returned as a result;
 * only failures to obtain a response are thrown.
 */
public interface HttpTransport {

    HttpFetchResult execute(FetchRequest request, String proxy, Duration timeout)
        throws IOException, InterruptedException;
}
