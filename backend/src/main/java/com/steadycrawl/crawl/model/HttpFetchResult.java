package com.steadycrawl.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    byte[] bodyBytes,
    Map<String, List<String>> headers,
    String contentType,
    String proxy,
    Instant fetchedAt,
    Duration duration
) {
    public HttpFetchResult {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
