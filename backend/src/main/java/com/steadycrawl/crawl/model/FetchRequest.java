package com.steadycrawl.crawl.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public record FetchRequest(
    String method,
    String url,
    String payload,
    Map<String, String> headers
) {
    public FetchRequest {
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static FetchRequest get(String url) {
        return new FetchRequest("GET", url, null, Map.of());
    }

    public static FetchRequest postJson(String url, String jsonBody) {
        return new FetchRequest("POST", url, jsonBody == null ? "" : jsonBody, Map.of("Content-Type", "application/json"));
    }

    public boolean hasHeader(String name) {
        return headers.keySet().stream().anyMatch(key -> key.equalsIgnoreCase(name));
    }

    public FetchRequest withHeader(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return new FetchRequest(method, url, payload, merged);
    }
}
