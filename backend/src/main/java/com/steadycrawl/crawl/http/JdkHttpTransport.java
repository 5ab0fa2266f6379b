package com.steadycrawl.crawl.http;

import com.steadycrawl.crawl.model.FetchRequest;
import com.steadycrawl.crawl.model.HttpFetchResult;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * {@link HttpTransport} on {@code java.net.http}. A client is kept per egress proxy since the JDK binds
 * the proxy selector to the client.
 */
public class JdkHttpTransport implements HttpTransport {
    private static final String DIRECT = "";

    private final Duration connectTimeout;
    private final ExecutorService executor;
    private final Map<String, HttpClient> clients = new ConcurrentHashMap<>();

    public JdkHttpTransport(Duration connectTimeout, ExecutorService executor) {
        this.connectTimeout = connectTimeout;
        this.executor = executor;
    }

    @Override
    public HttpFetchResult execute(FetchRequest request, String proxy, Duration timeout)
        throws IOException, InterruptedException {
        Instant startedAt = Instant.now();
        URI uri = URI.create(request.url());
        HttpRequest.BodyPublisher publisher = request.payload() == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(request.payload(), StandardCharsets.UTF_8);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .method(request.method(), publisher);
        request.headers().forEach(builder::header);

        HttpResponse<byte[]> response = clientFor(proxy).send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        byte[] responseBytes = response.body();
        String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
        return new HttpFetchResult(
            request.url(),
            response.uri(),
            response.statusCode(),
            responseBody,
            responseBytes,
            response.headers().map(),
            response.headers().firstValue("Content-Type").orElse(null),
            proxy,
            Instant.now(),
            Duration.between(startedAt, Instant.now())
        );
    }

    private HttpClient clientFor(String proxy) {
        String key = proxy == null ? DIRECT : proxy;
        return clients.computeIfAbsent(key, this::buildClient);
    }

    private HttpClient buildClient(String proxy) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(connectTimeout)
            .version(HttpClient.Version.HTTP_1_1);
        if (executor != null) {
            builder.executor(executor);
        }
        if (!DIRECT.equals(proxy)) {
            builder.proxy(ProxySelector.of(proxyAddress(proxy)));
        }
        return builder.build();
    }

    static InetSocketAddress proxyAddress(String proxy) {
        String value = proxy.trim();
        if (!value.contains("://")) {
            value = "http://" + value;
        }
        URI uri = URI.create(value);
        if (uri.getHost() == null || uri.getPort() < 0) {
            throw new IllegalArgumentException("Proxy must be host:port but was " + proxy);
        }
        return InetSocketAddress.createUnresolved(uri.getHost(), uri.getPort());
    }
}
