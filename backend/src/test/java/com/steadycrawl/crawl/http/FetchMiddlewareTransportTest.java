package com.steadycrawl.crawl.http;

import com.steadycrawl.config.CircuitBreakerConfig;
import com.steadycrawl.config.ProxyConfig;
import com.steadycrawl.config.RateLimitConfig;
import com.steadycrawl.config.RetryConfig;
import com.steadycrawl.crawl.model.FetchRequest;
import com.steadycrawl.crawl.model.HttpFetchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchMiddlewareTransportTest {
    private static final String URL = "https://api.example.org/series?page=3";

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private static HttpFetchResult ok(FetchRequest request, String proxy) {
        byte[] body = "ok".getBytes(StandardCharsets.UTF_8);
        return new HttpFetchResult(request.url(), URI.create(request.url()), 200, "ok", body, Map.of(),
            "text/plain", proxy, Instant.now(), Duration.ZERO);
    }

    private static FetchMiddleware.Builder builder(HttpTransport transport) {
        return FetchMiddleware.builder()
            .rateLimit(new RateLimitConfig(100.0, 1, 10))
            .retry(new RetryConfig(1, Duration.ZERO, 1.0))
            .circuitBreaker(new CircuitBreakerConfig(3, Duration.ofSeconds(60), 1))
            .requestTimeout(Duration.ofSeconds(5))
            .transport(transport);
    }

    @Test
    void refusedProxyIsExcludedAndTheRetryUsesTheNextOne() {
        List<String> proxiesUsed = new CopyOnWriteArrayList<>();
        HttpTransport transport = (request, proxy, timeout) -> {
            proxiesUsed.add(proxy);
            if ("p1:8080".equals(proxy)) {
                throw new ConnectException("Connection refused");
            }
            return ok(request, proxy);
        };
        FetchMiddleware middleware = builder(transport)
            .proxy(new ProxyConfig(true, List.of("p1:8080", "p2:8080"), ProxyConfig.RotationStrategy.ROUND_ROBIN,
                Duration.ofMinutes(5)))
            .build();

        HttpFetchResult result = middleware.request(FetchRequest.get(URL));

        assertThat(result.proxy()).isEqualTo("p2:8080");
        assertThat(proxiesUsed).containsExactly("p1:8080", "p2:8080");
        assertThat(middleware.stats().proxyFailures()).isEqualTo(1);
        assertThat(middleware.stats().retriedRequests()).isEqualTo(1);

        middleware.request(FetchRequest.get(URL));
        assertThat(proxiesUsed).endsWith("p2:8080");
    }

    @Test
    void rotatesUserAgentsWhenCallerSetsNone() {
        List<String> agents = new CopyOnWriteArrayList<>();
        HttpTransport transport = (request, proxy, timeout) -> {
            agents.add(request.headers().get("User-Agent"));
            return ok(request, proxy);
        };
        FetchMiddleware middleware = builder(transport).userAgents(List.of("agent-a", "agent-b")).build();

        middleware.request(FetchRequest.get(URL));
        middleware.request(FetchRequest.get(URL));
        middleware.request(FetchRequest.get(URL));
        middleware.request(FetchRequest.get(URL).withHeader("User-Agent", "custom"));

        assertThat(agents).containsExactly("agent-a", "agent-b", "agent-a", "custom");
    }

    @Test
    void callerDeadlineDuringCallAbortsWithoutCountingAgainstBreaker() {
        HttpTransport transport = (request, proxy, timeout) -> {
            TimeUnit.MILLISECONDS.sleep(timeout.toMillis());
            throw new HttpTimeoutException("request timed out");
        };
        FetchMiddleware middleware = builder(transport).build();

        assertThatThrownBy(() -> middleware.request(FetchRequest.get(URL), Duration.ofMillis(100)))
            .isInstanceOf(FetchTimeoutException.class);

        assertThat(middleware.stats().abortedRequests()).isEqualTo(1);
        assertThat(middleware.stats().activeConcurrency()).isZero();
        assertThat(middleware.circuitState(URL)).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void queuedCallerTimesOutAndHoldsNothing() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch unblock = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        HttpTransport transport = (request, proxy, timeout) -> {
            calls.incrementAndGet();
            entered.countDown();
            unblock.await(5, TimeUnit.SECONDS);
            return ok(request, proxy);
        };
        FetchMiddleware middleware = builder(transport).build();
        executor = Executors.newSingleThreadExecutor();

        Future<HttpFetchResult> first = executor.submit(() -> middleware.request(FetchRequest.get(URL)));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> middleware.request(FetchRequest.get(URL), Duration.ofMillis(100)))
            .isInstanceOf(FetchTimeoutException.class);
        assertThat(calls.get()).isEqualTo(1);

        unblock.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).statusCode()).isEqualTo(200);
        assertThat(middleware.stats().activeConcurrency()).isZero();
        assertThat(middleware.request(FetchRequest.get(URL)).statusCode()).isEqualTo(200);
    }

    @Test
    void breakersAreKeptPerHost() {
        HttpTransport transport = (request, proxy, timeout) -> {
            if (request.url().contains("down.example.org")) {
                throw new ConnectException("Connection refused");
            }
            return ok(request, proxy);
        };
        FetchMiddleware middleware = builder(transport)
            .retry(new RetryConfig(0, Duration.ZERO, 1.0))
            .circuitBreaker(new CircuitBreakerConfig(1, Duration.ofSeconds(60), 1))
            .build();

        assertThatThrownBy(() -> middleware.request(FetchRequest.get("https://down.example.org/a")))
            .isInstanceOf(TransientNetworkException.class);

        assertThat(middleware.circuitState("https://down.example.org/b")).isEqualTo(CircuitState.OPEN);
        assertThat(middleware.request(FetchRequest.get(URL)).statusCode()).isEqualTo(200);
        assertThat(middleware.stats().circuitStates())
            .containsEntry("down.example.org", CircuitState.OPEN)
            .containsEntry("api.example.org", CircuitState.CLOSED);
    }
}
