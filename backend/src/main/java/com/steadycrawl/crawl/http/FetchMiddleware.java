package com.steadycrawl.crawl.http;

import com.steadycrawl.config.CircuitBreakerConfig;
import com.steadycrawl.config.ConfigurationException;
import com.steadycrawl.config.ProxyConfig;
import com.steadycrawl.config.RateLimitConfig;
import com.steadycrawl.config.RetryConfig;
import com.steadycrawl.crawl.model.FetchRequest;
import com.steadycrawl.crawl.model.FetchStatsSnapshot;
import com.steadycrawl.crawl.model.HttpFetchResult;
import com.steadycrawl.crawl.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Wraps every outbound call in circuit breaker, rate limiter, proxy/user-agent rotation and inline retry.
 *
 * <p>One instance is shared by all crawl workers; its limiter, breakers, proxy pool and counters are the
 * shared state. Final failures are thrown as {@link FetchException}s. Recording them as deferred work is
 * left to the caller.
 */
public class FetchMiddleware {
    private static final Logger log = LoggerFactory.getLogger(FetchMiddleware.class);
    static final String GLOBAL_TARGET = "*";

    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerConfig breakerConfig;
    private final ProxyManager proxyManager;
    private final UserAgentRotator userAgents;
    private final HttpTransport transport;
    private final Duration requestTimeout;
    private final Executor asyncExecutor;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final FetchStats stats = new FetchStats();

    private FetchMiddleware(Builder builder) {
        this.rateLimiter = new RateLimiter(builder.rateLimit);
        this.retryPolicy = new RetryPolicy(builder.retry);
        this.breakerConfig = builder.circuitBreaker;
        this.proxyManager = new ProxyManager(builder.proxy, builder.clock);
        this.userAgents = new UserAgentRotator(builder.userAgents);
        this.transport = builder.transport;
        this.requestTimeout = builder.requestTimeout;
        this.asyncExecutor = builder.asyncExecutor;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public HttpFetchResult request(String method, String url, String payload, Map<String, String> headers) {
        return request(new FetchRequest(method, url, payload, headers));
    }

    public HttpFetchResult request(FetchRequest request) {
        return request(request, null);
    }

    /**
     * @param timeout overall deadline including queueing and backoff, or {@code null} for none
     */
    public HttpFetchResult request(FetchRequest request, Duration timeout) {
        URI uri = parseUri(request.url());
        String target = targetKey(uri);
        CircuitBreaker breaker = breakerFor(target);
        long deadlineNanos = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
        stats.recordRequest();

        int attempt = 0;
        while (true) {
            try {
                HttpFetchResult result = attemptOnce(request, breaker, deadlineNanos, timeout != null);
                stats.recordSuccess();
                if (attempt > 0) {
                    log.info("{} {} succeeded after {} retries", request.method(), request.url(), attempt);
                }
                return result;
            } catch (CircuitOpenException e) {
                stats.recordCircuitOpen();
                log.debug("{} {} rejected, circuit {} open until {}", request.method(), request.url(), target,
                    e.retryAfter());
                throw e;
            } catch (FetchTimeoutException e) {
                stats.recordAborted();
                throw e;
            } catch (FetchException e) {
                if (!retryPolicy.shouldRetry(e, attempt)) {
                    stats.recordFailure();
                    log.warn("{} {} failed after {} attempts: {} {}", request.method(), request.url(), attempt + 1,
                        e.reasonCode(), e.getMessage());
                    throw e;
                }
                Duration delay = retryPolicy.sleepDelay(attempt);
                if (remainingNanos(deadlineNanos) < delay.toNanos()) {
                    stats.recordAborted();
                    throw new FetchTimeoutException(request.url(),
                        "deadline reached before retry " + (attempt + 1) + " (last error " + e.reasonCode() + ")");
                }
                stats.recordRetry();
                log.info("{} {} attempt {} failed with {}, retrying in {} ms", request.method(), request.url(),
                    attempt + 1, e.reasonCode(), delay.toMillis());
                sleepBackoff(request, delay);
                attempt++;
            }
        }
    }

    /**
     * Non-blocking variant; the call runs on the middleware's executor and shares all limits with
     * {@link #request(FetchRequest)}.
     */
    public CompletableFuture<HttpFetchResult> requestAsync(FetchRequest request) {
        return requestAsync(request, null);
    }

    public CompletableFuture<HttpFetchResult> requestAsync(FetchRequest request, Duration timeout) {
        return CompletableFuture.supplyAsync(() -> request(request, timeout), asyncExecutor);
    }

    public FetchStatsSnapshot stats() {
        return stats.snapshot(rateLimiter.throttledCount(), rateLimiter.inFlight(), circuitStates());
    }

    public void resetStats() {
        stats.reset();
    }

    public CircuitState circuitState(String url) {
        CircuitBreaker breaker = breakers.get(targetKey(parseUri(url)));
        return breaker == null ? CircuitState.CLOSED : breaker.state();
    }

    public Map<String, CircuitState> circuitStates() {
        Map<String, CircuitState> states = new TreeMap<>();
        breakers.forEach((target, breaker) -> states.put(target, breaker.state()));
        return states;
    }

    private HttpFetchResult attemptOnce(
        FetchRequest request,
        CircuitBreaker breaker,
        long deadlineNanos,
        boolean hasDeadline
    ) {
        if (!breaker.tryAcquire()) {
            throw new CircuitOpenException(request.url(), breaker.name(), breaker.retryAfter());
        }
        boolean breakerSettled = false;
        boolean permitHeld = false;
        Optional<String> proxy = Optional.empty();
        try {
            if (hasDeadline) {
                if (!rateLimiter.tryAcquire(Duration.ofNanos(remainingNanos(deadlineNanos)))) {
                    throw new FetchTimeoutException(request.url(), "deadline reached while waiting for a rate limit slot");
                }
            } else {
                rateLimiter.acquire();
            }
            permitHeld = true;

            Duration callTimeout = requestTimeout;
            boolean boundByDeadline = false;
            if (hasDeadline) {
                long remaining = remainingNanos(deadlineNanos);
                if (remaining <= 0) {
                    throw new FetchTimeoutException(request.url(), "deadline reached before the call started");
                }
                if (remaining < requestTimeout.toNanos()) {
                    callTimeout = Duration.ofNanos(remaining);
                    boundByDeadline = true;
                }
            }

            proxy = proxyManager.nextProxy();
            FetchRequest prepared = request.hasHeader("User-Agent")
                ? request
                : request.withHeader("User-Agent", userAgents.next());

            HttpFetchResult result;
            try {
                result = transport.execute(prepared, proxy.orElse(null), callTimeout);
            } catch (HttpTimeoutException e) {
                if (boundByDeadline) {
                    throw new FetchTimeoutException(request.url(), "deadline reached during the call");
                }
                breakerSettled = true;
                throw networkFailure(request, breaker, proxy, e);
            } catch (IOException e) {
                breakerSettled = true;
                throw networkFailure(request, breaker, proxy, e);
            }

            FetchException failure = classify(result);
            breakerSettled = true;
            if (failure == null) {
                breaker.recordSuccess();
                proxy.ifPresent(proxyManager::markHealthy);
                return result;
            }
            if (result.statusCode() == 407 && proxy.isPresent()) {
                markProxyFailed(proxy.get());
            }
            if (failure.countsAsBreakerFailure()) {
                breaker.recordFailure();
            } else {
                // the target answered, so it is reachable
                breaker.recordSuccess();
            }
            throw failure;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchTimeoutException(request.url(), "request interrupted");
        } finally {
            if (!breakerSettled) {
                breaker.release();
            }
            if (permitHeld) {
                rateLimiter.release();
            }
        }
    }

    private TransientNetworkException networkFailure(
        FetchRequest request,
        CircuitBreaker breaker,
        Optional<String> proxy,
        IOException error
    ) {
        String reason = ReasonCodeClassifier.fromIoException(error);
        breaker.recordFailure();
        if (proxy.isPresent() && ReasonCodeClassifier.isProxyFailure(reason)) {
            markProxyFailed(proxy.get());
        }
        return new TransientNetworkException(request.url(), reason, reason + ": " + error.getMessage(), error);
    }

    private void markProxyFailed(String proxy) {
        stats.recordProxyFailure();
        proxyManager.markFailed(proxy);
    }

    static FetchException classify(HttpFetchResult result) {
        int status = result.statusCode();
        String url = result.requestedUrl();
        if (status == 429) {
            return new RateLimitedException(url, "HTTP 429 from " + url);
        }
        if (status >= 500) {
            return new ServerErrorException(url, status, "HTTP " + status + " from " + url);
        }
        if (status >= 400) {
            return new ClientErrorException(url, status, "HTTP " + status + " from " + url);
        }
        return null;
    }

    private void sleepBackoff(FetchRequest request, Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stats.recordAborted();
            throw new FetchTimeoutException(request.url(), "interrupted during retry backoff");
        }
    }

    private CircuitBreaker breakerFor(String target) {
        return breakers.computeIfAbsent(target, name -> new CircuitBreaker(name, breakerConfig, clock));
    }

    private String targetKey(URI uri) {
        if (!breakerConfig.perTarget()) {
            return GLOBAL_TARGET;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return uri.getPort() > 0 ? host + ":" + uri.getPort() : host;
    }

    private static long remainingNanos(long deadlineNanos) {
        if (deadlineNanos == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return deadlineNanos - System.nanoTime();
    }

    private static URI parseUri(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL is required");
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("URL missing host: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URL: " + url, e);
        }
    }

    public static class Builder {
        private RateLimitConfig rateLimit = new RateLimitConfig(4.0, 5);
        private RetryConfig retry = new RetryConfig(3, Duration.ofSeconds(1), 2.0);
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig(5, Duration.ofSeconds(60), 2);
        private ProxyConfig proxy = ProxyConfig.disabled();
        private List<String> userAgents = List.of();
        private HttpTransport transport;
        private Duration requestTimeout = Duration.ofSeconds(20);
        private Executor asyncExecutor = ForkJoinPool.commonPool();
        private Clock clock = Clock.systemUTC();

        public Builder rateLimit(RateLimitConfig rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder retry(RetryConfig retry) {
            this.retry = retry;
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerConfig circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        public Builder proxy(ProxyConfig proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder userAgents(List<String> userAgents) {
            this.userAgents = userAgents;
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder asyncExecutor(Executor asyncExecutor) {
            this.asyncExecutor = asyncExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public FetchMiddleware build() {
            if (rateLimit == null || retry == null || circuitBreaker == null) {
                throw new ConfigurationException(
                    "rate limit, retry and circuit breaker settings are required");
            }
            if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new ConfigurationException(
                    "requestTimeout must be > 0 but was " + requestTimeout);
            }
            if (transport == null) {
                transport = new JdkHttpTransport(requestTimeout, null);
            }
            return new FetchMiddleware(this);
        }
    }
}
