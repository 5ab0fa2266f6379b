package com.steadycrawl.crawl.http;

import com.steadycrawl.config.RetryConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff for transient failures: {@code delay(n) = baseDelay * backoffFactor^n}, n from 0,
 * capped at {@code maxDelay}.
 */
public class RetryPolicy {
    private final RetryConfig config;

    public RetryPolicy(RetryConfig config) {
        this.config = config;
    }

    public boolean shouldRetry(FetchException failure, int attempt) {
        return failure != null && failure.isRetriable() && attempt < config.maxRetries();
    }

    /**
     * Backoff before the retry that follows failed attempt {@code attempt}, without jitter.
     */
    public Duration delay(int attempt) {
        long baseMs = config.baseDelay().toMillis();
        long maxMs = config.maxDelay().toMillis();
        if (baseMs <= 0) {
            return Duration.ZERO;
        }
        double raw = baseMs * Math.pow(config.backoffFactor(), Math.max(0, attempt));
        long capped = raw >= maxMs ? maxMs : (long) raw;
        return Duration.ofMillis(capped);
    }

    /**
     * The delay actually slept: {@link #delay(int)} plus up to 10% jitter when enabled, still capped.
     */
    public Duration sleepDelay(int attempt) {
        Duration delay = delay(attempt);
        if (!config.jitter() || delay.isZero()) {
            return delay;
        }
        long jitterMs = ThreadLocalRandom.current().nextLong(Math.max(1L, delay.toMillis() / 10) + 1);
        long total = Math.min(config.maxDelay().toMillis(), delay.toMillis() + jitterMs);
        return Duration.ofMillis(total);
    }
}
