package com.steadycrawl.crawl.http;

import com.steadycrawl.config.ConfigurationException;
import com.steadycrawl.config.RateLimitConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Bounds in-flight calls with a fair semaphore and the long-run call rate with a token bucket.
 *
 * <p>Callers that find the bucket empty reserve the next token and sleep until it is due, so excess demand
 * queues up instead of being rejected. A reservation is only committed once the caller is sure to wait for
 * it, which keeps the bucket exact when a bounded {@link #tryAcquire(Duration)} gives up.
 */
public class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitConfig config;
    private final Semaphore permits;
    private final LongSupplier nanoClock;
    private final double nanosPerToken;

    private double storedTokens;
    private long lastRefillNanos;
    private long throttledCount;

    public RateLimiter(RateLimitConfig config) {
        this(config, System::nanoTime);
    }

    RateLimiter(RateLimitConfig config, LongSupplier nanoClock) {
        if (config == null) {
            throw new ConfigurationException("rate limit config is required");
        }
        this.config = config;
        this.permits = new Semaphore(config.maxConcurrent(), true);
        this.nanoClock = nanoClock;
        this.nanosPerToken = TimeUnit.SECONDS.toNanos(1) / config.maxRequestsPerSecond();
        this.storedTokens = config.burstSize();
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public void acquire() throws InterruptedException {
        permits.acquire();
        try {
            long waitNanos = reserve(Long.MAX_VALUE);
            sleepNanos(waitNanos);
        } catch (InterruptedException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    /**
     * Like {@link #acquire()} but gives up after {@code timeout}. On {@code false} nothing is held.
     */
    public boolean tryAcquire(Duration timeout) throws InterruptedException {
        long budgetNanos = Math.max(0L, timeout.toNanos());
        long startedAt = nanoClock.getAsLong();
        if (!permits.tryAcquire(budgetNanos, TimeUnit.NANOSECONDS)) {
            return false;
        }
        try {
            long remaining = budgetNanos - (nanoClock.getAsLong() - startedAt);
            long waitNanos = reserve(Math.max(0L, remaining));
            if (waitNanos < 0) {
                permits.release();
                return false;
            }
            sleepNanos(waitNanos);
            return true;
        } catch (InterruptedException | RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    public void release() {
        permits.release();
    }

    public int inFlight() {
        return config.maxConcurrent() - permits.availablePermits();
    }

    public synchronized long throttledCount() {
        return throttledCount;
    }

    /**
     * Takes one token, possibly in the future. Returns the nanos to wait for it, or -1 when that wait would
     * exceed {@code maxWaitNanos} (in which case nothing is taken).
     */
    private synchronized long reserve(long maxWaitNanos) {
        long now = nanoClock.getAsLong();
        refill(now);
        long waitNanos = storedTokens >= 1.0 ? 0L : (long) Math.ceil((1.0 - storedTokens) * nanosPerToken);
        if (waitNanos > maxWaitNanos) {
            return -1L;
        }
        storedTokens -= 1.0;
        if (waitNanos > 0) {
            throttledCount++;
            if (log.isDebugEnabled()) {
                log.debug("Rate limit reached, waiting {} ms", TimeUnit.NANOSECONDS.toMillis(waitNanos));
            }
        }
        return waitNanos;
    }

    private void refill(long now) {
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            storedTokens = Math.min(config.burstSize(), storedTokens + elapsed / nanosPerToken);
            lastRefillNanos = now;
        }
    }

    private static void sleepNanos(long nanos) throws InterruptedException {
        if (nanos > 0) {
            TimeUnit.NANOSECONDS.sleep(nanos);
        }
    }
}
