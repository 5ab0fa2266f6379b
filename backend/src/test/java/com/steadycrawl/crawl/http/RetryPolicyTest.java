package com.steadycrawl.crawl.http;

import com.steadycrawl.config.RetryConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {
    private static final String URL = "https://example.org/list?page=1";

    @Test
    void delayGrowsExponentiallyAndIsCapped() {
        RetryPolicy policy = new RetryPolicy(new RetryConfig(5, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), false));

        assertThat(policy.delay(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delay(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delay(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delay(3)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.delay(30)).isEqualTo(Duration.ofSeconds(5));

        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 12; attempt++) {
            Duration current = policy.delay(attempt);
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    void onlyTransientFailuresAreRetriedWithinBudget() {
        RetryPolicy policy = new RetryPolicy(new RetryConfig(2, Duration.ofMillis(10), 2.0));

        assertThat(policy.shouldRetry(new ServerErrorException(URL, 503, "HTTP 503"), 0)).isTrue();
        assertThat(policy.shouldRetry(new RateLimitedException(URL, "HTTP 429"), 1)).isTrue();
        assertThat(policy.shouldRetry(new RateLimitedException(URL, "HTTP 429"), 2)).isFalse();
        assertThat(policy.shouldRetry(new ClientErrorException(URL, 404, "HTTP 404"), 0)).isFalse();
        assertThat(policy.shouldRetry(new CircuitOpenException(URL, "example.org", null), 0)).isFalse();
    }

    @Test
    void jitterStaysWithinTenPercentAndTheCap() {
        RetryPolicy policy = new RetryPolicy(new RetryConfig(5, Duration.ofMillis(1000), 2.0, Duration.ofMillis(3000), true));

        for (int i = 0; i < 50; i++) {
            assertThat(policy.sleepDelay(0).toMillis()).isBetween(1000L, 1101L);
            assertThat(policy.sleepDelay(4).toMillis()).isEqualTo(3000L);
        }
    }
}
