package com.steadycrawl.crawl.http;

import com.steadycrawl.config.ProxyConfig;
import com.steadycrawl.crawl.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyManagerTest {
    private static final List<String> POOL = List.of("p1:8080", "p2:8080", "p3:8080");

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    private ProxyManager manager(List<String> proxies) {
        ProxyConfig config = new ProxyConfig(true, proxies, ProxyConfig.RotationStrategy.ROUND_ROBIN,
            Duration.ofMinutes(5));
        return new ProxyManager(config, clock);
    }

    @Test
    void roundRobinSpreadsCallsEvenly() {
        ProxyManager manager = manager(POOL);
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < 10; i++) {
            counts.merge(manager.nextProxy().orElseThrow(), 1, Integer::sum);
        }
        assertThat(counts).containsOnlyKeys(POOL);
        assertThat(counts.values()).allSatisfy(count -> assertThat(count).isBetween(3, 4));
    }

    @Test
    void failedProxyIsSkippedUntilCooldownExpires() {
        ProxyManager manager = manager(POOL);
        manager.markFailed("p2:8080");

        for (int i = 0; i < 6; i++) {
            assertThat(manager.nextProxy()).isPresent().get().isNotEqualTo("p2:8080");
        }

        clock.advance(Duration.ofMinutes(5));
        assertThat(manager.isExcluded("p2:8080")).isFalse();
        assertThat(List.of(
            manager.nextProxy().orElseThrow(),
            manager.nextProxy().orElseThrow(),
            manager.nextProxy().orElseThrow()
        )).containsExactlyInAnyOrderElementsOf(POOL);
    }

    @Test
    void oldestExcludedProxyIsUsedWhenAllAreExcluded() {
        ProxyManager manager = manager(List.of("a:1", "b:2"));
        manager.markFailed("b:2");
        clock.advance(Duration.ofSeconds(10));
        manager.markFailed("a:1");

        assertThat(manager.excludedCount()).isEqualTo(2);
        assertThat(manager.nextProxy()).contains("b:2");
    }

    @Test
    void successfulCallReinstatesProxy() {
        ProxyManager manager = manager(POOL);
        manager.markFailed("p1:8080");
        manager.markHealthy("p1:8080");
        assertThat(manager.isExcluded("p1:8080")).isFalse();
    }

    @Test
    void disabledPoolMeansDirectConnection() {
        ProxyManager manager = new ProxyManager(ProxyConfig.disabled(), clock);
        assertThat(manager.isEnabled()).isFalse();
        assertThat(manager.nextProxy()).isEmpty();
    }
}
