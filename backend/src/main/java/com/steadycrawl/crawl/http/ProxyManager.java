package com.steadycrawl.crawl.http;

import com.steadycrawl.config.ProxyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Round-robin egress proxy pool. Failing proxies are excluded for the configured cooldown; when every proxy
 * is excluded the one excluded longest ago is handed out so the pool never starves.
 */
public class ProxyManager {
    private static final Logger log = LoggerFactory.getLogger(ProxyManager.class);

    private final ProxyConfig config;
    private final List<String> proxies;
    private final Clock clock;
    private final Map<String, Instant> excludedAt = new LinkedHashMap<>();
    private int cursor;

    public ProxyManager(ProxyConfig config) {
        this(config, Clock.systemUTC());
    }

    public ProxyManager(ProxyConfig config, Clock clock) {
        this.config = config == null ? ProxyConfig.disabled() : config;
        this.proxies = List.copyOf(this.config.proxies());
        this.clock = clock;
    }

    /**
     * @return the proxy to use for the next call, or empty for a direct connection
     */
    public synchronized Optional<String> nextProxy() {
        if (!config.enabled() || proxies.isEmpty()) {
            return Optional.empty();
        }
        expireExclusions();
        for (int i = 0; i < proxies.size(); i++) {
            String proxy = proxies.get(cursor);
            cursor = (cursor + 1) % proxies.size();
            if (!excludedAt.containsKey(proxy)) {
                return Optional.of(proxy);
            }
        }
        return Optional.of(oldestExcluded());
    }

    public synchronized void markFailed(String proxy) {
        if (proxy == null || !proxies.contains(proxy)) {
            return;
        }
        // re-insert so iteration order stays oldest-excluded-first
        excludedAt.remove(proxy);
        excludedAt.put(proxy, clock.instant());
        log.warn("Proxy {} excluded for {}s ({} of {} excluded)",
            proxy, config.cooldown().toSeconds(), excludedAt.size(), proxies.size());
    }

    public synchronized void markHealthy(String proxy) {
        if (proxy != null && excludedAt.remove(proxy) != null) {
            log.info("Proxy {} reinstated after a successful call", proxy);
        }
    }

    public synchronized boolean isExcluded(String proxy) {
        expireExclusions();
        return excludedAt.containsKey(proxy);
    }

    public synchronized int excludedCount() {
        expireExclusions();
        return excludedAt.size();
    }

    public boolean isEnabled() {
        return config.enabled() && !proxies.isEmpty();
    }

    private String oldestExcluded() {
        String proxy = excludedAt.keySet().iterator().next();
        log.debug("All proxies excluded, falling back to {}", proxy);
        return proxy;
    }

    private void expireExclusions() {
        if (excludedAt.isEmpty()) {
            return;
        }
        Instant threshold = clock.instant().minus(config.cooldown());
        excludedAt.entrySet().removeIf(entry -> {
            boolean expired = !entry.getValue().isAfter(threshold);
            if (expired) {
                log.info("Proxy {} cooldown expired, eligible again", entry.getKey());
            }
            return expired;
        });
    }
}
