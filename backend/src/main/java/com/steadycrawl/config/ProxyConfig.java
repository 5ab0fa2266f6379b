package com.steadycrawl.config;

import static com.steadycrawl.config.ConfigurationException.require;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

public record ProxyConfig(
    boolean enabled,
    List<String> proxies,
    RotationStrategy rotationStrategy,
    Duration cooldown
) {

    public enum RotationStrategy {
        ROUND_ROBIN;

        public static RotationStrategy parse(String value) {
            if (value == null || value.isBlank()) {
                return ROUND_ROBIN;
            }
            String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            try {
                return RotationStrategy.valueOf(normalized);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unsupported proxy rotation strategy: " + value);
            }
        }
    }

    public ProxyConfig {
        proxies = proxies == null ? List.of() : proxies.stream()
            .filter(p -> p != null && !p.isBlank())
            .map(String::trim)
            .distinct()
            .toList();
        rotationStrategy = rotationStrategy == null ? RotationStrategy.ROUND_ROBIN : rotationStrategy;
        require(cooldown != null && !cooldown.isNegative() && !cooldown.isZero(),
            "proxy cooldown must be > 0 but was " + cooldown);
        require(!enabled || !proxies.isEmpty(), "proxy rotation is enabled but no proxies are configured");
    }

    public static ProxyConfig disabled() {
        return new ProxyConfig(false, List.of(), RotationStrategy.ROUND_ROBIN, Duration.ofMinutes(5));
    }
}
