package com.steadycrawl.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "steadycrawl/0.1 (+contact)";

    private String userAgent;
    private List<String> userAgents = new ArrayList<>();
    private int requestTimeoutSeconds = 20;
    private String stateDir = "data/state";
    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Proxy proxy = new Proxy();
    private Checkpoint checkpoint = new Checkpoint();
    private FailedTasks failedTasks = new FailedTasks();
    private Scheduler scheduler = new Scheduler();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    /**
     * Agents rotated round-robin over outgoing requests. Falls back to the single configured user agent.
     */
    public List<String> getUserAgents() {
        List<String> cleaned = userAgents == null ? List.of() : userAgents.stream()
            .filter(agent -> agent != null && !agent.isBlank())
            .map(String::trim)
            .toList();
        return cleaned.isEmpty() ? List.of(getUserAgent()) : cleaned;
    }

    public void setUserAgents(List<String> userAgents) {
        this.userAgents = userAgents == null ? new ArrayList<>() : new ArrayList<>(userAgents);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public String getStateDir() {
        return stateDir;
    }

    public void setStateDir(String stateDir) {
        this.stateDir = stateDir;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimit rateLimit) {
        this.rateLimit = rateLimit;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public Proxy getProxy() {
        return proxy;
    }

    public void setProxy(Proxy proxy) {
        this.proxy = proxy;
    }

    public Checkpoint getCheckpoint() {
        return checkpoint;
    }

    public void setCheckpoint(Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }

    public FailedTasks getFailedTasks() {
        return failedTasks;
    }

    public void setFailedTasks(FailedTasks failedTasks) {
        this.failedTasks = failedTasks;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class RateLimit {
        private double maxRequestsPerSecond = 4.0;
        private int maxConcurrent = 5;
        private int burstSize = 1;

        public double getMaxRequestsPerSecond() {
            return maxRequestsPerSecond;
        }

        public void setMaxRequestsPerSecond(double maxRequestsPerSecond) {
            this.maxRequestsPerSecond = maxRequestsPerSecond;
        }

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public int getBurstSize() {
            return burstSize;
        }

        public void setBurstSize(int burstSize) {
            this.burstSize = burstSize;
        }

        public RateLimitConfig toConfig() {
            return new RateLimitConfig(maxRequestsPerSecond, maxConcurrent, burstSize);
        }
    }

    public static class Retry {
        private int maxRetries = 3;
        private long baseDelayMs = 1000;
        private double backoffFactor = 2.0;
        private long maxDelayMs = 60_000;
        private boolean jitter = false;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public boolean isJitter() {
            return jitter;
        }

        public void setJitter(boolean jitter) {
            this.jitter = jitter;
        }

        public RetryConfig toConfig() {
            return new RetryConfig(
                maxRetries,
                Duration.ofMillis(baseDelayMs),
                backoffFactor,
                Duration.ofMillis(maxDelayMs),
                jitter
            );
        }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private int recoveryTimeoutSeconds = 60;
        private int successThreshold = 2;
        private int halfOpenMaxCalls = 0;
        private boolean perTarget = true;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public int getRecoveryTimeoutSeconds() {
            return recoveryTimeoutSeconds;
        }

        public void setRecoveryTimeoutSeconds(int recoveryTimeoutSeconds) {
            this.recoveryTimeoutSeconds = recoveryTimeoutSeconds;
        }

        public int getSuccessThreshold() {
            return successThreshold;
        }

        public void setSuccessThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
        }

        /**
         * 0 means "same as successThreshold".
         */
        public int getHalfOpenMaxCalls() {
            return halfOpenMaxCalls;
        }

        public void setHalfOpenMaxCalls(int halfOpenMaxCalls) {
            this.halfOpenMaxCalls = halfOpenMaxCalls;
        }

        public boolean isPerTarget() {
            return perTarget;
        }

        public void setPerTarget(boolean perTarget) {
            this.perTarget = perTarget;
        }

        public CircuitBreakerConfig toConfig() {
            return new CircuitBreakerConfig(
                failureThreshold,
                Duration.ofSeconds(recoveryTimeoutSeconds),
                successThreshold,
                halfOpenMaxCalls <= 0 ? successThreshold : halfOpenMaxCalls,
                perTarget
            );
        }
    }

    public static class Proxy {
        private boolean enabled = false;
        private List<String> proxies = new ArrayList<>();
        private String rotationStrategy = "round-robin";
        private int cooldownSeconds = 300;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getProxies() {
            return proxies;
        }

        public void setProxies(List<String> proxies) {
            this.proxies = proxies == null ? new ArrayList<>() : new ArrayList<>(proxies);
        }

        public String getRotationStrategy() {
            return rotationStrategy;
        }

        public void setRotationStrategy(String rotationStrategy) {
            this.rotationStrategy = rotationStrategy;
        }

        public int getCooldownSeconds() {
            return cooldownSeconds;
        }

        public void setCooldownSeconds(int cooldownSeconds) {
            this.cooldownSeconds = cooldownSeconds;
        }

        public ProxyConfig toConfig() {
            return new ProxyConfig(
                enabled,
                proxies,
                ProxyConfig.RotationStrategy.parse(rotationStrategy),
                Duration.ofSeconds(cooldownSeconds)
            );
        }
    }

    public static class Checkpoint {
        private int resumePointTtlHours = 168;

        public int getResumePointTtlHours() {
            return Math.max(1, resumePointTtlHours);
        }

        public void setResumePointTtlHours(int resumePointTtlHours) {
            this.resumePointTtlHours = Math.max(1, resumePointTtlHours);
        }
    }

    public static class FailedTasks {
        private int baseDelaySeconds = 300;
        private double backoffFactor = 2.0;
        private int maxDelaySeconds = 3600;
        private int attemptCap = 3;

        public int getBaseDelaySeconds() {
            return baseDelaySeconds;
        }

        public void setBaseDelaySeconds(int baseDelaySeconds) {
            this.baseDelaySeconds = baseDelaySeconds;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }

        public int getMaxDelaySeconds() {
            return maxDelaySeconds;
        }

        public void setMaxDelaySeconds(int maxDelaySeconds) {
            this.maxDelaySeconds = maxDelaySeconds;
        }

        public int getAttemptCap() {
            return attemptCap;
        }

        public void setAttemptCap(int attemptCap) {
            this.attemptCap = attemptCap;
        }

        public FailedTaskQueueConfig toConfig() {
            return new FailedTaskQueueConfig(
                Duration.ofSeconds(baseDelaySeconds),
                backoffFactor,
                Duration.ofSeconds(maxDelaySeconds),
                attemptCap
            );
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int checkIntervalSeconds = 30;
        private int maxWorkers = 5;
        private int stopTimeoutSeconds = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCheckIntervalSeconds() {
            return Math.max(1, checkIntervalSeconds);
        }

        public void setCheckIntervalSeconds(int checkIntervalSeconds) {
            this.checkIntervalSeconds = Math.max(1, checkIntervalSeconds);
        }

        public int getMaxWorkers() {
            return Math.max(1, maxWorkers);
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = Math.max(1, maxWorkers);
        }

        public int getStopTimeoutSeconds() {
            return Math.max(1, stopTimeoutSeconds);
        }

        public void setStopTimeoutSeconds(int stopTimeoutSeconds) {
            this.stopTimeoutSeconds = Math.max(1, stopTimeoutSeconds);
        }
    }
}
