package com.steadycrawl.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.steadycrawl.crawl.http.FetchMiddleware;
import com.steadycrawl.crawl.http.HttpTransport;
import com.steadycrawl.crawl.http.JdkHttpTransport;
import com.steadycrawl.crawl.persistence.CheckpointStore;
import com.steadycrawl.crawl.persistence.CollectionStateStore;
import com.steadycrawl.crawl.persistence.FailedTaskQueue;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getRateLimit().getMaxConcurrent() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "fetchExecutor", destroyMethod = "shutdown")
    public ExecutorService fetchExecutor(CrawlerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(4, properties.getRateLimit().getMaxConcurrent() * 4));
    }

    @Bean
    public Clock crawlClock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpTransport httpTransport(
        CrawlerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        return new JdkHttpTransport(Duration.ofSeconds(properties.getRequestTimeoutSeconds()), httpExecutor);
    }

    @Bean
    public FetchMiddleware fetchMiddleware(
        CrawlerProperties properties,
        HttpTransport httpTransport,
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        Clock crawlClock
    ) {
        return FetchMiddleware.builder()
            .rateLimit(properties.getRateLimit().toConfig())
            .retry(properties.getRetry().toConfig())
            .circuitBreaker(properties.getCircuitBreaker().toConfig())
            .proxy(properties.getProxy().toConfig())
            .userAgents(properties.getUserAgents())
            .transport(httpTransport)
            .requestTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .asyncExecutor(fetchExecutor)
            .clock(crawlClock)
            .build();
    }

    @Bean
    public CheckpointStore checkpointStore(CrawlerProperties properties, ObjectMapper objectMapper, Clock crawlClock) {
        return new CheckpointStore(
            Path.of(properties.getStateDir()),
            objectMapper,
            Duration.ofHours(properties.getCheckpoint().getResumePointTtlHours()),
            crawlClock
        );
    }

    @Bean
    public FailedTaskQueue failedTaskQueue(CrawlerProperties properties, ObjectMapper objectMapper, Clock crawlClock) {
        return new FailedTaskQueue(
            Path.of(properties.getStateDir()),
            objectMapper,
            properties.getFailedTasks().toConfig(),
            crawlClock
        );
    }

    @Bean
    public CollectionStateStore collectionStateStore(
        CrawlerProperties properties,
        ObjectMapper objectMapper,
        Clock crawlClock
    ) {
        return new CollectionStateStore(Path.of(properties.getStateDir()), objectMapper, crawlClock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
