package com.steadycrawl.crawl.service;

import com.steadycrawl.crawl.http.CircuitOpenException;
import com.steadycrawl.crawl.http.FetchException;
import com.steadycrawl.crawl.http.FetchMiddleware;
import com.steadycrawl.crawl.model.CollectionState;
import com.steadycrawl.crawl.model.FailedTask;
import com.steadycrawl.crawl.model.FetchRequest;
import com.steadycrawl.crawl.model.FetchStatsSnapshot;
import com.steadycrawl.crawl.model.HttpFetchResult;
import com.steadycrawl.crawl.model.ResumePoint;
import com.steadycrawl.crawl.model.RetryPassSummary;
import com.steadycrawl.crawl.model.RetrySchedulerStatus;
import com.steadycrawl.crawl.persistence.CheckpointStore;
import com.steadycrawl.crawl.persistence.CollectionStateStore;
import com.steadycrawl.crawl.persistence.FailedTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What a crawl loop talks to: fetch through the middleware, checkpoint progress, defer failures.
 */
@Service
public class CrawlResilienceService {
    private static final Logger log = LoggerFactory.getLogger(CrawlResilienceService.class);

    private final FetchMiddleware fetchMiddleware;
    private final CheckpointStore checkpointStore;
    private final FailedTaskQueue failedTaskQueue;
    private final CollectionStateStore collectionStateStore;
    private final RetryScheduler retryScheduler;

    public CrawlResilienceService(
        FetchMiddleware fetchMiddleware,
        CheckpointStore checkpointStore,
        FailedTaskQueue failedTaskQueue,
        CollectionStateStore collectionStateStore,
        RetryScheduler retryScheduler
    ) {
        this.fetchMiddleware = fetchMiddleware;
        this.checkpointStore = checkpointStore;
        this.failedTaskQueue = failedTaskQueue;
        this.collectionStateStore = collectionStateStore;
        this.retryScheduler = retryScheduler;
    }

    public HttpFetchResult request(String method, String url, String payload, Map<String, String> headers) {
        return fetchMiddleware.request(method, url, payload, headers);
    }

    /**
     * Fetches and, if the fetch fails for good with a retriable error or an open circuit, queues the work
     * item for a later retry instead of throwing. The queued task keeps the method, payload and headers so the
     * default retry handler can replay the same request. Client errors and deadline aborts are rethrown.
     *
     * @return the response, or empty when the item was deferred
     */
    public Optional<HttpFetchResult> fetchOrDefer(String taskType, FetchRequest request) {
        try {
            return Optional.of(fetchMiddleware.request(request));
        } catch (FetchException e) {
            if (!e.isRetriable() && !(e instanceof CircuitOpenException)) {
                throw e;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(RetryScheduler.METHOD_KEY, request.method());
            if (request.payload() != null) {
                metadata.put(RetryScheduler.PAYLOAD_KEY, request.payload());
            }
            if (!request.headers().isEmpty()) {
                metadata.put(RetryScheduler.HEADERS_KEY, new LinkedHashMap<>(request.headers()));
            }
            metadata.put("reasonCode", e.reasonCode());
            if (e.statusCode() > 0) {
                metadata.put("statusCode", e.statusCode());
            }
            FailedTask task = failedTaskQueue.add(taskType, request.url(), e.getMessage(), metadata);
            log.info("Deferred {} {} as {}", request.method(), request.url(), task.taskId());
            return Optional.empty();
        }
    }

    public FetchStatsSnapshot stats() {
        return fetchMiddleware.stats();
    }

    public ResumePoint saveCheckpoint(String taskType, int currentPage, long totalProcessed, Map<String, Object> metadata) {
        return checkpointStore.save(taskType, currentPage, totalProcessed, metadata);
    }

    public ResumePoint saveCheckpoint(
        String taskType,
        int currentPage,
        String lastCursor,
        String lastSlug,
        long totalProcessed,
        Map<String, Object> metadata
    ) {
        return checkpointStore.save(taskType, currentPage, lastCursor, lastSlug, totalProcessed, metadata);
    }

    public Optional<ResumePoint> loadCheckpoint(String taskType) {
        return checkpointStore.load(taskType);
    }

    public Map<String, ResumePoint> checkpoints() {
        return checkpointStore.loadAll();
    }

    public void clearCheckpoint(String taskType) {
        if (!checkpointStore.clear(taskType)) {
            throw new UnknownTaskException("No resume point for task type " + taskType);
        }
    }

    public String addFailedTask(String taskType, String target, String errorMessage) {
        return failedTaskQueue.add(taskType, target, errorMessage).taskId();
    }

    public String addFailedTask(String taskType, String target, String errorMessage, Map<String, Object> metadata) {
        return failedTaskQueue.add(taskType, target, errorMessage, metadata).taskId();
    }

    public List<FailedTask> dueTasks() {
        return failedTaskQueue.dueTasks();
    }

    public List<FailedTask> failedTasks() {
        return failedTaskQueue.allTasks();
    }

    public FailedTask requeueFailedTask(String taskId) {
        return failedTaskQueue.requeue(taskId)
            .orElseThrow(() -> new UnknownTaskException("Unknown failed task " + taskId));
    }

    public void registerRetryHandler(String taskType, RetryHandler handler) {
        retryScheduler.registerHandler(taskType, handler);
    }

    public RetrySchedulerStatus startRetryScheduler() {
        retryScheduler.start();
        return retryScheduler.status();
    }

    public RetrySchedulerStatus stopRetryScheduler() {
        retryScheduler.stop();
        return retryScheduler.status();
    }

    public RetrySchedulerStatus retrySchedulerStatus() {
        return retryScheduler.status();
    }

    public RetryPassSummary runRetryPass() {
        return retryScheduler.runOnce();
    }

    public CollectionState startRun(String taskType) {
        return collectionStateStore.startRun(taskType);
    }

    public List<CollectionState> runs() {
        return collectionStateStore.all();
    }
}
