package com.steadycrawl.crawl.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.steadycrawl.config.FailedTaskQueueConfig;
import com.steadycrawl.crawl.model.FailedTask;
import com.steadycrawl.crawl.model.FailedTaskStatus;
import com.steadycrawl.crawl.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable queue of work items whose fetch failed for good, re-offered on an exponential schedule until they
 * succeed or run out of attempts. Backed by {@code failed_tasks.json}.
 *
 * <p>Resolved tasks are dropped from the file; exhausted ones stay for operators.
 */
public class FailedTaskQueue {
    private static final Logger log = LoggerFactory.getLogger(FailedTaskQueue.class);
    public static final String FILE_NAME = "failed_tasks.json";
    private static final TypeReference<List<FailedTask>> FILE_TYPE = new TypeReference<>() {
    };
    private static final Comparator<FailedTask> BY_NEXT_RETRY = Comparator
        .comparing(FailedTask::nextRetryAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(FailedTask::createdAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final AtomicJsonFile file;
    private final FailedTaskQueueConfig config;
    private final Clock clock;
    private Map<String, FailedTask> tasks;

    public FailedTaskQueue(Path stateDir, ObjectMapper objectMapper, FailedTaskQueueConfig config, Clock clock) {
        this.file = new AtomicJsonFile(stateDir.resolve(FILE_NAME), objectMapper);
        this.config = config;
        this.clock = clock;
        file.removeStaleTempFiles();
        Map<String, FailedTask> loaded = new LinkedHashMap<>();
        for (FailedTask task : file.read(FILE_TYPE).orElseGet(List::of)) {
            loaded.put(task.taskId(), task);
        }
        this.tasks = loaded;
        log.info("Loaded {} failed task(s) from {}", tasks.size(), file.path());
    }

    public FailedTask add(String taskType, String target, String errorMessage) {
        return add(taskType, target, errorMessage, Map.of());
    }

    /**
     * Queues a failed work item. An item already waiting for retry keeps its schedule and only gets the new
     * error message; an exhausted one starts over.
     */
    public synchronized FailedTask add(
        String taskType,
        String target,
        String errorMessage,
        Map<String, Object> metadata
    ) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        Instant now = clock.instant();
        String taskId = HashUtils.taskId(taskType, target);
        FailedTask existing = tasks.get(taskId);
        FailedTask task;
        if (existing != null && isWaiting(existing)) {
            Map<String, Object> mergedMetadata = new LinkedHashMap<>(existing.metadata());
            if (metadata != null) {
                mergedMetadata.putAll(metadata);
            }
            task = new FailedTask(
                taskId,
                taskType,
                target,
                errorMessage,
                existing.attemptCount(),
                existing.nextRetryAt(),
                existing.createdAt(),
                now,
                existing.status(),
                mergedMetadata
            );
            log.debug("Failed task {} already queued, refreshed error", taskId);
        } else {
            task = new FailedTask(
                taskId,
                taskType,
                target,
                errorMessage,
                0,
                now.plus(config.baseDelay()),
                now,
                now,
                FailedTaskStatus.PENDING,
                metadata
            );
            log.info("Queued failed task {} ({} {}): {}", taskId, taskType, target, errorMessage);
        }
        persistWith(task);
        return task;
    }

    /**
     * @return tasks waiting for retry whose time has come, earliest first
     */
    public synchronized List<FailedTask> dueTasks() {
        Instant now = clock.instant();
        return tasks.values().stream()
            .filter(task -> task.dueAt(now))
            .sorted(BY_NEXT_RETRY)
            .toList();
    }

    public synchronized Optional<FailedTask> markResolved(String taskId) {
        FailedTask task = tasks.get(taskId);
        if (task == null) {
            return Optional.empty();
        }
        Map<String, FailedTask> next = new LinkedHashMap<>(tasks);
        next.remove(taskId);
        file.write(new ArrayList<>(next.values()));
        tasks = next;
        Instant now = clock.instant();
        log.info("Failed task {} resolved after {} retries", taskId, task.attemptCount());
        return Optional.of(task.withRetry(task.errorMessage(), task.attemptCount(), FailedTaskStatus.RESOLVED, null, now));
    }

    /**
     * Records a failed retry: the task is rescheduled with exponential delay, or exhausted once its attempt
     * count exceeds the cap.
     */
    public synchronized Optional<FailedTask> markFailed(String taskId, String errorMessage) {
        FailedTask task = tasks.get(taskId);
        if (task == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        int attempts = task.attemptCount() + 1;
        FailedTask updated;
        if (attempts > config.attemptCap()) {
            updated = task.withRetry(errorMessage, attempts, FailedTaskStatus.EXHAUSTED, null, now);
            log.warn("Failed task {} exhausted after {} attempts: {}", taskId, attempts, errorMessage);
        } else {
            Instant nextRetryAt = now.plus(retryDelay(attempts));
            updated = task.withRetry(errorMessage, attempts, FailedTaskStatus.RETRYING, nextRetryAt, now);
            log.info("Failed task {} attempt {} failed, next retry at {}", taskId, attempts, nextRetryAt);
        }
        persistWith(updated);
        return Optional.of(updated);
    }

    /**
     * Puts an exhausted task back in line with a fresh attempt budget.
     */
    public synchronized Optional<FailedTask> requeue(String taskId) {
        FailedTask task = tasks.get(taskId);
        if (task == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        FailedTask requeued = task.withRetry(task.errorMessage(), 0, FailedTaskStatus.PENDING, now, now);
        persistWith(requeued);
        log.info("Failed task {} requeued by operator", taskId);
        return Optional.of(requeued);
    }

    public synchronized Optional<FailedTask> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public synchronized List<FailedTask> allTasks() {
        return tasks.values().stream().sorted(BY_NEXT_RETRY).toList();
    }

    public synchronized List<FailedTask> exhaustedTasks() {
        return tasks.values().stream()
            .filter(task -> task.status() == FailedTaskStatus.EXHAUSTED)
            .toList();
    }

    public synchronized int size() {
        return tasks.size();
    }

    /**
     * {@code min(baseDelay * backoffFactor^(attempts-1), maxDelay)}.
     */
    Duration retryDelay(int attempts) {
        long baseMs = config.baseDelay().toMillis();
        long maxMs = config.maxDelay().toMillis();
        double raw = baseMs * Math.pow(config.backoffFactor(), Math.max(0, attempts - 1));
        return Duration.ofMillis(raw >= maxMs ? maxMs : (long) raw);
    }

    private void persistWith(FailedTask task) {
        Map<String, FailedTask> next = new LinkedHashMap<>(tasks);
        next.put(task.taskId(), task);
        file.write(new ArrayList<>(next.values()));
        tasks = next;
    }

    private static boolean isWaiting(FailedTask task) {
        return task.status() == FailedTaskStatus.PENDING || task.status() == FailedTaskStatus.RETRYING;
    }
}
