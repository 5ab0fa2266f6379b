package com.steadycrawl.crawl.model;

import java.time.Instant;
import java.util.Map;

public record FailedTask(
    String taskId,
    String taskType,
    String target,
    String errorMessage,
    int attemptCount,
    Instant nextRetryAt,
    Instant createdAt,
    Instant updatedAt,
    FailedTaskStatus status,
    Map<String, Object> metadata
) {
    public FailedTask {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public boolean dueAt(Instant now) {
        return (status == FailedTaskStatus.PENDING || status == FailedTaskStatus.RETRYING)
            && nextRetryAt != null
            && !nextRetryAt.isAfter(now);
    }

    public FailedTask withRetry(
        String error,
        int attempts,
        FailedTaskStatus nextStatus,
        Instant nextRetry,
        Instant now
    ) {
        return new FailedTask(taskId, taskType, target, error, attempts, nextRetry, createdAt, now, nextStatus, metadata);
    }
}
