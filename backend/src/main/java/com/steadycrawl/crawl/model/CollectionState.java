package com.steadycrawl.crawl.model;

import java.time.Instant;

/**
 * Progress of one collection run, kept for operators. Resume decisions use {@link ResumePoint} instead.
 */
public record CollectionState(
    String runId,
    String taskType,
    CollectionRunStatus status,
    Instant startedAt,
    Instant updatedAt,
    Instant finishedAt,
    long totalItems,
    long processedItems,
    long failedItems
) {
}
