package com.steadycrawl.crawl.model;

import java.time.Instant;
import java.util.Map;

/**
 * Where a multi-page collection left off. One live record per task type.
 */
public record ResumePoint(
    String taskType,
    int currentPage,
    String lastCursor,
    String lastSlug,
    long totalProcessed,
    Map<String, Object> metadata,
    Instant updatedAt
) {
    public ResumePoint {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
