package com.steadycrawl.crawl.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.steadycrawl.crawl.model.ResumePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Durable resume points, one per task type, kept in {@code resume_points.json}.
 */
public class CheckpointStore {
    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);
    public static final String FILE_NAME = "resume_points.json";
    private static final TypeReference<LinkedHashMap<String, ResumePoint>> FILE_TYPE = new TypeReference<>() {
    };

    private final AtomicJsonFile file;
    private final Duration resumePointTtl;
    private final Clock clock;
    private Map<String, ResumePoint> points;

    public CheckpointStore(Path stateDir, ObjectMapper objectMapper, Duration resumePointTtl, Clock clock) {
        this.file = new AtomicJsonFile(stateDir.resolve(FILE_NAME), objectMapper);
        this.resumePointTtl = resumePointTtl;
        this.clock = clock;
        file.removeStaleTempFiles();
        this.points = new LinkedHashMap<>(file.read(FILE_TYPE).orElseGet(LinkedHashMap::new));
        log.info("Loaded {} resume point(s) from {}", points.size(), file.path());
    }

    public ResumePoint save(String taskType, int currentPage, long totalProcessed, Map<String, Object> metadata) {
        return save(taskType, currentPage, null, null, totalProcessed, metadata);
    }

    /**
     * Replaces the resume point of {@code taskType}. On a write failure the previous point stays in effect
     * both on disk and in memory.
     */
    public synchronized ResumePoint save(
        String taskType,
        int currentPage,
        String lastCursor,
        String lastSlug,
        long totalProcessed,
        Map<String, Object> metadata
    ) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        if (currentPage < 0) {
            throw new IllegalArgumentException("currentPage must be >= 0 but was " + currentPage);
        }
        if (totalProcessed < 0) {
            throw new IllegalArgumentException("totalProcessed must be >= 0 but was " + totalProcessed);
        }
        ResumePoint previous = points.get(taskType);
        if (previous != null && totalProcessed < previous.totalProcessed()) {
            log.warn("Resume point {} totalProcessed went backwards: {} -> {}",
                taskType, previous.totalProcessed(), totalProcessed);
        }

        ResumePoint point = new ResumePoint(
            taskType,
            currentPage,
            lastCursor,
            lastSlug,
            totalProcessed,
            metadata,
            clock.instant()
        );
        Map<String, ResumePoint> next = new LinkedHashMap<>(points);
        next.put(taskType, point);
        file.write(next);
        points = next;
        log.debug("Saved resume point {} page={} processed={}", taskType, currentPage, totalProcessed);
        return point;
    }

    public synchronized Optional<ResumePoint> load(String taskType) {
        ResumePoint point = points.get(taskType);
        if (point != null && isStale(point)) {
            log.warn("Resume point {} was last updated at {}, older than {}h",
                taskType, point.updatedAt(), resumePointTtl.toHours());
        }
        return Optional.ofNullable(point);
    }

    public synchronized Map<String, ResumePoint> loadAll() {
        return Collections.unmodifiableMap(new TreeMap<>(points));
    }

    /**
     * @return whether a point existed
     */
    public synchronized boolean clear(String taskType) {
        if (!points.containsKey(taskType)) {
            return false;
        }
        Map<String, ResumePoint> next = new LinkedHashMap<>(points);
        next.remove(taskType);
        file.write(next);
        points = next;
        log.info("Cleared resume point {}", taskType);
        return true;
    }

    private boolean isStale(ResumePoint point) {
        Instant updatedAt = point.updatedAt();
        return updatedAt != null && updatedAt.plus(resumePointTtl).isBefore(clock.instant());
    }
}
