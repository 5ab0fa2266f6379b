package com.steadycrawl.crawl.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.steadycrawl.crawl.model.CollectionRunStatus;
import com.steadycrawl.crawl.model.CollectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-run progress counters in {@code collection_state.json}.
 */
public class CollectionStateStore {
    private static final Logger log = LoggerFactory.getLogger(CollectionStateStore.class);
    public static final String FILE_NAME = "collection_state.json";
    private static final TypeReference<LinkedHashMap<String, CollectionState>> FILE_TYPE = new TypeReference<>() {
    };

    private final AtomicJsonFile file;
    private final Clock clock;
    private Map<String, CollectionState> runs;

    public CollectionStateStore(Path stateDir, ObjectMapper objectMapper, Clock clock) {
        this.file = new AtomicJsonFile(stateDir.resolve(FILE_NAME), objectMapper);
        this.clock = clock;
        file.removeStaleTempFiles();
        this.runs = new LinkedHashMap<>(file.read(FILE_TYPE).orElseGet(LinkedHashMap::new));
    }

    public synchronized CollectionState startRun(String taskType) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        Instant now = clock.instant();
        String runId = taskType + "-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8);
        CollectionState state = new CollectionState(runId, taskType, CollectionRunStatus.RUNNING, now, now, null, 0, 0, 0);
        persistWith(state);
        log.info("Collection run {} started", runId);
        return state;
    }

    /**
     * Adds to the run's counters. {@code totalItems} replaces the known total when positive.
     */
    public synchronized CollectionState recordProgress(String runId, long processedDelta, long failedDelta, long totalItems) {
        CollectionState current = require(runId);
        if (processedDelta < 0 || failedDelta < 0) {
            throw new IllegalArgumentException("progress deltas must be >= 0");
        }
        CollectionState updated = new CollectionState(
            current.runId(),
            current.taskType(),
            current.status(),
            current.startedAt(),
            clock.instant(),
            current.finishedAt(),
            totalItems > 0 ? totalItems : current.totalItems(),
            current.processedItems() + processedDelta,
            current.failedItems() + failedDelta
        );
        persistWith(updated);
        return updated;
    }

    public synchronized CollectionState finishRun(String runId, CollectionRunStatus status) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("finish status must be terminal but was " + status);
        }
        CollectionState current = require(runId);
        Instant now = clock.instant();
        CollectionState finished = new CollectionState(
            current.runId(),
            current.taskType(),
            status,
            current.startedAt(),
            now,
            now,
            current.totalItems(),
            current.processedItems(),
            current.failedItems()
        );
        persistWith(finished);
        log.info("Collection run {} finished {}: processed={} failed={}",
            runId, status, finished.processedItems(), finished.failedItems());
        return finished;
    }

    public synchronized Optional<CollectionState> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * @return all runs, most recently started first
     */
    public synchronized List<CollectionState> all() {
        return runs.values().stream()
            .sorted(Comparator.comparing(CollectionState::startedAt).reversed())
            .toList();
    }

    private CollectionState require(String runId) {
        CollectionState state = runs.get(runId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown collection run " + runId);
        }
        return state;
    }

    private void persistWith(CollectionState state) {
        Map<String, CollectionState> next = new LinkedHashMap<>(runs);
        next.put(state.runId(), state);
        file.write(next);
        runs = next;
    }
}
