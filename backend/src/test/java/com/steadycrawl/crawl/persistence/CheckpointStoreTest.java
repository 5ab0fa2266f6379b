package com.steadycrawl.crawl.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.steadycrawl.config.CrawlConfig;
import com.steadycrawl.crawl.MutableClock;
import com.steadycrawl.crawl.model.ResumePoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckpointStoreTest {
    private final ObjectMapper objectMapper = new CrawlConfig().objectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));

    @TempDir
    Path stateDir;

    private CheckpointStore store() {
        return new CheckpointStore(stateDir, objectMapper, Duration.ofHours(168), clock);
    }

    @Test
    void savedResumePointSurvivesRestart() {
        store().save("LIST_COLLECTION", 5, 120, Map.of("seriesId", "abc", "pageSize", 20));

        ResumePoint point = store().load("LIST_COLLECTION").orElseThrow();

        assertThat(point.currentPage()).isEqualTo(5);
        assertThat(point.totalProcessed()).isEqualTo(120);
        assertThat(point.metadata()).containsEntry("seriesId", "abc").containsEntry("pageSize", 20);
        assertThat(point.updatedAt()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(store().load("DETAIL_COLLECTION")).isEmpty();
    }

    @Test
    void cursorAndSlugAreKept() {
        store().save("LIST_COLLECTION", 2, "cursor-42", "model-x", 40, Map.of());

        ResumePoint point = store().load("LIST_COLLECTION").orElseThrow();
        assertThat(point.lastCursor()).isEqualTo("cursor-42");
        assertThat(point.lastSlug()).isEqualTo("model-x");
    }

    @Test
    void newSaveOverwritesPreviousPoint() {
        CheckpointStore store = store();
        store.save("LIST_COLLECTION", 1, 20, Map.of());
        store.save("LIST_COLLECTION", 2, 40, Map.of());
        store.save("IMAGE_COLLECTION", 7, 3, Map.of());

        assertThat(store.loadAll()).containsOnlyKeys("IMAGE_COLLECTION", "LIST_COLLECTION");
        assertThat(store.load("LIST_COLLECTION").orElseThrow().currentPage()).isEqualTo(2);
    }

    @Test
    void rejectsNegativeCounts() {
        CheckpointStore store = store();
        assertThatThrownBy(() -> store.save("LIST_COLLECTION", -1, 0, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.save("LIST_COLLECTION", 0, -5, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.loadAll()).isEmpty();
    }

    @Test
    void leftoverTempFileFromKilledWriterIsIgnoredAndRemoved() throws Exception {
        store().save("LIST_COLLECTION", 5, 120, Map.of());
        Path partial = stateDir.resolve(CheckpointStore.FILE_NAME + ".81723.tmp");
        Files.writeString(partial, "{\"LIST_COLLECTION\":{\"currentPage\":6,", StandardCharsets.UTF_8);

        CheckpointStore reopened = store();

        assertThat(reopened.load("LIST_COLLECTION").orElseThrow().currentPage()).isEqualTo(5);
        assertThat(Files.exists(partial)).isFalse();
    }

    @Test
    void failedWriteKeepsPreviousContent() throws Exception {
        CheckpointStore store = store();
        store.save("LIST_COLLECTION", 5, 120, Map.of());
        String before = Files.readString(stateDir.resolve(CheckpointStore.FILE_NAME));

        assertThatThrownBy(() -> store.save("LIST_COLLECTION", 6, 140, Map.of("handle", new Object())))
            .isInstanceOf(PersistenceException.class);

        assertThat(store.load("LIST_COLLECTION").orElseThrow().currentPage()).isEqualTo(5);
        assertThat(Files.readString(stateDir.resolve(CheckpointStore.FILE_NAME))).isEqualTo(before);
        try (Stream<Path> files = Files.list(stateDir)) {
            assertThat(files).extracting(path -> path.getFileName().toString())
                .containsExactly(CheckpointStore.FILE_NAME);
        }
    }

    @Test
    void clearRemovesOnlyThatTaskType() {
        CheckpointStore store = store();
        store.save("LIST_COLLECTION", 5, 120, Map.of());
        store.save("DETAIL_COLLECTION", 1, 9, Map.of());

        assertThat(store.clear("LIST_COLLECTION")).isTrue();
        assertThat(store.clear("LIST_COLLECTION")).isFalse();
        assertThat(store().loadAll()).containsOnlyKeys("DETAIL_COLLECTION");
    }

    @Test
    void corruptFileIsReportedNotSilentlyReset() throws Exception {
        Files.writeString(stateDir.resolve(CheckpointStore.FILE_NAME), "{not json", StandardCharsets.UTF_8);

        assertThatThrownBy(this::store).isInstanceOf(PersistenceException.class);
    }
}
