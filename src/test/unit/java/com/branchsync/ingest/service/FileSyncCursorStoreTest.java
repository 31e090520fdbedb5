package com.branchsync.ingest.service;

import com.branchsync.ingest.error.CursorStoreException;
import com.branchsync.ingest.model.SyncCursor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSyncCursorStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void unknownBranchHasNoCursor() {
        FileSyncCursorStore store = new FileSyncCursorStore(tempDir.resolve("cursor.json"), objectMapper, clock);

        assertThat(store.getCursor("nairobi-main")).isEmpty();
        assertThat(store.getLastSyncTime("nairobi-main")).isEmpty();
    }

    @Test
    void cursorSurvivesRestart() {
        Path file = tempDir.resolve("cursor.json");
        FileSyncCursorStore store = new FileSyncCursorStore(file, objectMapper, clock);

        assertThat(store.setLastSyncTime("nairobi-main", Instant.parse("2024-03-04T05:01:00Z"), "sync-1")).isTrue();

        SyncCursor reloaded = new FileSyncCursorStore(file, objectMapper, clock).getCursor("nairobi-main").orElseThrow();
        assertThat(reloaded.lastSyncTime()).isEqualTo(Instant.parse("2024-03-04T05:01:00Z"));
        assertThat(reloaded.lastSyncBatchId()).isEqualTo("sync-1");
        assertThat(reloaded.updatedAt()).isEqualTo(NOW);
    }

    @Test
    void cursorNeverMovesBackward() {
        FileSyncCursorStore store = new FileSyncCursorStore(tempDir.resolve("cursor.json"), objectMapper, clock);
        store.setLastSyncTime("nairobi-main", Instant.parse("2024-03-04T05:01:00Z"), "sync-1");

        assertThat(store.setLastSyncTime("nairobi-main", Instant.parse("2024-03-04T04:00:00Z"), "sync-2")).isFalse();
        assertThat(store.setLastSyncTime("nairobi-main", Instant.parse("2024-03-04T05:01:00Z"), "sync-3")).isFalse();

        assertThat(store.getCursor("nairobi-main").orElseThrow().lastSyncBatchId()).isEqualTo("sync-1");
    }

    @Test
    void branchesAreTrackedIndependently() {
        FileSyncCursorStore store = new FileSyncCursorStore(tempDir.resolve("cursor.json"), objectMapper, clock);
        store.setLastSyncTime("nairobi-main", Instant.parse("2024-03-04T05:01:00Z"), "sync-1");
        store.setLastSyncTime("mombasa", Instant.parse("2024-03-03T05:01:00Z"), "sync-2");

        assertThat(store.getLastSyncTime("nairobi-main")).contains(Instant.parse("2024-03-04T05:01:00Z"));
        assertThat(store.getLastSyncTime("mombasa")).contains(Instant.parse("2024-03-03T05:01:00Z"));
    }

    @Test
    void corruptFileFailsStartup() throws IOException {
        Path file = tempDir.resolve("cursor.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new FileSyncCursorStore(file, objectMapper, clock))
                .isInstanceOf(CursorStoreException.class)
                .hasMessageContaining("cursor.json");
    }

    @Test
    void unreadableBranchTimestampFailsStartup() throws IOException {
        Path file = tempDir.resolve("cursor.json");
        Files.writeString(file, """
                {"branches": {"nairobi-main": {"lastSyncTime": "yesterday", "lastSyncBatchId": "sync-1"}}}
                """);

        assertThatThrownBy(() -> new FileSyncCursorStore(file, objectMapper, clock))
                .isInstanceOf(CursorStoreException.class)
                .hasMessageContaining("nairobi-main");
    }

    @Test
    void failedWriteLeavesCursorUnchanged() throws IOException {
        Path blocked = tempDir.resolve("blocked");
        Files.writeString(blocked, "a file where a directory is needed");
        FileSyncCursorStore store = new FileSyncCursorStore(blocked.resolve("cursor.json"), objectMapper, clock);

        assertThatThrownBy(() -> store.setLastSyncTime("nairobi-main", Instant.parse("2024-03-04T05:01:00Z"), "sync-1"))
                .isInstanceOf(CursorStoreException.class);
        assertThat(store.getCursor("nairobi-main")).isEmpty();
    }
}
