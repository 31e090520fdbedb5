package com.branchsync.ingest.service;

import com.branchsync.ingest.error.CursorStoreException;
import com.branchsync.ingest.model.SyncCursor;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Cursor store backed by one JSON file holding an entry per branch. Writes go to a
 * temporary sibling that is atomically moved over the file, and the in-memory copy
 * only changes once the move succeeded.
 *
 * <p>An unreadable file fails construction instead of being treated as empty, since an
 * empty store would restart every branch from its look-back window.</p>
 */
public class FileSyncCursorStore implements SyncCursorStore {
    private static final Logger log = LoggerFactory.getLogger(FileSyncCursorStore.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Object lock = new Object();
    private final Path cursorPath;
    private CursorData data;

    public FileSyncCursorStore(Path cursorPath, ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.cursorPath = cursorPath.toAbsolutePath();
        this.data = load();
        log.info("Sync cursor file={} branches={}", this.cursorPath, data.branches.keySet());
    }

    @Override
    public Optional<SyncCursor> getCursor(String branchId) {
        if (!StringUtils.hasText(branchId)) {
            return Optional.empty();
        }
        synchronized (lock) {
            CursorEntry entry = data.branches.get(branchId);
            if (entry == null) {
                return Optional.empty();
            }
            return parseInstant(entry.lastSyncTime).map(lastSyncTime -> new SyncCursor(
                    branchId, lastSyncTime, entry.lastSyncBatchId, parseInstant(entry.updatedAt).orElse(null)));
        }
    }

    @Override
    public boolean setLastSyncTime(String branchId, Instant lastSyncTime, String batchId) {
        synchronized (lock) {
            CursorEntry existing = data.branches.get(branchId);
            if (!shouldUpdate(existing, lastSyncTime)) {
                log.debug("Ignoring cursor for branch {} at {}; stored cursor is not older", branchId, lastSyncTime);
                return false;
            }
            CursorEntry updated = new CursorEntry();
            updated.lastSyncTime = lastSyncTime.toString();
            updated.lastSyncBatchId = batchId;
            updated.updatedAt = clock.instant().toString();

            CursorData next = new CursorData();
            next.branches.putAll(data.branches);
            next.branches.put(branchId, updated);
            next.updatedAt = updated.updatedAt;
            persist(next);
            data = next;
            return true;
        }
    }

    private boolean shouldUpdate(CursorEntry existing, Instant lastSyncTime) {
        if (existing == null) {
            return true;
        }
        Optional<Instant> existingTime = parseInstant(existing.lastSyncTime);
        return existingTime.isEmpty() || lastSyncTime.isAfter(existingTime.get());
    }

    private Optional<Instant> parseInstant(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(value));
        } catch (DateTimeParseException ex) {
            log.warn("Unreadable timestamp {} in cursor file {}", value, cursorPath);
            return Optional.empty();
        }
    }

    private CursorData load() {
        if (!Files.exists(cursorPath)) {
            return new CursorData();
        }
        try {
            CursorData loaded = objectMapper.readValue(cursorPath.toFile(), CursorData.class);
            if (loaded.branches == null) {
                loaded.branches = new TreeMap<>();
            }
            loaded.branches.forEach((branchId, entry) -> requireTimestamp(branchId, entry));
            return loaded;
        } catch (IOException ex) {
            throw new CursorStoreException("Failed to read cursor file " + cursorPath, ex);
        }
    }

    private void requireTimestamp(String branchId, CursorEntry entry) {
        String value = entry == null ? null : entry.lastSyncTime;
        if (!StringUtils.hasText(value)) {
            throw new CursorStoreException("Cursor file " + cursorPath + " has no lastSyncTime for branch " + branchId, null);
        }
        try {
            Instant.parse(value);
        } catch (DateTimeParseException ex) {
            throw new CursorStoreException("Cursor file " + cursorPath + " has an unreadable lastSyncTime for branch " + branchId, ex);
        }
    }

    private void persist(CursorData next) {
        try {
            Path parent = cursorPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = cursorPath.resolveSibling(cursorPath.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), next);
            Files.move(tmp, cursorPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new CursorStoreException("Failed to persist cursor file " + cursorPath, ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CursorData {
        public String updatedAt;
        public Map<String, CursorEntry> branches = new TreeMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class CursorEntry {
        public String lastSyncTime;
        public String lastSyncBatchId;
        public String updatedAt;
    }
}
