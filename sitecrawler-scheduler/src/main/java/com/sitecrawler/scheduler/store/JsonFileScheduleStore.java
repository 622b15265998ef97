package com.sitecrawler.scheduler.store;

import com.sitecrawler.common.infra.JsonFile;
import com.sitecrawler.scheduler.model.Execution;
import com.sitecrawler.scheduler.model.ExecutionStatus;
import com.sitecrawler.scheduler.model.Schedule;
import com.sitecrawler.scheduler.model.SessionCounters;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link InMemoryScheduleStore} backed by a JSON document that is rewritten
 * after every mutation.
 *
 * <p>
 * File layout:
 *
 * <pre>
 * {
 *   "version": 1,
 *   "savedAt": "2026-01-01T00:00:00Z",
 *   "lastScheduleId": 3,
 *   "lastExecutionId": 17,
 *   "schedules": [ ... ],
 *   "executions": [ ... ],
 *   "sessions": { "42": { "pagesCrawled": 120, "resourcesFound": 800 } }
 * }
 * </pre>
 *
 * A missing or blank file starts an empty store; a file that does not parse is
 * logged and also starts empty (it is overwritten on the next mutation).
 * Executions still {@code RUNNING} in the file belonged to a process that
 * stopped mid-run; they are finalized as {@code FAILED} on load.
 */
@Slf4j
public class JsonFileScheduleStore extends InMemoryScheduleStore {

    static final int FORMAT_VERSION = 1;
    static final String INTERRUPTED_MESSAGE = "Interrupted by restart";

    private final Path storePath;

    public JsonFileScheduleStore(Path storePath) {
        this.storePath = storePath;
        load();
    }

    public Path getStorePath() {
        return storePath;
    }

    /**
     * On-disk document.
     */
    public record StoreFile(
            int version,
            Instant savedAt,
            long lastScheduleId,
            long lastExecutionId,
            List<Schedule> schedules,
            List<Execution> executions,
            Map<Long, SessionCounters> sessions) {
    }

    private synchronized void load() {
        StoreFile file;
        try {
            file = JsonFile.load(storePath, StoreFile.class);
        } catch (IOException e) {
            log.error("Failed to load schedule store from {}: {}", storePath, e.getMessage());
            return;
        }
        if (file == null) {
            log.debug("Schedule store file not found: {}", storePath);
            return;
        }
        if (file.version() != FORMAT_VERSION) {
            log.warn("Schedule store {} has version {}, expected {}; reading anyway",
                    storePath, file.version(), FORMAT_VERSION);
        }
        if (file.schedules() != null) {
            for (Schedule schedule : file.schedules()) {
                schedules.put(schedule.getId(), schedule);
            }
        }
        if (file.executions() != null) {
            for (Execution execution : file.executions()) {
                executions.put(execution.getId(), execution);
            }
        }
        if (file.sessions() != null) {
            sessions.putAll(file.sessions());
        }
        // ids are never reused, even if the counters in the file are stale
        lastScheduleId = Math.max(file.lastScheduleId(), schedules.isEmpty() ? 0 : schedules.lastKey());
        lastExecutionId = Math.max(file.lastExecutionId(), executions.isEmpty() ? 0 : executions.lastKey());
        log.info("Loaded {} schedules and {} executions from {}",
                schedules.size(), executions.size(), storePath);

        int interrupted = finalizeInterrupted(Instant.now());
        if (interrupted > 0) {
            log.warn("Marked {} interrupted executions as failed in {}", interrupted, storePath);
            onChanged();
        }
    }

    private int finalizeInterrupted(Instant now) {
        int count = 0;
        for (Execution execution : executions.values()) {
            if (execution.getStatus() == null || !execution.getStatus().isFinal()) {
                execution.setStatus(ExecutionStatus.FAILED);
                execution.setCompletedAt(now);
                execution.setErrorMessage(INTERRUPTED_MESSAGE);
                if (execution.getStartedAt() != null) {
                    execution.setDurationMs(Math.max(0, Duration.between(execution.getStartedAt(), now).toMillis()));
                }
                count++;
            }
        }
        return count;
    }

    @Override
    protected void onChanged() {
        StoreFile file = new StoreFile(
                FORMAT_VERSION,
                Instant.now(),
                lastScheduleId,
                lastExecutionId,
                new ArrayList<>(schedules.values()),
                new ArrayList<>(executions.values()),
                new LinkedHashMap<>(sessions));
        try {
            JsonFile.save(storePath, file);
            log.debug("Saved schedule store to {} ({} schedules)", storePath, schedules.size());
        } catch (IOException e) {
            log.error("Failed to save schedule store to {}: {}", storePath, e.getMessage());
        }
    }
}
