package com.sitecrawler.scheduler.store;

import com.sitecrawler.scheduler.model.CrawlMode;
import com.sitecrawler.scheduler.model.Execution;
import com.sitecrawler.scheduler.model.ExecutionPatch;
import com.sitecrawler.scheduler.model.ExecutionStatus;
import com.sitecrawler.scheduler.model.Schedule;
import com.sitecrawler.scheduler.model.SessionCounters;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileScheduleStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void missingFile_startsEmpty() {
        JsonFileScheduleStore store = new JsonFileScheduleStore(tempDir.resolve("schedules.json"));

        assertTrue(store.getAllSchedules().isEmpty());
        assertFalse(Files.exists(store.getStorePath()));
    }

    @Test
    void mutations_surviveReload() throws Exception {
        Path path = tempDir.resolve("data/schedules.json");
        JsonFileScheduleStore store = new JsonFileScheduleStore(path);
        long id = store.insertSchedule(Schedule.builder()
                .name("Docs")
                .startUrl("https://docs.example.com/")
                .mode(CrawlMode.JS)
                .cronExpression("0 9 * * *")
                .createdAt(NOW)
                .nextRun(NOW.plusSeconds(3600))
                .build());
        long executionId = store.recordExecution(id, 0, NOW);
        store.updateExecution(executionId, ExecutionPatch.builder()
                .status(ExecutionStatus.FAILED)
                .errorMessage("boom")
                .completedAt(NOW.plusSeconds(5))
                .durationMs(5_000L)
                .build());
        store.putSessionCounters(42, new SessionCounters(10, 20));

        assertTrue(Files.exists(path));
        assertTrue(Files.readString(path).contains("\"version\" : 1"));

        JsonFileScheduleStore reloaded = new JsonFileScheduleStore(path);
        Schedule schedule = reloaded.getSchedule(id).orElseThrow();
        assertEquals("Docs", schedule.getName());
        assertEquals(CrawlMode.JS, schedule.getMode());
        assertEquals(NOW, schedule.getCreatedAt());
        assertEquals(NOW.plusSeconds(3600), schedule.getNextRun());

        Execution execution = reloaded.getExecution(executionId).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertEquals("boom", execution.getErrorMessage());
        assertEquals(new SessionCounters(10, 20), reloaded.findSessionCounters(42).orElseThrow());
    }

    @Test
    void runningExecutions_areFailedOnReload() throws Exception {
        Path path = tempDir.resolve("schedules.json");
        JsonFileScheduleStore store = new JsonFileScheduleStore(path);
        long id = store.insertSchedule(Schedule.builder().name("Docs").build());
        long finished = store.recordExecution(id, 0, NOW);
        store.updateExecution(finished, ExecutionPatch.builder()
                .status(ExecutionStatus.COMPLETED)
                .completedAt(NOW.plusSeconds(5))
                .durationMs(5_000L)
                .build());
        long inFlight = store.recordExecution(id, 0, NOW.plusSeconds(10));

        JsonFileScheduleStore restarted = new JsonFileScheduleStore(path);

        Execution interrupted = restarted.getExecution(inFlight).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, interrupted.getStatus());
        assertNotNull(interrupted.getCompletedAt());
        assertEquals(JsonFileScheduleStore.INTERRUPTED_MESSAGE, interrupted.getErrorMessage());
        assertThrows(IllegalStateException.class, () -> restarted.updateExecution(inFlight,
                ExecutionPatch.builder().status(ExecutionStatus.COMPLETED).build()));

        Execution untouched = restarted.getExecution(finished).orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, untouched.getStatus());
        assertEquals(NOW.plusSeconds(5), untouched.getCompletedAt());
        assertNull(untouched.getErrorMessage());

        // persisted without a further mutation
        Execution reread = new JsonFileScheduleStore(path).getExecution(inFlight).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, reread.getStatus());
        assertEquals(interrupted.getCompletedAt(), reread.getCompletedAt());
    }

    @Test
    void reload_continuesIdSequenceAfterDeletes() {
        Path path = tempDir.resolve("schedules.json");
        JsonFileScheduleStore store = new JsonFileScheduleStore(path);
        store.insertSchedule(Schedule.builder().name("a").build());
        long b = store.insertSchedule(Schedule.builder().name("b").build());
        store.deleteSchedule(b);

        JsonFileScheduleStore reloaded = new JsonFileScheduleStore(path);

        assertEquals(3, reloaded.insertSchedule(Schedule.builder().name("c").build()));
    }

    @Test
    void corruptFile_startsEmptyAndIsOverwritten() throws Exception {
        Path path = tempDir.resolve("schedules.json");
        Files.writeString(path, "{ not json");

        JsonFileScheduleStore store = new JsonFileScheduleStore(path);
        assertTrue(store.getAllSchedules().isEmpty());

        store.insertSchedule(Schedule.builder().name("fresh").build());
        assertEquals("fresh", new JsonFileScheduleStore(path).getSchedule(1).orElseThrow().getName());
    }

    @Test
    void unknownFieldsAndOtherVersion_areTolerated() throws Exception {
        Path path = tempDir.resolve("schedules.json");
        Files.writeString(path, """
                {
                  "version": 2,
                  "lastScheduleId": 0,
                  "lastExecutionId": 0,
                  "schedules": [
                    { "id": 4, "name": "legacy", "cronExpression": "0 0 * * *", "owner": "someone" }
                  ]
                }
                """);

        JsonFileScheduleStore store = new JsonFileScheduleStore(path);

        assertEquals("legacy", store.getSchedule(4).orElseThrow().getName());
        assertEquals(5, store.insertSchedule(Schedule.builder().name("next").build()));
    }
}
