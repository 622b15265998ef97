package com.sitecrawler.scheduler;

import com.sitecrawler.scheduler.cron.CronExpressionEngine;
import com.sitecrawler.scheduler.cron.CronValidation;
import com.sitecrawler.scheduler.model.CrawlMode;
import com.sitecrawler.scheduler.model.Execution;
import com.sitecrawler.scheduler.model.ExecutionPatch;
import com.sitecrawler.scheduler.model.ExecutionStatus;
import com.sitecrawler.scheduler.model.Schedule;
import com.sitecrawler.scheduler.model.ScheduleDraft;
import com.sitecrawler.scheduler.model.SchedulePatch;
import com.sitecrawler.scheduler.model.ScheduleStats;
import com.sitecrawler.scheduler.store.InMemoryScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleManagerTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:07:00Z");

    private InMemoryScheduleStore store;
    private ScheduleManager manager;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryScheduleStore();
        manager = new ScheduleManager(store, new CronExpressionEngine(clock, ZoneOffset.UTC), clock);
    }

    private static ScheduleDraft draft(String cron) {
        return ScheduleDraft.builder()
                .name("Docs")
                .description("docs site")
                .startUrl("https://docs.example.com/")
                .allowSubdomains(true)
                .maxConcurrency(8)
                .mode(CrawlMode.JS)
                .userId("u-1")
                .cronExpression(cron)
                .build();
    }

    @Test
    void create_storesScheduleWithComputedNextRun() {
        long id = manager.createSchedule(draft(" */15 * * * * "));

        Schedule schedule = manager.getSchedule(id);
        assertEquals("Docs", schedule.getName());
        assertEquals("*/15 * * * *", schedule.getCronExpression());
        assertTrue(schedule.isAllowSubdomains());
        assertEquals(8, schedule.getMaxConcurrency());
        assertEquals(CrawlMode.JS, schedule.getMode());
        assertEquals("u-1", schedule.getUserId());
        assertTrue(schedule.isEnabled());
        assertEquals(NOW, schedule.getCreatedAt());
        assertEquals(Instant.parse("2024-03-15T10:15:00Z"), schedule.getNextRun());
        assertEquals(0, schedule.getTotalRuns());
        assertNull(schedule.getLastRun());
    }

    @Test
    void create_invalidCron_isRejectedAndNothingStored() {
        InvalidCronExpressionException e = assertThrows(InvalidCronExpressionException.class,
                () -> manager.createSchedule(draft("99 * * * *")));

        assertTrue(e.getMessage().contains("minute"), e.getMessage());
        assertTrue(manager.getAllSchedules().isEmpty());
    }

    @Test
    void update_changedCron_recomputesNextRun() {
        long id = manager.createSchedule(draft("*/15 * * * *"));

        Schedule updated = manager.updateSchedule(id, SchedulePatch.builder().cronExpression("30 9 * * *").build());

        assertEquals("30 9 * * *", updated.getCronExpression());
        assertEquals(Instant.parse("2024-03-16T09:30:00Z"), updated.getNextRun());
    }

    @Test
    void update_withoutCron_keepsNextRun() {
        long id = manager.createSchedule(draft("*/15 * * * *"));

        Schedule updated = manager.updateSchedule(id, SchedulePatch.builder().name("Docs v2").build());

        assertEquals("Docs v2", updated.getName());
        assertEquals(Instant.parse("2024-03-15T10:15:00Z"), updated.getNextRun());
    }

    @Test
    void update_invalidCron_leavesScheduleUntouched() {
        long id = manager.createSchedule(draft("*/15 * * * *"));

        assertThrows(InvalidCronExpressionException.class,
                () -> manager.updateSchedule(id, SchedulePatch.builder().name("x").cronExpression("* *").build()));
        assertEquals("Docs", manager.getSchedule(id).getName());
    }

    @Test
    void update_unknownId_throwsNotFound() {
        assertThrows(ScheduleNotFoundException.class,
                () -> manager.updateSchedule(9, SchedulePatch.builder().name("x").build()));
    }

    @Test
    void deleteAndGet_unknownId_throwNotFound() {
        long id = manager.createSchedule(draft("0 0 * * *"));
        manager.deleteSchedule(id);

        assertThrows(ScheduleNotFoundException.class, () -> manager.getSchedule(id));
        assertThrows(ScheduleNotFoundException.class, () -> manager.deleteSchedule(id));
    }

    @Test
    void toggle_flipsEnabled() {
        long id = manager.createSchedule(draft("0 0 * * *"));

        assertFalse(manager.toggleSchedule(id).isEnabled());
        assertTrue(manager.toggleSchedule(id).isEnabled());
        assertThrows(ScheduleNotFoundException.class, () -> manager.toggleSchedule(404));
    }

    @Test
    void stats_neverRun() {
        long id = manager.createSchedule(draft("0 0 * * *"));

        ScheduleStats stats = manager.getScheduleStats(id);

        assertEquals(0, stats.totalRuns());
        assertEquals(0.0, stats.successRate());
        assertEquals(0.0, stats.averageDurationMs());
        assertNull(stats.lastRun());
        assertEquals(Instant.parse("2024-03-16T00:00:00Z"), stats.nextRun());
    }

    @Test
    void stats_rateAndAverageOverFinalizedExecutions() {
        long id = manager.createSchedule(draft("0 0 * * *"));
        finish(id, ExecutionStatus.COMPLETED, 1_000);
        finish(id, ExecutionStatus.COMPLETED, 3_000);
        finish(id, ExecutionStatus.FAILED, 5_000);
        store.recordExecution(id, 0, NOW); // still running, excluded
        store.updateSchedule(id, SchedulePatch.builder()
                .totalRuns(4).successfulRuns(3).failedRuns(1).lastRun(NOW).build());

        ScheduleStats stats = manager.getScheduleStats(id);

        assertEquals(4, stats.totalRuns());
        assertEquals(3, stats.successfulRuns());
        assertEquals(1, stats.failedRuns());
        assertEquals(75.0, stats.successRate());
        assertEquals(3_000.0, stats.averageDurationMs());
        assertEquals(NOW, stats.lastRun());
    }

    @Test
    void history_defaultsAndLimits() {
        long id = manager.createSchedule(draft("0 0 * * *"));
        for (int i = 0; i < 60; i++) {
            store.recordExecution(id, 0, NOW.plusSeconds(i));
        }

        assertEquals(50, manager.getExecutionHistory(id).size());
        assertEquals(5, manager.getExecutionHistory(id, 5).size());
        assertEquals(60, manager.getAllExecutions().size());
        Execution newest = manager.getAllExecutions(1).get(0);
        assertEquals(NOW.plusSeconds(59), newest.getStartedAt());
    }

    @Test
    void cronHelpers() {
        CronValidation ok = manager.validateCronExpression("0 9 * * *");
        assertTrue(ok.valid());
        assertEquals(Instant.parse("2024-03-16T09:00:00Z"), ok.nextRun());

        assertFalse(manager.validateCronExpression("0 9 * *").valid());
        assertEquals("Daily at 9:00 AM", manager.getCronDescription("0 9 * * *"));
    }

    private void finish(long scheduleId, ExecutionStatus status, long durationMs) {
        long executionId = store.recordExecution(scheduleId, 0, NOW);
        store.updateExecution(executionId, ExecutionPatch.builder()
                .status(status)
                .durationMs(durationMs)
                .completedAt(NOW.plusMillis(durationMs))
                .build());
    }
}
