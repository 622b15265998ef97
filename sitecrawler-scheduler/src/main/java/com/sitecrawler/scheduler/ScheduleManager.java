package com.sitecrawler.scheduler;

import com.sitecrawler.scheduler.cron.CronExpressionEngine;
import com.sitecrawler.scheduler.cron.CronValidation;
import com.sitecrawler.scheduler.model.Execution;
import com.sitecrawler.scheduler.model.Schedule;
import com.sitecrawler.scheduler.model.ScheduleDraft;
import com.sitecrawler.scheduler.model.SchedulePatch;
import com.sitecrawler.scheduler.model.ScheduleStats;
import com.sitecrawler.scheduler.store.ScheduleStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Owner-facing schedule operations: create, edit, toggle, delete, history and
 * statistics. Cron expressions are validated before they reach the store.
 */
@Slf4j
public class ScheduleManager {

    static final int DEFAULT_HISTORY_LIMIT = 50;
    static final int DEFAULT_ALL_EXECUTIONS_LIMIT = 100;
    static final int STATS_WINDOW = 100;

    private final ScheduleStore store;
    private final CronExpressionEngine cronEngine;
    private final Clock clock;

    public ScheduleManager(ScheduleStore store, CronExpressionEngine cronEngine) {
        this(store, cronEngine, Clock.systemUTC());
    }

    public ScheduleManager(ScheduleStore store, CronExpressionEngine cronEngine, Clock clock) {
        this.store = store;
        this.cronEngine = cronEngine;
        this.clock = clock;
    }

    /**
     * @return the new schedule's id
     * @throws InvalidCronExpressionException if the cron expression does not
     *                                        validate
     */
    public long createSchedule(ScheduleDraft draft) {
        CronValidation validation = requireValid(draft.getCronExpression());

        long id = store.insertSchedule(Schedule.builder()
                .name(draft.getName())
                .description(draft.getDescription())
                .startUrl(draft.getStartUrl())
                .allowSubdomains(draft.isAllowSubdomains())
                .maxConcurrency(draft.getMaxConcurrency())
                .mode(draft.getMode())
                .userId(draft.getUserId())
                .cronExpression(draft.getCronExpression().trim())
                .enabled(draft.isEnabled())
                .createdAt(clock.instant())
                .nextRun(validation.nextRun())
                .build());

        log.info("Crawl schedule created (id: {}, name: {}, cron: {})", id, draft.getName(),
                draft.getCronExpression());
        return id;
    }

    /**
     * Apply a partial update; a changed cron expression is validated and
     * {@code nextRun} recomputed from it.
     *
     * @throws ScheduleNotFoundException      if no schedule has {@code id}
     * @throws InvalidCronExpressionException if the new expression does not
     *                                        validate
     */
    public Schedule updateSchedule(long id, SchedulePatch patch) {
        SchedulePatch effective = patch;
        if (patch.getCronExpression() != null) {
            CronValidation validation = requireValid(patch.getCronExpression());
            effective = patch.toBuilder()
                    .cronExpression(patch.getCronExpression().trim())
                    .nextRun(validation.nextRun())
                    .build();
        }
        Schedule updated = store.updateSchedule(id, effective);
        log.info("Crawl schedule updated (id: {})", id);
        return updated;
    }

    /**
     * @throws ScheduleNotFoundException if no schedule has {@code id}
     */
    public void deleteSchedule(long id) {
        if (!store.deleteSchedule(id)) {
            throw new ScheduleNotFoundException(id);
        }
        log.info("Crawl schedule deleted (id: {})", id);
    }

    /**
     * @throws ScheduleNotFoundException if no schedule has {@code id}
     */
    public Schedule getSchedule(long id) {
        return store.getSchedule(id).orElseThrow(() -> new ScheduleNotFoundException(id));
    }

    public List<Schedule> getAllSchedules() {
        return store.getAllSchedules();
    }

    /**
     * Flip the enabled flag.
     *
     * @return the updated schedule
     * @throws ScheduleNotFoundException if no schedule has {@code id}
     */
    public Schedule toggleSchedule(long id) {
        Schedule schedule = getSchedule(id);
        boolean enabled = !schedule.isEnabled();
        Schedule updated = store.updateSchedule(id, SchedulePatch.builder().enabled(enabled).build());
        log.info("Schedule toggled (id: {}, enabled: {})", id, enabled);
        return updated;
    }

    public List<Execution> getExecutionHistory(long scheduleId) {
        return getExecutionHistory(scheduleId, DEFAULT_HISTORY_LIMIT);
    }

    public List<Execution> getExecutionHistory(long scheduleId, int limit) {
        return store.getExecutionHistory(scheduleId, limit);
    }

    public List<Execution> getAllExecutions() {
        return getAllExecutions(DEFAULT_ALL_EXECUTIONS_LIMIT);
    }

    public List<Execution> getAllExecutions(int limit) {
        return store.getAllExecutions(limit);
    }

    /**
     * Counters from the schedule plus the mean duration of its most recent
     * finalized executions.
     *
     * @throws ScheduleNotFoundException if no schedule has {@code id}
     */
    public ScheduleStats getScheduleStats(long id) {
        Schedule schedule = getSchedule(id);
        double averageDuration = store.getExecutionHistory(id, STATS_WINDOW).stream()
                .filter(e -> e.getStatus().isFinal())
                .mapToLong(Execution::getDurationMs)
                .average()
                .orElse(0);
        double successRate = schedule.getTotalRuns() > 0
                ? (schedule.getSuccessfulRuns() * 100.0) / schedule.getTotalRuns()
                : 0;
        return new ScheduleStats(
                schedule.getTotalRuns(),
                schedule.getSuccessfulRuns(),
                schedule.getFailedRuns(),
                successRate,
                averageDuration,
                schedule.getLastRun(),
                schedule.getNextRun());
    }

    public CronValidation validateCronExpression(String expression) {
        return cronEngine.validate(expression);
    }

    public String getCronDescription(String expression) {
        return cronEngine.getDescription(expression);
    }

    public ScheduleStore getStore() {
        return store;
    }

    private CronValidation requireValid(String expression) {
        CronValidation validation = cronEngine.validate(expression);
        if (!validation.valid()) {
            throw new InvalidCronExpressionException(expression, validation.error());
        }
        return validation;
    }
}
