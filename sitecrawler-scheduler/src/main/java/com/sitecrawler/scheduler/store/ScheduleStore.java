package com.sitecrawler.scheduler.store;

import com.sitecrawler.scheduler.ScheduleNotFoundException;
import com.sitecrawler.scheduler.model.Execution;
import com.sitecrawler.scheduler.model.ExecutionPatch;
import com.sitecrawler.scheduler.model.Schedule;
import com.sitecrawler.scheduler.model.SchedulePatch;
import com.sitecrawler.scheduler.model.SessionCounters;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable schedule definitions and execution history.
 *
 * <p>
 * The store is the single source of truth: every read returns a detached copy,
 * so callers observe changes only by reading again.
 */
public interface ScheduleStore {

    // --- Schedules ---

    /**
     * Enabled schedules whose {@code nextRun} is at or before {@code now},
     * ordered by id.
     */
    List<Schedule> getSchedulesToRun(Instant now);

    Optional<Schedule> getSchedule(long id);

    List<Schedule> getAllSchedules();

    /**
     * Insert a schedule; the id on {@code schedule} is ignored.
     *
     * @return the assigned id
     */
    long insertSchedule(Schedule schedule);

    /**
     * @throws ScheduleNotFoundException if no schedule has {@code id}
     */
    Schedule updateSchedule(long id, SchedulePatch patch);

    /**
     * @return whether a schedule was removed
     */
    boolean deleteSchedule(long id);

    // --- Executions ---

    /**
     * Open an execution row in {@code RUNNING} state.
     *
     * @return the execution id
     */
    long recordExecution(long scheduleId, long sessionId, Instant startedAt);

    /**
     * @throws IllegalArgumentException if no execution has {@code executionId}
     * @throws IllegalStateException    if the execution is already finalized
     */
    Execution updateExecution(long executionId, ExecutionPatch patch);

    Optional<Execution> getExecution(long executionId);

    /**
     * Executions of one schedule, newest first.
     */
    List<Execution> getExecutionHistory(long scheduleId, int limit);

    /**
     * Executions of all schedules, newest first.
     */
    List<Execution> getAllExecutions(int limit);

    // --- Crawl sessions ---

    /**
     * Result counters of a crawl session, if the session is known.
     */
    Optional<SessionCounters> findSessionCounters(long sessionId);

    void putSessionCounters(long sessionId, SessionCounters counters);
}
