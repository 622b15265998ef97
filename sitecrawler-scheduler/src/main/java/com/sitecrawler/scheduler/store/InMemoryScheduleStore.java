package com.sitecrawler.scheduler.store;

import com.sitecrawler.scheduler.ScheduleNotFoundException;
import com.sitecrawler.scheduler.model.Execution;
import com.sitecrawler.scheduler.model.ExecutionPatch;
import com.sitecrawler.scheduler.model.Schedule;
import com.sitecrawler.scheduler.model.SchedulePatch;
import com.sitecrawler.scheduler.model.SessionCounters;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Thread-safe in-process store. All access is serialized on the instance
 * monitor; reads and writes exchange copies, never live objects.
 */
@Slf4j
public class InMemoryScheduleStore implements ScheduleStore {

    private static final Comparator<Execution> NEWEST_FIRST = Comparator
            .comparing(Execution::getStartedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Execution::getId, Comparator.reverseOrder());

    protected final TreeMap<Long, Schedule> schedules = new TreeMap<>();
    protected final TreeMap<Long, Execution> executions = new TreeMap<>();
    protected final Map<Long, SessionCounters> sessions = new HashMap<>();
    protected long lastScheduleId;
    protected long lastExecutionId;

    @Override
    public synchronized List<Schedule> getSchedulesToRun(Instant now) {
        List<Schedule> due = new ArrayList<>();
        for (Schedule schedule : schedules.values()) {
            if (schedule.isDue(now)) {
                due.add(copy(schedule));
            }
        }
        return due;
    }

    @Override
    public synchronized Optional<Schedule> getSchedule(long id) {
        return Optional.ofNullable(schedules.get(id)).map(InMemoryScheduleStore::copy);
    }

    @Override
    public synchronized List<Schedule> getAllSchedules() {
        return schedules.values().stream().map(InMemoryScheduleStore::copy).toList();
    }

    @Override
    public synchronized long insertSchedule(Schedule schedule) {
        long id = ++lastScheduleId;
        Schedule stored = copy(schedule);
        stored.setId(id);
        schedules.put(id, stored);
        onChanged();
        return id;
    }

    @Override
    public synchronized Schedule updateSchedule(long id, SchedulePatch patch) {
        Schedule stored = schedules.get(id);
        if (stored == null) {
            throw new ScheduleNotFoundException(id);
        }
        patch.applyTo(stored);
        onChanged();
        return copy(stored);
    }

    @Override
    public synchronized boolean deleteSchedule(long id) {
        boolean removed = schedules.remove(id) != null;
        if (removed) {
            onChanged();
        }
        return removed;
    }

    @Override
    public synchronized long recordExecution(long scheduleId, long sessionId, Instant startedAt) {
        long id = ++lastExecutionId;
        executions.put(id, Execution.builder()
                .id(id)
                .scheduleId(scheduleId)
                .sessionId(sessionId)
                .startedAt(startedAt)
                .build());
        onChanged();
        log.debug("Execution {} opened for schedule {}", id, scheduleId);
        return id;
    }

    @Override
    public synchronized Execution updateExecution(long executionId, ExecutionPatch patch) {
        Execution stored = executions.get(executionId);
        if (stored == null) {
            throw new IllegalArgumentException("Execution not found: " + executionId);
        }
        if (stored.getStatus().isFinal()) {
            throw new IllegalStateException(
                    "Execution " + executionId + " is already " + stored.getStatus());
        }
        patch.applyTo(stored);
        onChanged();
        return stored.toBuilder().build();
    }

    @Override
    public synchronized Optional<Execution> getExecution(long executionId) {
        return Optional.ofNullable(executions.get(executionId)).map(e -> e.toBuilder().build());
    }

    @Override
    public synchronized List<Execution> getExecutionHistory(long scheduleId, int limit) {
        return executions.values().stream()
                .filter(e -> e.getScheduleId() == scheduleId)
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .map(e -> e.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized List<Execution> getAllExecutions(int limit) {
        return executions.values().stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .map(e -> e.toBuilder().build())
                .toList();
    }

    @Override
    public synchronized Optional<SessionCounters> findSessionCounters(long sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public synchronized void putSessionCounters(long sessionId, SessionCounters counters) {
        sessions.put(sessionId, counters);
        onChanged();
    }

    /**
     * Called with the monitor held after every mutation.
     */
    protected void onChanged() {
    }

    private static Schedule copy(Schedule schedule) {
        return schedule.toBuilder().build();
    }
}
