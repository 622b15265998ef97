package com.sitecrawler.scheduler.executor;

import com.sitecrawler.scheduler.ScheduleBusyException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-flight runs keyed by schedule id; at most one entry per schedule.
 *
 * <p>
 * The "already running" check, the capacity check and the insertion happen
 * under one lock, so overlapping poll passes, manual triggers and retries can
 * neither double-book a schedule nor overshoot the cap.
 */
public class ActiveRunSet {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, ActiveRun> runs = new LinkedHashMap<>();
    private final AtomicLong tokens = new AtomicLong();

    /**
     * Register a run for {@code scheduleId}.
     *
     * @return the handle to pass to {@link #release}
     * @throws ScheduleBusyException if the schedule is already running or
     *                               {@code maxConcurrentRuns} runs are active
     */
    public ActiveRun tryAcquire(long scheduleId, Trigger trigger, int maxConcurrentRuns, Instant now) {
        lock.lock();
        try {
            if (runs.containsKey(scheduleId)) {
                throw new ScheduleBusyException(scheduleId, ScheduleBusyException.Reason.ALREADY_RUNNING);
            }
            if (runs.size() >= maxConcurrentRuns) {
                throw new ScheduleBusyException(scheduleId, ScheduleBusyException.Reason.AT_CAPACITY);
            }
            ActiveRun run = new ActiveRun(scheduleId, trigger, now, tokens.incrementAndGet());
            runs.put(scheduleId, run);
            return run;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the entry if it is still {@code handle}.
     *
     * @return whether the entry was removed
     */
    public boolean release(long scheduleId, ActiveRun handle) {
        lock.lock();
        try {
            return runs.remove(scheduleId, handle);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(long scheduleId) {
        lock.lock();
        try {
            return runs.containsKey(scheduleId);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return runs.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Active runs in acquisition order.
     */
    public List<ActiveRun> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(runs.values());
        } finally {
            lock.unlock();
        }
    }
}
