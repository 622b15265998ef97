package com.sitecrawler.scheduler;

/**
 * A launch was refused because the schedule already has a run in flight or
 * the global concurrency cap is reached.
 */
public class ScheduleBusyException extends RuntimeException {

    public enum Reason {
        ALREADY_RUNNING, AT_CAPACITY
    }

    private final long scheduleId;
    private final Reason reason;

    public ScheduleBusyException(long scheduleId, Reason reason) {
        super(reason == Reason.ALREADY_RUNNING
                ? "Schedule is already running: " + scheduleId
                : "Max concurrent runs reached, cannot start schedule: " + scheduleId);
        this.scheduleId = scheduleId;
        this.reason = reason;
    }

    public long getScheduleId() {
        return scheduleId;
    }

    public Reason getReason() {
        return reason;
    }
}
