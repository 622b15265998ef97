package com.sitecrawler.scheduler;

/**
 * A manual trigger targeted a schedule whose {@code enabled} flag is off.
 */
public class ScheduleDisabledException extends RuntimeException {

    private final long scheduleId;

    public ScheduleDisabledException(long scheduleId) {
        super("Schedule is disabled: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public long getScheduleId() {
        return scheduleId;
    }
}
