package com.sitecrawler.scheduler;

/**
 * No schedule exists with the requested id.
 */
public class ScheduleNotFoundException extends RuntimeException {

    private final long scheduleId;

    public ScheduleNotFoundException(long scheduleId) {
        super("Schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public long getScheduleId() {
        return scheduleId;
    }
}
