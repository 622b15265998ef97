package com.sitecrawler.scheduler.executor;

/**
 * What started a run.
 */
public enum Trigger {
    /** A poll pass found the schedule due. */
    SCHEDULED,
    /** An owner called {@link ScheduleExecutor#triggerSchedule(long)}. */
    MANUAL,
    /** The delayed re-run after a failure. */
    RETRY
}
