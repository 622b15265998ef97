package com.sitecrawler.scheduler.model;

import java.time.Instant;

/**
 * Run statistics of a schedule.
 *
 * @param successRate       successful runs as a percentage of total runs, 0 when
 *                          never run
 * @param averageDurationMs mean duration of recent finalized executions
 */
public record ScheduleStats(
        int totalRuns,
        int successfulRuns,
        int failedRuns,
        double successRate,
        double averageDurationMs,
        Instant lastRun,
        Instant nextRun) {
}
