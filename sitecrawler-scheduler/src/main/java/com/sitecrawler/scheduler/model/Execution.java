package com.sitecrawler.scheduler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One attempt of a schedule. Created as {@link ExecutionStatus#RUNNING} when
 * the run starts and finalized once when it settles.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Execution {
    private long id;
    private long scheduleId;
    private long sessionId; // 0 when no crawl session was produced
    private Instant startedAt;
    private Instant completedAt;
    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.RUNNING;
    private String errorMessage;
    private long pagesCrawled;
    private long resourcesFound;
    private long durationMs;
}
