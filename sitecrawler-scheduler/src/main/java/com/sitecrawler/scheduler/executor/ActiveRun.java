package com.sitecrawler.scheduler.executor;

import java.time.Instant;

/**
 * Handle of an in-flight run held in the {@link ActiveRunSet}.
 *
 * @param token unique per acquisition, so a stale handle can never release a
 *              newer run of the same schedule
 */
public record ActiveRun(long scheduleId, Trigger trigger, Instant startedAt, long token) {
}
