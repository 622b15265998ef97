package com.sitecrawler.scheduler.worker;

/**
 * What a finished job produced.
 *
 * @param sessionId     crawl session the job wrote to, 0 if none
 * @param itemCount     pages processed
 * @param resourceCount resources discovered
 */
public record JobOutcome(long sessionId, long itemCount, long resourceCount) {
}
