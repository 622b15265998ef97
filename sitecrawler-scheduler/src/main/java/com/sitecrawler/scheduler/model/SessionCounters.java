package com.sitecrawler.scheduler.model;

/**
 * Result counters of one crawl session.
 */
public record SessionCounters(long pagesCrawled, long resourcesFound) {

    public static final SessionCounters EMPTY = new SessionCounters(0, 0);
}
