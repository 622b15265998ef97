package com.sitecrawler.scheduler.executor;

/**
 * Read-only snapshot of the executor.
 */
public record ExecutorStatus(boolean running, int activeRunCount, int maxConcurrentRuns, long checkIntervalMs) {
}
