package com.sitecrawler.scheduler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A recurring crawl: what to crawl, when (cron), and its run statistics.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Schedule {
    private long id;
    private String name;
    private String description;

    private String startUrl;
    private boolean allowSubdomains;
    @Builder.Default
    private int maxConcurrency = 5;
    @Builder.Default
    private CrawlMode mode = CrawlMode.HTML;
    private String userId;

    private String cronExpression; // e.g. "0 */6 * * *"
    @Builder.Default
    private boolean enabled = true;

    private Instant createdAt;
    private Instant lastRun;
    private Instant nextRun;
    private int totalRuns;
    private int successfulRuns;
    private int failedRuns;

    /**
     * Enabled and {@code nextRun} at or before {@code now}.
     */
    public boolean isDue(Instant now) {
        return enabled && nextRun != null && !nextRun.isAfter(now);
    }
}
