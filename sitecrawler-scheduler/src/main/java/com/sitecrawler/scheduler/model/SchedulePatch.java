package com.sitecrawler.scheduler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial schedule update. Null fields are left unchanged.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SchedulePatch {
    private String name;
    private String description;
    private String startUrl;
    private Boolean allowSubdomains;
    private Integer maxConcurrency;
    private CrawlMode mode;
    private String cronExpression;
    private Boolean enabled;
    private Instant lastRun;
    private Instant nextRun;
    private Integer totalRuns;
    private Integer successfulRuns;
    private Integer failedRuns;

    /**
     * Apply the non-null fields to {@code target} in place.
     */
    public void applyTo(Schedule target) {
        if (name != null)
            target.setName(name);
        if (description != null)
            target.setDescription(description);
        if (startUrl != null)
            target.setStartUrl(startUrl);
        if (allowSubdomains != null)
            target.setAllowSubdomains(allowSubdomains);
        if (maxConcurrency != null)
            target.setMaxConcurrency(maxConcurrency);
        if (mode != null)
            target.setMode(mode);
        if (cronExpression != null)
            target.setCronExpression(cronExpression);
        if (enabled != null)
            target.setEnabled(enabled);
        if (lastRun != null)
            target.setLastRun(lastRun);
        if (nextRun != null)
            target.setNextRun(nextRun);
        if (totalRuns != null)
            target.setTotalRuns(totalRuns);
        if (successfulRuns != null)
            target.setSuccessfulRuns(successfulRuns);
        if (failedRuns != null)
            target.setFailedRuns(failedRuns);
    }
}
