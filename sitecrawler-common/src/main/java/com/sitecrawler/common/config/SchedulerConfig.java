package com.sitecrawler.common.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Schedule executor settings.
 *
 * <p>
 * Instances handed to the executor are treated as values: {@link #merge}
 * returns a new config rather than mutating the receiver.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerConfig {

    public static final long DEFAULT_CHECK_INTERVAL_MS = 60_000;
    public static final int DEFAULT_MAX_CONCURRENT_RUNS = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 300_000;

    @Builder.Default
    private boolean enabled = true;
    @Builder.Default
    private long checkIntervalMs = DEFAULT_CHECK_INTERVAL_MS;
    @Builder.Default
    private int maxConcurrentRuns = DEFAULT_MAX_CONCURRENT_RUNS;
    @Builder.Default
    private boolean retryFailedSchedules = true;
    @Builder.Default
    private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
    /** IANA zone cron expressions are evaluated in; null means the system zone. */
    private String timeZone;

    public static SchedulerConfig defaults() {
        return SchedulerConfig.builder().build();
    }

    /**
     * Return a copy with every non-null field of {@code patch} applied.
     */
    public SchedulerConfig merge(Patch patch) {
        if (patch == null)
            return toBuilder().build();
        SchedulerConfigBuilder b = toBuilder();
        if (patch.getEnabled() != null)
            b.enabled(patch.getEnabled());
        if (patch.getCheckIntervalMs() != null)
            b.checkIntervalMs(patch.getCheckIntervalMs());
        if (patch.getMaxConcurrentRuns() != null)
            b.maxConcurrentRuns(patch.getMaxConcurrentRuns());
        if (patch.getRetryFailedSchedules() != null)
            b.retryFailedSchedules(patch.getRetryFailedSchedules());
        if (patch.getRetryDelayMs() != null)
            b.retryDelayMs(patch.getRetryDelayMs());
        if (patch.getTimeZone() != null)
            b.timeZone(patch.getTimeZone());
        return b.build();
    }

    /**
     * @throws IllegalArgumentException if a value is outside its allowed range
     */
    public SchedulerConfig validate() {
        if (checkIntervalMs <= 0)
            throw new IllegalArgumentException("scheduler.checkIntervalMs must be > 0, got " + checkIntervalMs);
        if (maxConcurrentRuns <= 0)
            throw new IllegalArgumentException("scheduler.maxConcurrentRuns must be > 0, got " + maxConcurrentRuns);
        if (retryDelayMs < 0)
            throw new IllegalArgumentException("scheduler.retryDelayMs must be >= 0, got " + retryDelayMs);
        return this;
    }

    /**
     * Partial scheduler settings; null fields leave the current value alone.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Patch {
        private Boolean enabled;
        private Long checkIntervalMs;
        private Integer maxConcurrentRuns;
        private Boolean retryFailedSchedules;
        private Long retryDelayMs;
        private String timeZone;
    }
}
