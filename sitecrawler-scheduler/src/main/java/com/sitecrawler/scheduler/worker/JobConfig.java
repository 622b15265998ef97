package com.sitecrawler.scheduler.worker;

import com.sitecrawler.scheduler.model.CrawlMode;
import com.sitecrawler.scheduler.model.Schedule;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * What a triggered schedule asks the crawl worker to do.
 */
@Data
@Builder
public class JobConfig {

    public static final long DEFAULT_PER_HOST_DELAY_MS = 1000;
    public static final List<String> DEFAULT_DENY_PARAM_PREFIXES = List.of("utm_", "fbclid", "gclid");

    private String startUrl;
    private boolean allowSubdomains;
    private int maxConcurrency;
    @Builder.Default
    private long perHostDelayMs = DEFAULT_PER_HOST_DELAY_MS;
    @Builder.Default
    private List<String> denyParamPrefixes = DEFAULT_DENY_PARAM_PREFIXES;
    private CrawlMode mode;
    private long scheduleId;
    private String userId;

    public static JobConfig fromSchedule(Schedule schedule) {
        return JobConfig.builder()
                .startUrl(schedule.getStartUrl())
                .allowSubdomains(schedule.isAllowSubdomains())
                .maxConcurrency(schedule.getMaxConcurrency())
                .mode(schedule.getMode())
                .scheduleId(schedule.getId())
                .userId(schedule.getUserId())
                .build();
    }
}
