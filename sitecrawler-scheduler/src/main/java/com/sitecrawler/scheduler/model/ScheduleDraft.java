package com.sitecrawler.scheduler.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-supplied fields for a new schedule; ids, timestamps and counters are
 * assigned on creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDraft {
    private String name;
    private String description;
    private String startUrl;
    private boolean allowSubdomains;
    @Builder.Default
    private int maxConcurrency = 5;
    @Builder.Default
    private CrawlMode mode = CrawlMode.HTML;
    private String userId;
    private String cronExpression;
    @Builder.Default
    private boolean enabled = true;
}
