package com.sitecrawler.common.config;

import lombok.Data;

/**
 * Root configuration document ({@code sitecrawler.json}).
 */
@Data
public class SiteCrawlerConfig {

    /** Schedule polling and execution settings. */
    private SchedulerConfig scheduler;

    /** Outbound notification settings. */
    private NotifyConfig notify;

    /** Schedule store settings. */
    private StoreConfig store;

    @Data
    public static class NotifyConfig {
        /** Webhook receiving notification POSTs; delivery is off when unset. */
        private String webhookUrl;
        /** Recipient address forwarded to the webhook. */
        private String recipient;
        private long timeoutMs = 10_000;
    }

    @Data
    public static class StoreConfig {
        /** JSON file holding schedules and execution history. */
        private String path = "~/.sitecrawler/schedules.json";
    }
}
