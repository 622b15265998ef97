package com.sitecrawler.scheduler.cron;

/**
 * The five cron fields with their value domains.
 */
enum CronField {
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day of month", 1, 31),
    MONTH("month", 1, 12),
    DAY_OF_WEEK("day of week", 0, 6);

    final String label;
    final int min;
    final int max;

    CronField(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    boolean inRange(int value) {
        return value >= min && value <= max;
    }
}
