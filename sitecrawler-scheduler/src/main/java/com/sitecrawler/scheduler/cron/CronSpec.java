package com.sitecrawler.scheduler.cron;

import java.util.List;

/**
 * The five field tokens of a cron expression, in order.
 */
public record CronSpec(String minute, String hour, String dayOfMonth, String month, String dayOfWeek) {

    public List<String> fields() {
        return List.of(minute, hour, dayOfMonth, month, dayOfWeek);
    }

    @Override
    public String toString() {
        return String.join(" ", fields());
    }
}
