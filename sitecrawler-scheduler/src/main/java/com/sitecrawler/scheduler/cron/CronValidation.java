package com.sitecrawler.scheduler.cron;

import java.time.Instant;

/**
 * Outcome of {@link CronExpressionEngine#validate(String)}.
 *
 * @param valid   whether every field is well formed and in range
 * @param error   message naming the first failing field, null when valid
 * @param nextRun next run computed for a valid expression, null otherwise
 */
public record CronValidation(boolean valid, String error, Instant nextRun) {

    static CronValidation ok(Instant nextRun) {
        return new CronValidation(true, null, nextRun);
    }

    static CronValidation ok() {
        return new CronValidation(true, null, null);
    }

    static CronValidation invalid(String error) {
        return new CronValidation(false, error, null);
    }
}
