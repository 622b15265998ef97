package com.sitecrawler.scheduler.worker;

import java.util.concurrent.CompletableFuture;

/**
 * Performs the work a schedule triggers (a crawl).
 *
 * <p>
 * {@link #execute} should return promptly and complete the future when the
 * job settles: normally with a {@link JobOutcome}, exceptionally (ideally with
 * a {@link JobExecutionException}) when the job fails. The scheduler enforces
 * no timeout on the returned future.
 */
@FunctionalInterface
public interface JobWorker {

    CompletableFuture<JobOutcome> execute(JobConfig config, JobHooks hooks);
}
