package com.sitecrawler.scheduler.executor;

import com.sitecrawler.common.config.SchedulerConfig;
import com.sitecrawler.common.infra.ErrorUtils;
import com.sitecrawler.common.infra.FormatDuration;
import com.sitecrawler.common.logging.SubsystemLogger;
import com.sitecrawler.scheduler.ScheduleBusyException;
import com.sitecrawler.scheduler.ScheduleDisabledException;
import com.sitecrawler.scheduler.ScheduleNotFoundException;
import com.sitecrawler.scheduler.cron.CronExpressionEngine;
import com.sitecrawler.scheduler.cron.CronValidation;
import com.sitecrawler.scheduler.model.Execution;
import com.sitecrawler.scheduler.model.ExecutionPatch;
import com.sitecrawler.scheduler.model.ExecutionStatus;
import com.sitecrawler.scheduler.model.Schedule;
import com.sitecrawler.scheduler.model.SchedulePatch;
import com.sitecrawler.scheduler.model.SessionCounters;
import com.sitecrawler.scheduler.notify.Notifier;
import com.sitecrawler.scheduler.store.ScheduleStore;
import com.sitecrawler.scheduler.worker.JobConfig;
import com.sitecrawler.scheduler.worker.JobExecutionException;
import com.sitecrawler.scheduler.worker.JobHooks;
import com.sitecrawler.scheduler.worker.JobOutcome;
import com.sitecrawler.scheduler.worker.JobWorker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Polls the schedule store for due schedules and runs them.
 *
 * <p>
 * One timer thread drives the poll passes and the delayed retries; runs are
 * dispatched to a separate pool so a slow worker never delays a pass. Each
 * schedule has at most one run in flight ({@link ActiveRunSet}) and at most
 * {@code maxConcurrentRuns} runs are active overall. A due schedule that finds
 * the cap reached is skipped and stays due for the next pass; there is no
 * queue, so under sustained saturation a schedule can be passed over
 * indefinitely.
 *
 * <p>
 * Runs are not cancellable and have no timeout: {@link #stop()} only halts
 * future passes and retries, in-flight runs continue to completion, and a hung
 * worker keeps its slot.
 */
@Slf4j
public class ScheduleExecutor implements AutoCloseable {

    private static final SubsystemLogger JOB_LOG = SubsystemLogger.create("scheduler/job");

    private final ScheduleStore store;
    private final JobWorker jobWorker;
    private final Notifier notifier;
    private final CronExpressionEngine cronEngine;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor timer;
    private final ExecutorService runPool;
    private final ActiveRunSet activeRuns = new ActiveRunSet();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile SchedulerConfig config;
    private ScheduledFuture<?> pollTask; // guarded by this
    // bumped on every start, so a pass left over from an earlier start stops launching
    private volatile long pollGeneration;

    public ScheduleExecutor(ScheduleStore store, JobWorker jobWorker, Notifier notifier, SchedulerConfig config) {
        this(store, jobWorker, notifier, new CronExpressionEngine(), config, Clock.systemUTC());
    }

    public ScheduleExecutor(ScheduleStore store,
            JobWorker jobWorker,
            Notifier notifier,
            CronExpressionEngine cronEngine,
            SchedulerConfig config,
            Clock clock) {
        this.store = store;
        this.jobWorker = jobWorker;
        this.notifier = notifier;
        this.cronEngine = cronEngine;
        this.config = (config != null ? config : SchedulerConfig.defaults()).validate();
        this.clock = clock;

        this.timer = new ScheduledThreadPoolExecutor(1, daemonThreads("schedule-timer"));
        this.timer.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.timer.setRemoveOnCancelPolicy(true);
        this.runPool = Executors.newCachedThreadPool(daemonThreads("schedule-run"));
    }

    // --- Lifecycle ---

    /**
     * Run a pass now and then every {@code checkIntervalMs}. No-op with a
     * warning if already running.
     *
     * @throws IllegalStateException if the executor has been closed
     */
    public synchronized void start() {
        if (timer.isShutdown()) {
            throw new IllegalStateException("Schedule executor is closed");
        }
        if (!running.compareAndSet(false, true)) {
            log.warn("Schedule executor is already running");
            return;
        }
        SchedulerConfig cfg = config;
        log.info("Starting schedule executor (checkInterval: {}, maxConcurrentRuns: {}, retryFailed: {}, retryDelay: {})",
                FormatDuration.formatMs(cfg.getCheckIntervalMs()), cfg.getMaxConcurrentRuns(),
                cfg.isRetryFailedSchedules(), FormatDuration.formatMs(cfg.getRetryDelayMs()));
        Instant now = clock.instant();
        log.info("Cron uses server local time; stored timestamps are UTC (zone: {}, local: {}, utc: {})",
                cronEngine.getZone(), now.atZone(cronEngine.getZone()).toLocalDateTime(), now);

        long generation = ++pollGeneration;
        try {
            pollTask = timer.scheduleAtFixedRate(() -> runSchedulingPass(() -> isCurrentPoll(generation)),
                    0, cfg.getCheckIntervalMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            running.set(false);
            throw new IllegalStateException("Schedule executor is closed", e);
        }
        log.info("Schedule executor started");
    }

    /**
     * Halt future passes and new launches; a pass already in progress stops
     * before its next launch. In-flight runs are not interrupted. No-op with a
     * warning if not running.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            log.warn("Schedule executor is not running");
            return;
        }
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        log.info("Schedule executor stopped ({} runs still in flight)", activeRuns.size());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Merge {@code patch} into the current configuration; a running executor
     * is restarted so the new interval takes effect.
     *
     * @throws IllegalArgumentException if the merged configuration is invalid
     */
    public synchronized void updateConfig(SchedulerConfig.Patch patch) {
        this.config = config.merge(patch).validate();
        log.info("Scheduler configuration updated: {}", config);
        if (running.get()) {
            stop();
            start();
        }
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public ExecutorStatus getStatus() {
        SchedulerConfig cfg = config;
        return new ExecutorStatus(running.get(), activeRuns.size(), cfg.getMaxConcurrentRuns(),
                cfg.getCheckIntervalMs());
    }

    public List<ActiveRun> getActiveRuns() {
        return activeRuns.snapshot();
    }

    public ScheduleStore getScheduleStore() {
        return store;
    }

    // --- Triggers ---

    /**
     * Run a schedule now, outside its cron timing.
     *
     * @return completes with the finalized execution, or exceptionally with a
     *         {@link JobExecutionException} once a failed run has been recorded
     * @throws ScheduleNotFoundException if no schedule has {@code scheduleId}
     * @throws ScheduleDisabledException if the schedule is disabled
     * @throws ScheduleBusyException     if the schedule is already running or
     *                                   the concurrency cap is reached
     */
    public CompletableFuture<Execution> triggerSchedule(long scheduleId) {
        Schedule schedule = store.getSchedule(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        if (!schedule.isEnabled()) {
            throw new ScheduleDisabledException(scheduleId);
        }
        log.info("Manually triggering schedule {} ({})", scheduleId, schedule.getName());
        return launch(schedule, Trigger.MANUAL);
    }

    void runSchedulingPass() {
        runSchedulingPass(() -> true);
    }

    private boolean isCurrentPoll(long generation) {
        return running.get() && pollGeneration == generation;
    }

    /**
     * One poll pass: launch every due schedule that is not already running,
     * while capacity lasts and {@code keepLaunching} holds. Never throws.
     */
    void runSchedulingPass(BooleanSupplier keepLaunching) {
        try {
            List<Schedule> due = store.getSchedulesToRun(clock.instant());
            if (due.isEmpty()) {
                return;
            }
            log.info("Found {} schedules to run", due.size());

            for (Schedule schedule : due) {
                if (!keepLaunching.getAsBoolean()) {
                    log.info("Executor stopped during pass; not launching remaining due schedules");
                    break;
                }
                try {
                    launch(schedule, Trigger.SCHEDULED);
                } catch (ScheduleBusyException e) {
                    if (e.getReason() == ScheduleBusyException.Reason.ALREADY_RUNNING) {
                        log.debug("Schedule {} already running", schedule.getId());
                    } else {
                        log.warn("Max concurrent runs reached, skipping schedule {} (active runs: {})",
                                schedule.getId(), activeRuns.size());
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to launch schedule {}: {}", schedule.getId(), e.getMessage(), e);
                }
            }
        } catch (Exception e) {
            log.error("Error checking schedules: {}", e.getMessage(), e);
        }
    }

    /**
     * Register the run in the active set, dispatch it, and release the slot
     * when it settles, whatever the outcome.
     */
    private CompletableFuture<Execution> launch(Schedule schedule, Trigger trigger) {
        long scheduleId = schedule.getId();
        ActiveRun handle = activeRuns.tryAcquire(scheduleId, trigger, config.getMaxConcurrentRuns(),
                clock.instant());

        CompletableFuture<Execution> settled;
        try {
            settled = CompletableFuture
                    .supplyAsync(() -> executeSchedule(schedule, trigger), runPool)
                    .thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            settled = CompletableFuture.failedFuture(e);
        }
        return settled.whenComplete((execution, error) -> {
            activeRuns.release(scheduleId, handle);
            if (error != null && !(ErrorUtils.unwrap(error) instanceof JobExecutionException)) {
                log.error("Run of schedule {} ended without being recorded: {}",
                        scheduleId, ErrorUtils.formatErrorMessage(error), ErrorUtils.unwrap(error));
            }
        });
    }

    // --- Single execution ---

    private CompletableFuture<Execution> executeSchedule(Schedule schedule, Trigger trigger) {
        Instant startedAt = clock.instant();
        log.info("Starting scheduled crawl (schedule: {}, name: {}, url: {}, trigger: {})",
                schedule.getId(), schedule.getName(), schedule.getStartUrl(), trigger);

        notifySafely("Crawler started: " + schedule.getName(), String.join("\n",
                "Schedule: " + schedule.getName() + " (ID: " + schedule.getId() + ")",
                "URL: " + schedule.getStartUrl(),
                "Started: " + startedAt,
                "Mode: " + schedule.getMode(),
                "Concurrency: " + schedule.getMaxConcurrency(),
                "Trigger: " + trigger));

        long executionId = store.recordExecution(schedule.getId(), 0, startedAt);

        CompletableFuture<JobOutcome> job;
        try {
            job = jobWorker.execute(JobConfig.fromSchedule(schedule), hooksFor(schedule));
            if (job == null) {
                job = CompletableFuture.failedFuture(new JobExecutionException("Job worker returned no result"));
            }
        } catch (RuntimeException e) {
            job = CompletableFuture.failedFuture(e);
        }

        return job.handle((outcome, error) -> {
            if (error == null) {
                return onSuccess(schedule, executionId, startedAt, outcome);
            }
            throw onFailure(schedule, executionId, startedAt, error);
        });
    }

    private Execution onSuccess(Schedule schedule, long executionId, Instant startedAt, JobOutcome outcome) {
        Instant completedAt = clock.instant();
        long durationMs = Duration.between(startedAt, completedAt).toMillis();
        SessionCounters counters = countersFor(outcome);

        Execution execution = store.updateExecution(executionId, ExecutionPatch.builder()
                .sessionId(outcome != null ? outcome.sessionId() : 0L)
                .status(ExecutionStatus.COMPLETED)
                .completedAt(completedAt)
                .durationMs(durationMs)
                .pagesCrawled(counters.pagesCrawled())
                .resourcesFound(counters.resourcesFound())
                .build());

        notifySafely("Crawler completed: " + schedule.getName(), String.join("\n",
                "Schedule: " + schedule.getName() + " (ID: " + schedule.getId() + ")",
                "URL: " + schedule.getStartUrl(),
                "Status: completed",
                "Duration: " + FormatDuration.formatRoundedSeconds(durationMs),
                "Pages: " + counters.pagesCrawled(),
                "Resources: " + counters.resourcesFound(),
                "Finished: " + completedAt));

        updateStatistics(schedule, completedAt, true);
        log.info("Scheduled crawl completed successfully (schedule: {}, duration: {}, execution: {})",
                schedule.getId(), FormatDuration.formatMs(durationMs), executionId);
        return execution;
    }

    private JobExecutionException onFailure(Schedule schedule, long executionId, Instant startedAt, Throwable error) {
        Throwable cause = ErrorUtils.unwrap(error);
        String message = ErrorUtils.formatErrorMessage(cause);
        log.error("Scheduled crawl failed (schedule: {}): {}", schedule.getId(), message, cause);

        JobExecutionException failure = cause instanceof JobExecutionException jobError
                ? jobError
                : new JobExecutionException(message, cause);
        JobOutcome partial = failure.getPartialOutcome();
        SessionCounters counters = partial != null ? countersFor(partial) : SessionCounters.EMPTY;

        Instant completedAt = clock.instant();
        long durationMs = Duration.between(startedAt, completedAt).toMillis();
        try {
            store.updateExecution(executionId, ExecutionPatch.builder()
                    .sessionId(partial != null ? partial.sessionId() : 0L)
                    .status(ExecutionStatus.FAILED)
                    .completedAt(completedAt)
                    .errorMessage(message)
                    .durationMs(durationMs)
                    .pagesCrawled(counters.pagesCrawled())
                    .resourcesFound(counters.resourcesFound())
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to record failed execution {} of schedule {}: {}",
                    executionId, schedule.getId(), e.getMessage(), e);
        }

        notifySafely("Crawler failed: " + schedule.getName(), String.join("\n",
                "Schedule: " + schedule.getName() + " (ID: " + schedule.getId() + ")",
                "URL: " + schedule.getStartUrl(),
                "Status: failed",
                "Error: " + message,
                "Duration: " + FormatDuration.formatRoundedSeconds(durationMs),
                "Pages: " + counters.pagesCrawled(),
                "Resources: " + counters.resourcesFound(),
                "Finished: " + completedAt));

        updateStatistics(schedule, completedAt, false);

        SchedulerConfig cfg = config;
        if (cfg.isRetryFailedSchedules()) {
            scheduleRetry(schedule.getId(), cfg.getRetryDelayMs());
        }
        return failure;
    }

    /**
     * Bump the run counters and move {@code nextRun} forward. Reads the
     * schedule afresh so owner edits made during the run are kept.
     */
    private void updateStatistics(Schedule schedule, Instant finishedAt, boolean success) {
        long scheduleId = schedule.getId();
        try {
            Optional<Schedule> current = store.getSchedule(scheduleId);
            if (current.isEmpty()) {
                log.warn("Schedule {} was deleted while running; statistics not updated", scheduleId);
                return;
            }
            Schedule latest = current.get();
            SchedulePatch.SchedulePatchBuilder patch = SchedulePatch.builder()
                    .lastRun(finishedAt)
                    .nextRun(nextRunAfter(latest.getCronExpression(), finishedAt))
                    .totalRuns(latest.getTotalRuns() + 1);
            if (success) {
                patch.successfulRuns(latest.getSuccessfulRuns() + 1);
            } else {
                patch.failedRuns(latest.getFailedRuns() + 1);
            }
            store.updateSchedule(scheduleId, patch.build());
        } catch (ScheduleNotFoundException e) {
            log.warn("Schedule {} was deleted while running; statistics not updated", scheduleId);
        } catch (RuntimeException e) {
            log.error("Failed to update statistics of schedule {}: {}", scheduleId, e.getMessage(), e);
        }
    }

    private Instant nextRunAfter(String cronExpression, Instant from) {
        CronValidation validation = cronEngine.validate(cronExpression);
        if (validation.valid()) {
            return cronEngine.computeNextRun(cronEngine.parse(cronExpression), from);
        }
        log.warn("Stored cron expression '{}' no longer validates ({}); next run in an hour",
                cronExpression, validation.error());
        return cronEngine.fallbackNextRun(from);
    }

    private SessionCounters countersFor(JobOutcome outcome) {
        if (outcome == null) {
            return SessionCounters.EMPTY;
        }
        SessionCounters reported = new SessionCounters(outcome.itemCount(), outcome.resourceCount());
        if (outcome.sessionId() <= 0) {
            return reported;
        }
        return store.findSessionCounters(outcome.sessionId()).orElse(reported);
    }

    // --- Retry ---

    private void scheduleRetry(long scheduleId, long delayMs) {
        log.info("Scheduling retry for failed crawl (schedule: {}, retryDelay: {})",
                scheduleId, FormatDuration.formatMs(delayMs));
        try {
            timer.schedule(() -> retry(scheduleId), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Retry of schedule {} not scheduled: executor is closed", scheduleId);
        }
    }

    private void retry(long scheduleId) {
        try {
            if (!running.get()) {
                log.info("Skipping retry of schedule {}: executor is stopped", scheduleId);
                return;
            }
            Optional<Schedule> schedule = store.getSchedule(scheduleId);
            if (schedule.isEmpty()) {
                log.info("Skipping retry of schedule {}: schedule was deleted", scheduleId);
                return;
            }
            if (!schedule.get().isEnabled()) {
                log.info("Skipping retry of schedule {}: schedule is disabled", scheduleId);
                return;
            }
            log.info("Retrying failed schedule {}", scheduleId);
            launch(schedule.get(), Trigger.RETRY);
        } catch (ScheduleBusyException e) {
            log.warn("Retry of schedule {} skipped: {}", scheduleId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Retry of schedule {} failed to launch: {}", scheduleId, e.getMessage(), e);
        }
    }

    // --- Helpers ---

    private JobHooks hooksFor(Schedule schedule) {
        SubsystemLogger jobLog = JOB_LOG.child("schedule-" + schedule.getId());
        String name = schedule.getName();
        return new JobHooks() {
            @Override
            public void onLog(String message) {
                jobLog.info("[" + name + "] " + message);
            }

            @Override
            public void onItem(String ref) {
                jobLog.debug("[" + name + "] Page processed: " + ref);
            }

            @Override
            public void onDone(long count) {
                jobLog.info("[" + name + "] Crawl completed", Map.of("pages", count));
            }
        };
    }

    private void notifySafely(String subject, String body) {
        try {
            notifier.send(subject, body);
        } catch (RuntimeException e) {
            log.warn("Notification '{}' failed: {}", subject, e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Stop polling and release the threads. Pending retries are dropped;
     * in-flight runs are left to finish on their own.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (running.get()) {
                stop();
            }
        }
        timer.shutdown();
        runPool.shutdown();
        try {
            if (!timer.awaitTermination(5, TimeUnit.SECONDS)) {
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            timer.shutdownNow();
        }
    }
}
