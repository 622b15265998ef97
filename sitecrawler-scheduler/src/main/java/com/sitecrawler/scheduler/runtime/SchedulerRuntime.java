package com.sitecrawler.scheduler.runtime;

import com.sitecrawler.common.config.ConfigService;
import com.sitecrawler.common.config.SchedulerConfig;
import com.sitecrawler.common.config.SiteCrawlerConfig;
import com.sitecrawler.scheduler.ScheduleManager;
import com.sitecrawler.scheduler.cron.CronExpressionEngine;
import com.sitecrawler.scheduler.executor.ScheduleExecutor;
import com.sitecrawler.scheduler.notify.LoggingNotifier;
import com.sitecrawler.scheduler.notify.Notifier;
import com.sitecrawler.scheduler.notify.WebhookNotifier;
import com.sitecrawler.scheduler.store.JsonFileScheduleStore;
import com.sitecrawler.scheduler.store.ScheduleStore;
import com.sitecrawler.scheduler.worker.JobWorker;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.function.Function;

/**
 * Wires the scheduler from configuration: JSON schedule store, notifier,
 * cron engine and executor around an injected {@link JobWorker}.
 *
 * <p>
 * The executor is started only when {@code scheduler.enabled} is true and the
 * {@code SITECRAWLER_SKIP_SCHEDULER} environment variable is not {@code 1}.
 */
@Slf4j
public class SchedulerRuntime implements AutoCloseable {

    static final String SKIP_ENV = "SITECRAWLER_SKIP_SCHEDULER";

    private final ScheduleStore store;
    private final Notifier notifier;
    private final CronExpressionEngine cronEngine;
    private final ScheduleExecutor executor;
    private final ScheduleManager manager;
    private final boolean schedulerEnabled;

    public SchedulerRuntime(ConfigService configService, JobWorker jobWorker) {
        this(configService, jobWorker, System::getenv);
    }

    SchedulerRuntime(ConfigService configService, JobWorker jobWorker, Function<String, String> env) {
        SiteCrawlerConfig cfg = configService.loadConfig();
        SchedulerConfig schedulerConfig = cfg.getScheduler().validate();

        this.store = new JsonFileScheduleStore(ConfigService.expandHome(cfg.getStore().getPath()));
        this.notifier = createNotifier(cfg.getNotify());
        this.cronEngine = new CronExpressionEngine(Clock.systemUTC(), resolveZone(schedulerConfig.getTimeZone()));
        this.executor = new ScheduleExecutor(store, jobWorker, notifier, cronEngine, schedulerConfig,
                Clock.systemUTC());
        this.manager = new ScheduleManager(store, cronEngine);
        this.schedulerEnabled = !"1".equals(env.apply(SKIP_ENV)) && schedulerConfig.isEnabled();
    }

    static Notifier createNotifier(SiteCrawlerConfig.NotifyConfig notifyConfig) {
        if (notifyConfig != null && notifyConfig.getWebhookUrl() != null
                && !notifyConfig.getWebhookUrl().isBlank()) {
            return new WebhookNotifier(notifyConfig);
        }
        return new LoggingNotifier();
    }

    static ZoneId resolveZone(String timeZone) {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timeZone.trim());
        } catch (DateTimeException e) {
            log.warn("Unknown scheduler.timeZone '{}', using system zone {}", timeZone, ZoneId.systemDefault());
            return ZoneId.systemDefault();
        }
    }

    /**
     * Start the executor if enabled.
     */
    public void start() {
        if (!schedulerEnabled) {
            log.info("scheduler: disabled by config or {}", SKIP_ENV);
            return;
        }
        executor.start();
    }

    public void stop() {
        if (executor.isRunning()) {
            executor.stop();
        }
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public ScheduleExecutor getExecutor() {
        return executor;
    }

    public ScheduleManager getManager() {
        return manager;
    }

    public ScheduleStore getStore() {
        return store;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    @Override
    public void close() {
        executor.close();
        if (notifier instanceof WebhookNotifier webhook) {
            webhook.shutdown();
        }
    }
}
