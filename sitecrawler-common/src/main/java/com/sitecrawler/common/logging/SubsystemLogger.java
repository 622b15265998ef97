package com.sitecrawler.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * SLF4J wrapper that tags every line with a subsystem path.
 *
 * <p>
 * The subsystem becomes part of the logger name ({@code sitecrawler.<subsystem>})
 * so levels can be tuned per subsystem in logback.xml, and is also put in the
 * MDC under {@code subsystem} while the line is emitted.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("scheduler/job");
 * log.info("Crawl completed", Map.of("scheduleId", 7));
 * SubsystemLogger child = log.child("nightly");
 * </pre>
 */
public class SubsystemLogger {

    static final String MDC_SUBSYSTEM = "subsystem";

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        this.logger = LoggerFactory.getLogger("sitecrawler." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /**
     * Create a child logger with extended subsystem path.
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    public void trace(String message) {
        log(LogLevel.TRACE, message, null);
    }

    public void debug(String message) {
        log(LogLevel.DEBUG, message, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        log(LogLevel.DEBUG, message, meta);
    }

    public void info(String message) {
        log(LogLevel.INFO, message, null);
    }

    public void info(String message, Map<String, Object> meta) {
        log(LogLevel.INFO, message, meta);
    }

    public void warn(String message) {
        log(LogLevel.WARN, message, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        log(LogLevel.WARN, message, meta);
    }

    public void error(String message) {
        log(LogLevel.ERROR, message, null);
    }

    public void error(String message, Map<String, Object> meta) {
        log(LogLevel.ERROR, message, meta);
    }

    public void error(String message, Throwable t) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            logger.error(formatMessage(message, null), t);
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    /**
     * Emit at a level chosen at runtime.
     */
    public void log(LogLevel level, String message, Map<String, Object> meta) {
        if (!isEnabled(level))
            return;
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case INFO -> logger.info(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> logger.error(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    public boolean isEnabled(LogLevel level) {
        return switch (level) {
            case TRACE -> logger.isTraceEnabled();
            case DEBUG -> logger.isDebugEnabled();
            case INFO -> logger.isInfoEnabled();
            case WARN -> logger.isWarnEnabled();
            case ERROR -> logger.isErrorEnabled();
        };
    }

    public String getSubsystem() {
        return subsystem;
    }

    public Logger getSlf4jLogger() {
        return logger;
    }

    String formatMessage(String message, Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return "[" + subsystem + "] " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}
