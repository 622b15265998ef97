package com.sitecrawler.common.logging;

/**
 * Log levels understood by {@link SubsystemLogger}.
 */
public enum LogLevel {
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE
}
