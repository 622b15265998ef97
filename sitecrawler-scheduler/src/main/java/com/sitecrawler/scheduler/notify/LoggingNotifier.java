package com.sitecrawler.scheduler.notify;

import lombok.extern.slf4j.Slf4j;

/**
 * Notifier used when no delivery channel is configured: records the subject
 * in the log and drops the message.
 */
@Slf4j
public class LoggingNotifier implements Notifier {

    @Override
    public void send(String subject, String body) {
        log.debug("Notification skipped (delivery not configured): {}", subject);
    }
}
