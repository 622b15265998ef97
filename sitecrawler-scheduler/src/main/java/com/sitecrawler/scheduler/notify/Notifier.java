package com.sitecrawler.scheduler.notify;

/**
 * Best-effort outbound messaging about schedule runs.
 *
 * <p>
 * Implementations must not throw and must not block the caller on delivery.
 */
public interface Notifier {

    void send(String subject, String body);
}
