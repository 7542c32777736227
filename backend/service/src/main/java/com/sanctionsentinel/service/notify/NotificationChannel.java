package com.sanctionsentinel.service.notify;

/**
 * One delivery target. Implementations signal whether a failure is worth retrying through
 * {@link NotificationException#retryable()}.
 */
public interface NotificationChannel {
    String id();

    void send(NotificationPayload payload) throws NotificationException;
}
