package com.sanctionsentinel.service.notify;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Slack-compatible incoming webhook: a single {@code text} field.
 */
public class ChatNotificationChannel extends HttpPostChannel {
    public ChatNotificationChannel(HttpClient httpClient, URI endpoint, Duration timeout) {
        super("chat", httpClient, endpoint, timeout);
    }

    @Override
    protected Object body(NotificationPayload payload) {
        return Map.of("text", payload.text());
    }
}
