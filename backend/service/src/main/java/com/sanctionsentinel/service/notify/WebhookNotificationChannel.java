package com.sanctionsentinel.service.notify;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts the structured payload, including every change event, as JSON.
 */
public class WebhookNotificationChannel extends HttpPostChannel {
    public WebhookNotificationChannel(HttpClient httpClient, URI endpoint, Duration timeout) {
        super("webhook", httpClient, endpoint, timeout);
    }

    @Override
    protected Object body(NotificationPayload payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", payload.kind());
        body.put("riskLevel", payload.riskLevel());
        body.put("subject", payload.subject());
        body.put("text", payload.text());
        body.put("createdAt", payload.createdAt());
        body.put("events", payload.events());
        return body;
    }
}
