package com.sanctionsentinel.service.config;

import java.time.Duration;
import java.util.List;

/**
 * Channels are enabled by presence: a webhook URL enables that channel, a recipient list
 * enables email.
 */
public record NotificationSettings(
        long batchWindowSeconds,
        Boolean logEnabled,
        String webhookUrl,
        String chatWebhookUrl,
        List<String> emailRecipients,
        String emailOutboxFile,
        long requestTimeoutSeconds,
        RetrySettings retry
) {
    public NotificationSettings {
        batchWindowSeconds = batchWindowSeconds <= 0 ? 300 : batchWindowSeconds;
        logEnabled = logEnabled == null || logEnabled;
        emailRecipients = emailRecipients == null ? List.of() : List.copyOf(emailRecipients);
        emailOutboxFile = emailOutboxFile == null || emailOutboxFile.isBlank() ? "data/outbox.json" : emailOutboxFile;
        requestTimeoutSeconds = requestTimeoutSeconds <= 0 ? 10 : requestTimeoutSeconds;
        retry = retry == null ? new RetrySettings(3, 1_000, 30_000, 0.2) : retry;
    }

    public static NotificationSettings defaults() {
        return new NotificationSettings(0, null, null, null, List.of(), null, 0, null);
    }

    public Duration batchWindow() {
        return Duration.ofSeconds(batchWindowSeconds);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    NotificationSettings withWebhooks(String webhook, String chatWebhook) {
        return new NotificationSettings(batchWindowSeconds, logEnabled, webhook, chatWebhook, emailRecipients,
                emailOutboxFile, requestTimeoutSeconds, retry);
    }
}
