package com.sanctionsentinel.service.config;

import com.sanctionsentinel.service.runtime.OrchestratorSettings;

import java.time.Duration;
import java.util.Map;

public record ServiceConfig(
        int apiPort,
        String stateFile,
        String eventLogFile,
        String archiveDir,
        int workerThreads,
        int maxConcurrentDownloads,
        long maxRunLifetimeMinutes,
        long sweepIntervalSeconds,
        Boolean suppressBaselineNotifications,
        int retentionDays,
        long retentionIntervalHours,
        RetrySettings retry,
        NotificationSettings notifications
) {
    public ServiceConfig {
        apiPort = apiPort <= 0 ? 8080 : apiPort;
        stateFile = stateFile == null || stateFile.isBlank() ? "state/sanctions.json" : stateFile;
        eventLogFile = eventLogFile == null || eventLogFile.isBlank() ? "logs/events.jsonl" : eventLogFile;
        workerThreads = workerThreads <= 0 ? 4 : workerThreads;
        maxConcurrentDownloads = maxConcurrentDownloads <= 0 ? 4 : maxConcurrentDownloads;
        maxRunLifetimeMinutes = maxRunLifetimeMinutes <= 0 ? 120 : maxRunLifetimeMinutes;
        sweepIntervalSeconds = sweepIntervalSeconds <= 0 ? 60 : sweepIntervalSeconds;
        suppressBaselineNotifications = suppressBaselineNotifications == null || suppressBaselineNotifications;
        retentionDays = retentionDays <= 0 ? 90 : retentionDays;
        retentionIntervalHours = retentionIntervalHours <= 0 ? 24 : retentionIntervalHours;
        retry = retry == null ? RetrySettings.defaults() : retry;
        notifications = notifications == null ? NotificationSettings.defaults() : notifications;
    }

    public static ServiceConfig defaults() {
        return new ServiceConfig(0, null, null, null, 0, 0, 0, 0, null, 0, 0, null, null);
    }

    public OrchestratorSettings orchestratorSettings() {
        return new OrchestratorSettings(workerThreads, Duration.ofMinutes(maxRunLifetimeMinutes),
                suppressBaselineNotifications);
    }

    public Duration sweepInterval() {
        return Duration.ofSeconds(sweepIntervalSeconds);
    }

    public Duration retention() {
        return Duration.ofDays(retentionDays);
    }

    public Duration retentionInterval() {
        return Duration.ofHours(retentionIntervalHours);
    }

    /**
     * Applies {@code API_PORT}, {@code WEBHOOK_URL} and {@code CHAT_WEBHOOK_URL} overrides.
     */
    public ServiceConfig withEnvironment(Map<String, String> environment) {
        int port = apiPort;
        String portRaw = environment.get("API_PORT");
        if (portRaw != null && !portRaw.isBlank()) {
            try {
                port = Integer.parseInt(portRaw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("API_PORT must be a number, got " + portRaw, e);
            }
        }
        String webhook = firstNonBlank(environment.get("WEBHOOK_URL"), notifications.webhookUrl());
        String chat = firstNonBlank(environment.get("CHAT_WEBHOOK_URL"), notifications.chatWebhookUrl());
        return new ServiceConfig(port, stateFile, eventLogFile, archiveDir, workerThreads, maxConcurrentDownloads,
                maxRunLifetimeMinutes, sweepIntervalSeconds, suppressBaselineNotifications, retentionDays,
                retentionIntervalHours, retry,
                notifications.withWebhooks(webhook, chat));
    }

    private static String firstNonBlank(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }
}
