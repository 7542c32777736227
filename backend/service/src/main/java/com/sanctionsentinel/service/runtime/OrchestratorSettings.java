package com.sanctionsentinel.service.runtime;

import java.time.Duration;
import java.util.Objects;

public record OrchestratorSettings(int workerThreads, Duration maxRunLifetime, boolean suppressBaselineNotifications) {
    public OrchestratorSettings {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        Objects.requireNonNull(maxRunLifetime, "maxRunLifetime is required");
    }

    public static OrchestratorSettings defaults() {
        return new OrchestratorSettings(4, Duration.ofHours(2), true);
    }
}
