package com.sanctionsentinel.service.config;

import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.sources.api.SourceFetchConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-source scheduling and fetch overrides from {@code sources.json}. Unset values keep the
 * adapter's defaults; a source without {@code enabled} is scheduled.
 */
public record SourceSettings(
        SanctionsSource source,
        Boolean enabled,
        long intervalMinutes,
        String url,
        long requestTimeoutSeconds,
        long minRequestIntervalMillis
) {
    public SourceSettings {
        Objects.requireNonNull(source, "source is required");
        enabled = enabled == null || enabled;
    }

    public Duration interval() {
        return intervalMinutes > 0 ? Duration.ofMinutes(intervalMinutes) : source.defaultInterval();
    }

    public SourceFetchConfig applyTo(SourceFetchConfig defaults) {
        SourceFetchConfig config = url == null || url.isBlank() ? defaults : defaults.withUrl(url);
        Duration timeout = requestTimeoutSeconds > 0
                ? Duration.ofSeconds(requestTimeoutSeconds) : config.requestTimeout();
        Duration spacing = minRequestIntervalMillis > 0
                ? Duration.ofMillis(minRequestIntervalMillis) : config.minRequestInterval();
        return config.withTimeouts(timeout, spacing);
    }
}
