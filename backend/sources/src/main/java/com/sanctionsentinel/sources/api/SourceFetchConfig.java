package com.sanctionsentinel.sources.api;

import com.sanctionsentinel.core.model.SanctionsSource;

import java.time.Duration;
import java.util.Objects;

public record SourceFetchConfig(
        SanctionsSource source,
        String url,
        String accept,
        Duration requestTimeout,
        Duration minRequestInterval
) {
    public SourceFetchConfig {
        Objects.requireNonNull(source, "source is required");
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required for " + source);
        }
        accept = accept == null || accept.isBlank() ? "*/*" : accept;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(60) : requestTimeout;
        minRequestInterval = minRequestInterval == null ? Duration.ZERO : minRequestInterval;
    }

    public SourceFetchConfig withUrl(String newUrl) {
        return new SourceFetchConfig(source, newUrl, accept, requestTimeout, minRequestInterval);
    }

    public SourceFetchConfig withTimeouts(Duration newRequestTimeout, Duration newMinRequestInterval) {
        return new SourceFetchConfig(source, url, accept, newRequestTimeout, newMinRequestInterval);
    }
}
