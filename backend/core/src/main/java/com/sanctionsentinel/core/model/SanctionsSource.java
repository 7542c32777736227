package com.sanctionsentinel.core.model;

import java.time.Duration;

public enum SanctionsSource {
    OFAC("US Treasury Office of Foreign Assets Control", Duration.ofHours(6)),
    UN("United Nations Security Council", Duration.ofHours(24)),
    EU("European Union", Duration.ofHours(24)),
    UK_HMT("UK HM Treasury", Duration.ofHours(24));

    private final String fullName;
    private final Duration defaultInterval;

    SanctionsSource(String fullName, Duration defaultInterval) {
        this.fullName = fullName;
        this.defaultInterval = defaultInterval;
    }

    public String fullName() {
        return fullName;
    }

    public Duration defaultInterval() {
        return defaultInterval;
    }

    /**
     * Case-insensitive lookup accepting either the enum name or its dashed form ({@code uk-hmt}).
     */
    public static SanctionsSource parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Source is required");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(java.util.Locale.ROOT);
        return SanctionsSource.valueOf(normalized);
    }
}
