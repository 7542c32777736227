package com.sanctionsentinel.sources.api;

import com.sanctionsentinel.core.model.SanctionsSource;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit source-to-adapter table, built once at startup and handed to the orchestrator.
 */
public final class SourceRegistry {
    private final Map<SanctionsSource, SourceAdapter> adapters;

    private SourceRegistry(Map<SanctionsSource, SourceAdapter> adapters) {
        this.adapters = Collections.unmodifiableMap(new EnumMap<>(adapters));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SourceAdapter> find(SanctionsSource source) {
        return Optional.ofNullable(adapters.get(source));
    }

    public SourceAdapter require(SanctionsSource source) {
        return find(source).orElseThrow(() -> new IllegalArgumentException("No adapter registered for " + source));
    }

    public boolean supports(SanctionsSource source) {
        return adapters.containsKey(source);
    }

    public Collection<SourceAdapter> adapters() {
        return adapters.values();
    }

    public static final class Builder {
        private final Map<SanctionsSource, SourceAdapter> adapters = new EnumMap<>(SanctionsSource.class);

        private Builder() {
        }

        public Builder register(SourceAdapter adapter) {
            SourceAdapter existing = adapters.putIfAbsent(adapter.source(), adapter);
            if (existing != null) {
                throw new IllegalStateException("Adapter already registered for " + adapter.source()
                        + ": " + existing.getClass().getSimpleName());
            }
            return this;
        }

        public SourceRegistry build() {
            return new SourceRegistry(adapters);
        }
    }
}
