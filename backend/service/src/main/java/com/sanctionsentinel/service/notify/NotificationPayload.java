package com.sanctionsentinel.service.notify;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.RiskLevel;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record NotificationPayload(
        Kind kind,
        RiskLevel riskLevel,
        String subject,
        String text,
        List<ChangeEvent> events,
        Instant createdAt
) {
    public enum Kind {
        CRITICAL_ALERT,
        DIGEST
    }

    public NotificationPayload {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(riskLevel, "riskLevel is required");
        events = events == null ? List.of() : List.copyOf(events);
    }

    @JsonIgnore
    public List<String> eventIds() {
        return events.stream().map(ChangeEvent::eventId).toList();
    }
}
