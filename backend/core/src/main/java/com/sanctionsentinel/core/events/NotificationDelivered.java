package com.sanctionsentinel.core.events;

import com.sanctionsentinel.core.model.RiskLevel;

import java.time.Instant;

public record NotificationDelivered(
        Instant timestamp,
        String channel,
        RiskLevel riskLevel,
        int eventCount,
        int attempts
) implements Event {
    @Override
    public String type() {
        return "NotificationDelivered";
    }
}
