package com.sanctionsentinel.core.events;

import com.sanctionsentinel.core.model.RiskLevel;

import java.time.Instant;

public record NotificationFailed(
        Instant timestamp,
        String channel,
        RiskLevel riskLevel,
        int eventCount,
        int attempts,
        String reason
) implements Event {
    @Override
    public String type() {
        return "NotificationFailed";
    }
}
