package com.sanctionsentinel.core.diff;

import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ChangeType;
import com.sanctionsentinel.core.model.RiskLevel;

import java.util.Collection;

public record DetectionSummary(
        int added,
        int modified,
        int removed,
        int critical,
        int high,
        int medium,
        int low
) {
    public static DetectionSummary of(Collection<ChangeEvent> events) {
        return new DetectionSummary(
                count(events, ChangeType.ADDED),
                count(events, ChangeType.MODIFIED),
                count(events, ChangeType.REMOVED),
                count(events, RiskLevel.CRITICAL),
                count(events, RiskLevel.HIGH),
                count(events, RiskLevel.MEDIUM),
                count(events, RiskLevel.LOW)
        );
    }

    public int total() {
        return added + modified + removed;
    }

    private static int count(Collection<ChangeEvent> events, ChangeType type) {
        return (int) events.stream().filter(event -> event.changeType() == type).count();
    }

    private static int count(Collection<ChangeEvent> events, RiskLevel level) {
        return (int) events.stream().filter(event -> event.riskLevel() == level).count();
    }
}
