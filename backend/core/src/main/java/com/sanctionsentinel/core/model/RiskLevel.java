package com.sanctionsentinel.core.model;

public enum RiskLevel {
    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int priority;

    RiskLevel(int priority) {
        this.priority = priority;
    }

    /** Higher is more urgent. */
    public int priority() {
        return priority;
    }
}
