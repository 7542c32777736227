package com.sanctionsentinel.core.model;

public record RunMetrics(
        int entitiesProcessed,
        int entitiesAdded,
        int entitiesModified,
        int entitiesRemoved,
        int recordsSkipped,
        int criticalChanges,
        int highRiskChanges,
        int mediumRiskChanges,
        int lowRiskChanges,
        long downloadMillis,
        long parseMillis,
        long diffMillis,
        long storeMillis,
        String contentHash,
        long sizeBytes
) {
    public static RunMetrics empty() {
        return new RunMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, null, 0);
    }

    public int totalChanges() {
        return entitiesAdded + entitiesModified + entitiesRemoved;
    }
}
