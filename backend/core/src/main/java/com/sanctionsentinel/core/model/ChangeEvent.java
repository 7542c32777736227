package com.sanctionsentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable record of one detected difference. Created unclassified by the change detector,
 * classified once, and stamped with delivery metadata at most once by the dispatcher.
 */
public record ChangeEvent(
        String eventId,
        String entityUid,
        String entityName,
        SanctionsSource source,
        ChangeType changeType,
        RiskLevel riskLevel,
        List<FieldChange> fieldChanges,
        String changeSummary,
        String oldContentHash,
        String newContentHash,
        Instant detectedAt,
        String runId,
        Instant notificationSentAt,
        Set<String> notificationChannels
) {
    public ChangeEvent {
        Objects.requireNonNull(eventId, "eventId is required");
        Objects.requireNonNull(entityUid, "entityUid is required");
        Objects.requireNonNull(changeType, "changeType is required");
        fieldChanges = fieldChanges == null ? List.of() : List.copyOf(fieldChanges);
        notificationChannels = notificationChannels == null ? Set.of() : Set.copyOf(notificationChannels);
    }

    public ChangeEvent withRiskLevel(RiskLevel level) {
        return new ChangeEvent(eventId, entityUid, entityName, source, changeType, level, fieldChanges, changeSummary,
                oldContentHash, newContentHash, detectedAt, runId, notificationSentAt, notificationChannels);
    }

    public ChangeEvent withNotification(Instant sentAt, Set<String> channels) {
        if (notificationSentAt != null) {
            throw new IllegalStateException("Change event " + eventId + " was already stamped as notified");
        }
        Objects.requireNonNull(sentAt, "sentAt is required");
        return new ChangeEvent(eventId, entityUid, entityName, source, changeType, riskLevel, fieldChanges, changeSummary,
                oldContentHash, newContentHash, detectedAt, runId, sentAt, channels);
    }

    public boolean notified() {
        return notificationSentAt != null;
    }
}
