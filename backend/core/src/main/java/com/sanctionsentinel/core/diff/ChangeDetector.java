package com.sanctionsentinel.core.diff;

import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ChangeType;
import com.sanctionsentinel.core.model.EntityField;
import com.sanctionsentinel.core.model.FieldChange;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Structural diff of two snapshots of one source, keyed by uid.
 * <p>
 * Identity is uid equality only: an authority that reissues a new uid for the same subject
 * produces an unrelated ADDED and REMOVED pair. Events leave this class unclassified.
 */
public class ChangeDetector {
    private static final Logger LOGGER = Logger.getLogger(ChangeDetector.class.getName());

    private final Supplier<String> eventIds;

    public ChangeDetector() {
        this(() -> UUID.randomUUID().toString());
    }

    public ChangeDetector(Supplier<String> eventIds) {
        this.eventIds = Objects.requireNonNull(eventIds, "eventIds is required");
    }

    public List<ChangeEvent> detectChanges(
            Collection<CanonicalEntity> previous,
            Collection<CanonicalEntity> current,
            String runId,
            Instant detectedAt
    ) {
        Map<String, CanonicalEntity> before = index(previous, "previous");
        Map<String, CanonicalEntity> after = index(current, "current");

        List<ChangeEvent> added = new ArrayList<>();
        List<ChangeEvent> removed = new ArrayList<>();
        List<ChangeEvent> modified = new ArrayList<>();

        for (Map.Entry<String, CanonicalEntity> entry : after.entrySet()) {
            CanonicalEntity old = before.get(entry.getKey());
            CanonicalEntity now = entry.getValue();
            if (old == null) {
                added.add(addition(now, runId, detectedAt));
            } else if (!Objects.equals(old.contentHash(), now.contentHash())) {
                modified.add(modification(old, now, runId, detectedAt));
            }
        }
        for (Map.Entry<String, CanonicalEntity> entry : before.entrySet()) {
            if (!after.containsKey(entry.getKey())) {
                removed.add(removal(entry.getValue(), runId, detectedAt));
            }
        }

        LOGGER.info(() -> String.format("Detected changes for run %s: %d added, %d modified, %d removed (%d -> %d entities)",
                runId, added.size(), modified.size(), removed.size(), before.size(), after.size()));

        List<ChangeEvent> events = new ArrayList<>(added.size() + removed.size() + modified.size());
        events.addAll(added);
        events.addAll(removed);
        events.addAll(modified);
        return events;
    }

    /**
     * Fields whose normalized values differ. List fields compare as sets, so reordering alone
     * is never a change.
     */
    public static List<FieldChange> compareFields(CanonicalEntity old, CanonicalEntity now) {
        List<FieldChange> changes = new ArrayList<>();
        for (EntityField field : EntityField.values()) {
            if (!field.normalizedValue(old).equals(field.normalizedValue(now))) {
                changes.add(new FieldChange(field.fieldName(), field.rawValue(old), field.rawValue(now)));
            }
        }
        return changes;
    }

    private Map<String, CanonicalEntity> index(Collection<CanonicalEntity> entities, String label) {
        // TreeMap keeps event order stable across calls.
        Map<String, CanonicalEntity> byUid = new TreeMap<>();
        if (entities == null) {
            return byUid;
        }
        for (CanonicalEntity entity : entities) {
            if (byUid.put(entity.uid(), entity) != null) {
                LOGGER.warning("Duplicate uid " + entity.uid() + " in " + label + " snapshot; last occurrence wins");
            }
        }
        return byUid;
    }

    private ChangeEvent addition(CanonicalEntity entity, String runId, Instant detectedAt) {
        String summary = "New " + entity.entityType().name().toLowerCase(Locale.ROOT) + " added: " + entity.name();
        return new ChangeEvent(eventIds.get(), entity.uid(), entity.name(), entity.source(), ChangeType.ADDED, null,
                List.of(), summary, null, entity.contentHash(), detectedAt, runId, null, null);
    }

    private ChangeEvent removal(CanonicalEntity entity, String runId, Instant detectedAt) {
        String summary = "Entity removed from sanctions list: " + entity.name();
        return new ChangeEvent(eventIds.get(), entity.uid(), entity.name(), entity.source(), ChangeType.REMOVED, null,
                List.of(), summary, entity.contentHash(), null, detectedAt, runId, null, null);
    }

    private ChangeEvent modification(CanonicalEntity old, CanonicalEntity now, String runId, Instant detectedAt) {
        List<FieldChange> fieldChanges = compareFields(old, now);
        String fields = fieldChanges.stream().map(FieldChange::field).collect(Collectors.joining(", "));
        String summary = fieldChanges.isEmpty()
                ? "Modified " + now.name() + ": content hash changed"
                : "Modified " + now.name() + ": updated " + fields;
        return new ChangeEvent(eventIds.get(), now.uid(), now.name(), now.source(), ChangeType.MODIFIED, null,
                fieldChanges, summary, old.contentHash(), now.contentHash(), detectedAt, runId, null, null);
    }
}
