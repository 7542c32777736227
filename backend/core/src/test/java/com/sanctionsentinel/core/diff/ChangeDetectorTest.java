package com.sanctionsentinel.core.diff;

import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ChangeType;
import com.sanctionsentinel.core.model.EntityType;
import com.sanctionsentinel.core.model.FieldChange;
import com.sanctionsentinel.core.model.SanctionsSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeDetectorTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");

    private final ChangeDetector detector = new ChangeDetector();

    @Test
    void identicalSnapshotsProduceNoEvents() {
        List<CanonicalEntity> snapshot = List.of(person("X1", "John Doe", "SDGT"), person("X2", "Jane Roe", "IRAN"));

        assertTrue(detector.detectChanges(snapshot, snapshot, "ofac_1", NOW).isEmpty());
    }

    @Test
    void reorderedListFieldsAreNotAChange() {
        CanonicalEntity before = person("X1", "John Doe", "SDGT", "CYBER");
        CanonicalEntity after = person("X1", "John Doe", "CYBER", "SDGT");

        assertTrue(detector.detectChanges(List.of(before), List.of(after), "ofac_1", NOW).isEmpty());
    }

    @Test
    void programAdditionYieldsSingleModifiedEventWithProgramsFieldChange() {
        CanonicalEntity before = person("X1", "John Doe", "SDGT");
        CanonicalEntity after = person("X1", "John Doe", "SDGT", "CYBER");

        List<ChangeEvent> events = detector.detectChanges(List.of(before), List.of(after), "ofac_2", NOW);

        assertEquals(1, events.size());
        ChangeEvent event = events.get(0);
        assertEquals(ChangeType.MODIFIED, event.changeType());
        assertEquals(List.of(new FieldChange("programs", List.of("SDGT"), List.of("SDGT", "CYBER"))), event.fieldChanges());
        assertEquals(before.contentHash(), event.oldContentHash());
        assertEquals(after.contentHash(), event.newContentHash());
        assertEquals("Modified John Doe: updated programs", event.changeSummary());
        assertEquals("ofac_2", event.runId());
        assertNull(event.riskLevel());
    }

    @Test
    void omittedEntityYieldsRemovedEvent() {
        List<ChangeEvent> events = detector.detectChanges(
                List.of(person("X1", "John Doe", "SDGT"), person("X2", "Jane Roe", "IRAN")),
                List.of(person("X1", "John Doe", "SDGT")),
                "ofac_3",
                NOW
        );

        assertEquals(1, events.size());
        assertEquals(ChangeType.REMOVED, events.get(0).changeType());
        assertEquals("X2", events.get(0).entityUid());
        assertTrue(events.get(0).fieldChanges().isEmpty());
        assertEquals("Entity removed from sanctions list: Jane Roe", events.get(0).changeSummary());
    }

    @Test
    void uidReissueIsReportedAsUnrelatedAddAndRemove() {
        List<ChangeEvent> events = detector.detectChanges(
                List.of(person("OLD-1", "John Doe", "SDGT")),
                List.of(person("NEW-1", "John Doe", "SDGT")),
                "ofac_4",
                NOW
        );

        assertEquals(2, events.size());
        assertEquals(ChangeType.ADDED, events.get(0).changeType());
        assertEquals("NEW-1", events.get(0).entityUid());
        assertEquals(ChangeType.REMOVED, events.get(1).changeType());
        assertEquals("OLD-1", events.get(1).entityUid());
    }

    @Test
    void eventsPartitionKeysExhaustivelyAndWithoutOverlap() {
        List<CanonicalEntity> previous = IntStream.range(0, 30)
                .mapToObj(i -> person("U" + i, "Name " + i, "P" + (i % 3)))
                .toList();
        List<CanonicalEntity> current = IntStream.range(10, 40)
                .mapToObj(i -> person("U" + i, "Name " + i, i % 5 == 0 ? "CHANGED" : "P" + (i % 3)))
                .toList();

        List<ChangeEvent> events = detector.detectChanges(previous, current, "un_1", NOW);

        Set<String> added = uids(events, ChangeType.ADDED);
        Set<String> removed = uids(events, ChangeType.REMOVED);
        Set<String> modified = uids(events, ChangeType.MODIFIED);

        Set<String> expectedAdded = IntStream.range(30, 40).mapToObj(i -> "U" + i).collect(Collectors.toSet());
        Set<String> expectedRemoved = IntStream.range(0, 10).mapToObj(i -> "U" + i).collect(Collectors.toSet());
        Set<String> expectedModified = IntStream.range(10, 30).filter(i -> i % 5 == 0).mapToObj(i -> "U" + i)
                .collect(Collectors.toSet());

        assertEquals(expectedAdded, added);
        assertEquals(expectedRemoved, removed);
        assertEquals(expectedModified, modified);
        Set<String> union = new HashSet<>(added);
        union.addAll(removed);
        union.addAll(modified);
        assertEquals(added.size() + removed.size() + modified.size(), union.size());
        assertEquals(events.size(), union.size());
    }

    @Test
    void repeatedDetectionIsIdempotentApartFromIds() {
        List<CanonicalEntity> previous = List.of(person("A", "Alpha", "SDGT"), person("B", "Bravo", "IRAN"));
        List<CanonicalEntity> current = List.of(person("B", "Bravo", "IRAN", "RUSSIA"), person("C", "Charlie", "CYBER"));

        List<String> first = fingerprint(detector.detectChanges(previous, current, "ofac_9", NOW));
        List<String> second = fingerprint(detector.detectChanges(previous, current, "ofac_9", NOW));

        assertEquals(first, second);
        assertEquals(3, first.size());
    }

    @Test
    void onlyDifferingFieldsAreListed() {
        CanonicalEntity before = CanonicalEntity.builder(SanctionsSource.OFAC, "X1")
                .name("John Doe")
                .entityType(EntityType.PERSON)
                .programs(List.of("SDGT"))
                .remarks("Old remark")
                .placesOfBirth(List.of("Kabul"))
                .build();
        CanonicalEntity after = before.toBuilder()
                .remarks("  old REMARK ")
                .placesOfBirth(List.of("Herat"))
                .build();

        List<ChangeEvent> events = detector.detectChanges(List.of(before), List.of(after), "ofac_5", NOW);

        assertEquals(1, events.size());
        assertEquals(List.of(new FieldChange("placesOfBirth", List.of("Kabul"), List.of("Herat"))), events.get(0).fieldChanges());
    }

    @Test
    void emptyPreviousSnapshotMarksEverythingAdded() {
        List<ChangeEvent> events = detector.detectChanges(List.of(), List.of(person("A", "Alpha", "SDGT")), "ofac_6", NOW);

        assertEquals(1, events.size());
        assertEquals(ChangeType.ADDED, events.get(0).changeType());
        assertEquals("New person added: Alpha", events.get(0).changeSummary());
    }

    private static Set<String> uids(List<ChangeEvent> events, ChangeType type) {
        return events.stream().filter(e -> e.changeType() == type).map(ChangeEvent::entityUid).collect(Collectors.toSet());
    }

    private static List<String> fingerprint(List<ChangeEvent> events) {
        return events.stream()
                .map(e -> e.changeType() + "|" + e.entityUid() + "|" + e.fieldChanges() + "|" + e.changeSummary()
                        + "|" + e.oldContentHash() + "|" + e.newContentHash())
                .toList();
    }

    private static CanonicalEntity person(String uid, String name, String... programs) {
        return CanonicalEntity.builder(SanctionsSource.OFAC, uid)
                .name(name)
                .entityType(EntityType.PERSON)
                .programs(List.of(programs))
                .build();
    }
}
