package com.sanctionsentinel.core.util;

import com.sanctionsentinel.core.model.Address;
import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.EntityType;
import com.sanctionsentinel.core.model.SanctionsSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class EntityNormalizerTest {
    @Test
    void normalizeTextTrimsCollapsesAndLowercases() {
        assertEquals("john doe", EntityNormalizer.normalizeText("  John \t  DOE "));
        assertEquals("", EntityNormalizer.normalizeText(null));
    }

    @Test
    void normalizeListSortsDedupesAndDropsBlanks() {
        assertEquals(Set.of("cyber", "sdgt"), EntityNormalizer.normalizeList(List.of("SDGT", " cyber", "sdgt ", "  ")));
        assertEquals(List.of("cyber", "sdgt"), List.copyOf(EntityNormalizer.normalizeList(List.of("SDGT", "CYBER"))));
    }

    @Test
    void hashIgnoresListOrderingCaseAndWhitespace() {
        CanonicalEntity first = CanonicalEntity.builder(SanctionsSource.OFAC, "X1")
                .name("John Doe")
                .entityType(EntityType.PERSON)
                .programs(List.of("SDGT", "CYBER"))
                .aliases(List.of("Johnny", "J. Doe"))
                .addresses(List.of(Address.of("Kabul", "Afghanistan"), Address.of("Tehran", "Iran")))
                .build();
        CanonicalEntity second = CanonicalEntity.builder(SanctionsSource.OFAC, "X1")
                .name("  JOHN   doe ")
                .entityType(EntityType.PERSON)
                .programs(List.of("cyber", "SDGT"))
                .aliases(List.of("j. doe", "JOHNNY"))
                .addresses(List.of(Address.of("Tehran", "Iran"), Address.of("Kabul", "Afghanistan")))
                .build();

        assertEquals(first.contentHash(), second.contentHash());
    }

    @Test
    void hashExcludesLastSeen() {
        CanonicalEntity entity = CanonicalEntity.builder(SanctionsSource.UN, "UN-IND-1").name("A").build();
        CanonicalEntity seenLater = entity.withLastSeen(Instant.parse("2026-03-01T00:00:00Z"));
        CanonicalEntity rebuilt = seenLater.toBuilder().build();

        assertEquals(entity.contentHash(), seenLater.contentHash());
        assertEquals(entity.contentHash(), rebuilt.contentHash());
    }

    @Test
    void hashChangesWhenAnyTrackedFieldChanges() {
        CanonicalEntity base = CanonicalEntity.builder(SanctionsSource.OFAC, "X1").name("John Doe").remarks("r").build();

        assertNotEquals(base.contentHash(), base.toBuilder().remarks("other").build().contentHash());
        assertNotEquals(base.contentHash(), base.toBuilder().addNationality("Iran").build().contentHash());
        assertNotEquals(base.contentHash(), base.toBuilder().entityType(EntityType.VESSEL).build().contentHash());
        assertNotEquals(base.contentHash(),
                CanonicalEntity.builder(SanctionsSource.UN, "X1").name("John Doe").remarks("r").build().contentHash());
    }
}
