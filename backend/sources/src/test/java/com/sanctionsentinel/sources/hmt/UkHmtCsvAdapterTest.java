package com.sanctionsentinel.sources.hmt;

import com.sanctionsentinel.core.model.Address;
import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.EntityType;
import com.sanctionsentinel.sources.api.ParseException;
import com.sanctionsentinel.sources.api.ParseResult;
import com.sanctionsentinel.sources.support.FixtureUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UkHmtCsvAdapterTest {
    private final UkHmtCsvAdapter adapter = new UkHmtCsvAdapter();

    @Test
    void groupsNameVariantsIntoOneEntity() throws Exception {
        ParseResult result = adapter.parse(FixtureUtils.fixtureBytes("fixtures/hmt-conlist-sample.csv"));
        Map<String, CanonicalEntity> byUid = result.entities().stream()
                .collect(Collectors.toMap(CanonicalEntity::uid, Function.identity()));

        assertEquals(3, result.entities().size());
        assertEquals(1, result.recordsSkipped());
        assertEquals("Group ID", result.recordErrors().get(0).field());

        CanonicalEntity person = byUid.get("HMT-15000");
        assertEquals("Ivan Sergeyevich PETROV", person.name());
        assertEquals(EntityType.PERSON, person.entityType());
        assertEquals(List.of("Ivan PETROFF"), person.aliases());
        assertEquals(List.of("Russia"), person.programs());
        assertEquals(List.of("01/02/1970"), person.datesOfBirth());
        assertEquals(List.of("Moscow, Russia"), person.placesOfBirth());
        assertEquals(List.of("Russia"), person.nationalities());
        assertEquals(List.of(new Address("12 Tverskaya Street", null, null, "Moscow", null, "125009", "Russia")),
                person.addresses());
        assertEquals("Director of a defence company, designated for support of the war.", person.remarks());

        assertEquals(EntityType.COMPANY, byUid.get("HMT-14200").entityType());
        assertEquals(EntityType.VESSEL, byUid.get("HMT-14201").entityType());
        assertEquals("IMO 9187629", byUid.get("HMT-14201").remarks());
    }

    @Test
    void acceptsExportWithoutLastUpdatedLineAndWithBom() throws Exception {
        String csv = "\uFEFFName 6,Name 1,Group Type,Alias Type,Regime,Group ID\r\n"
                + "DOE,John,Individual,Primary name,Global Human Rights,101\r\n";

        ParseResult result = adapter.parse(csv.getBytes(StandardCharsets.UTF_8));

        assertEquals(1, result.entities().size());
        assertEquals("HMT-101", result.entities().get(0).uid());
        assertEquals("John DOE", result.entities().get(0).name());
    }

    @Test
    void missingRequiredColumnsIsFormatError() {
        String csv = "Name,Type\nJohn,Individual\n";

        ParseException error = assertThrows(ParseException.class, () -> adapter.parse(csv.getBytes(StandardCharsets.UTF_8)));

        assertEquals(ParseException.Level.FORMAT, error.level());
    }

    @Test
    void headerOnlyExportIsFormatError() {
        String csv = "Name 6,Name 1,Group Type,Alias Type,Regime,Group ID\n";

        assertThrows(ParseException.class, () -> adapter.parse(csv.getBytes(StandardCharsets.UTF_8)));
    }
}
