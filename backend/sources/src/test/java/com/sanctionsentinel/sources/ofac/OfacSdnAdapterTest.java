package com.sanctionsentinel.sources.ofac;

import com.sanctionsentinel.core.model.Address;
import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.EntityType;
import com.sanctionsentinel.core.model.SanctionsSource;
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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OfacSdnAdapterTest {
    private final OfacSdnAdapter adapter = new OfacSdnAdapter();

    @Test
    void parsesNamespacedSdnFixture() throws Exception {
        ParseResult result = adapter.parse(FixtureUtils.fixtureBytes("fixtures/ofac-sdn-sample.xml"));
        Map<String, CanonicalEntity> byUid = result.entities().stream()
                .collect(Collectors.toMap(CanonicalEntity::uid, Function.identity()));

        assertEquals(3, result.entities().size());
        assertEquals(1, result.recordsSkipped());
        assertEquals("99999", result.recordErrors().get(0).recordRef());
        assertEquals("name", result.recordErrors().get(0).field());

        CanonicalEntity person = byUid.get("7157");
        assertEquals("Ayman AL-ZAWAHIRI", person.name());
        assertEquals(EntityType.PERSON, person.entityType());
        assertEquals(SanctionsSource.OFAC, person.source());
        assertEquals(List.of("SDGT", "SDT"), person.programs());
        assertEquals(List.of("Aiman Muhammad Rabi AL-ZAWAHIRI", "THE DOCTOR"), person.aliases());
        assertEquals(List.of("19 Jun 1951"), person.datesOfBirth());
        assertEquals(List.of("Giza, Egypt"), person.placesOfBirth());
        assertEquals(List.of("Egypt"), person.nationalities());
        assertEquals("Operational and Military Leader of JIHAD GROUP.", person.remarks());
        assertNotNull(person.contentHash());

        CanonicalEntity airline = byUid.get("36");
        assertEquals(EntityType.COMPANY, airline.entityType());
        assertEquals(List.of(Address.of("Havana", "Cuba")), airline.addresses());
        assertEquals(List.of("AERO-CARIBBEAN"), airline.aliases());

        assertEquals(EntityType.VESSEL, byUid.get("15036").entityType());
    }

    @Test
    void sameBytesProduceSameHashes() throws Exception {
        byte[] raw = FixtureUtils.fixtureBytes("fixtures/ofac-sdn-sample.xml");

        List<String> first = adapter.parse(raw).entities().stream().map(CanonicalEntity::contentHash).toList();
        List<String> second = adapter.parse(raw).entities().stream().map(CanonicalEntity::contentHash).toList();

        assertEquals(first, second);
    }

    @Test
    void malformedXmlIsFormatError() {
        ParseException error = assertThrows(ParseException.class,
                () -> adapter.parse("<sdnList><sdnEntry>".getBytes(StandardCharsets.UTF_8)));

        assertEquals(ParseException.Level.FORMAT, error.level());
    }

    @Test
    void wrongRootIsFormatError() {
        ParseException error = assertThrows(ParseException.class,
                () -> adapter.parse("<rss><channel/></rss>".getBytes(StandardCharsets.UTF_8)));

        assertEquals(ParseException.Level.FORMAT, error.level());
    }

    @Test
    void listWithoutEntriesIsFormatError() {
        ParseException error = assertThrows(ParseException.class,
                () -> adapter.parse("<sdnList><publshInformation/></sdnList>".getBytes(StandardCharsets.UTF_8)));

        assertEquals(ParseException.Level.FORMAT, error.level());
    }

    @Test
    void mapsSdnTypes() {
        assertEquals(EntityType.PERSON, OfacSdnAdapter.entityType("Individual"));
        assertEquals(EntityType.AIRCRAFT, OfacSdnAdapter.entityType("Aircraft"));
        assertEquals(EntityType.OTHER, OfacSdnAdapter.entityType(""));
    }
}
