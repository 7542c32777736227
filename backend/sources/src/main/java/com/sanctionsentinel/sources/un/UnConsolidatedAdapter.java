package com.sanctionsentinel.sources.un;

import com.sanctionsentinel.core.model.Address;
import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.EntityType;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.sources.api.ParseException;
import com.sanctionsentinel.sources.api.ParseResult;
import com.sanctionsentinel.sources.api.RecordError;
import com.sanctionsentinel.sources.api.SourceAdapter;
import com.sanctionsentinel.sources.api.SourceFetchConfig;
import com.sanctionsentinel.sources.xml.XmlSupport;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.sanctionsentinel.sources.xml.XmlSupport.childText;
import static com.sanctionsentinel.sources.xml.XmlSupport.children;

/**
 * UN Security Council consolidated list ({@code CONSOLIDATED_LIST}), individuals and entities.
 */
public class UnConsolidatedAdapter implements SourceAdapter {
    public static final String DEFAULT_URL = "https://scsanctions.un.org/resources/xml/en/consolidated.xml";

    private static final Logger LOGGER = Logger.getLogger(UnConsolidatedAdapter.class.getName());
    private static final List<String> NAME_PARTS = List.of("FIRST_NAME", "SECOND_NAME", "THIRD_NAME", "FOURTH_NAME");

    private final SourceFetchConfig fetchConfig;

    public UnConsolidatedAdapter() {
        this(new SourceFetchConfig(SanctionsSource.UN, DEFAULT_URL, "application/xml",
                Duration.ofSeconds(120), Duration.ofSeconds(2)));
    }

    public UnConsolidatedAdapter(SourceFetchConfig fetchConfig) {
        if (fetchConfig.source() != SanctionsSource.UN) {
            throw new IllegalArgumentException("UN adapter cannot use fetch config for " + fetchConfig.source());
        }
        this.fetchConfig = fetchConfig;
    }

    @Override
    public SanctionsSource source() {
        return SanctionsSource.UN;
    }

    @Override
    public SourceFetchConfig fetchConfig() {
        return fetchConfig;
    }

    @Override
    public ParseResult parse(byte[] raw) throws ParseException {
        Document document = XmlSupport.parse(raw);
        Element root = XmlSupport.requireRoot(document, "CONSOLIDATED_LIST");

        List<Element> individuals = XmlSupport.nested(root, "INDIVIDUALS", "INDIVIDUAL");
        List<Element> organisations = XmlSupport.nested(root, "ENTITIES", "ENTITY");
        if (individuals.isEmpty() && organisations.isEmpty()) {
            throw ParseException.format("CONSOLIDATED_LIST contains no INDIVIDUAL or ENTITY records");
        }

        List<CanonicalEntity> entities = new ArrayList<>(individuals.size() + organisations.size());
        List<RecordError> errors = new ArrayList<>();
        collect(individuals, true, entities, errors);
        collect(organisations, false, entities, errors);
        if (entities.isEmpty()) {
            throw ParseException.format("no usable records (" + errors.size() + " rejected)");
        }
        LOGGER.info(() -> "Parsed " + entities.size() + " UN entities (" + errors.size() + " skipped)");
        return new ParseResult(entities, errors);
    }

    private void collect(List<Element> listings, boolean individual, List<CanonicalEntity> entities, List<RecordError> errors) {
        String kind = individual ? "INDIVIDUAL" : "ENTITY";
        for (int i = 0; i < listings.size(); i++) {
            Element listing = listings.get(i);
            String ref = kind + " " + childText(listing, "DATAID").orElse("#" + (i + 1));
            try {
                entities.add(toEntity(listing, individual));
            } catch (ParseException e) {
                LOGGER.warning("Skipping UN " + ref + ": " + e.getMessage());
                errors.add(RecordError.of(e, ref));
            }
        }
    }

    CanonicalEntity toEntity(Element listing, boolean individual) throws ParseException {
        String dataId = childText(listing, "DATAID")
                .orElseThrow(() -> ParseException.record("DATAID", "listing has no DATAID"));
        String uid = (individual ? "UN-IND-" : "UN-ENT-") + dataId;
        String name = name(listing, individual)
                .orElseThrow(() -> ParseException.record("name", uid + " has no name"));
        String prefix = individual ? "INDIVIDUAL" : "ENTITY";

        CanonicalEntity.Builder builder = CanonicalEntity.builder(SanctionsSource.UN, uid)
                .name(name)
                .entityType(individual ? EntityType.PERSON : EntityType.COMPANY)
                .remarks(childText(listing, "COMMENTS1").orElse(null));

        childText(listing, "UN_LIST_TYPE").ifPresent(builder::addProgram);
        childText(listing, "COMMITTEE").ifPresent(builder::addProgram);
        for (Element alias : children(listing, prefix + "_ALIAS")) {
            childText(alias, "ALIAS_NAME").ifPresent(builder::addAlias);
        }
        for (Element address : children(listing, prefix + "_ADDRESS")) {
            builder.addAddress(new Address(
                    childText(address, "STREET").orElse(null),
                    null,
                    null,
                    childText(address, "CITY").orElse(null),
                    childText(address, "STATE_PROVINCE").orElse(null),
                    childText(address, "ZIP_CODE").orElse(null),
                    childText(address, "COUNTRY").orElse(null)
            ));
        }
        if (individual) {
            for (Element dob : children(listing, "INDIVIDUAL_DATE_OF_BIRTH")) {
                childText(dob, "DATE").or(() -> childText(dob, "YEAR")).ifPresent(builder::addDateOfBirth);
            }
            for (Element pob : children(listing, "INDIVIDUAL_PLACE_OF_BIRTH")) {
                String place = Stream.of("CITY", "STATE_PROVINCE", "COUNTRY")
                        .map(part -> childText(pob, part))
                        .flatMap(Optional::stream)
                        .collect(Collectors.joining(", "));
                builder.addPlaceOfBirth(place);
            }
            for (Element nationality : children(listing, "NATIONALITY")) {
                XmlSupport.childTexts(nationality, "VALUE").forEach(builder::addNationality);
            }
        }
        return builder.build();
    }

    private static Optional<String> name(Element listing, boolean individual) {
        List<String> parts = individual ? NAME_PARTS : List.of("FIRST_NAME");
        String joined = parts.stream()
                .map(part -> childText(listing, part))
                .flatMap(Optional::stream)
                .collect(Collectors.joining(" "));
        if (!joined.isBlank()) {
            return Optional.of(joined);
        }
        return childText(listing, "NAME_ORIGINAL_SCRIPT");
    }
}
