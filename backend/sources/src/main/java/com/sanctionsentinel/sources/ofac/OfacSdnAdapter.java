package com.sanctionsentinel.sources.ofac;

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
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static com.sanctionsentinel.sources.xml.XmlSupport.childText;
import static com.sanctionsentinel.sources.xml.XmlSupport.children;
import static com.sanctionsentinel.sources.xml.XmlSupport.nested;
import static com.sanctionsentinel.sources.xml.XmlSupport.requireRoot;

/**
 * US Treasury SDN list, XML edition ({@code sdnList/sdnEntry}).
 */
public class OfacSdnAdapter implements SourceAdapter {
    public static final String DEFAULT_URL = "https://www.treasury.gov/ofac/downloads/sdn.xml";

    private static final Logger LOGGER = Logger.getLogger(OfacSdnAdapter.class.getName());

    private final SourceFetchConfig fetchConfig;

    public OfacSdnAdapter() {
        this(new SourceFetchConfig(SanctionsSource.OFAC, DEFAULT_URL, "application/xml",
                Duration.ofSeconds(120), Duration.ofSeconds(2)));
    }

    public OfacSdnAdapter(SourceFetchConfig fetchConfig) {
        if (fetchConfig.source() != SanctionsSource.OFAC) {
            throw new IllegalArgumentException("OFAC adapter cannot use fetch config for " + fetchConfig.source());
        }
        this.fetchConfig = fetchConfig;
    }

    @Override
    public SanctionsSource source() {
        return SanctionsSource.OFAC;
    }

    @Override
    public SourceFetchConfig fetchConfig() {
        return fetchConfig;
    }

    @Override
    public ParseResult parse(byte[] raw) throws ParseException {
        Document document = XmlSupport.parse(raw);
        Element root = requireRoot(document, "sdnList");
        List<Element> entries = children(root, "sdnEntry");
        if (entries.isEmpty()) {
            throw ParseException.format("sdnList contains no sdnEntry records");
        }

        List<CanonicalEntity> entities = new ArrayList<>(entries.size());
        List<RecordError> errors = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Element entry = entries.get(i);
            String ref = uidOf(entry).orElse("#" + (i + 1));
            try {
                entities.add(toEntity(entry));
            } catch (ParseException e) {
                LOGGER.warning("Skipping OFAC sdnEntry " + ref + ": " + e.getMessage());
                errors.add(RecordError.of(e, ref));
            }
        }
        if (entities.isEmpty()) {
            throw ParseException.format("no usable records (" + errors.size() + " rejected)");
        }
        LOGGER.info(() -> "Parsed " + entities.size() + " OFAC entities (" + errors.size() + " skipped)");
        return new ParseResult(entities, errors);
    }

    CanonicalEntity toEntity(Element entry) throws ParseException {
        String uid = uidOf(entry).orElseThrow(() -> ParseException.record("uid", "sdnEntry has no uid"));
        EntityType type = entityType(childText(entry, "sdnType").orElse(""));
        String name = primaryName(entry, type)
                .orElseThrow(() -> ParseException.record("name", "sdnEntry " + uid + " has no name"));

        CanonicalEntity.Builder builder = CanonicalEntity.builder(SanctionsSource.OFAC, uid)
                .name(name)
                .entityType(type)
                .remarks(childText(entry, "remarks").orElse(null));

        nested(entry, "programList", "program").forEach(program -> builder.addProgram(program.getTextContent()));
        for (Element aka : nested(entry, "akaList", "aka")) {
            joinName(childText(aka, "firstName"), childText(aka, "lastName")).ifPresent(builder::addAlias);
        }
        for (Element address : nested(entry, "addressList", "address")) {
            builder.addAddress(new Address(
                    childText(address, "address1").orElse(null),
                    childText(address, "address2").orElse(null),
                    childText(address, "address3").orElse(null),
                    childText(address, "city").orElse(null),
                    childText(address, "stateOrProvince").orElse(null),
                    childText(address, "postalCode").orElse(null),
                    childText(address, "country").orElse(null)
            ));
        }
        for (Element item : nested(entry, "dateOfBirthList", "dateOfBirthItem")) {
            childText(item, "dateOfBirth").ifPresent(builder::addDateOfBirth);
        }
        for (Element item : nested(entry, "placeOfBirthList", "placeOfBirthItem")) {
            childText(item, "placeOfBirth").ifPresent(builder::addPlaceOfBirth);
        }
        for (Element nationality : nested(entry, "nationalityList", "nationality")) {
            childText(nationality, "country").ifPresent(builder::addNationality);
        }
        return builder.build();
    }

    private static Optional<String> uidOf(Element entry) {
        Optional<String> child = childText(entry, "uid");
        if (child.isPresent()) {
            return child;
        }
        String attribute = entry.getAttribute("uid");
        return attribute == null || attribute.isBlank() ? Optional.empty() : Optional.of(attribute.trim());
    }

    private static Optional<String> primaryName(Element entry, EntityType type) {
        Optional<String> lastName = childText(entry, "lastName");
        if (type == EntityType.PERSON) {
            Optional<String> full = joinName(childText(entry, "firstName"), lastName);
            if (full.isPresent()) {
                return full;
            }
        }
        return lastName.or(() -> childText(entry, "title"));
    }

    private static Optional<String> joinName(Optional<String> first, Optional<String> last) {
        String joined = Stream.of(first, last)
                .flatMap(Optional::stream)
                .collect(Collectors.joining(" "));
        return joined.isBlank() ? Optional.empty() : Optional.of(joined);
    }

    static EntityType entityType(String sdnType) {
        return switch (sdnType.trim().toLowerCase(Locale.ROOT)) {
            case "individual" -> EntityType.PERSON;
            case "entity" -> EntityType.COMPANY;
            case "vessel" -> EntityType.VESSEL;
            case "aircraft" -> EntityType.AIRCRAFT;
            default -> EntityType.OTHER;
        };
    }
}
