package com.sanctionsentinel.sources.hmt;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import com.sanctionsentinel.core.model.Address;
import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.EntityType;
import com.sanctionsentinel.core.model.SanctionsSource;
import com.sanctionsentinel.sources.api.ParseException;
import com.sanctionsentinel.sources.api.ParseResult;
import com.sanctionsentinel.sources.api.RecordError;
import com.sanctionsentinel.sources.api.SourceAdapter;
import com.sanctionsentinel.sources.api.SourceFetchConfig;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * UK HM Treasury consolidated list, spreadsheet CSV export. The export has one row per name
 * variant; rows sharing a {@code Group ID} describe one designated subject.
 */
public class UkHmtCsvAdapter implements SourceAdapter {
    public static final String DEFAULT_URL = "https://ofsistorage.blob.core.windows.net/publishlive/2022format/ConList.csv";

    static final String GROUP_ID = "Group ID";
    static final String SURNAME = "Name 6";
    static final String GROUP_TYPE = "Group Type";
    static final List<String> REQUIRED_COLUMNS = List.of(GROUP_ID, SURNAME, GROUP_TYPE);

    private static final Logger LOGGER = Logger.getLogger(UkHmtCsvAdapter.class.getName());
    private static final List<String> GIVEN_NAMES = List.of("Name 1", "Name 2", "Name 3", "Name 4", "Name 5");
    private static final int HEADER_SEARCH_ROWS = 3;

    private final SourceFetchConfig fetchConfig;

    public UkHmtCsvAdapter() {
        this(new SourceFetchConfig(SanctionsSource.UK_HMT, DEFAULT_URL, "text/csv",
                Duration.ofSeconds(120), Duration.ofSeconds(2)));
    }

    public UkHmtCsvAdapter(SourceFetchConfig fetchConfig) {
        if (fetchConfig.source() != SanctionsSource.UK_HMT) {
            throw new IllegalArgumentException("UK HMT adapter cannot use fetch config for " + fetchConfig.source());
        }
        this.fetchConfig = fetchConfig;
    }

    @Override
    public SanctionsSource source() {
        return SanctionsSource.UK_HMT;
    }

    @Override
    public SourceFetchConfig fetchConfig() {
        return fetchConfig;
    }

    @Override
    public ParseResult parse(byte[] raw) throws ParseException {
        List<String[]> rows = readRows(raw);
        int headerIndex = headerIndex(rows);
        Map<String, Integer> columns = columnIndex(rows.get(headerIndex));

        List<RecordError> errors = new ArrayList<>();
        Map<String, List<Row>> groups = new LinkedHashMap<>();
        for (int i = headerIndex + 1; i < rows.size(); i++) {
            Row row = new Row(rows.get(i), columns, i + 1);
            if (row.isBlank()) {
                continue;
            }
            Optional<String> groupId = row.get(GROUP_ID);
            if (groupId.isEmpty()) {
                ParseException error = ParseException.record(GROUP_ID, "row has no Group ID");
                LOGGER.warning("Skipping UK HMT row " + row.lineNumber() + ": " + error.getMessage());
                errors.add(RecordError.of(error, "row " + row.lineNumber()));
                continue;
            }
            groups.computeIfAbsent(groupId.get(), ignored -> new ArrayList<>()).add(row);
        }

        List<CanonicalEntity> entities = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<Row>> group : groups.entrySet()) {
            try {
                entities.add(toEntity(group.getKey(), group.getValue()));
            } catch (ParseException e) {
                LOGGER.warning("Skipping UK HMT group " + group.getKey() + ": " + e.getMessage());
                errors.add(RecordError.of(e, "group " + group.getKey()));
            }
        }
        if (entities.isEmpty()) {
            throw ParseException.format("CSV contains no usable designation rows (" + errors.size() + " rejected)");
        }
        LOGGER.info(() -> "Parsed " + entities.size() + " UK HMT entities (" + errors.size() + " skipped)");
        return new ParseResult(entities, errors);
    }

    CanonicalEntity toEntity(String groupId, List<Row> rows) throws ParseException {
        Row primary = rows.stream()
                .filter(row -> row.get("Alias Type").map(type -> type.equalsIgnoreCase("Primary name")).orElse(false))
                .findFirst()
                .orElse(rows.get(0));
        String uid = "HMT-" + groupId;
        String name = primary.fullName()
                .orElseThrow(() -> ParseException.record("name", "group " + groupId + " has no primary name"));

        CanonicalEntity.Builder builder = CanonicalEntity.builder(SanctionsSource.UK_HMT, uid)
                .name(name)
                .entityType(entityType(primary.get(GROUP_TYPE).orElse("")))
                .remarks(primary.get("Other Information").orElse(null));

        for (Row row : rows) {
            if (row != primary) {
                row.fullName().filter(alias -> !alias.equals(name)).ifPresent(builder::addAlias);
            }
            row.get("Regime").ifPresent(builder::addProgram);
            row.get("DOB").ifPresent(builder::addDateOfBirth);
            builder.addPlaceOfBirth(join(", ", row.get("Town of Birth"), row.get("Country of Birth")));
            row.get("Nationality").ifPresent(builder::addNationality);
            builder.addAddress(new Address(
                    row.get("Address 1").orElse(null),
                    row.get("Address 2").orElse(null),
                    blankToNull(join(", ", row.get("Address 3"), row.get("Address 4"), row.get("Address 5"))),
                    row.get("Address 6").orElse(null),
                    null,
                    row.get("Post/Zip Code").orElse(null),
                    row.get("Country").orElse(null)
            ));
        }
        return builder.build();
    }

    static EntityType entityType(String groupType) {
        return switch (groupType.trim().toLowerCase(Locale.ROOT)) {
            case "individual" -> EntityType.PERSON;
            case "entity" -> EntityType.COMPANY;
            case "ship" -> EntityType.VESSEL;
            default -> EntityType.OTHER;
        };
    }

    private static List<String[]> readRows(byte[] raw) throws ParseException {
        if (raw == null || raw.length == 0) {
            throw ParseException.format("empty payload");
        }
        String text = new String(raw, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(text)).build()) {
            return reader.readAll();
        } catch (IOException | CsvException e) {
            throw ParseException.format("payload is not readable CSV: " + e.getMessage(), e);
        }
    }

    private static int headerIndex(List<String[]> rows) throws ParseException {
        int limit = Math.min(HEADER_SEARCH_ROWS, rows.size());
        for (int i = 0; i < limit; i++) {
            Map<String, Integer> columns = columnIndex(rows.get(i));
            if (columns.keySet().containsAll(REQUIRED_COLUMNS)) {
                return i;
            }
        }
        throw ParseException.format("missing required columns " + REQUIRED_COLUMNS);
    }

    private static Map<String, Integer> columnIndex(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (!name.isEmpty()) {
                columns.putIfAbsent(name, i);
            }
        }
        return columns;
    }

    @SafeVarargs
    private static String join(String separator, Optional<String>... parts) {
        return Stream.of(parts).flatMap(Optional::stream).collect(Collectors.joining(separator));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    static final class Row {
        private final String[] cells;
        private final Map<String, Integer> columns;
        private final int lineNumber;

        Row(String[] cells, Map<String, Integer> columns, int lineNumber) {
            this.cells = cells;
            this.columns = columns;
            this.lineNumber = lineNumber;
        }

        Optional<String> get(String column) {
            Integer index = columns.get(column);
            if (index == null || index >= cells.length || cells[index] == null) {
                return Optional.empty();
            }
            String value = cells[index].trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        }

        Optional<String> fullName() {
            String given = GIVEN_NAMES.stream()
                    .map(this::get)
                    .flatMap(Optional::stream)
                    .collect(Collectors.joining(" "));
            String full = Stream.of(given, get(SURNAME).orElse(""))
                    .filter(part -> !part.isBlank())
                    .collect(Collectors.joining(" "));
            return full.isEmpty() ? Optional.empty() : Optional.of(full);
        }

        boolean isBlank() {
            for (String cell : cells) {
                if (cell != null && !cell.isBlank()) {
                    return false;
                }
            }
            return true;
        }

        int lineNumber() {
            return lineNumber;
        }
    }
}
