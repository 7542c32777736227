package com.sanctionsentinel.core.model;

import com.sanctionsentinel.core.util.EntityNormalizer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One sanctioned subject as observed in a single run, in the shape every source adapter
 * must produce. {@code contentHash} covers every field except {@code lastSeen}.
 */
public record CanonicalEntity(
        String uid,
        String name,
        EntityType entityType,
        SanctionsSource source,
        List<String> programs,
        List<String> aliases,
        List<Address> addresses,
        List<String> datesOfBirth,
        List<String> placesOfBirth,
        List<String> nationalities,
        String remarks,
        String contentHash,
        Instant lastSeen
) {
    public CanonicalEntity {
        if (uid == null || uid.isBlank()) {
            throw new IllegalArgumentException("uid is required");
        }
        Objects.requireNonNull(source, "source is required");
        entityType = entityType == null ? EntityType.OTHER : entityType;
        programs = clean(programs);
        aliases = clean(aliases);
        addresses = clean(addresses);
        datesOfBirth = clean(datesOfBirth);
        placesOfBirth = clean(placesOfBirth);
        nationalities = clean(nationalities);
    }

    public static Builder builder(SanctionsSource source, String uid) {
        return new Builder(source, uid);
    }

    public CanonicalEntity withLastSeen(Instant seenAt) {
        return new CanonicalEntity(uid, name, entityType, source, programs, aliases, addresses, datesOfBirth,
                placesOfBirth, nationalities, remarks, contentHash, seenAt);
    }

    public Builder toBuilder() {
        return new Builder(source, uid)
                .name(name)
                .entityType(entityType)
                .programs(programs)
                .aliases(aliases)
                .addresses(addresses)
                .datesOfBirth(datesOfBirth)
                .placesOfBirth(placesOfBirth)
                .nationalities(nationalities)
                .remarks(remarks)
                .lastSeen(lastSeen);
    }

    private static <T> List<T> clean(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }

    public static final class Builder {
        private final SanctionsSource source;
        private final String uid;
        private String name;
        private EntityType entityType = EntityType.OTHER;
        private List<String> programs = new ArrayList<>();
        private List<String> aliases = new ArrayList<>();
        private List<Address> addresses = new ArrayList<>();
        private List<String> datesOfBirth = new ArrayList<>();
        private List<String> placesOfBirth = new ArrayList<>();
        private List<String> nationalities = new ArrayList<>();
        private String remarks;
        private Instant lastSeen;

        private Builder(SanctionsSource source, String uid) {
            this.source = source;
            this.uid = uid;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder programs(List<String> programs) {
            this.programs = new ArrayList<>(programs);
            return this;
        }

        public Builder aliases(List<String> aliases) {
            this.aliases = new ArrayList<>(aliases);
            return this;
        }

        public Builder addresses(List<Address> addresses) {
            this.addresses = new ArrayList<>(addresses);
            return this;
        }

        public Builder datesOfBirth(List<String> datesOfBirth) {
            this.datesOfBirth = new ArrayList<>(datesOfBirth);
            return this;
        }

        public Builder placesOfBirth(List<String> placesOfBirth) {
            this.placesOfBirth = new ArrayList<>(placesOfBirth);
            return this;
        }

        public Builder nationalities(List<String> nationalities) {
            this.nationalities = new ArrayList<>(nationalities);
            return this;
        }

        public Builder remarks(String remarks) {
            this.remarks = remarks;
            return this;
        }

        public Builder lastSeen(Instant lastSeen) {
            this.lastSeen = lastSeen;
            return this;
        }

        public Builder addProgram(String program) {
            addIfPresent(programs, program);
            return this;
        }

        public Builder addAlias(String alias) {
            addIfPresent(aliases, alias);
            return this;
        }

        public Builder addAddress(Address address) {
            if (address != null && !address.isEmpty()) {
                addresses.add(address);
            }
            return this;
        }

        public Builder addDateOfBirth(String dateOfBirth) {
            addIfPresent(datesOfBirth, dateOfBirth);
            return this;
        }

        public Builder addPlaceOfBirth(String placeOfBirth) {
            addIfPresent(placesOfBirth, placeOfBirth);
            return this;
        }

        public Builder addNationality(String nationality) {
            addIfPresent(nationalities, nationality);
            return this;
        }

        public CanonicalEntity build() {
            CanonicalEntity unhashed = new CanonicalEntity(uid, name, entityType, source, programs, aliases, addresses,
                    datesOfBirth, placesOfBirth, nationalities, remarks, null, lastSeen);
            String hash = EntityNormalizer.contentHash(unhashed);
            return new CanonicalEntity(uid, name, entityType, source, programs, aliases, addresses,
                    datesOfBirth, placesOfBirth, nationalities, remarks, hash, lastSeen);
        }

        private static void addIfPresent(List<String> target, String value) {
            if (value != null && !value.isBlank() && !target.contains(value.trim())) {
                target.add(value.trim());
            }
        }
    }
}
