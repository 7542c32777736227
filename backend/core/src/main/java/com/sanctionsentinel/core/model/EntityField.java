package com.sanctionsentinel.core.model;

import com.sanctionsentinel.core.util.EntityNormalizer;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * The tracked fields of a {@link CanonicalEntity}, in hashing order. Used both to build the
 * content hash and to compare two observations of the same uid field by field.
 */
public enum EntityField {
    NAME("name", false, CanonicalEntity::name),
    ENTITY_TYPE("entityType", false, entity -> entity.entityType().name()),
    PROGRAMS("programs", true, CanonicalEntity::programs),
    ALIASES("aliases", true, CanonicalEntity::aliases),
    ADDRESSES("addresses", true, entity -> entity.addresses().stream().map(Address::formatted).toList()),
    DATES_OF_BIRTH("datesOfBirth", true, CanonicalEntity::datesOfBirth),
    PLACES_OF_BIRTH("placesOfBirth", true, CanonicalEntity::placesOfBirth),
    NATIONALITIES("nationalities", true, CanonicalEntity::nationalities),
    REMARKS("remarks", false, CanonicalEntity::remarks);

    private final String fieldName;
    private final boolean multiValued;
    private final Function<CanonicalEntity, Object> accessor;

    EntityField(String fieldName, boolean multiValued, Function<CanonicalEntity, Object> accessor) {
        this.fieldName = fieldName;
        this.multiValued = multiValued;
        this.accessor = accessor;
    }

    public String fieldName() {
        return fieldName;
    }

    public boolean multiValued() {
        return multiValued;
    }

    /** The value as published, list fields in source order. */
    public Object rawValue(CanonicalEntity entity) {
        return accessor.apply(entity);
    }

    /** A normalized string for scalar fields, a sorted set for list fields. */
    @SuppressWarnings("unchecked")
    public Object normalizedValue(CanonicalEntity entity) {
        Object raw = rawValue(entity);
        if (multiValued) {
            return EntityNormalizer.normalizeList((List<String>) raw);
        }
        return EntityNormalizer.normalizeText((String) raw);
    }

    public static Optional<EntityField> byName(String fieldName) {
        return Arrays.stream(values()).filter(field -> field.fieldName.equals(fieldName)).findFirst();
    }
}
