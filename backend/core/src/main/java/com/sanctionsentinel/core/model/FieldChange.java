package com.sanctionsentinel.core.model;

/**
 * One differing field of a modified entity. Values are either a {@code String} or a
 * {@code List<String>} in the order the authority published them.
 */
public record FieldChange(String field, Object oldValue, Object newValue) {
}
