package com.sanctionsentinel.core.util;

import com.sanctionsentinel.core.model.CanonicalEntity;
import com.sanctionsentinel.core.model.EntityField;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * The one normalization routine shared by every adapter, so entity hashes stay comparable
 * across sources and across runs.
 */
public final class EntityNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final char VALUE_SEPARATOR = '\u001f';
    private static final char FIELD_SEPARATOR = '\u001e';

    private EntityNormalizer() {
    }

    public static String normalizeText(String value) {
        if (value == null) {
            return "";
        }
        String composed = Normalizer.normalize(value, Normalizer.Form.NFC);
        return WHITESPACE.matcher(composed.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public static SortedSet<String> normalizeList(Collection<String> values) {
        SortedSet<String> normalized = new TreeSet<>();
        if (values == null) {
            return normalized;
        }
        for (String value : values) {
            String item = normalizeText(value);
            if (!item.isEmpty()) {
                normalized.add(item);
            }
        }
        return normalized;
    }

    public static String canonicalForm(CanonicalEntity entity) {
        StringBuilder out = new StringBuilder();
        out.append("uid=").append(normalizeText(entity.uid())).append(FIELD_SEPARATOR);
        out.append("source=").append(entity.source().name()).append(FIELD_SEPARATOR);
        for (EntityField field : EntityField.values()) {
            out.append(field.fieldName()).append('=');
            Object value = field.normalizedValue(entity);
            if (value instanceof SortedSet<?> set) {
                out.append(String.join(String.valueOf(VALUE_SEPARATOR), castStrings(set)));
            } else {
                out.append(value);
            }
            out.append(FIELD_SEPARATOR);
        }
        return out.toString();
    }

    public static String contentHash(CanonicalEntity entity) {
        return HashingUtils.sha256(canonicalForm(entity));
    }

    @SuppressWarnings("unchecked")
    private static Collection<String> castStrings(SortedSet<?> set) {
        return (Collection<String>) set;
    }
}
