package com.sanctionsentinel.core.risk;

import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ChangeType;
import com.sanctionsentinel.core.model.FieldChange;
import com.sanctionsentinel.core.model.RiskLevel;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * One row of the classification table.
 */
public record RiskRule(String name, ChangeType changeType, FieldMatch match, Set<String> fields, RiskLevel level) {
    public enum FieldMatch {
        /** Matches every event of the change type. */
        ALWAYS,
        /** At least one changed field is in the set. */
        ANY_OF,
        /** At least one field changed and every changed field is in the set. */
        ONLY
    }

    public RiskRule {
        fields = fields == null ? Set.of() : Set.copyOf(fields);
    }

    public static RiskRule always(String name, ChangeType changeType, RiskLevel level) {
        return new RiskRule(name, changeType, FieldMatch.ALWAYS, Set.of(), level);
    }

    public static RiskRule anyOf(String name, Set<String> fields, RiskLevel level) {
        return new RiskRule(name, ChangeType.MODIFIED, FieldMatch.ANY_OF, fields, level);
    }

    public static RiskRule only(String name, Set<String> fields, RiskLevel level) {
        return new RiskRule(name, ChangeType.MODIFIED, FieldMatch.ONLY, fields, level);
    }

    public boolean matches(ChangeEvent event) {
        if (event.changeType() != changeType) {
            return false;
        }
        Set<String> changed = event.fieldChanges().stream().map(FieldChange::field).collect(Collectors.toSet());
        return switch (match) {
            case ALWAYS -> true;
            case ANY_OF -> changed.stream().anyMatch(fields::contains);
            case ONLY -> !changed.isEmpty() && fields.containsAll(changed);
        };
    }
}
