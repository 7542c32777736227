package com.sanctionsentinel.core.risk;

import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.ChangeType;
import com.sanctionsentinel.core.model.RiskLevel;

import java.util.List;
import java.util.Set;

/**
 * Assigns a {@link RiskLevel} to a change event from an ordered rule table. Rules are listed
 * in precedence order and the first match wins; events no rule matches fall back to
 * {@link RiskLevel#MEDIUM}.
 */
public class RiskClassifier {
    public static final Set<String> HIGH_SALIENCE_FIELDS = Set.of("programs", "aliases", "name", "nationalities", "entityType");
    public static final Set<String> LOW_SALIENCE_FIELDS = Set.of("remarks", "placesOfBirth");

    private final List<RiskRule> rules;

    public RiskClassifier() {
        this(defaultRules());
    }

    public RiskClassifier(List<RiskRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<RiskRule> defaultRules() {
        return List.of(
                RiskRule.always("delisted", ChangeType.REMOVED, RiskLevel.CRITICAL),
                RiskRule.always("newly-listed", ChangeType.ADDED, RiskLevel.HIGH),
                RiskRule.anyOf("identity-or-program-change", HIGH_SALIENCE_FIELDS, RiskLevel.HIGH),
                RiskRule.only("low-salience-change", LOW_SALIENCE_FIELDS, RiskLevel.LOW),
                RiskRule.always("other-modification", ChangeType.MODIFIED, RiskLevel.MEDIUM)
        );
    }

    public RiskLevel classify(ChangeEvent event) {
        for (RiskRule rule : rules) {
            if (rule.matches(event)) {
                return rule.level();
            }
        }
        return RiskLevel.MEDIUM;
    }

    public List<ChangeEvent> classifyAll(List<ChangeEvent> events) {
        return events.stream().map(event -> event.withRiskLevel(classify(event))).toList();
    }

    public List<RiskRule> rules() {
        return rules;
    }
}
