package com.covenantguard.config;

import com.covenantguard.report.SourceLocation;
import com.covenantguard.report.Violation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable rule id to {@link RuleSpec} table. Detectors never hard-code
 * severity, category or exploit text; they look them up here.
 */
public final class RuleTable {

    private final Map<String, RuleSpec> rules;

    public RuleTable(Map<String, RuleSpec> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public Optional<RuleSpec> find(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public boolean contains(String ruleId) {
        return rules.containsKey(ruleId);
    }

    /** @throws IllegalArgumentException if the rule id is not in the table */
    public RuleSpec rule(String ruleId) {
        RuleSpec spec = rules.get(ruleId);
        if (spec == null) {
            throw new IllegalArgumentException("Unknown rule id: " + ruleId);
        }
        return spec;
    }

    /** Builds a violation carrying the table's severity, category and exploit text for {@code ruleId}. */
    public Violation violation(String ruleId, String reason, SourceLocation location) {
        RuleSpec spec = rule(ruleId);
        return new Violation(ruleId, reason, spec.exploit(), location, spec.severity(), spec.category());
    }

    public Set<String> ids() {
        return rules.keySet();
    }
}
