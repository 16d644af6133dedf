package com.covenantguard.config;

import com.covenantguard.report.Severity;
import com.covenantguard.report.Violation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Penalty weights and blocking rules used by the score aggregator.
 */
public record ScoringPolicy(
        Map<Severity, Integer> penalties,
        int baselineScore,
        int softFailBudget,
        Set<String> blockingCategories
) {

    /** Security categories that block at critical/high severity no matter what configuration says. */
    public static final Set<String> ALWAYS_BLOCKING = Set.of(
            "position", "covenant", "output_bound", "token_pairing", "division", "vocabulary", "verification");

    public ScoringPolicy {
        EnumMap<Severity, Integer> copy = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            Integer p = penalties.get(s);
            if (p == null || p < 0) {
                throw new IllegalArgumentException("penalty for " + s.label() + " must be a non-negative integer");
            }
            copy.put(s, p);
        }
        penalties = Collections.unmodifiableMap(copy);
        if (baselineScore < 0) {
            throw new IllegalArgumentException("baseline score must be >= 0");
        }
        if (softFailBudget < 0) {
            throw new IllegalArgumentException("soft fail budget must be >= 0");
        }
        TreeSet<String> categories = new TreeSet<>(ALWAYS_BLOCKING);
        categories.addAll(blockingCategories);
        blockingCategories = Collections.unmodifiableSet(categories);
    }

    public int penalty(Severity severity) {
        return penalties.get(severity);
    }

    /** A blocking violation hard-fails the contract on its own. */
    public boolean isBlocking(Violation v) {
        return v.severity().isBlockingGrade() && blockingCategories.contains(v.category());
    }
}
