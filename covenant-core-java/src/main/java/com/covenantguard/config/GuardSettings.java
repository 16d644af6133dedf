package com.covenantguard.config;

/**
 * The validated, immutable configuration one run analyzes with.
 */
public record GuardSettings(RuleTable rules, ScoringPolicy scoring, EscalationPolicy escalation) {

    /** Settings from the bundled defaults only. */
    public static GuardSettings defaults() {
        return new GuardConfigReader().load(null);
    }
}
