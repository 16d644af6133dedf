package com.covenantguard.config;

/**
 * Attempt thresholds for the escalation ladder. Attempts are 1-based:
 * up to {@code minimalThroughAttempt} retry with minimal context, up to
 * {@code expandedThroughAttempt} retry with expanded context, after that hard-fail.
 */
public record EscalationPolicy(int minimalThroughAttempt, int expandedThroughAttempt) {

    public EscalationPolicy {
        if (minimalThroughAttempt < 0) {
            throw new IllegalArgumentException("minimalThroughAttempt must be >= 0, got " + minimalThroughAttempt);
        }
        if (expandedThroughAttempt < minimalThroughAttempt) {
            throw new IllegalArgumentException("expandedThroughAttempt (" + expandedThroughAttempt
                    + ") must not be below minimalThroughAttempt (" + minimalThroughAttempt + ")");
        }
    }

    public static EscalationPolicy standard() {
        return new EscalationPolicy(1, 2);
    }
}
