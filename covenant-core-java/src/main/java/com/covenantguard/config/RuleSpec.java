package com.covenantguard.config;

import com.covenantguard.report.Severity;

/** Static description of one rule id, as loaded from the rule table. */
public record RuleSpec(
        String id,
        Severity severity,
        String category,
        String exploit,
        String fixHint,
        String pattern
) {}
