package com.covenantguard.escalation;

import com.covenantguard.config.EscalationPolicy;
import com.covenantguard.config.RuleSpec;
import com.covenantguard.config.RuleTable;
import com.covenantguard.escalation.Directive.Kind;
import com.covenantguard.escalation.Directive.RuleGuidance;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stateless mapping from (attempt, violations) to the next directive.
 * The thresholds come from {@link EscalationPolicy}; nothing here depends on scoring.
 */
public class EscalationController {

    private final EscalationPolicy policy;
    private final RuleTable rules;

    public EscalationController(EscalationPolicy policy, RuleTable rules) {
        this.policy = policy;
        this.rules = rules;
    }

    /**
     * @param attempt    1-based number of the attempt that produced {@code violations}
     * @param violations findings of that attempt; must not be empty
     * @throws IllegalArgumentException if attempt is below 1 or there is nothing to escalate
     */
    public Directive decide(int attempt, List<Violation> violations) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("no violations to escalate at attempt " + attempt);
        }
        Kind kind = kindFor(attempt);
        switch (kind) {
            case RETRY_MINIMAL:
                return new Directive(kind, attempt, violations, minimalGuidance(violations));
            case RETRY_EXPANDED:
                return new Directive(kind, attempt, violations, expandedGuidance(violations));
            default:
                return new Directive(kind, attempt, violations, List.of());
        }
    }

    Kind kindFor(int attempt) {
        if (attempt <= policy.minimalThroughAttempt()) return Kind.RETRY_MINIMAL;
        if (attempt <= policy.expandedThroughAttempt()) return Kind.RETRY_EXPANDED;
        return Kind.HARD_FAIL;
    }

    private static List<RuleGuidance> minimalGuidance(List<Violation> violations) {
        List<RuleGuidance> out = new ArrayList<>();
        for (Violation v : violations) {
            out.add(new RuleGuidance(v.ruleId(), v.reason(), null, null, null));
        }
        return out;
    }

    // One entry per rule id, in first-seen order; the reason is the first one seen for that rule.
    private List<RuleGuidance> expandedGuidance(List<Violation> violations) {
        Map<String, RuleGuidance> byRule = new LinkedHashMap<>();
        for (Violation v : violations) {
            if (byRule.containsKey(v.ruleId())) continue;
            Optional<RuleSpec> spec = rules.find(v.ruleId());
            byRule.put(v.ruleId(), new RuleGuidance(
                    v.ruleId(),
                    v.reason(),
                    v.exploit(),
                    spec.map(RuleSpec::fixHint).orElse(null),
                    spec.map(RuleSpec::pattern).orElse(null)));
        }
        return new ArrayList<>(byRule.values());
    }
}
