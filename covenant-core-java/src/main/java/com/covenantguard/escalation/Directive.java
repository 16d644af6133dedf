package com.covenantguard.escalation;

import com.covenantguard.report.Violation;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * What the drafting loop should do next.
 *
 * @param guidance material to feed back into the next draft; empty for {@link Kind#HARD_FAIL}
 */
public record Directive(
        @SerializedName("kind")       Kind kind,
        @SerializedName("attempt")    int attempt,
        @SerializedName("violations") List<Violation> violations,
        @SerializedName("guidance")   List<RuleGuidance> guidance
) {
    public enum Kind {
        @SerializedName("retry_minimal")  RETRY_MINIMAL,
        @SerializedName("retry_expanded") RETRY_EXPANDED,
        @SerializedName("hard_fail")      HARD_FAIL
    }

    public Directive {
        violations = List.copyOf(violations);
        guidance = List.copyOf(guidance);
    }

    public boolean isRetry() {
        return kind != Kind.HARD_FAIL;
    }

    /**
     * One entry of retry guidance. Minimal guidance fills only rule id and reason;
     * the other fields are null.
     */
    public record RuleGuidance(
            @SerializedName("rule_id")  String ruleId,
            @SerializedName("reason")   String reason,
            @SerializedName("exploit")  String exploit,
            @SerializedName("fix_hint") String fixHint,
            @SerializedName("pattern")  String pattern
    ) {}
}
