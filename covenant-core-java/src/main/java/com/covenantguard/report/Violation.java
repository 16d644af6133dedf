package com.covenantguard.report;

import com.google.gson.annotations.SerializedName;

/**
 * One finding. {@code ruleId} is machine-readable and stable across releases;
 * {@code exploit} describes what an adversary gains if the finding is real.
 */
public record Violation(
        @SerializedName("rule_id")  String ruleId,
        @SerializedName("reason")   String reason,
        @SerializedName("exploit")  String exploit,
        @SerializedName("location") SourceLocation location,
        @SerializedName("severity") Severity severity,
        @SerializedName("category") String category
) {
    @Override
    public String toString() {
        return "[" + severity.label() + "] " + ruleId + " at " + location + ": " + reason;
    }
}
