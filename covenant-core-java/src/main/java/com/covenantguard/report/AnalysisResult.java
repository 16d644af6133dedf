package com.covenantguard.report;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated outcome of running every detector over one contract.
 *
 * @param violations     in function order, then detector order, then source order
 * @param hardFail       true if any violation is blocking or the soft budget is exceeded
 * @param score          baseline minus penalties, floored at zero
 * @param severityCounts violation count per severity label, every severity present
 * @param softPenalty    penalty points of the non-blocking violations
 */
public record AnalysisResult(
        @SerializedName("contract")        String contract,
        @SerializedName("violations")      List<Violation> violations,
        @SerializedName("hard_fail")       boolean hardFail,
        @SerializedName("score")           int score,
        @SerializedName("risk_level")      RiskLevel riskLevel,
        @SerializedName("severity_counts") Map<String, Integer> severityCounts,
        @SerializedName("soft_penalty")    int softPenalty
) {
    public AnalysisResult {
        violations = List.copyOf(violations);
        severityCounts = Collections.unmodifiableMap(new LinkedHashMap<>(severityCounts));
    }

    public boolean passed() {
        return !hardFail;
    }

    public long count(String ruleId) {
        return violations.stream().filter(v -> v.ruleId().equals(ruleId)).count();
    }
}
