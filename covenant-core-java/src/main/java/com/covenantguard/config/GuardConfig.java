package com.covenantguard.config;

import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Deserialized form of covenant-guard-defaults.json and of user override files.
 * Every field is optional in an override file; absent fields keep the default.
 */
public class GuardConfig {

    public static class RuleEntry {
        @SerializedName("severity") String severity;
        @SerializedName("category") String category;
        @SerializedName("exploit")  String exploit;
        @SerializedName("fix_hint") String fixHint;
        @SerializedName("pattern")  String pattern;

        RuleEntry overlay(RuleEntry override) {
            RuleEntry merged = new RuleEntry();
            merged.severity = override.severity != null ? override.severity : severity;
            merged.category = override.category != null ? override.category : category;
            merged.exploit  = override.exploit  != null ? override.exploit  : exploit;
            merged.fixHint  = override.fixHint  != null ? override.fixHint  : fixHint;
            merged.pattern  = override.pattern  != null ? override.pattern  : pattern;
            return merged;
        }
    }

    public static class EscalationEntry {
        @SerializedName("minimal_through_attempt")  Integer minimalThroughAttempt;
        @SerializedName("expanded_through_attempt") Integer expandedThroughAttempt;
    }

    @SerializedName("rules")
    private Map<String, RuleEntry> rules;

    @SerializedName("penalties")
    private Map<String, Integer> penalties;

    @SerializedName("baseline_score")
    private Integer baselineScore;

    /** Penalty points of non-blocking violations tolerated before the result hard-fails. */
    @SerializedName("soft_fail_budget")
    private Integer softFailBudget;

    /** Categories that block at critical/high severity in addition to the built-in security ones. */
    @SerializedName("blocking_categories")
    private List<String> blockingCategories;

    @SerializedName("escalation")
    private EscalationEntry escalation;

    public Map<String, RuleEntry> getRules() { return rules != null ? rules : Collections.emptyMap(); }
    public Map<String, Integer> getPenalties() { return penalties != null ? penalties : Collections.emptyMap(); }
    public Integer getBaselineScore() { return baselineScore; }
    public Integer getSoftFailBudget() { return softFailBudget; }
    public List<String> getBlockingCategories() {
        return blockingCategories != null ? blockingCategories : Collections.emptyList();
    }
    public EscalationEntry getEscalation() { return escalation; }

    /**
     * Returns a new config with {@code override} laid over this one: rules merge per id
     * and per field, penalties per severity, blocking categories are unioned, scalars replace.
     */
    public GuardConfig merge(GuardConfig override) {
        GuardConfig merged = new GuardConfig();

        merged.rules = new LinkedHashMap<>(getRules());
        for (Map.Entry<String, RuleEntry> e : override.getRules().entrySet()) {
            RuleEntry base = merged.rules.get(e.getKey());
            merged.rules.put(e.getKey(), base != null ? base.overlay(e.getValue()) : e.getValue());
        }

        merged.penalties = new LinkedHashMap<>(getPenalties());
        merged.penalties.putAll(override.getPenalties());

        merged.baselineScore = override.baselineScore != null ? override.baselineScore : baselineScore;
        merged.softFailBudget = override.softFailBudget != null ? override.softFailBudget : softFailBudget;

        LinkedHashSet<String> categories = new LinkedHashSet<>(getBlockingCategories());
        categories.addAll(override.getBlockingCategories());
        merged.blockingCategories = new ArrayList<>(categories);

        merged.escalation = new EscalationEntry();
        EscalationEntry baseEsc = escalation != null ? escalation : new EscalationEntry();
        EscalationEntry overEsc = override.escalation != null ? override.escalation : new EscalationEntry();
        merged.escalation.minimalThroughAttempt = overEsc.minimalThroughAttempt != null
                ? overEsc.minimalThroughAttempt : baseEsc.minimalThroughAttempt;
        merged.escalation.expandedThroughAttempt = overEsc.expandedThroughAttempt != null
                ? overEsc.expandedThroughAttempt : baseEsc.expandedThroughAttempt;
        return merged;
    }
}
