package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.FunctionNode;
import com.covenantguard.report.Violation;

import java.util.List;

/**
 * Base interface for all rule checks.
 * Each detector inspects one function in isolation and must not rely on any other detector having run.
 */
public interface Detector {

    /**
     * Returns a unique identifier for this detector.
     */
    String id();

    /**
     * Returns a human-readable description of what this detector finds.
     */
    String description();

    /**
     * Rule ids this detector may emit. Every id must exist in the rule table.
     */
    default List<String> ruleIds() {
        return List.of(id());
    }

    /**
     * Checks one function.
     *
     * @return findings in source order; empty if the function is clean
     * @throws DetectorException if the function contains a shape this detector cannot classify
     */
    List<Violation> detect(FunctionNode function);
}
