package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.FunctionNode;
import com.covenantguard.ast.AstModel.Stmt;
import com.covenantguard.config.RuleTable;
import com.covenantguard.report.SourceLocation;
import com.covenantguard.report.Violation;

abstract class AbstractDetector implements Detector {

    protected final RuleTable rules;

    protected AbstractDetector(RuleTable rules) {
        this.rules = rules;
    }

    protected Violation violation(String reason, FunctionNode function, Stmt stmt) {
        return rules.violation(id(), reason, SourceLocation.of(function, stmt));
    }

    protected Violation violation(String ruleId, String reason, SourceLocation location) {
        return rules.violation(ruleId, reason, location);
    }
}
