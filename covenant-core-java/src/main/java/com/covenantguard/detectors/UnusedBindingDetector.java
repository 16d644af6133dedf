package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * A declared local that no later statement reads.
 */
public class UnusedBindingDetector extends AbstractDetector {

    public UnusedBindingDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "unused_binding"; }

    @Override
    public String description() {
        return "Local bindings that are never read";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        List<Violation> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            if (!(stmt instanceof Assignment) || ((Assignment) stmt).declaredType() == null) continue;
            String name = ((Assignment) stmt).name();
            if (!readAfter(function, stmt.ordinal(), name)) {
                out.add(violation("'" + name + "' is bound but never read", function, stmt));
            }
        }
        return out;
    }

    private static boolean readAfter(FunctionNode function, int ordinal, String name) {
        for (int i = ordinal + 1; i <= function.lastOrdinal(); i++) {
            if (AstWalker.contains(function.statement(i).expression(), e -> AstPatterns.isIdentifier(e, name))) {
                return true;
            }
        }
        return false;
    }
}
