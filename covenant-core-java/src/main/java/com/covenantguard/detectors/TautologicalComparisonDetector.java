package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.dominance.ExprEquivalence;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.List;

public class TautologicalComparisonDetector extends AbstractDetector {

    public TautologicalComparisonDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "tautological_comparison"; }

    @Override
    public String description() {
        return "Comparisons whose operands are the same expression";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        List<Violation> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            for (Expr e : AstWalker.preOrder(stmt.expression())) {
                if (!(e instanceof Binary)) continue;
                Binary b = (Binary) e;
                if (b.op().isComparison() && ExprEquivalence.equivalent(b.left(), b.right())) {
                    out.add(violation("'" + ExprEquivalence.canonical(b.left()) + " " + b.op().symbol()
                            + " " + ExprEquivalence.canonical(b.right()) + "' is constant", function, stmt));
                }
            }
        }
        return out;
    }
}
