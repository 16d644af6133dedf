package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * With {@code tx.time} / {@code tx.age} on the left, only {@code >=} (at or after)
 * and {@code <} (strictly before) are accepted.
 */
public class TimeComparisonDetector extends AbstractDetector {

    public TimeComparisonDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "time_comparison"; }

    @Override
    public String description() {
        return "Time lock comparisons using an operator other than >= or <";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        List<Violation> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            for (Expr e : AstWalker.preOrder(stmt.expression())) {
                Optional<Binary> oriented = AstPatterns.orient(e, AstPatterns::isTimeIntrinsic);
                if (oriented.isEmpty()) continue;
                BinaryOp op = oriented.get().op();
                if (op == BinaryOp.GE || op == BinaryOp.LT) continue;
                String intrinsic = ((FieldAccess) oriented.get().left()).field();
                out.add(violation("tx." + intrinsic + " compared with '" + op.symbol()
                        + "'; use >= for at-or-after or < for strictly-before", function, stmt));
            }
        }
        return out;
    }
}
