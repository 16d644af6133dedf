package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.dominance.DominanceResolver;
import com.covenantguard.dominance.ExprEquivalence;
import com.covenantguard.dominance.GuardShapes;
import com.covenantguard.report.Violation;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code /} and {@code %} with a non-literal divisor need a dominating strictly-positive
 * bound on a structurally equivalent divisor. A literal zero divisor is always reported.
 */
public class UnguardedDivisionDetector extends AbstractDetector {

    public UnguardedDivisionDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "unguarded_division"; }

    @Override
    public String description() {
        return "Division or modulo by a value not proven strictly positive";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        DominanceResolver resolver = new DominanceResolver(function);
        List<Violation> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            for (Expr e : AstWalker.preOrder(stmt.expression())) {
                if (!(e instanceof Binary)) continue;
                Binary b = (Binary) e;
                if (b.op() != BinaryOp.DIV && b.op() != BinaryOp.MOD) continue;

                Expr divisor = b.right();
                Optional<BigInteger> constant = AstPatterns.intLiteral(divisor);
                if (constant.isPresent()) {
                    if (constant.get().signum() == 0) {
                        out.add(violation("division by literal zero", function, stmt));
                    }
                    continue;
                }
                if (!resolver.guards(stmt, b, GuardShapes.strictlyPositive(divisor)).found()) {
                    out.add(violation("divisor " + ExprEquivalence.canonical(divisor)
                            + " is not asserted > 0 before '" + b.op().symbol() + "'", function, stmt));
                }
            }
        }
        return out;
    }
}
