package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstPatterns.TxCollection;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fee arithmetic on a single input: {@code tx.inputs[i].value - fee}, or a fee-named
 * binding computed from an input value. One finding per statement.
 */
public class FeeAssumptionDetector extends AbstractDetector {

    public FeeAssumptionDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "fee_assumption"; }

    @Override
    public String description() {
        return "Miner fee deducted from one input's value";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        List<Violation> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            if (stmt instanceof Assignment && isFeeName(((Assignment) stmt).name())
                    && AstWalker.contains(stmt.expression(), FeeAssumptionDetector::isInputValue)) {
                out.add(violation("'" + ((Assignment) stmt).name() + "' is derived from an input value",
                        function, stmt));
                continue;
            }
            for (Expr e : AstWalker.preOrder(stmt.expression())) {
                if (!(e instanceof Binary) || ((Binary) e).op() != BinaryOp.SUB) continue;
                Binary b = (Binary) e;
                if (AstWalker.contains(b.left(), FeeAssumptionDetector::isInputValue)
                        && b.right() instanceof Identifier && isFeeName(((Identifier) b.right()).name())) {
                    out.add(violation("input value reduced by '" + ((Identifier) b.right()).name() + "'",
                            function, stmt));
                    break;
                }
            }
        }
        return out;
    }

    private static boolean isInputValue(Expr e) {
        return AstPatterns.txField(e)
                .filter(ref -> ref.collection() == TxCollection.INPUTS)
                .filter(ref -> ref.field().equals(AstPatterns.VALUE))
                .isPresent();
    }

    private static boolean isFeeName(String name) {
        return name.toLowerCase(Locale.ROOT).contains("fee");
    }
}
