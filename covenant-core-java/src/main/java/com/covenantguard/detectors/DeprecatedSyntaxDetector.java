package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstPatterns.TxCollection;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Introspection and builtins that current compilers no longer accept:
 * {@code tx.locktime}, {@code tx.inputs[i].time}, {@code checkDataSig} and {@code new Sig(...)}.
 * One finding per occurrence.
 */
public class DeprecatedSyntaxDetector extends AbstractDetector {

    public DeprecatedSyntaxDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "deprecated_syntax"; }

    @Override
    public String description() {
        return "Removed or renamed language features";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        List<Violation> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            for (Expr e : AstWalker.preOrder(stmt.expression())) {
                String problem = deprecation(e);
                if (problem != null) {
                    out.add(violation(problem, function, stmt));
                }
            }
        }
        return out;
    }

    private static String deprecation(Expr e) {
        if (AstPatterns.isTxField(e, "locktime")) {
            return "tx.locktime is deprecated; use tx.time for absolute or tx.age for relative locks";
        }
        if (AstPatterns.txField(e)
                .filter(ref -> ref.collection() == TxCollection.INPUTS && ref.field().equals("time"))
                .isPresent()) {
            return "tx.inputs[i].time does not exist; use tx.time";
        }
        if (e instanceof Call) {
            Call call = (Call) e;
            if (call.name().equals("checkDataSig")) return "checkDataSig has been removed";
            if (call.name().equals("Sig") && call.receiver() == null) return "the Sig(...) constructor has been removed";
        }
        return null;
    }
}
