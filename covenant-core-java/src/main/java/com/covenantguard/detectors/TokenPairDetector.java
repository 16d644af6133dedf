package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstPatterns.TxCollection;
import com.covenantguard.ast.AstPatterns.TxFieldRef;
import com.covenantguard.config.RuleTable;
import com.covenantguard.dominance.ExprEquivalence;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An asserted {@code tx.outputs[k].tokenCategory} needs an asserted {@code tx.outputs[k].tokenAmount}
 * on the same output somewhere in the function. Order does not matter. A field counts as asserted
 * when a {@code require} reads it directly or through a local binding; a binding no assertion
 * reads counts for nothing.
 */
public class TokenPairDetector extends AbstractDetector {

    public TokenPairDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "token_pair"; }

    @Override
    public String description() {
        return "Outputs whose token category is checked but whose token amount is not";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        Map<String, Expr> bindings = AstPatterns.bindings(function);
        Map<String, Stmt> categoryChecks = new LinkedHashMap<>();
        Set<String> amountChecks = new HashSet<>();
        for (Stmt stmt : function.body()) {
            if (!(stmt instanceof Assertion)) continue;
            for (Expr e : AstPatterns.throughBindings(((Assertion) stmt).predicate(), bindings)) {
                Optional<TxFieldRef> ref = AstPatterns.txField(e);
                if (ref.isEmpty() || ref.get().collection() != TxCollection.OUTPUTS) continue;
                String index = ExprEquivalence.canonical(ref.get().index());
                if (ref.get().field().equals(AstPatterns.TOKEN_AMOUNT)) {
                    amountChecks.add(index);
                } else if (ref.get().field().equals(AstPatterns.TOKEN_CATEGORY)) {
                    categoryChecks.putIfAbsent(index, stmt);
                }
            }
        }

        List<Violation> out = new ArrayList<>();
        for (Map.Entry<String, Stmt> check : categoryChecks.entrySet()) {
            if (!amountChecks.contains(check.getKey())) {
                out.add(violation("tx.outputs[" + check.getKey() + "].tokenCategory is checked but its tokenAmount never is",
                        function, check.getValue()));
            }
        }
        return out;
    }
}
