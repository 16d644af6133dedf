package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.dominance.ExprEquivalence;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The same signature passed to {@code checkSig} with two different public keys.
 */
public class SignatureReuseDetector extends AbstractDetector {

    public SignatureReuseDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "signature_reuse"; }

    @Override
    public String description() {
        return "One signature checked against more than one public key";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        Map<String, String> keyBySignature = new HashMap<>();
        List<Violation> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            for (Expr e : AstWalker.preOrder(stmt.expression())) {
                if (!(e instanceof Call)) continue;
                Call call = (Call) e;
                if (call.kind() != CallKind.SIGNATURE || !call.name().equals("checkSig")
                        || call.arguments().size() != 2) continue;
                String sig = ExprEquivalence.canonical(call.arguments().get(0));
                String key = ExprEquivalence.canonical(call.arguments().get(1));
                String first = keyBySignature.putIfAbsent(sig, key);
                if (first != null && !first.equals(key)) {
                    out.add(violation("signature " + sig + " is checked against both " + first + " and " + key,
                            function, stmt));
                }
            }
        }
        return out;
    }
}
