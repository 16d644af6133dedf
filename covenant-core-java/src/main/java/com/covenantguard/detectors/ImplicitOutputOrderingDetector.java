package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstPatterns.TxCollection;
import com.covenantguard.ast.AstPatterns.TxFieldRef;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.dominance.DominanceResolver;
import com.covenantguard.dominance.ExprEquivalence;
import com.covenantguard.dominance.GuardShapes;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reading {@code tx.outputs[k].value} (or any field other than the locking bytecode) assumes
 * the output at position k is the one the contract means. The transaction builder chooses
 * output order, so some assertion must equate {@code tx.outputs[k].lockingBytecode} to a value.
 * One finding per output index, at its first read.
 */
public class ImplicitOutputOrderingDetector extends AbstractDetector {

    public ImplicitOutputOrderingDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "implicit_output_ordering"; }

    @Override
    public String description() {
        return "Outputs addressed by position whose locking bytecode is never asserted";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        Map<String, TxFieldRef> firstRef = new LinkedHashMap<>();
        Map<String, Stmt> firstStmt = new LinkedHashMap<>();
        for (Stmt stmt : function.body()) {
            for (Expr e : AstWalker.preOrder(stmt.expression())) {
                Optional<TxFieldRef> ref = AstPatterns.txField(e);
                if (ref.isEmpty() || ref.get().collection() != TxCollection.OUTPUTS) continue;
                if (ref.get().field().equals(AstPatterns.LOCKING_BYTECODE)) continue;
                String index = ExprEquivalence.canonical(ref.get().index());
                if (firstRef.putIfAbsent(index, ref.get()) == null) {
                    firstStmt.put(index, stmt);
                }
            }
        }
        if (firstRef.isEmpty()) return List.of();

        DominanceResolver resolver = new DominanceResolver(function);
        List<Violation> out = new ArrayList<>();
        for (Map.Entry<String, TxFieldRef> read : firstRef.entrySet()) {
            TxFieldRef ref = read.getValue();
            if (!resolver.findAnywhere(GuardShapes.outputFieldTied(ref.index(), AstPatterns.LOCKING_BYTECODE, x -> true)).found()) {
                out.add(violation("tx.outputs[" + read.getKey() + "]." + ref.field()
                                + " is read but tx.outputs[" + read.getKey() + "].lockingBytecode is never asserted",
                        function, firstStmt.get(read.getKey())));
            }
        }
        return out;
    }
}
