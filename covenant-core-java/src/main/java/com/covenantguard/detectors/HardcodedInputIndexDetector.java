package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstPatterns.TxCollection;
import com.covenantguard.ast.AstPatterns.TxEntry;
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
 * Every {@code tx.inputs[<literal>]} access needs a dominating equality pinning that input's
 * token category, locking bytecode or outpoint hash. Reported per access.
 * An input index that is neither a literal nor {@code this.activeInputIndex} cannot be
 * classified and raises {@link DetectorException}.
 */
public class HardcodedInputIndexDetector extends AbstractDetector {

    public HardcodedInputIndexDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "hardcoded_input_index"; }

    @Override
    public String description() {
        return "Literal input indices read without pinning the input's identity";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        DominanceResolver resolver = new DominanceResolver(function);
        List<Violation> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            for (Expr e : AstWalker.preOrder(stmt.expression())) {
                Optional<TxEntry> entry = AstPatterns.txEntry(e);
                if (entry.isEmpty() || entry.get().collection() != TxCollection.INPUTS) continue;
                Expr index = entry.get().index();
                if (AstPatterns.isSelfPosition(index)) continue;

                Optional<BigInteger> literal = AstPatterns.intLiteral(index);
                if (literal.isEmpty()) {
                    throw new DetectorException("cannot classify input index " + ExprEquivalence.canonical(index)
                            + " in " + function.name() + " at statement " + stmt.ordinal());
                }
                if (!resolver.guards(stmt, e, GuardShapes.inputIdentityPinned(literal.get())).found()) {
                    out.add(violation("tx.inputs[" + literal.get() + "] is read without pinning its tokenCategory, "
                            + "lockingBytecode or outpointTransactionHash",
                            function, stmt));
                }
            }
        }
        return out;
    }
}
