package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.dominance.DominanceResolver;
import com.covenantguard.dominance.ExprEquivalence;
import com.covenantguard.dominance.GuardShape;
import com.covenantguard.dominance.GuardShapes;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Every {@code tx.inputs[this.activeInputIndex]} or {@code tx.outputs[this.activeInputIndex]}
 * access must be dominated by proof that the active input is this contract: its locking
 * bytecode matched against {@code this.activeBytecode} or a covenant output, or the
 * position pinned to a literal. One finding per statement.
 */
public class UnvalidatedPositionDetector extends AbstractDetector {

    private static final GuardShape GUARD = GuardShapes.selfPositionValidated();

    public UnvalidatedPositionDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "unvalidated_position"; }

    @Override
    public String description() {
        return "Self-position accesses not preceded by a locking bytecode check or position pin";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        DominanceResolver resolver = new DominanceResolver(function);
        List<Violation> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            IndexAccess access = firstSelfIndexed(stmt.expression());
            if (access == null) continue;
            if (!resolver.dominates(stmt.ordinal(), GUARD)) {
                out.add(violation(ExprEquivalence.canonical(access)
                        + " is read before the active input is proven to be this contract", function, stmt));
            }
        }
        return out;
    }

    private static IndexAccess firstSelfIndexed(Expr root) {
        for (Expr e : AstWalker.preOrder(root)) {
            if (e instanceof IndexAccess && AstPatterns.isSelfPosition(((IndexAccess) e).index())) {
                return (IndexAccess) e;
            }
        }
        return null;
    }
}
