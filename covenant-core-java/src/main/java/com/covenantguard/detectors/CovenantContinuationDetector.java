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
import com.covenantguard.report.SourceLocation;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * An output that carries this contract's state forward (its nftCommitment is asserted,
 * or its locking bytecode is asserted equal to this contract's) must have its locking
 * bytecode, token category and value each tied to the active input, either exactly or
 * through a value computed from the corresponding input field. Each missing tie is a
 * separate finding.
 */
public class CovenantContinuationDetector extends AbstractDetector {

    public static final String LOCKING_BYTECODE_RULE = "covenant_continuation.locking_bytecode";
    public static final String TOKEN_CATEGORY_RULE = "covenant_continuation.token_category";
    public static final String VALUE_RULE = "covenant_continuation.value";

    private static final String[][] TIED_FIELDS = {
            {AstPatterns.LOCKING_BYTECODE, LOCKING_BYTECODE_RULE},
            {AstPatterns.TOKEN_CATEGORY, TOKEN_CATEGORY_RULE},
            {AstPatterns.VALUE, VALUE_RULE},
    };

    public CovenantContinuationDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "covenant_continuation"; }

    @Override
    public String description() {
        return "State-continuing outputs whose locking bytecode, token category or value is not tied to the input";
    }

    @Override
    public List<String> ruleIds() {
        return List.of(LOCKING_BYTECODE_RULE, TOKEN_CATEGORY_RULE, VALUE_RULE);
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        Map<String, Expr> bindings = AstPatterns.bindings(function);
        Map<String, Assertion> continuations = continuingOutputs(function);
        if (continuations.isEmpty()) return List.of();

        DominanceResolver resolver = new DominanceResolver(function);
        List<Violation> out = new ArrayList<>();
        for (Map.Entry<String, Assertion> c : continuations.entrySet()) {
            Assertion trigger = c.getValue();
            Expr index = outputIndexOf(trigger, c.getKey());
            for (String[] tie : TIED_FIELDS) {
                String field = tie[0];
                Predicate<Expr> source = x -> derivesFromInput(x, field, bindings);
                if (!resolver.findAnywhere(GuardShapes.outputFieldTied(index, field, source)).found()) {
                    out.add(violation(tie[1], "continuing output tx.outputs[" + c.getKey() + "]." + field
                                    + " is not tied to tx.inputs[this.activeInputIndex]." + field,
                            SourceLocation.of(function, trigger)));
                }
            }
        }
        return out;
    }

    // canonical output index -> first assertion that marks the output as continuing state
    private static Map<String, Assertion> continuingOutputs(FunctionNode function) {
        Map<String, Assertion> out = new LinkedHashMap<>();
        for (Stmt stmt : function.body()) {
            if (!(stmt instanceof Assertion)) continue;
            Assertion assertion = (Assertion) stmt;
            for (Expr e : AstWalker.preOrder(assertion.predicate())) {
                outputField(e, AstPatterns.NFT_COMMITMENT)
                        .ifPresent(ref -> out.putIfAbsent(ExprEquivalence.canonical(ref.index()), assertion));
            }
            for (Expr conjunct : AstPatterns.conjuncts(assertion.predicate())) {
                if (!(conjunct instanceof Binary) || ((Binary) conjunct).op() != BinaryOp.EQ) continue;
                Binary b = (Binary) conjunct;
                selfBytecodeTie(b.left(), b.right())
                        .or(() -> selfBytecodeTie(b.right(), b.left()))
                        .ifPresent(ref -> out.putIfAbsent(ExprEquivalence.canonical(ref.index()), assertion));
            }
        }
        return out;
    }

    private static Optional<TxFieldRef> selfBytecodeTie(Expr output, Expr other) {
        Optional<TxFieldRef> ref = outputField(output, AstPatterns.LOCKING_BYTECODE);
        if (ref.isEmpty()) return Optional.empty();
        boolean self = AstPatterns.isSelfBytecode(other)
                || AstPatterns.isSelfInputField(other, AstPatterns.LOCKING_BYTECODE);
        return self ? ref : Optional.empty();
    }

    private static Optional<TxFieldRef> outputField(Expr e, String field) {
        return AstPatterns.txField(e)
                .filter(ref -> ref.collection() == TxCollection.OUTPUTS)
                .filter(ref -> ref.field().equals(field));
    }

    private static Expr outputIndexOf(Assertion trigger, String canonicalIndex) {
        for (Expr e : AstWalker.preOrder(trigger.predicate())) {
            Optional<TxFieldRef> ref = AstPatterns.txField(e);
            if (ref.isPresent() && ref.get().collection() == TxCollection.OUTPUTS
                    && ExprEquivalence.canonical(ref.get().index()).equals(canonicalIndex)) {
                return ref.get().index();
            }
        }
        throw new DetectorException("output index " + canonicalIndex + " vanished from its own trigger");
    }

    /**
     * True if {@code e} is the active input's {@code field}, references it, or references a
     * local binding that does. For lockingBytecode, {@code this.activeBytecode} and a freshly
     * built {@code new LockingBytecode*(...)} also count.
     */
    private static boolean derivesFromInput(Expr e, String field, Map<String, Expr> bindings) {
        return derivesFromInput(e, field, bindings, new HashSet<>());
    }

    private static boolean derivesFromInput(Expr e, String field, Map<String, Expr> bindings, Set<String> visiting) {
        for (Expr node : AstWalker.preOrder(e)) {
            if (AstPatterns.isSelfInputField(node, field)) return true;
            if (field.equals(AstPatterns.LOCKING_BYTECODE)) {
                if (AstPatterns.isSelfBytecode(node)) return true;
                if (node instanceof Call && ((Call) node).kind() == CallKind.LOCKING_BYTECODE) return true;
            }
            if (node instanceof Identifier) {
                String name = ((Identifier) node).name();
                Expr bound = bindings.get(name);
                if (bound != null && visiting.add(name) && derivesFromInput(bound, field, bindings, visiting)) {
                    return true;
                }
            }
        }
        return false;
    }
}
