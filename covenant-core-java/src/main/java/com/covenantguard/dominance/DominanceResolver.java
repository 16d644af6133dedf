package com.covenantguard.dominance;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers "does an assertion matching shape P occur at or before ordinal N?"
 * for one straight-line function body.
 *
 * <p>Because the body has no branches, dominance is sequence order. An
 * assertion dominates the statement that contains it: both halves of a
 * conjunction are evaluated before the assertion can succeed. Each asserted
 * predicate is split into its {@code &&} conjuncts and every conjunct is
 * tested against the shape; disjunctions are never split.
 *
 * <p>{@link #guards(Stmt, Expr, GuardShape)} narrows this for a single node: inside the
 * node's own assertion only conjuncts evaluated no later than the one holding the node
 * count, since {@code &&} evaluates left to right.
 */
public class DominanceResolver {

    private final FunctionNode function;
    private final List<Assertion> assertions;

    public DominanceResolver(FunctionNode function) {
        this.function = function;
        this.assertions = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            if (stmt instanceof Assertion) {
                assertions.add((Assertion) stmt);
            }
        }
    }

    public FunctionNode function() {
        return function;
    }

    /** Assertions of the function, in statement order. */
    public List<Assertion> assertions() {
        return assertions;
    }

    /** First assertion at or before {@code ordinal} with a conjunct matching {@code shape}. */
    public DominanceResult find(int ordinal, GuardShape shape) {
        for (Assertion assertion : assertions) {
            if (assertion.ordinal() > ordinal) break;
            for (Expr conjunct : AstPatterns.conjuncts(assertion.predicate())) {
                if (shape.matches(conjunct)) {
                    return DominanceResult.at(assertion.ordinal(), conjunct);
                }
            }
        }
        return DominanceResult.notFound();
    }

    /** Whether {@code shape} is asserted anywhere in the body, i.e. dominates the last statement. */
    public DominanceResult findAnywhere(GuardShape shape) {
        return find(function.lastOrdinal(), shape);
    }

    public boolean dominates(int ordinal, GuardShape shape) {
        return find(ordinal, shape).found();
    }

    /**
     * First assertion guarding {@code node} inside {@code stmt}. Earlier assertions count in
     * full. When {@code stmt} is itself an assertion, only its conjuncts up to and including
     * the one that contains {@code node} (by identity) count.
     */
    public DominanceResult guards(Stmt stmt, Expr node, GuardShape shape) {
        DominanceResult earlier = find(stmt.ordinal() - 1, shape);
        if (earlier.found() || !(stmt instanceof Assertion)) return earlier;
        for (Expr conjunct : AstPatterns.conjuncts(((Assertion) stmt).predicate())) {
            if (shape.matches(conjunct)) {
                return DominanceResult.at(stmt.ordinal(), conjunct);
            }
            if (AstWalker.contains(conjunct, e -> e == node)) break;
        }
        return DominanceResult.notFound();
    }
}
