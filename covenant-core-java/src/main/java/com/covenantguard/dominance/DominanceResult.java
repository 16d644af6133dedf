package com.covenantguard.dominance;

import com.covenantguard.ast.AstModel.Expr;

/**
 * Outcome of a dominance query. When {@code found}, {@code ordinal} is the
 * dominating assertion and {@code conjunct} the part of its predicate that
 * matched; otherwise ordinal is -1 and conjunct is null.
 */
public record DominanceResult(boolean found, int ordinal, Expr conjunct) {

    private static final DominanceResult NOT_FOUND = new DominanceResult(false, -1, null);

    public static DominanceResult notFound() {
        return NOT_FOUND;
    }

    public static DominanceResult at(int ordinal, Expr conjunct) {
        return new DominanceResult(true, ordinal, conjunct);
    }

    public String describe() {
        if (!found) return "no dominating assertion";
        return "guarded by statement " + ordinal + ": " + ExprEquivalence.canonical(conjunct);
    }
}
