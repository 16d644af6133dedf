package com.covenantguard.dominance;

import com.covenantguard.ast.AstModel.Expr;

import java.util.function.Predicate;

/**
 * A named structural pattern that a single assertion conjunct may satisfy.
 *
 * @param name  short label used in explanations, e.g. {@code "d > 0"}
 * @param test  matcher over one conjunct of an asserted predicate
 */
public record GuardShape(String name, Predicate<Expr> test) {

    public boolean matches(Expr conjunct) {
        return test.test(conjunct);
    }

    public GuardShape or(GuardShape other) {
        return new GuardShape(name + " | " + other.name, test.or(other.test));
    }
}
