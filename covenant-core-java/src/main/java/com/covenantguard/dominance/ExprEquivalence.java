package com.covenantguard.dominance;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstWalker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structural equality of expressions up to commutativity of {@code ==} and {@code &&}.
 *
 * <p>Every expression maps to a canonical string: children of {@code ==} are
 * sorted, {@code &&} chains are flattened and their conjuncts sorted, integer
 * literals are normalized and hex literals lowercased. Two expressions are
 * equivalent iff their canonical forms are equal. Nothing else is assumed
 * equivalent; {@code a + b} and {@code b + a} are different.
 */
public final class ExprEquivalence {

    private ExprEquivalence() {}

    public static boolean equivalent(Expr a, Expr b) {
        return canonical(a).equals(canonical(b));
    }

    public static String canonical(Expr e) {
        return e.accept(CANONICALIZER);
    }

    /** True if {@code needle} occurs anywhere under {@code haystack}, up to equivalence. */
    public static boolean occursIn(Expr needle, Expr haystack) {
        String target = canonical(needle);
        return AstWalker.contains(haystack, e -> canonical(e).equals(target));
    }

    private static final ExprVisitor<String> CANONICALIZER = new ExprVisitor<>() {

        @Override
        public String visitLiteral(Literal literal) {
            switch (literal.kind()) {
                case INT: return literal.intValue().map(Object::toString).orElse(literal.text());
                case HEX: return literal.text().toLowerCase();
                case STRING: return "\"" + literal.text() + "\"";
                default: return literal.text();
            }
        }

        @Override
        public String visitIdentifier(Identifier identifier) {
            return identifier.name();
        }

        @Override
        public String visitFieldAccess(FieldAccess access) {
            return access.target().accept(this) + "." + access.field();
        }

        @Override
        public String visitIndexAccess(IndexAccess access) {
            return access.target().accept(this) + "[" + access.index().accept(this) + "]";
        }

        @Override
        public String visitBinary(Binary binary) {
            if (binary.op() == BinaryOp.AND) {
                List<String> parts = new ArrayList<>();
                for (Expr c : AstPatterns.conjuncts(binary)) parts.add(c.accept(this));
                Collections.sort(parts);
                return "(&& " + String.join(" ", parts) + ")";
            }
            String left = binary.left().accept(this);
            String right = binary.right().accept(this);
            if (binary.op() == BinaryOp.EQ && left.compareTo(right) > 0) {
                String tmp = left;
                left = right;
                right = tmp;
            }
            return "(" + binary.op().symbol() + " " + left + " " + right + ")";
        }

        @Override
        public String visitUnary(Unary unary) {
            return "(" + unary.op().symbol() + unary.operand().accept(this) + ")";
        }

        @Override
        public String visitCall(Call call) {
            StringBuilder sb = new StringBuilder();
            if (call.receiver() != null) sb.append(call.receiver().accept(this)).append('.');
            sb.append(call.name()).append('(');
            for (int i = 0; i < call.arguments().size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(call.arguments().get(i).accept(this));
            }
            return sb.append(')').toString();
        }
    };
}
