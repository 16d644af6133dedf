package com.covenantguard.ast;

import com.covenantguard.ast.AstModel.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Pre-order traversal over expression trees.
 * Visits a node before its children; children are visited left to right.
 */
public final class AstWalker {

    private AstWalker() {}

    /** Every expression node under {@code root}, root first. */
    public static List<Expr> preOrder(Expr root) {
        List<Expr> out = new ArrayList<>();
        walk(root, out::add);
        return out;
    }

    /** Every expression node of every statement, in statement order. */
    public static List<Expr> preOrder(FunctionNode function) {
        List<Expr> out = new ArrayList<>();
        for (Stmt stmt : function.body()) {
            walk(stmt.expression(), out::add);
        }
        return out;
    }

    public static void walk(Expr root, Consumer<Expr> sink) {
        root.accept(new Collector(sink));
    }

    /** True if any node under {@code root} satisfies the test. */
    public static boolean contains(Expr root, Predicate<Expr> test) {
        for (Expr e : preOrder(root)) {
            if (test.test(e)) return true;
        }
        return false;
    }

    private static final class Collector implements ExprVisitor<Void> {

        private final Consumer<Expr> sink;

        Collector(Consumer<Expr> sink) { this.sink = sink; }

        @Override
        public Void visitLiteral(Literal literal) {
            sink.accept(literal);
            return null;
        }

        @Override
        public Void visitIdentifier(Identifier identifier) {
            sink.accept(identifier);
            return null;
        }

        @Override
        public Void visitFieldAccess(FieldAccess access) {
            sink.accept(access);
            access.target().accept(this);
            return null;
        }

        @Override
        public Void visitIndexAccess(IndexAccess access) {
            sink.accept(access);
            access.target().accept(this);
            access.index().accept(this);
            return null;
        }

        @Override
        public Void visitBinary(Binary binary) {
            sink.accept(binary);
            binary.left().accept(this);
            binary.right().accept(this);
            return null;
        }

        @Override
        public Void visitUnary(Unary unary) {
            sink.accept(unary);
            unary.operand().accept(this);
            return null;
        }

        @Override
        public Void visitCall(Call call) {
            sink.accept(call);
            if (call.receiver() != null) call.receiver().accept(this);
            for (Expr arg : call.arguments()) arg.accept(this);
            return null;
        }
    }
}
