package com.covenantguard.ast;

import java.math.BigInteger;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable structural tree of a parsed contract.
 *
 * Contract -> functions -> statements -> expressions. Every node is a record;
 * the expression and statement variants are closed by their visitor interfaces,
 * so adding a variant breaks every analysis that has not been taught about it.
 */
public final class AstModel {

    private AstModel() {}

    /** 1-based line and column of the first token of a node. */
    public record SourcePos(int line, int column) {
        @Override
        public String toString() { return line + ":" + column; }
    }

    // -----------------------------------------------------------------------
    // Declarations
    // -----------------------------------------------------------------------

    public record Parameter(String type, String name, SourcePos pos) {}

    public record ContractNode(
            String name,
            String pragma,               // nullable
            List<Parameter> constructorParams,
            List<FunctionNode> functions
    ) {
        public ContractNode {
            constructorParams = List.copyOf(constructorParams);
            functions = List.copyOf(functions);
        }

        public Optional<FunctionNode> function(String functionName) {
            return functions.stream().filter(f -> f.name().equals(functionName)).findFirst();
        }
    }

    /**
     * A function body is a straight-line statement sequence: statement N is reached
     * only if statements 0..N-1 all executed. Ordinals equal list positions.
     */
    public record FunctionNode(
            String name,
            List<Parameter> params,
            List<String> modifiers,      // trailing header words; empty for well-formed sources
            List<Stmt> body,
            SourcePos pos
    ) {
        public FunctionNode {
            params = List.copyOf(params);
            modifiers = List.copyOf(modifiers);
            body = List.copyOf(body);
            for (int i = 0; i < body.size(); i++) {
                if (body.get(i).ordinal() != i) {
                    throw new IllegalArgumentException("Statement ordinal " + body.get(i).ordinal()
                            + " at position " + i + " in function " + name);
                }
            }
        }

        public Stmt statement(int ordinal) { return body.get(ordinal); }

        /** Ordinal of the last statement, or -1 for an empty body. */
        public int lastOrdinal() { return body.size() - 1; }
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    public interface Stmt {
        int ordinal();
        SourcePos pos();
        /** The single expression this statement evaluates. */
        Expr expression();
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitAssertion(Assertion assertion);
        R visitAssignment(Assignment assignment);
        R visitBare(Bare bare);
    }

    /** {@code require(predicate[, "message"]);} */
    public record Assertion(Expr predicate, String message, int ordinal, SourcePos pos) implements Stmt {
        @Override public Expr expression() { return predicate; }
        @Override public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssertion(this); }
    }

    /** {@code [type] name = value;}. A re-binding has a null {@code declaredType}. */
    public record Assignment(String declaredType, String name, Expr value, int ordinal, SourcePos pos) implements Stmt {
        @Override public Expr expression() { return value; }
        @Override public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignment(this); }
    }

    /** An expression evaluated for effect, e.g. {@code console.log(x);}. */
    public record Bare(Expr value, int ordinal, SourcePos pos) implements Stmt {
        @Override public Expr expression() { return value; }
        @Override public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBare(this); }
    }

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    public interface Expr {
        SourcePos pos();
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteral(Literal literal);
        R visitIdentifier(Identifier identifier);
        R visitFieldAccess(FieldAccess access);
        R visitIndexAccess(IndexAccess access);
        R visitBinary(Binary binary);
        R visitUnary(Unary unary);
        R visitCall(Call call);
    }

    public enum LiteralKind { INT, BOOL, HEX, STRING }

    public record Literal(LiteralKind kind, String text, SourcePos pos) implements Expr {
        /** Numeric value of an INT literal, underscores removed. */
        public Optional<BigInteger> intValue() {
            if (kind != LiteralKind.INT) return Optional.empty();
            return Optional.of(new BigInteger(text.replace("_", "")));
        }

        @Override public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitLiteral(this); }
    }

    public record Identifier(String name, SourcePos pos) implements Expr {
        @Override public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitIdentifier(this); }
    }

    /** {@code target.field}, e.g. {@code tx.outputs[0].lockingBytecode}. */
    public record FieldAccess(Expr target, String field, SourcePos pos) implements Expr {
        @Override public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitFieldAccess(this); }
    }

    /** {@code target[index]}, e.g. {@code tx.inputs[this.activeInputIndex]}. */
    public record IndexAccess(Expr target, Expr index, SourcePos pos) implements Expr {
        @Override public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitIndexAccess(this); }
    }

    public enum BinaryOp {
        OR("||"), AND("&&"),
        BIT_OR("|"), BIT_XOR("^"), BIT_AND("&"),
        EQ("=="), NE("!="),
        LT("<"), LE("<="), GT(">"), GE(">="),
        ADD("+"), SUB("-"),
        MUL("*"), DIV("/"), MOD("%");

        private final String symbol;

        BinaryOp(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }

        public boolean isComparison() {
            return this == EQ || this == NE || this == LT || this == LE || this == GT || this == GE;
        }

        public boolean isOrdering() {
            return this == LT || this == LE || this == GT || this == GE;
        }

        /** Operator that keeps the meaning when operands are swapped ({@code a < b} == {@code b > a}). */
        public BinaryOp mirrored() {
            switch (this) {
                case LT: return GT;
                case LE: return GE;
                case GT: return LT;
                case GE: return LE;
                default: return this;
            }
        }
    }

    public record Binary(BinaryOp op, Expr left, Expr right, SourcePos pos) implements Expr {
        @Override public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitBinary(this); }
    }

    public enum UnaryOp {
        NOT("!"), NEGATE("-");

        private final String symbol;

        UnaryOp(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }
    }

    public record Unary(UnaryOp op, Expr operand, SourcePos pos) implements Expr {
        @Override public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitUnary(this); }
    }

    public enum CallKind {
        /** sha256, sha1, ripemd160, hash160, hash256 */
        HASH,
        /** checkSig, checkMultiSig, checkDataSig */
        SIGNATURE,
        /** int(x), bytes(x), bytes20(x), ... */
        CAST,
        /** new LockingBytecodeP2PKH(...) and friends */
        LOCKING_BYTECODE,
        /** receiver.method(...), e.g. x.split(32) */
        METHOD,
        /** abs, min, max, within, date */
        BUILTIN,
        /** anything the language does not define */
        OTHER
    }

    /**
     * A call form. {@code receiver} is non-null only for METHOD calls.
     */
    public record Call(CallKind kind, String name, Expr receiver, List<Expr> arguments, SourcePos pos) implements Expr {
        public Call {
            arguments = arguments == null ? Collections.emptyList() : List.copyOf(arguments);
        }

        @Override public <R> R accept(ExprVisitor<R> visitor) { return visitor.visitCall(this); }
    }
}
