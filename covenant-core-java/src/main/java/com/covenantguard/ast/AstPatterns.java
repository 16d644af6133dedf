package com.covenantguard.ast;

import com.covenantguard.ast.AstModel.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Structural queries over the expression tree: transaction introspection
 * fields, self-references, integer literals and conjunct flattening.
 */
public final class AstPatterns {

    public static final String SELF_POSITION = "activeInputIndex";
    public static final String SELF_BYTECODE = "activeBytecode";

    public static final String LOCKING_BYTECODE = "lockingBytecode";
    public static final String TOKEN_CATEGORY = "tokenCategory";
    public static final String TOKEN_AMOUNT = "tokenAmount";
    public static final String VALUE = "value";
    public static final String NFT_COMMITMENT = "nftCommitment";

    private AstPatterns() {}

    public enum TxCollection {
        INPUTS("inputs"), OUTPUTS("outputs");

        private final String field;

        TxCollection(String field) { this.field = field; }

        public String field() { return field; }

        static Optional<TxCollection> of(String field) {
            for (TxCollection c : values()) {
                if (c.field.equals(field)) return Optional.of(c);
            }
            return Optional.empty();
        }
    }

    /** {@code tx.inputs[index]} or {@code tx.outputs[index]}. */
    public record TxEntry(TxCollection collection, Expr index) {}

    /** {@code tx.inputs[index].field} or {@code tx.outputs[index].field}. */
    public record TxFieldRef(TxCollection collection, Expr index, String field) {}

    // --- Self references ---

    public static boolean isThisField(Expr e, String field) {
        if (!(e instanceof FieldAccess)) return false;
        FieldAccess fa = (FieldAccess) e;
        return fa.field().equals(field) && isIdentifier(fa.target(), "this");
    }

    /** {@code this.activeInputIndex} */
    public static boolean isSelfPosition(Expr e) {
        return isThisField(e, SELF_POSITION);
    }

    /** {@code this.activeBytecode} */
    public static boolean isSelfBytecode(Expr e) {
        return isThisField(e, SELF_BYTECODE);
    }

    // --- Transaction introspection ---

    /** {@code tx.<field>}, e.g. {@code tx.time}. */
    public static boolean isTxField(Expr e, String field) {
        if (!(e instanceof FieldAccess)) return false;
        FieldAccess fa = (FieldAccess) e;
        return fa.field().equals(field) && isIdentifier(fa.target(), "tx");
    }

    /** {@code tx.time} (absolute lock) or {@code tx.age} (relative lock). */
    public static boolean isTimeIntrinsic(Expr e) {
        return isTxField(e, "time") || isTxField(e, "age");
    }

    /** {@code tx.outputs.length} / {@code tx.inputs.length}. */
    public static boolean isCollectionLength(Expr e, TxCollection collection) {
        if (!(e instanceof FieldAccess)) return false;
        FieldAccess fa = (FieldAccess) e;
        return fa.field().equals("length") && isTxField(fa.target(), collection.field());
    }

    public static Optional<TxEntry> txEntry(Expr e) {
        if (!(e instanceof IndexAccess)) return Optional.empty();
        IndexAccess ia = (IndexAccess) e;
        if (!(ia.target() instanceof FieldAccess)) return Optional.empty();
        FieldAccess coll = (FieldAccess) ia.target();
        if (!isIdentifier(coll.target(), "tx")) return Optional.empty();
        return TxCollection.of(coll.field()).map(c -> new TxEntry(c, ia.index()));
    }

    public static Optional<TxFieldRef> txField(Expr e) {
        if (!(e instanceof FieldAccess)) return Optional.empty();
        FieldAccess fa = (FieldAccess) e;
        return txEntry(fa.target()).map(entry -> new TxFieldRef(entry.collection(), entry.index(), fa.field()));
    }

    /** True for {@code tx.inputs[this.activeInputIndex].<field>}. */
    public static boolean isSelfInputField(Expr e, String field) {
        Optional<TxFieldRef> ref = txField(e);
        return ref.isPresent()
                && ref.get().collection() == TxCollection.INPUTS
                && ref.get().field().equals(field)
                && isSelfPosition(ref.get().index());
    }

    // --- Literals ---

    public static boolean isIdentifier(Expr e, String name) {
        return e instanceof Identifier && ((Identifier) e).name().equals(name);
    }

    /** Integer value of an INT literal, optionally negated. */
    public static Optional<BigInteger> intLiteral(Expr e) {
        if (e instanceof Literal) {
            return ((Literal) e).intValue();
        }
        if (e instanceof Unary && ((Unary) e).op() == UnaryOp.NEGATE) {
            return intLiteral(((Unary) e).operand()).map(BigInteger::negate);
        }
        return Optional.empty();
    }

    // --- Predicates ---

    /** Flattens nested {@code &&} chains; a non-conjunction yields itself. */
    public static List<Expr> conjuncts(Expr predicate) {
        List<Expr> out = new ArrayList<>();
        collectConjuncts(predicate, out);
        return out;
    }

    private static void collectConjuncts(Expr e, List<Expr> out) {
        if (e instanceof Binary && ((Binary) e).op() == BinaryOp.AND) {
            collectConjuncts(((Binary) e).left(), out);
            collectConjuncts(((Binary) e).right(), out);
        } else {
            out.add(e);
        }
    }

    /**
     * Reorients a comparison so that {@code side} is on the left.
     * Returns empty if {@code e} is not a comparison or neither operand matches.
     */
    public static Optional<Binary> orient(Expr e, Predicate<Expr> side) {
        if (!(e instanceof Binary)) return Optional.empty();
        Binary b = (Binary) e;
        if (!b.op().isComparison()) return Optional.empty();
        if (side.test(b.left())) return Optional.of(b);
        if (side.test(b.right())) return Optional.of(new Binary(b.op().mirrored(), b.right(), b.left(), b.pos()));
        return Optional.empty();
    }

    // --- Local bindings ---

    /** Local name to bound value. A rebinding keeps every value the name ever held, joined with {@code ||}. */
    public static Map<String, Expr> bindings(FunctionNode function) {
        Map<String, Expr> out = new HashMap<>();
        for (Stmt stmt : function.body()) {
            if (stmt instanceof Assignment) {
                Assignment a = (Assignment) stmt;
                Expr previous = out.get(a.name());
                out.put(a.name(), previous == null ? a.value()
                        : new Binary(BinaryOp.OR, previous, a.value(), a.pos()));
            }
        }
        return out;
    }

    /**
     * Every node under {@code root} followed by the nodes of each local binding an identifier
     * under it names, transitively. Each binding is expanded once.
     */
    public static List<Expr> throughBindings(Expr root, Map<String, Expr> bindings) {
        List<Expr> out = new ArrayList<>();
        Set<String> expanded = new HashSet<>();
        List<Expr> pending = new ArrayList<>();
        pending.add(root);
        while (!pending.isEmpty()) {
            for (Expr node : AstWalker.preOrder(pending.remove(0))) {
                out.add(node);
                if (node instanceof Identifier) {
                    String name = ((Identifier) node).name();
                    Expr bound = bindings.get(name);
                    if (bound != null && expanded.add(name)) pending.add(bound);
                }
            }
        }
        return out;
    }
}
