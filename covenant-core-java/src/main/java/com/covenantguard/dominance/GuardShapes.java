package com.covenantguard.dominance;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstPatterns.TxCollection;
import com.covenantguard.ast.AstPatterns.TxFieldRef;
import com.covenantguard.ast.AstWalker;

import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The library of guard shapes used by the detectors. Each shape matches a
 * single conjunct; operand order of {@code ==} never matters, and ordering
 * comparisons are matched in either orientation ({@code 0 < d} is {@code d > 0}).
 */
public final class GuardShapes {

    /** Input fields that identify where an input came from. */
    static final Set<String> IDENTITY_FIELDS = Set.of(
            AstPatterns.TOKEN_CATEGORY, AstPatterns.LOCKING_BYTECODE, "outpointTransactionHash");

    private GuardShapes() {}

    /**
     * {@code tx.inputs[this.activeInputIndex].lockingBytecode} equated to this
     * contract's own bytecode or to an output's locking bytecode, or the
     * self output's bytecode equated to {@code this.activeBytecode}.
     */
    public static GuardShape selfScriptMatched() {
        return new GuardShape("self locking bytecode matched", e -> {
            if (!isEquality(e)) return false;
            Binary b = (Binary) e;
            return selfScriptPair(b.left(), b.right()) || selfScriptPair(b.right(), b.left());
        });
    }

    private static boolean selfScriptPair(Expr a, Expr b) {
        if (AstPatterns.isSelfInputField(a, AstPatterns.LOCKING_BYTECODE)) {
            if (AstPatterns.isSelfBytecode(b)) return true;
            Optional<TxFieldRef> ref = AstPatterns.txField(b);
            return ref.isPresent()
                    && ref.get().collection() == TxCollection.OUTPUTS
                    && ref.get().field().equals(AstPatterns.LOCKING_BYTECODE);
        }
        Optional<TxFieldRef> out = AstPatterns.txField(a);
        return out.isPresent()
                && out.get().collection() == TxCollection.OUTPUTS
                && out.get().field().equals(AstPatterns.LOCKING_BYTECODE)
                && AstPatterns.isSelfPosition(out.get().index())
                && AstPatterns.isSelfBytecode(b);
    }

    /** {@code this.activeInputIndex == <int literal>} */
    public static GuardShape positionPinned() {
        return new GuardShape("this.activeInputIndex == literal", e -> {
            if (!isEquality(e)) return false;
            Binary b = (Binary) e;
            return (AstPatterns.isSelfPosition(b.left()) && AstPatterns.intLiteral(b.right()).isPresent())
                    || (AstPatterns.isSelfPosition(b.right()) && AstPatterns.intLiteral(b.left()).isPresent());
        });
    }

    public static GuardShape selfPositionValidated() {
        return selfScriptMatched().or(positionPinned());
    }

    /**
     * {@code tx.outputs.length} bounded from above by a literal: {@code ==},
     * {@code <=} or {@code <}. A lower bound alone does not qualify.
     */
    public static GuardShape outputCountBounded() {
        return new GuardShape("tx.outputs.length bounded", e -> {
            Optional<Binary> oriented = AstPatterns.orient(e, x -> AstPatterns.isCollectionLength(x, TxCollection.OUTPUTS));
            if (oriented.isEmpty()) return false;
            BinaryOp op = oriented.get().op();
            boolean upper = op == BinaryOp.EQ || op == BinaryOp.LE || op == BinaryOp.LT;
            return upper && AstPatterns.intLiteral(oriented.get().right()).isPresent();
        });
    }

    /**
     * {@code d > k} with k &gt;= 0, or {@code d >= k} with k &gt;= 1, where
     * {@code d} is structurally equivalent to {@code divisor}. {@code d >= 0}
     * and {@code d != 0} do not match.
     */
    public static GuardShape strictlyPositive(Expr divisor) {
        String target = ExprEquivalence.canonical(divisor);
        return new GuardShape(target + " > 0", e -> {
            Optional<Binary> oriented = AstPatterns.orient(e, x -> ExprEquivalence.canonical(x).equals(target));
            if (oriented.isEmpty()) return false;
            Optional<BigInteger> bound = AstPatterns.intLiteral(oriented.get().right());
            if (bound.isEmpty()) return false;
            switch (oriented.get().op()) {
                case GT: return bound.get().signum() >= 0;
                case GE: return bound.get().signum() > 0;
                default: return false;
            }
        });
    }

    /**
     * An equality that pins the identity of {@code tx.inputs[literal]}: one side
     * reads its token category, locking bytecode or outpoint hash (possibly
     * through {@code split} / indexing), the other side reads no input other
     * than this contract's own.
     */
    public static GuardShape inputIdentityPinned(BigInteger literal) {
        return new GuardShape("tx.inputs[" + literal + "] identity pinned", e -> {
            if (!isEquality(e)) return false;
            Binary b = (Binary) e;
            return pinsInput(b.left(), literal) && !AstWalker.contains(b.right(), GuardShapes::isForeignInput)
                    || pinsInput(b.right(), literal) && !AstWalker.contains(b.left(), GuardShapes::isForeignInput);
        });
    }

    private static boolean pinsInput(Expr e, BigInteger literal) {
        Expr core = unwrapSlicing(e);
        Optional<TxFieldRef> ref = AstPatterns.txField(core);
        return ref.isPresent()
                && ref.get().collection() == TxCollection.INPUTS
                && IDENTITY_FIELDS.contains(ref.get().field())
                && AstPatterns.intLiteral(ref.get().index()).filter(literal::equals).isPresent();
    }

    // tx.inputs[k] for any k other than this.activeInputIndex
    private static boolean isForeignInput(Expr x) {
        return AstPatterns.txEntry(x)
                .filter(entry -> entry.collection() == TxCollection.INPUTS)
                .filter(entry -> !AstPatterns.isSelfPosition(entry.index()))
                .isPresent();
    }

    /** Strips {@code x.split(n)[i]}, {@code x.slice(a, b)} and {@code x[i]} wrappers. */
    static Expr unwrapSlicing(Expr e) {
        while (true) {
            if (e instanceof IndexAccess && AstPatterns.txEntry(e).isEmpty()) {
                e = ((IndexAccess) e).target();
            } else if (e instanceof Call && ((Call) e).kind() == CallKind.METHOD
                    && (((Call) e).name().equals("split") || ((Call) e).name().equals("slice"))) {
                e = ((Call) e).receiver();
            } else {
                return e;
            }
        }
    }

    /**
     * {@code tx.outputs[index].field == source} in either order, where
     * {@code index} is structurally equivalent and {@code source} satisfies
     * the given predicate.
     */
    public static GuardShape outputFieldTied(Expr index, String field, Predicate<Expr> source) {
        String targetIndex = ExprEquivalence.canonical(index);
        Predicate<Expr> isOutputField = x -> AstPatterns.txField(x)
                .filter(ref -> ref.collection() == TxCollection.OUTPUTS)
                .filter(ref -> ref.field().equals(field))
                .filter(ref -> ExprEquivalence.canonical(ref.index()).equals(targetIndex))
                .isPresent();
        return new GuardShape("tx.outputs[" + targetIndex + "]." + field + " tied", e -> {
            if (!isEquality(e)) return false;
            Binary b = (Binary) e;
            return isOutputField.test(b.left()) && source.test(b.right())
                    || isOutputField.test(b.right()) && source.test(b.left());
        });
    }

    /** A bare {@code checkSig} or {@code checkMultiSig} conjunct. */
    public static GuardShape signatureChecked() {
        return new GuardShape("signature checked", e -> e instanceof Call
                && ((Call) e).kind() == CallKind.SIGNATURE
                && !((Call) e).name().equals("checkDataSig"));
    }

    private static boolean isEquality(Expr e) {
        return e instanceof Binary && ((Binary) e).op() == BinaryOp.EQ;
    }
}
