package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.*;
import com.covenantguard.ast.AstPatterns;
import com.covenantguard.ast.AstWalker;
import com.covenantguard.config.RuleTable;
import com.covenantguard.report.SourceLocation;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Account-model vocabulary: caller identity, block globals, storage-style members,
 * event emission, value transfer methods, undefined calls and function modifiers.
 */
public class UnsafeVocabularyDetector extends AbstractDetector {

    private static final Set<String> FOREIGN_GLOBALS = Set.of("msg", "block");
    private static final Set<String> FOREIGN_TX_FIELDS = Set.of("origin", "gasprice");
    private static final Set<String> FOREIGN_THIS_FIELDS = Set.of("balance", "lockingBytecode", "owner");
    private static final Set<String> TRANSFER_METHODS = Set.of("transfer", "send", "call", "delegatecall");

    public UnsafeVocabularyDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "unsafe_vocabulary"; }

    @Override
    public String description() {
        return "Constructs from account-based contract models with no meaning in UTXO validation";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        List<Violation> out = new ArrayList<>();
        if (!function.modifiers().isEmpty()) {
            out.add(violation(id(), "function header carries modifiers " + String.join(" ", function.modifiers()),
                    SourceLocation.functionLevel(function)));
        }
        for (Stmt stmt : function.body()) {
            Set<Expr> insideEmit = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Expr e : AstWalker.preOrder(stmt.expression())) {
                if (insideEmit.contains(e)) continue;
                String term = foreignTerm(e);
                if (term == null) continue;
                out.add(violation("'" + term + "' belongs to an account-based contract model", function, stmt));
                if (e instanceof Call && ((Call) e).name().equals("emit")) {
                    for (Expr arg : ((Call) e).arguments()) {
                        AstWalker.walk(arg, insideEmit::add);
                    }
                }
            }
        }
        return out;
    }

    private static String foreignTerm(Expr e) {
        if (e instanceof FieldAccess) {
            FieldAccess fa = (FieldAccess) e;
            if (fa.target() instanceof Identifier && FOREIGN_GLOBALS.contains(((Identifier) fa.target()).name())) {
                return ((Identifier) fa.target()).name() + "." + fa.field();
            }
            for (String field : FOREIGN_TX_FIELDS) {
                if (AstPatterns.isTxField(fa, field)) return "tx." + field;
            }
            for (String field : FOREIGN_THIS_FIELDS) {
                if (AstPatterns.isThisField(fa, field)) return "this." + field;
            }
            return null;
        }
        if (e instanceof Call) {
            Call call = (Call) e;
            if (call.kind() == CallKind.OTHER) {
                return call.name();
            }
            if (call.kind() == CallKind.METHOD && TRANSFER_METHODS.contains(call.name())) {
                return "." + call.name() + "()";
            }
        }
        return null;
    }
}
