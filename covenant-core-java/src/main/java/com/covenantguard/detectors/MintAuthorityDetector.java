package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.FunctionNode;
import com.covenantguard.config.RuleTable;
import com.covenantguard.dominance.DominanceResolver;
import com.covenantguard.dominance.GuardShapes;
import com.covenantguard.report.SourceLocation;
import com.covenantguard.report.Violation;

import java.util.List;
import java.util.Locale;

/**
 * Function-level: a function named for minting ({@code mint}, {@code mintTokens}, ...) must
 * assert a signature check, otherwise anyone can create tokens through it.
 */
public class MintAuthorityDetector extends AbstractDetector {

    public MintAuthorityDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "mint_authority"; }

    @Override
    public String description() {
        return "Mint functions that never require an authorizing signature";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        if (!function.name().toLowerCase(Locale.ROOT).contains("mint")) return List.of();
        if (new DominanceResolver(function).findAnywhere(GuardShapes.signatureChecked()).found()) {
            return List.of();
        }
        return List.of(violation(id(), "mint function " + function.name() + " does not require(checkSig(...))",
                SourceLocation.functionLevel(function)));
    }
}
