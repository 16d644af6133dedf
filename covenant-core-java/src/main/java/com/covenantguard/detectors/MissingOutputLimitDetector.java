package com.covenantguard.detectors;

import com.covenantguard.ast.AstModel.FunctionNode;
import com.covenantguard.config.RuleTable;
import com.covenantguard.dominance.DominanceResolver;
import com.covenantguard.dominance.GuardShapes;
import com.covenantguard.report.SourceLocation;
import com.covenantguard.report.Violation;

import java.util.List;

/**
 * Function-level: some assertion must bound {@code tx.outputs.length} from above
 * with a literal ({@code ==}, {@code <=} or {@code <}).
 */
public class MissingOutputLimitDetector extends AbstractDetector {

    public MissingOutputLimitDetector(RuleTable rules) {
        super(rules);
    }

    @Override
    public String id() { return "missing_output_limit"; }

    @Override
    public String description() {
        return "Functions that never bound the number of transaction outputs";
    }

    @Override
    public List<Violation> detect(FunctionNode function) {
        DominanceResolver resolver = new DominanceResolver(function);
        if (resolver.findAnywhere(GuardShapes.outputCountBounded()).found()) {
            return List.of();
        }
        return List.of(violation(id(), "function " + function.name()
                + " does not bound tx.outputs.length with ==, <= or < a literal", SourceLocation.functionLevel(function)));
    }
}
