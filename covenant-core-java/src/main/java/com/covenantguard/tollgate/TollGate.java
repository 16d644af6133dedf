package com.covenantguard.tollgate;

import com.covenantguard.ast.AstModel.ContractNode;
import com.covenantguard.ast.AstModel.FunctionNode;
import com.covenantguard.config.GuardSettings;
import com.covenantguard.config.RuleTable;
import com.covenantguard.detectors.Detector;
import com.covenantguard.detectors.DetectorRegistry;
import com.covenantguard.parse.ContractParser;
import com.covenantguard.parse.ParseException;
import com.covenantguard.report.AnalysisResult;
import com.covenantguard.report.SourceLocation;
import com.covenantguard.report.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered detector over every function and aggregates the findings.
 *
 * <p>Holds no per-call state, so one instance may analyze many contracts concurrently.
 * A detector that throws, or runs out of stack on a pathological tree, does not stop
 * the others; it contributes a {@code could_not_verify} finding for that function instead.
 */
public class TollGate {

    public static final String COULD_NOT_VERIFY = "could_not_verify";

    private final DetectorRegistry registry;
    private final RuleTable rules;
    private final ScoreAggregator aggregator;

    public TollGate(DetectorRegistry registry, RuleTable rules, ScoreAggregator aggregator) {
        if (!rules.contains(COULD_NOT_VERIFY)) {
            throw new IllegalArgumentException("Rule table has no " + COULD_NOT_VERIFY + " rule");
        }
        this.registry = registry;
        this.rules = rules;
        this.aggregator = aggregator;
    }

    public static TollGate standard(GuardSettings settings) {
        return new TollGate(DetectorRegistry.standard(settings.rules()), settings.rules(),
                new ScoreAggregator(settings.scoring()));
    }

    /**
     * Parses and analyzes {@code source}.
     *
     * @throws ParseException if the source is malformed or leaves the straight-line subset
     */
    public AnalysisResult check(String source) {
        return analyze(ContractParser.parse(source));
    }

    public AnalysisResult analyze(ContractNode contract) {
        List<Violation> violations = new ArrayList<>();
        for (FunctionNode function : contract.functions()) {
            for (Detector detector : registry.detectors()) {
                violations.addAll(runIsolated(detector, function));
            }
        }
        return aggregator.aggregate(contract.name(), violations);
    }

    private List<Violation> runIsolated(Detector detector, FunctionNode function) {
        try {
            return detector.detect(function);
        } catch (RuntimeException | StackOverflowError e) {
            String cause = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            System.err.println("[covenant-guard] WARNING: detector " + detector.id() + " failed on function "
                    + function.name() + ": " + cause);
            return List.of(rules.violation(COULD_NOT_VERIFY,
                    "detector " + detector.id() + " could not verify function " + function.name() + ": " + cause,
                    SourceLocation.functionLevel(function)));
        }
    }

    /** The terminal finding reported in place of an analysis when parsing fails. */
    public Violation parseFailure(ParseException e) {
        return rules.violation(e.ruleId(), e.getMessage(), new SourceLocation("", -1, e.line(), e.column()));
    }
}
