package com.covenantguard.detectors;

import com.covenantguard.config.RuleTable;

import java.util.List;
import java.util.Optional;

/**
 * The closed, ordered set of detectors run by the toll gate. Order is fixed
 * and determines the order of findings within a function.
 */
public final class DetectorRegistry {

    private final List<Detector> detectors;

    public DetectorRegistry(List<Detector> detectors, RuleTable rules) {
        for (Detector d : detectors) {
            for (String ruleId : d.ruleIds()) {
                if (!rules.contains(ruleId)) {
                    throw new IllegalArgumentException("Detector " + d.id() + " emits rule " + ruleId
                            + " which is missing from the rule table");
                }
            }
        }
        this.detectors = List.copyOf(detectors);
    }

    public static DetectorRegistry standard(RuleTable rules) {
        return new DetectorRegistry(List.of(
                new UnsafeVocabularyDetector(rules),
                new UnvalidatedPositionDetector(rules),
                new MissingOutputLimitDetector(rules),
                new TokenPairDetector(rules),
                new UnguardedDivisionDetector(rules),
                new TimeComparisonDetector(rules),
                new CovenantContinuationDetector(rules),
                new HardcodedInputIndexDetector(rules),
                new ImplicitOutputOrderingDetector(rules),
                new SignatureReuseDetector(rules),
                new MintAuthorityDetector(rules),
                new FeeAssumptionDetector(rules),
                new TautologicalComparisonDetector(rules),
                new DeprecatedSyntaxDetector(rules),
                new UnusedBindingDetector(rules)
        ), rules);
    }

    public List<Detector> detectors() {
        return detectors;
    }

    public Optional<Detector> find(String id) {
        return detectors.stream().filter(d -> d.id().equals(id)).findFirst();
    }
}
