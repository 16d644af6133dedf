package com.covenantguard.tollgate;

import com.covenantguard.config.ScoringPolicy;
import com.covenantguard.report.AnalysisResult;
import com.covenantguard.report.RiskLevel;
import com.covenantguard.report.Severity;
import com.covenantguard.report.Violation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a violation list into pass/fail, score and risk level.
 *
 * <p>A violation is blocking when its severity is critical or high and its category is a
 * blocking category; one blocking violation hard-fails the contract. Penalties of the
 * remaining violations add up to the soft penalty, and exceeding the soft budget
 * hard-fails as well. The score is the baseline minus every penalty, floored at zero.
 */
public class ScoreAggregator {

    private final ScoringPolicy policy;

    public ScoreAggregator(ScoringPolicy policy) {
        this.policy = policy;
    }

    public AnalysisResult aggregate(String contractName, List<Violation> violations) {
        int totalPenalty = 0;
        int softPenalty = 0;
        int blockingGrade = 0;
        boolean blocking = false;
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Severity s : Severity.values()) {
            counts.put(s.label(), 0);
        }

        for (Violation v : violations) {
            int penalty = policy.penalty(v.severity());
            totalPenalty += penalty;
            counts.merge(v.severity().label(), 1, Integer::sum);
            if (v.severity().isBlockingGrade()) blockingGrade++;
            if (policy.isBlocking(v)) {
                blocking = true;
            } else {
                softPenalty += penalty;
            }
        }

        boolean hardFail = blocking || softPenalty > policy.softFailBudget();
        int score = Math.max(0, policy.baselineScore() - totalPenalty);
        return new AnalysisResult(contractName, violations, hardFail, score,
                RiskLevel.classify(blockingGrade, score), counts, softPenalty);
    }
}
