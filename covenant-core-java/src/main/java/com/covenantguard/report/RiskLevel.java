package com.covenantguard.report;

public enum RiskLevel {
    SAFE, LOW, MEDIUM, HIGH, CRITICAL;

    /**
     * Two or more critical/high findings are CRITICAL; one, or a score under 60,
     * is HIGH; under 80 is MEDIUM; anything short of a perfect score is LOW.
     */
    public static RiskLevel classify(int blockingGradeCount, int score) {
        if (blockingGradeCount >= 2) return CRITICAL;
        if (blockingGradeCount == 1 || score < 60) return HIGH;
        if (score < 80) return MEDIUM;
        if (score < 100) return LOW;
        return SAFE;
    }
}
