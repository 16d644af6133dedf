package com.covenantguard;

import com.covenantguard.detectors.TimeComparisonDetector;
import com.covenantguard.report.Severity;
import com.covenantguard.report.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeComparisonDetectorTest {

    private final TimeComparisonDetector detector = new TimeComparisonDetector(Snippets.RULES);

    private List<Violation> detect(String body) {
        return detector.detect(Snippets.function(body));
    }

    @Test
    void strictGreaterThanIsReported() {
        List<Violation> found = detect("require(tx.time > deadline);");
        assertEquals(1, found.size());
        assertEquals("time_comparison", found.get(0).ruleId());
        assertEquals(Severity.MEDIUM, found.get(0).severity());
        assertTrue(found.get(0).reason().contains("'>'"));
    }

    @Test
    void acceptedOperators() {
        assertTrue(detect("require(tx.time >= deadline);").isEmpty());
        assertTrue(detect("require(tx.time < deadline);").isEmpty());
        assertTrue(detect("require(tx.age >= 144);").isEmpty());
    }

    @Test
    void reversedOperandsAreNormalized() {
        assertTrue(detect("require(deadline <= tx.time);").isEmpty());
        assertTrue(detect("require(deadline > tx.time);").isEmpty());
        assertEquals(1, detect("require(deadline < tx.time);").size());
    }

    @Test
    void otherOperatorsAreReported() {
        assertEquals(1, detect("require(tx.time <= deadline);").size());
        assertEquals(1, detect("require(tx.age == 10);").size());
        assertEquals(1, detect("require(tx.age != 10);").size());
    }

    @Test
    void everyComparisonInAStatementIsChecked() {
        List<Violation> found = detect("require(tx.time > start && tx.time <= end);");
        assertEquals(2, found.size());
    }
}
