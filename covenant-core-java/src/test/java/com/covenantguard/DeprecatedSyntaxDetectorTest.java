package com.covenantguard;

import com.covenantguard.detectors.DeprecatedSyntaxDetector;
import com.covenantguard.report.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeprecatedSyntaxDetectorTest {

    private final DeprecatedSyntaxDetector detector = new DeprecatedSyntaxDetector(Snippets.RULES);

    private List<Violation> detect(String body) {
        return detector.detect(Snippets.function(body));
    }

    @Test
    void removedFeaturesAreReportedPerOccurrence() {
        List<Violation> found = detect("""
                require(tx.locktime >= deadline);
                require(tx.inputs[0].time > 5);
                require(checkDataSig(oracleSig, message, oraclePk));
                sig s = new Sig(raw);
                """);
        assertEquals(4, found.size());
        assertTrue(found.stream().allMatch(v -> v.ruleId().equals("deprecated_syntax")));
        assertTrue(found.get(0).reason().contains("tx.locktime"));
        assertTrue(found.get(2).reason().contains("checkDataSig"));
        assertEquals(3, found.get(3).location().ordinal());
    }

    @Test
    void currentTimelockFormsAreClean() {
        assertTrue(detect("""
                require(tx.time >= deadline);
                require(tx.age >= 30 days);
                require(checkSig(s, pk));
                """).isEmpty());
    }

    @Test
    void similarlyNamedFieldsAreClean() {
        assertTrue(detect("""
                require(this.locktime == 1);
                require(tx.outputs[0].time == 2);
                """).isEmpty());
    }
}
