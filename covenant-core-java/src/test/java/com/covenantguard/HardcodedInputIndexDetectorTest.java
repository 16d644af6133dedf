package com.covenantguard;

import com.covenantguard.detectors.DetectorException;
import com.covenantguard.detectors.HardcodedInputIndexDetector;
import com.covenantguard.report.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HardcodedInputIndexDetectorTest {

    private final HardcodedInputIndexDetector detector = new HardcodedInputIndexDetector(Snippets.RULES);

    private List<Violation> detect(String body) {
        return detector.detect(Snippets.function(body));
    }

    @Test
    void unpinnedLiteralIndexIsReported() {
        List<Violation> found = detect("require(tx.inputs[1].value > 0);");
        assertEquals(1, found.size());
        assertEquals("hardcoded_input_index", found.get(0).ruleId());
        assertTrue(found.get(0).reason().contains("tx.inputs[1]"));
    }

    @Test
    void pinnedInputIsAccepted() {
        assertTrue(detect("""
                require(tx.inputs[1].tokenCategory == oracleCategory);
                require(tx.inputs[1].nftCommitment.split(8)[0] == price);
                """).isEmpty());
        assertTrue(detect("""
                require(tx.inputs[0].outpointTransactionHash == fundingTx);
                int v = tx.inputs[0].value;
                require(v > 0);
                """).isEmpty());
    }

    @Test
    void pinLaterInTheSameAssertionCoversOnlyWhatFollows() {
        List<Violation> found = detect(
                "require(tx.inputs[1].value > 0 && tx.inputs[1].tokenCategory == oracleCategory);");
        assertEquals(1, found.size());
        assertTrue(detect(
                "require(tx.inputs[1].tokenCategory == oracleCategory && tx.inputs[1].value > 0);").isEmpty());
    }

    @Test
    void pinOnOneInputDoesNotCoverAnother() {
        List<Violation> found = detect("""
                require(tx.inputs[1].tokenCategory == oracleCategory);
                require(tx.inputs[2].value > 0);
                """);
        assertEquals(1, found.size());
        assertEquals(1, found.get(0).location().ordinal());
    }

    @Test
    void reportedPerAccess() {
        assertEquals(2, detect("require(tx.inputs[1].value + tx.inputs[2].value > 0);").size());
    }

    @Test
    void selfPositionIsNotThisDetectorsConcern() {
        assertTrue(detect("require(tx.inputs[this.activeInputIndex].value > 0);").isEmpty());
    }

    @Test
    void variableIndexCannotBeClassified() {
        assertThrows(DetectorException.class, () -> detect("require(tx.inputs[i].value > 0);"));
    }
}
