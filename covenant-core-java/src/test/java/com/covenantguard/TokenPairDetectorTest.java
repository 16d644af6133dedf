package com.covenantguard;

import com.covenantguard.detectors.TokenPairDetector;
import com.covenantguard.report.Violation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenPairDetectorTest {

    private final TokenPairDetector detector = new TokenPairDetector(Snippets.RULES);

    @Test
    void categoryWithoutAmountIsReported() {
        List<Violation> found = detector.detect(Snippets.function(
                "require(tx.outputs[0].tokenCategory == category);"));
        assertEquals(1, found.size());
        assertEquals("token_pair", found.get(0).ruleId());
        assertTrue(found.get(0).reason().contains("tx.outputs[0]"));
    }

    @Test
    void amountOnSameOutputSatisfiesInEitherOrder() {
        assertTrue(detector.detect(Snippets.function("""
                require(tx.outputs[0].tokenAmount == amount);
                require(tx.outputs[0].tokenCategory == category);
                """)).isEmpty());
        assertTrue(detector.detect(Snippets.function("""
                require(tx.outputs[0].tokenCategory == category);
                int carried = tx.outputs[0].tokenAmount;
                require(carried > 0);
                """)).isEmpty());
    }

    @Test
    void amountOnAnotherOutputDoesNotCount() {
        List<Violation> found = detector.detect(Snippets.function("""
                require(tx.outputs[0].tokenCategory == category);
                require(tx.outputs[1].tokenAmount == amount);
                """));
        assertEquals(1, found.size());
    }

    @Test
    void eachOutputIsReportedOnce() {
        List<Violation> found = detector.detect(Snippets.function("""
                require(tx.outputs[0].tokenCategory == category);
                require(tx.outputs[0].tokenCategory != 0x00);
                require(tx.outputs[1].tokenCategory == category);
                """));
        assertEquals(2, found.size());
        assertEquals(0, found.get(0).location().ordinal());
        assertEquals(2, found.get(1).location().ordinal());
    }

    @Test
    void categoryCheckedThroughBindingIsReported() {
        List<Violation> found = detector.detect(Snippets.function("""
                bytes c = tx.outputs[0].tokenCategory;
                require(c == category);
                """));
        assertEquals(1, found.size());
        assertEquals(1, found.get(0).location().ordinal());
    }

    @Test
    void categoryReadNowhereAssertedIsIgnored() {
        assertTrue(detector.detect(Snippets.function("""
                bytes c = tx.outputs[0].tokenCategory;
                require(tx.outputs.length == 1);
                """)).isEmpty());
    }

    @Test
    void amountInUnreadBindingDoesNotCount() {
        List<Violation> found = detector.detect(Snippets.function("""
                require(tx.outputs.length == 1);
                require(tx.outputs[0].tokenCategory == category);
                int amt = tx.outputs[0].tokenAmount;
                """));
        assertEquals(1, found.size());
        assertEquals(1, found.get(0).location().ordinal());
    }

    @Test
    void amountInBareCallDoesNotCount() {
        assertEquals(1, detector.detect(Snippets.function("""
                require(tx.outputs[0].tokenCategory == category);
                console.log(tx.outputs[0].tokenAmount);
                """)).size());
    }

    @Test
    void amountReachedThroughChainedBindingsCounts() {
        assertTrue(detector.detect(Snippets.function("""
                bytes c = tx.outputs[0].tokenCategory;
                int a = tx.outputs[0].tokenAmount;
                int b = a + 1;
                require(c == category && b > 1);
                """)).isEmpty());
    }
}
