package com.covenantguard;

import com.covenantguard.config.GuardConfigReader;
import com.covenantguard.config.GuardConfigReader.ConfigReadException;
import com.covenantguard.config.GuardSettings;
import com.covenantguard.config.RuleSpec;
import com.covenantguard.detectors.Detector;
import com.covenantguard.detectors.DetectorRegistry;
import com.covenantguard.report.Severity;
import com.covenantguard.tollgate.TollGate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GuardConfigReaderTest {

    @TempDir
    Path tempDir;

    private final GuardConfigReader reader = new GuardConfigReader();

    private Path write(String json) throws IOException {
        Path p = tempDir.resolve("guard.json");
        Files.writeString(p, json, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void bundledDefaultsCoverEveryRule() {
        GuardSettings settings = reader.load(null);
        for (Detector d : DetectorRegistry.standard(settings.rules()).detectors()) {
            for (String id : d.ruleIds()) {
                RuleSpec spec = settings.rules().rule(id);
                assertFalse(spec.exploit().isBlank(), id);
                assertFalse(spec.fixHint().isBlank(), id);
            }
        }
        assertTrue(settings.rules().contains(TollGate.COULD_NOT_VERIFY));
        assertTrue(settings.rules().contains("parse_error"));
        assertTrue(settings.rules().contains("unsupported_construct"));
        assertEquals(100, settings.scoring().baselineScore());
        assertEquals(30, settings.scoring().softFailBudget());
        assertEquals(20, settings.scoring().penalty(Severity.CRITICAL));
        assertEquals(5, settings.scoring().penalty(Severity.LOW));
        assertEquals(0, settings.scoring().penalty(Severity.INFO));
        assertEquals(1, settings.escalation().minimalThroughAttempt());
        assertEquals(2, settings.escalation().expandedThroughAttempt());
    }

    @Test
    void overridesMergeOverDefaults() throws IOException {
        Path config = write("""
                {
                  "soft_fail_budget": 10,
                  "penalties": { "low": 7 },
                  "blocking_categories": ["style"],
                  "rules": {
                    "unused_binding": { "severity": "medium" }
                  },
                  "escalation": { "expanded_through_attempt": 5 }
                }
                """);
        GuardSettings settings = reader.load(config);

        RuleSpec unused = settings.rules().rule("unused_binding");
        assertEquals(Severity.MEDIUM, unused.severity());
        assertEquals("style", unused.category());
        assertFalse(unused.exploit().isBlank());

        assertEquals(10, settings.scoring().softFailBudget());
        assertEquals(100, settings.scoring().baselineScore());
        assertEquals(7, settings.scoring().penalty(Severity.LOW));
        assertEquals(20, settings.scoring().penalty(Severity.HIGH));
        assertTrue(settings.scoring().blockingCategories().contains("style"));
        assertTrue(settings.scoring().blockingCategories().contains("authorization"));
        assertTrue(settings.scoring().blockingCategories().contains("position"));
        assertEquals(1, settings.escalation().minimalThroughAttempt());
        assertEquals(5, settings.escalation().expandedThroughAttempt());
    }

    @Test
    void securityCategoriesCannotBeUnblocked() throws IOException {
        Path config = write("{ \"blocking_categories\": [] }");
        assertTrue(reader.load(config).scoring().blockingCategories().contains("covenant"));
    }

    @Test
    void missingFileIsRejected() {
        ConfigReadException e = assertThrows(ConfigReadException.class,
                () -> reader.load(tempDir.resolve("absent.json")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void malformedJsonIsRejected() throws IOException {
        Path config = write("{ \"rules\": ");
        assertThrows(ConfigReadException.class, () -> reader.load(config));
    }

    @Test
    void emptyFileIsRejected() throws IOException {
        Path config = write("");
        assertThrows(ConfigReadException.class, () -> reader.load(config));
    }

    @Test
    void unknownSeverityIsRejected() throws IOException {
        Path config = write("{ \"rules\": { \"token_pair\": { \"severity\": \"severe\" } } }");
        ConfigReadException e = assertThrows(ConfigReadException.class, () -> reader.load(config));
        assertTrue(e.getMessage().contains("severe"));
    }

    @Test
    void newRuleWithoutCategoryIsRejected() throws IOException {
        Path config = write("{ \"rules\": { \"my_rule\": { \"severity\": \"low\" } } }");
        assertThrows(ConfigReadException.class, () -> reader.load(config));
    }

    @Test
    void invalidThresholdsAreRejected() throws IOException {
        Path config = write("{ \"escalation\": { \"minimal_through_attempt\": 3, \"expanded_through_attempt\": 2 } }");
        assertThrows(ConfigReadException.class, () -> reader.load(config));
        Path negative = write("{ \"penalties\": { \"medium\": -1 } }");
        assertThrows(ConfigReadException.class, () -> reader.load(negative));
    }
}
