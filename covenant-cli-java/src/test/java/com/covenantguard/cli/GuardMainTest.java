package com.covenantguard.cli;

import com.covenantguard.config.GuardConfigReader.ConfigReadException;
import com.covenantguard.report.CheckReport;
import com.covenantguard.report.ReportWriter;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class GuardMainTest {

    private static Path fixtures;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void locateFixtures() {
        fixtures = Paths.get(System.getProperty("user.dir"))
                .getParent()
                .resolve("test-fixtures/contracts");
        assertTrue(Files.isDirectory(fixtures), "fixtures not found at " + fixtures);
    }

    private static String fixture(String name) {
        return fixtures.resolve(name).toString();
    }

    private CheckReport readReport(Path outputDir) throws IOException {
        String json = Files.readString(outputDir.resolve(ReportWriter.REPORT_FILE), StandardCharsets.UTF_8);
        return ReportWriter.fromJson(json);
    }

    @Test
    void secureContractExitsZero() throws IOException {
        Path out = tempDir.resolve("out");
        int code = GuardMain.run(new String[]{"check", "--source", fixture("p2pkh.cash"), "--output", out.toString()});
        assertEquals(GuardMain.EXIT_PASSED, code);
        CheckReport report = readReport(out);
        assertEquals(CheckReport.Status.PASSED, report.status);
        assertEquals(1, report.attempt);
    }

    @Test
    void vulnerableContractExitsThreeWithDirective() throws IOException {
        Path out = tempDir.resolve("out");
        int code = GuardMain.run(new String[]{
                "check", "--source", fixture("token_category_only.cash"),
                "--output", out.toString(), "--attempt", "2"});
        assertEquals(GuardMain.EXIT_HARD_FAIL, code);
        CheckReport report = readReport(out);
        assertEquals(CheckReport.Status.HARD_FAIL, report.status);
        assertEquals(2, report.attempt);
        assertEquals("token_pair", report.directive.guidance().get(0).ruleId());
        assertNotNull(report.directive.guidance().get(0).fixHint());
    }

    @Test
    void unsupportedConstructExitsThree() {
        Path out = tempDir.resolve("out");
        int code = GuardMain.run(new String[]{"check", "--source", fixture("branching.cash"), "--output", out.toString()});
        assertEquals(GuardMain.EXIT_HARD_FAIL, code);
    }

    @Test
    void configOverrideCanTightenTheSoftBudget() throws IOException {
        Path config = tempDir.resolve("strict.json");
        Files.writeString(config, "{ \"soft_fail_budget\": 5 }", StandardCharsets.UTF_8);
        Path out = tempDir.resolve("out");
        int code = GuardMain.run(new String[]{
                "check", "--source", fixture("timelock_strict.cash"),
                "--config", config.toString(), "--output", out.toString()});
        assertEquals(GuardMain.EXIT_HARD_FAIL, code);
        assertEquals(10, readReport(out).result.softPenalty());
    }

    @Test
    void missingConfigIsFatal() {
        assertThrows(ConfigReadException.class, () -> GuardMain.run(new String[]{
                "check", "--source", fixture("p2pkh.cash"), "--config", tempDir.resolve("absent.json").toString()}));
    }

    @Test
    void usageErrors() {
        assertThrows(GuardMain.UsageException.class, () -> GuardMain.run(new String[]{}));
        assertThrows(GuardMain.UsageException.class, () -> GuardMain.run(new String[]{"scan"}));
        assertThrows(GuardMain.UsageException.class, () -> GuardMain.run(new String[]{"check"}));
        assertThrows(GuardMain.UsageException.class, () -> GuardMain.run(new String[]{"check", "--source"}));
        assertThrows(GuardMain.UsageException.class, () -> GuardMain.run(new String[]{"check", "--verbose"}));
        assertThrows(GuardMain.UsageException.class, () -> GuardMain.run(new String[]{
                "check", "--source", fixture("p2pkh.cash"), "--attempt", "0"}));
        assertThrows(GuardMain.UsageException.class, () -> GuardMain.run(new String[]{
                "check", "--source", fixture("p2pkh.cash"), "--attempt", "two"}));
        assertThrows(GuardMain.UsageException.class, () -> GuardMain.run(new String[]{
                "check", "--source", fixture("p2pkh.cash"), "--compile-timeout", "5"}));
        assertThrows(GuardMain.UsageException.class, () -> GuardMain.run(new String[]{
                "check", "--source", tempDir.resolve("absent.cash").toString()}));
    }
}
