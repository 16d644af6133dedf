package com.covenantguard;

import com.covenantguard.ast.AstModel.FunctionNode;
import com.covenantguard.config.RuleTable;
import com.covenantguard.detectors.Detector;
import com.covenantguard.detectors.DetectorRegistry;
import com.covenantguard.detectors.UnusedBindingDetector;
import com.covenantguard.parse.ParseException;
import com.covenantguard.parse.UnsupportedConstructException;
import com.covenantguard.report.AnalysisResult;
import com.covenantguard.report.CheckReport;
import com.covenantguard.report.ReportWriter;
import com.covenantguard.report.RiskLevel;
import com.covenantguard.report.Violation;
import com.covenantguard.tollgate.ScoreAggregator;
import com.covenantguard.tollgate.TollGate;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TollGateTest {

    private static final TollGate GATE = TollGate.standard(Snippets.SETTINGS);

    private static final String TWO_FUNCTIONS = """
            contract Pool(pubkey owner) {
                function deposit(int parts) {
                    int share = tx.inputs[this.activeInputIndex].value / parts;
                    require(tx.outputs[0].value == share);
                }

                function withdraw(sig s) {
                    require(tx.outputs.length == 1);
                    require(tx.time > 100);
                    require(checkSig(s, owner));
                }
            }
            """;

    private static String unusedBindings(int count) {
        StringBuilder body = new StringBuilder("require(tx.outputs.length == 1);\n");
        for (int i = 1; i <= count; i++) {
            body.append("int spare").append(i).append(" = ").append(i).append(";\n");
        }
        return "contract Spares() {\n    function f() {\n" + body + "    }\n}\n";
    }

    @Test
    void findingsFollowFunctionThenDetectorOrder() {
        AnalysisResult result = GATE.check(TWO_FUNCTIONS);
        List<String> ids = result.violations().stream()
                .map(v -> v.location().function() + ":" + v.ruleId())
                .collect(Collectors.toList());
        assertEquals(List.of(
                "deposit:unvalidated_position",
                "deposit:missing_output_limit",
                "deposit:unguarded_division",
                "deposit:implicit_output_ordering",
                "withdraw:time_comparison"), ids);
        assertTrue(result.hardFail());
        assertEquals("Pool", result.contract());
    }

    @Test
    void repeatedRunsProduceIdenticalReports() {
        ReportWriter writer = new ReportWriter();
        String first = writer.toJson(report(GATE.check(TWO_FUNCTIONS)));
        String second = writer.toJson(report(TollGate.standard(Snippets.SETTINGS).check(TWO_FUNCTIONS)));
        assertEquals(first, second);
    }

    @Test
    void analysisDoesNotDependOnPreviousCalls() {
        AnalysisResult before = GATE.check(TWO_FUNCTIONS);
        GATE.check(unusedBindings(3));
        AnalysisResult after = GATE.check(TWO_FUNCTIONS);
        assertEquals(before, after);
    }

    @Test
    void addingAGuardNeverAddsFindings() {
        String weak = """
                contract Splitter() {
                    function split(int parts) {
                        require(tx.outputs.length == 2);
                        int share = 1000 / parts;
                        require(tx.outputs[0].value == share);
                    }
                }
                """;
        String guarded = weak.replace("require(tx.outputs.length == 2);",
                "require(tx.outputs.length == 2);\n        require(parts > 0);");
        AnalysisResult before = GATE.check(weak);
        AnalysisResult after = GATE.check(guarded);
        assertEquals(1, before.count("unguarded_division"));
        assertEquals(0, after.count("unguarded_division"));
        assertTrue(after.violations().size() <= before.violations().size());
        assertTrue(after.score() >= before.score());
    }

    @Test
    void softBudgetExceededHardFails() {
        AnalysisResult result = GATE.check(unusedBindings(7));
        assertEquals(7, result.count("unused_binding"));
        assertEquals(35, result.softPenalty());
        assertTrue(result.hardFail());
        assertEquals(65, result.score());
        assertEquals(RiskLevel.MEDIUM, result.riskLevel());
    }

    @Test
    void softFindingsWithinBudgetPass() {
        AnalysisResult result = GATE.check(unusedBindings(2));
        assertTrue(result.passed());
        assertEquals(90, result.score());
        assertEquals(RiskLevel.LOW, result.riskLevel());
        assertEquals(2, result.severityCounts().get("low"));
    }

    @Test
    void throwingDetectorYieldsCouldNotVerifyAndOthersStillRun() {
        Detector exploding = new Detector() {
            @Override public String id() { return "exploding"; }
            @Override public String description() { return "fails on function a"; }
            @Override public List<String> ruleIds() { return List.of(); }
            @Override public List<Violation> detect(FunctionNode function) {
                if (function.name().equals("a")) throw new IllegalStateException("boom");
                return List.of();
            }
        };
        DetectorRegistry registry = new DetectorRegistry(
                List.of(exploding, new UnusedBindingDetector(Snippets.RULES)), Snippets.RULES);
        TollGate gate = new TollGate(registry, Snippets.RULES, new ScoreAggregator(Snippets.SETTINGS.scoring()));

        AnalysisResult result = gate.check("""
                contract Two() {
                    function a() {
                        int x = 1;
                    }
                    function b() {
                        int y = 2;
                    }
                }
                """);
        List<String> ids = result.violations().stream()
                .map(v -> v.location().function() + ":" + v.ruleId())
                .collect(Collectors.toList());
        assertEquals(List.of("a:could_not_verify", "a:unused_binding", "b:unused_binding"), ids);
        assertTrue(result.violations().get(0).reason().contains("boom"));
        assertTrue(result.hardFail());
    }

    @Test
    void stackExhaustionInADetectorYieldsCouldNotVerify() {
        Detector bottomless = new Detector() {
            @Override public String id() { return "bottomless"; }
            @Override public String description() { return "runs out of stack"; }
            @Override public List<String> ruleIds() { return List.of(); }
            @Override public List<Violation> detect(FunctionNode function) {
                throw new StackOverflowError();
            }
        };
        TollGate gate = new TollGate(new DetectorRegistry(List.of(bottomless), Snippets.RULES), Snippets.RULES,
                new ScoreAggregator(Snippets.SETTINGS.scoring()));

        AnalysisResult result = gate.check("contract One() {\n function a() {\n require(true);\n }\n}");
        assertEquals(1, result.violations().size());
        assertEquals("could_not_verify", result.violations().get(0).ruleId());
        assertTrue(result.violations().get(0).reason().contains("StackOverflowError"));
        assertTrue(result.hardFail());
    }

    @Test
    void longOperatorChainIsAParseErrorNotACrash() {
        String chain = "1" + " + 1".repeat(29_999);
        ParseException e = assertThrows(ParseException.class, () -> GATE.check(
                "contract Long() {\n function f() {\n require(tx.outputs[0].value == " + chain + ");\n }\n}"));
        assertEquals("parse_error", GATE.parseFailure(e).ruleId());
        assertEquals(3, e.line());
    }

    @Test
    void ruleTableWithoutCouldNotVerifyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new TollGate(
                new DetectorRegistry(List.of(), Snippets.RULES),
                new RuleTable(Map.of()),
                new ScoreAggregator(Snippets.SETTINGS.scoring())));
    }

    @Test
    void parseErrorsPropagate() {
        ParseException e = assertThrows(ParseException.class, () -> GATE.check("contract Broken() {\n  function f( {\n}"));
        Violation v = GATE.parseFailure(e);
        assertEquals("parse_error", v.ruleId());
        assertEquals(2, v.location().line());
        assertEquals(-1, v.location().ordinal());
    }

    @Test
    void unsupportedConstructsPropagateWithTheirOwnRule() {
        ParseException e = assertThrows(UnsupportedConstructException.class, () -> GATE.check("""
                contract Loop() {
                    function f() {
                        for (int i = 0; i < 3; i++) {}
                    }
                }
                """));
        assertEquals("unsupported_construct", GATE.parseFailure(e).ruleId());
    }

    @Test
    void contractWithoutFunctionsIsClean() {
        AnalysisResult result = GATE.check("contract Empty() {}");
        assertTrue(result.violations().isEmpty());
        assertEquals(100, result.score());
        assertEquals(RiskLevel.SAFE, result.riskLevel());
    }

    private static CheckReport report(AnalysisResult result) {
        CheckReport report = new CheckReport();
        report.status = result.passed() ? CheckReport.Status.PASSED : CheckReport.Status.HARD_FAIL;
        report.source = "pool.cash";
        report.attempt = 1;
        report.result = result;
        return report;
    }
}
