package com.covenantguard.cli;

import com.covenantguard.cli.compiler.CompileResult;
import com.covenantguard.cli.compiler.ContractCompiler;
import com.covenantguard.escalation.EscalationController;
import com.covenantguard.parse.ParseException;
import com.covenantguard.report.AnalysisResult;
import com.covenantguard.report.CheckReport;
import com.covenantguard.report.Violation;
import com.covenantguard.tollgate.TollGate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Sequences one check: compile (optional) -> parse -> analyze -> directive.
 * Stops at the first failing stage; later stages never see its input.
 */
public class GuardPipeline {

    private final TollGate tollGate;
    private final EscalationController escalation;
    private final ContractCompiler compiler;  // nullable: compile stage skipped

    public GuardPipeline(TollGate tollGate, EscalationController escalation, ContractCompiler compiler) {
        this.tollGate = tollGate;
        this.escalation = escalation;
        this.compiler = compiler;
    }

    /**
     * @param label   name of the source shown in the report, typically its path
     * @param attempt 1-based attempt number used to pick the escalation directive
     */
    public CheckReport run(String label, String source, int attempt) {
        CheckReport report = new CheckReport();
        report.source = label;
        report.sourceSha256 = sha256(source);
        report.attempt = attempt;

        // 1. Compile gate
        if (compiler != null) {
            System.err.println("[covenant-guard] Compiling " + label + "...");
            CompileResult compiled = compiler.compile(source);
            if (!compiled.success()) {
                System.err.println("[covenant-guard] Compilation failed");
                report.status = CheckReport.Status.COMPILE_FAILED;
                report.compilerDiagnostics = compiled.diagnostics();
                return report;
            }
        }

        // 2. Parse + 3. Analyze
        System.err.println("[covenant-guard] Analyzing " + label + "...");
        AnalysisResult result;
        try {
            result = tollGate.check(source);
        } catch (ParseException e) {
            System.err.println("[covenant-guard] Parse failed: " + e.getMessage());
            Violation parseError = tollGate.parseFailure(e);
            report.status = CheckReport.Status.PARSE_FAILED;
            report.parseError = parseError;
            report.directive = escalation.decide(attempt, List.of(parseError));
            return report;
        }
        report.result = result;
        System.err.println("[covenant-guard] Analysis complete: " + result.violations().size()
                + " violations, score " + result.score() + ", risk " + result.riskLevel());

        // 4. Directive
        if (result.hardFail()) {
            report.status = CheckReport.Status.HARD_FAIL;
            report.directive = escalation.decide(attempt, result.violations());
            System.err.println("[covenant-guard] Directive: " + report.directive.kind());
        } else {
            report.status = CheckReport.Status.PASSED;
        }
        return report;
    }

    static String sha256(String source) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
