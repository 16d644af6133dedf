package com.covenantguard.report;

import com.covenantguard.escalation.Directive;
import com.google.gson.annotations.SerializedName;

/**
 * Outcome of one check run, written as check_report.json.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public class CheckReport {

    public enum Status {
        @SerializedName("passed")         PASSED,
        @SerializedName("hard_fail")      HARD_FAIL,
        @SerializedName("parse_failed")   PARSE_FAILED,
        @SerializedName("compile_failed") COMPILE_FAILED
    }

    @SerializedName("status")               public Status status;
    @SerializedName("source")               public String source;          // path or label of the checked file
    @SerializedName("source_sha256")        public String sourceSha256;
    @SerializedName("attempt")              public int attempt;
    @SerializedName("result")               public AnalysisResult result;  // null unless analysis ran
    @SerializedName("parse_error")          public Violation parseError;   // null unless PARSE_FAILED
    @SerializedName("compiler_diagnostics") public String compilerDiagnostics;
    @SerializedName("directive")            public Directive directive;    // null when PASSED

    public boolean passed() {
        return status == Status.PASSED;
    }
}
