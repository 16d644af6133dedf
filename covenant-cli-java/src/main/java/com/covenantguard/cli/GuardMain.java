package com.covenantguard.cli;

import com.covenantguard.cli.compiler.CashcCompiler;
import com.covenantguard.cli.compiler.ContractCompiler;
import com.covenantguard.config.GuardConfigReader;
import com.covenantguard.config.GuardSettings;
import com.covenantguard.escalation.EscalationController;
import com.covenantguard.report.CheckReport;
import com.covenantguard.report.ReportWriter;
import com.covenantguard.tollgate.TollGate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * Entry point for the covenant-guard command line.
 *
 * Usage:
 *   java -jar covenant-cli-java.jar check \
 *     --source <contract.cash> \
 *     [--config <overrides.json>] \
 *     [--output <dir>] \
 *     [--compiler <cashc>] [--compile-timeout <seconds>] \
 *     [--attempt <n>]
 *
 * Exit codes: 0 passed, 3 hard-fail (analysis, parse or compile), 2 usage error, 1 fatal.
 */
public class GuardMain {

    static final int EXIT_PASSED = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_HARD_FAIL = 3;

    public static void main(String[] args) {
        int code;
        try {
            code = run(args);
        } catch (UsageException e) {
            System.err.println("[covenant-guard] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar covenant-cli-java.jar check --source <file> "
                    + "[--config <json>] [--output <dir>] [--compiler <cashc>] [--compile-timeout <s>] [--attempt <n>]");
            code = EXIT_USAGE;
        } catch (Exception e) {
            System.err.println("[covenant-guard] FATAL: " + e.getMessage());
            code = EXIT_FATAL;
        }
        System.exit(code);
    }

    static int run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("check")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String sourcePath = null;
        String configPath = null;
        String outputDir = null;
        String compilerCmd = null;
        String timeoutSeconds = null;
        String attemptArg = "1";

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--source"          -> sourcePath     = requireNext(args, i++, "--source");
                case "--config"          -> configPath     = requireNext(args, i++, "--config");
                case "--output"          -> outputDir      = requireNext(args, i++, "--output");
                case "--compiler"        -> compilerCmd    = requireNext(args, i++, "--compiler");
                case "--compile-timeout" -> timeoutSeconds = requireNext(args, i++, "--compile-timeout");
                case "--attempt"         -> attemptArg     = requireNext(args, i++, "--attempt");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (sourcePath == null) throw new UsageException("--source is required");
        int attempt = positiveInt(attemptArg, "--attempt");
        Duration timeout = timeoutSeconds == null
                ? CashcCompiler.DEFAULT_TIMEOUT
                : Duration.ofSeconds(positiveInt(timeoutSeconds, "--compile-timeout"));
        if (timeoutSeconds != null && compilerCmd == null) {
            throw new UsageException("--compile-timeout requires --compiler");
        }

        Path source = Paths.get(sourcePath);

        // 1. Configuration
        GuardSettings settings = new GuardConfigReader().load(configPath != null ? Paths.get(configPath) : null);

        // 2. Wire the pipeline
        ContractCompiler compiler = compilerCmd != null ? new CashcCompiler(List.of(compilerCmd), timeout) : null;
        GuardPipeline pipeline = new GuardPipeline(
                TollGate.standard(settings),
                new EscalationController(settings.escalation(), settings.rules()),
                compiler);

        // 3. Run
        System.err.println("[covenant-guard] Reading source: " + source);
        CheckReport report = pipeline.run(source.toString(), readSource(source), attempt);

        // 4. Report
        ReportWriter writer = new ReportWriter();
        if (outputDir != null) {
            writer.write(report, Paths.get(outputDir));
        } else {
            System.out.println(writer.toJson(report));
        }

        System.err.println("[covenant-guard] Done: " + report.status);
        return report.passed() ? EXIT_PASSED : EXIT_HARD_FAIL;
    }

    private static String readSource(Path source) {
        if (!Files.isRegularFile(source)) {
            throw new UsageException("Source file not found: " + source);
        }
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source + ": " + e.getMessage(), e);
        }
    }

    private static int positiveInt(String value, String flag) {
        try {
            int n = Integer.parseInt(value);
            if (n < 1) throw new UsageException(flag + " must be >= 1, got " + value);
            return n;
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects an integer, got " + value);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
