package com.covenantguard.cli;

import com.covenantguard.cli.compiler.CashcCompiler;
import com.covenantguard.cli.compiler.CompileResult;
import com.covenantguard.cli.compiler.ContractCompiler.CompilerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Drives {@link CashcCompiler} with small shell scripts standing in for cashc.
 */
class CashcCompilerTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void requireShell() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs /bin/sh");
    }

    private CashcCompiler script(String body, Duration timeout) throws IOException {
        Path script = tempDir.resolve("cashc.sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n", StandardCharsets.UTF_8);
        return new CashcCompiler(List.of("/bin/sh", script.toString()), timeout);
    }

    @Test
    void successReturnsBytecode() throws IOException {
        CompileResult result = script("""
                [ "$2" = "--hex" ] || exit 9
                echo 0xa914deadbeef87
                """, Duration.ofSeconds(10)).compile("contract C() {}");
        assertTrue(result.success());
        assertEquals("0xa914deadbeef87", result.bytecodeHex());
        assertEquals("", result.diagnostics());
    }

    @Test
    void sourceIsStagedForTheCompiler() throws IOException {
        CompileResult result = script("cat \"$1\"", Duration.ofSeconds(10)).compile("contract Staged() {}");
        assertTrue(result.success());
        assertEquals("contract Staged() {}", result.bytecodeHex());
    }

    @Test
    void failureCarriesDiagnostics() throws IOException {
        CompileResult result = script("""
                echo "Error: Extraneous input ';'" >&2
                exit 1
                """, Duration.ofSeconds(10)).compile("contract C() {");
        assertFalse(result.success());
        assertEquals("Error: Extraneous input ';'", result.diagnostics());
        assertNull(result.bytecodeHex());
    }

    @Test
    void undecodableDiagnosticsStillFailAsACompileError() throws IOException {
        CompileResult result = script("""
                printf 'bad \\377 byte\\n'
                exit 1
                """, Duration.ofSeconds(10)).compile("contract C() {}");
        assertFalse(result.success());
        assertEquals("bad \uFFFD byte", result.diagnostics());
    }

    @Test
    void silentFailureReportsExitCode() throws IOException {
        CompileResult result = script("exit 4", Duration.ofSeconds(10)).compile("contract C() {}");
        assertFalse(result.success());
        assertEquals("Compiler exited with code 4", result.diagnostics());
    }

    @Test
    void hangingCompilerTimesOut() throws IOException {
        CompileResult result = script("sleep 5", Duration.ofSeconds(1)).compile("contract C() {}");
        assertFalse(result.success());
        assertTrue(result.diagnostics().contains("timed out"), result.diagnostics());
    }

    @Test
    void missingExecutableIsACompilerError() {
        CashcCompiler compiler = new CashcCompiler(tempDir.resolve("no-such-cashc").toString());
        assertThrows(CompilerException.class, () -> compiler.compile("contract C() {}"));
    }

    @Test
    void emptyCommandIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CashcCompiler(List.of(), Duration.ofSeconds(1)));
    }
}
