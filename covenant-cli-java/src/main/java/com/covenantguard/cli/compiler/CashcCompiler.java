package com.covenantguard.cli.compiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code cashc <file> --hex} on a temporary copy of the source.
 * Output is redirected to a file so the timeout applies even if the compiler never closes stdout.
 */
public class CashcCompiler implements ContractCompiler {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final List<String> command;
    private final Duration timeout;

    public CashcCompiler(String executable) {
        this(List.of(executable), DEFAULT_TIMEOUT);
    }

    /**
     * @param command executable plus any leading arguments; the source file and {@code --hex} are appended
     */
    public CashcCompiler(List<String> command, Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("compiler command is empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public CompileResult compile(String source) {
        Path workDir;
        try {
            workDir = Files.createTempDirectory("covenant-guard-cashc");
        } catch (IOException e) {
            throw new CompilerException("Could not create compiler work directory: " + e.getMessage(), e);
        }
        try {
            Path sourceFile = workDir.resolve("contract.cash");
            Path outputFile = workDir.resolve("cashc.out");
            Files.writeString(sourceFile, source, StandardCharsets.UTF_8);
            return run(sourceFile, outputFile);
        } catch (IOException e) {
            throw new CompilerException("Could not stage source for compiler: " + e.getMessage(), e);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private CompileResult run(Path sourceFile, Path outputFile) throws IOException {
        List<String> cmd = new ArrayList<>(command);
        cmd.add(sourceFile.toString());
        cmd.add("--hex");

        ProcessBuilder pb = new ProcessBuilder(cmd)
                .directory(sourceFile.getParent().toFile())
                .redirectErrorStream(true)
                .redirectOutput(outputFile.toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new CompilerException("Failed to spawn " + command.get(0) + ": " + e.getMessage(), e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                System.err.println("[covenant-guard] WARNING: compiler timed out after " + timeout.toSeconds() + "s");
                return CompileResult.failed("Compiler timed out after " + timeout.toSeconds() + "s");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CompilerException("Compiler interrupted", e);
        }

        // compiler output may not be valid UTF-8; malformed bytes decode to U+FFFD
        String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8).strip();
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            return CompileResult.failed(output.isEmpty() ? "Compiler exited with code " + exitCode : output);
        }
        return CompileResult.ok(output);
    }

    private static void deleteQuietly(Path dir) {
        try (var files = Files.list(dir)) {
            for (Path p : (Iterable<Path>) files::iterator) {
                Files.deleteIfExists(p);
            }
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            System.err.println("[covenant-guard] WARNING: could not clean up " + dir + ": " + e.getMessage());
        }
    }
}
