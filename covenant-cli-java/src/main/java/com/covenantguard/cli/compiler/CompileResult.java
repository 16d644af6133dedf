package com.covenantguard.cli.compiler;

/**
 * @param diagnostics merged compiler output; empty if the compiler printed nothing
 * @param bytecodeHex compiled bytecode, null unless {@code success}
 */
public record CompileResult(boolean success, String diagnostics, String bytecodeHex) {

    public static CompileResult ok(String bytecodeHex) {
        return new CompileResult(true, "", bytecodeHex);
    }

    public static CompileResult failed(String diagnostics) {
        return new CompileResult(false, diagnostics, null);
    }
}
