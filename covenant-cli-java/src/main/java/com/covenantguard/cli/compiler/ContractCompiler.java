package com.covenantguard.cli.compiler;

/**
 * External syntax gate run before analysis. A source that fails to compile is
 * never analyzed.
 */
public interface ContractCompiler {

    /**
     * @throws CompilerException if the compiler itself could not be run
     */
    CompileResult compile(String source);

    class CompilerException extends RuntimeException {
        public CompilerException(String msg) { super(msg); }
        public CompilerException(String msg, Throwable cause) { super(msg, cause); }
    }
}
