package com.covenantguard.parse;

public record Token(TokenKind kind, String text, int line, int column) {

    public boolean is(TokenKind k) { return kind == k; }

    /** Human-readable form for error messages. */
    public String describe() {
        return kind == TokenKind.EOF ? "end of input" : "'" + text + "'";
    }
}
