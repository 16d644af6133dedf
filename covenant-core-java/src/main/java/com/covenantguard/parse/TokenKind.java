package com.covenantguard.parse;

public enum TokenKind {
    // literals and names
    IDENT, INT, HEX, STRING, TYPE,

    // keywords
    PRAGMA, CONTRACT, FUNCTION, REQUIRE, NEW, TRUE, FALSE,

    // keywords outside the straight-line subset
    IF, ELSE, FOR, WHILE, DO, SWITCH, RETURN,

    // punctuation
    LPAREN, RPAREN, LBRACE, RBRACE, LBRACKET, RBRACKET,
    COMMA, SEMI, DOT, QUESTION, COLON,

    // operators
    PLUS, MINUS, STAR, SLASH, PERCENT, BANG,
    EQ_EQ, BANG_EQ, LT, LE, GT, GE,
    AMP_AMP, PIPE_PIPE, AMP, PIPE, CARET, ASSIGN,

    // mutation operators (always rejected)
    PLUS_PLUS, MINUS_MINUS, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,

    EOF;

    public boolean isControlFlow() {
        switch (this) {
            case IF: case ELSE: case FOR: case WHILE: case DO: case SWITCH: case RETURN:
                return true;
            default:
                return false;
        }
    }

    public boolean isMutation() {
        switch (this) {
            case PLUS_PLUS: case MINUS_MINUS: case PLUS_ASSIGN: case MINUS_ASSIGN:
            case STAR_ASSIGN: case SLASH_ASSIGN: case PERCENT_ASSIGN:
                return true;
            default:
                return false;
        }
    }
}
