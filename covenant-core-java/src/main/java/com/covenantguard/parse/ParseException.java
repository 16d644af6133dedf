package com.covenantguard.parse;

/**
 * Malformed source. Fatal to analysis: no partial tree is ever returned.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;
    private final String expected;

    public ParseException(String message, int line, int column, String expected) {
        super(line + ":" + column + ": " + message);
        this.line = line;
        this.column = column;
        this.expected = expected;
    }

    public int line() { return line; }
    public int column() { return column; }

    /** Description of what the parser expected at this location; may be empty. */
    public String expected() { return expected; }

    /** Machine-readable rule id used when this error is reported as a violation. */
    public String ruleId() { return "parse_error"; }
}
