package com.covenantguard.parse;

/**
 * A construct outside the straight-line subset: branching, looping, mutation
 * operators, early return or nested blocks. Accepting any of them would break
 * the assumption that every earlier statement executed before a later one.
 */
public class UnsupportedConstructException extends ParseException {

    private final String construct;

    public UnsupportedConstructException(String construct, int line, int column) {
        super("unsupported construct '" + construct + "': function bodies must be straight-line "
                + "sequences of require(), bindings and calls", line, column, "statement");
        this.construct = construct;
    }

    public String construct() { return construct; }

    @Override
    public String ruleId() { return "unsupported_construct"; }
}
