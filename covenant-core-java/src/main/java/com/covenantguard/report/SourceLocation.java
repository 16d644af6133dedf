package com.covenantguard.report;

import com.covenantguard.ast.AstModel.FunctionNode;
import com.covenantguard.ast.AstModel.SourcePos;
import com.covenantguard.ast.AstModel.Stmt;

/**
 * Where a finding sits: function name plus statement ordinal. Function-level
 * findings use ordinal -1 and the position of the function header.
 */
public record SourceLocation(String function, int ordinal, int line, int column) {

    public static SourceLocation of(FunctionNode function, Stmt stmt) {
        return new SourceLocation(function.name(), stmt.ordinal(), stmt.pos().line(), stmt.pos().column());
    }

    public static SourceLocation of(FunctionNode function, int ordinal, SourcePos pos) {
        return new SourceLocation(function.name(), ordinal, pos.line(), pos.column());
    }

    public static SourceLocation functionLevel(FunctionNode function) {
        return new SourceLocation(function.name(), -1, function.pos().line(), function.pos().column());
    }

    @Override
    public String toString() {
        String where = ordinal < 0 ? function : function + "#" + ordinal;
        return where + " (" + line + ":" + column + ")";
    }
}
