package com.covenantguard.parse;

import com.covenantguard.ast.AstModel.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the straight-line contract subset.
 *
 * <p>One token of lookahead. Either returns a complete {@link ContractNode}
 * or throws; a partial tree is never produced. Anything that would introduce
 * a second path through a function body is rejected with
 * {@link UnsupportedConstructException}.
 */
public class ContractParser {

    static final int MAX_DEPTH = 256;

    private static final Set<String> HASH_FUNCTIONS = Set.of("sha256", "sha1", "ripemd160", "hash160", "hash256");
    private static final Set<String> SIGNATURE_FUNCTIONS = Set.of("checkSig", "checkMultiSig", "checkDataSig");
    private static final Set<String> BUILTIN_FUNCTIONS = Set.of("abs", "min", "max", "within", "date");
    private static final Set<String> LOCKING_BYTECODE_TYPES = Set.of(
            "LockingBytecodeP2PKH", "LockingBytecodeP2SH20", "LockingBytecodeP2SH32", "LockingBytecodeNullData");

    private final List<Token> tokens;
    private int current = 0;
    private int depth = 0;

    public ContractParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** Tokenizes and parses {@code source}. */
    public static ContractNode parse(String source) {
        return new ContractParser(new Lexer(source).tokenize()).parseContract();
    }

    public ContractNode parseContract() {
        String pragma = null;
        if (check(TokenKind.PRAGMA)) {
            pragma = parsePragma();
        }
        expect(TokenKind.CONTRACT, "'contract'");
        String name = expect(TokenKind.IDENT, "contract name").text();
        List<Parameter> constructorParams = parseParams();
        expect(TokenKind.LBRACE, "'{'");
        List<FunctionNode> functions = new ArrayList<>();
        while (!check(TokenKind.RBRACE)) {
            if (check(TokenKind.EOF)) {
                throw error(peek(), "'}' closing contract " + name);
            }
            functions.add(parseFunction());
        }
        advance();
        expect(TokenKind.EOF, "end of input");
        return new ContractNode(name, pragma, constructorParams, functions);
    }

    private String parsePragma() {
        advance();
        StringBuilder sb = new StringBuilder();
        Token prev = null;
        while (!check(TokenKind.SEMI)) {
            Token t = peek();
            if (t.is(TokenKind.EOF)) {
                throw error(t, "';' after pragma");
            }
            if (prev != null && needsSpace(prev, t)) sb.append(' ');
            sb.append(t.text());
            prev = advance();
        }
        advance();
        return sb.toString();
    }

    private static boolean needsSpace(Token prev, Token next) {
        if (prev.is(TokenKind.IDENT)) return true;
        return prev.is(TokenKind.INT) && !next.is(TokenKind.DOT) && !next.is(TokenKind.INT);
    }

    private List<Parameter> parseParams() {
        expect(TokenKind.LPAREN, "'('");
        List<Parameter> params = new ArrayList<>();
        if (!check(TokenKind.RPAREN)) {
            do {
                Token type = expect(TokenKind.TYPE, "parameter type");
                Token name = expect(TokenKind.IDENT, "parameter name");
                params.add(new Parameter(type.text(), name.text(), pos(type)));
            } while (match(TokenKind.COMMA));
        }
        expect(TokenKind.RPAREN, "')'");
        return params;
    }

    private FunctionNode parseFunction() {
        Token start = expect(TokenKind.FUNCTION, "'function'");
        String name = expect(TokenKind.IDENT, "function name").text();
        List<Parameter> params = parseParams();
        List<String> modifiers = new ArrayList<>();
        while (check(TokenKind.IDENT)) {
            modifiers.add(advance().text());
        }
        expect(TokenKind.LBRACE, "'{'");
        List<Stmt> body = new ArrayList<>();
        while (!check(TokenKind.RBRACE)) {
            if (check(TokenKind.EOF)) {
                throw error(peek(), "'}' closing function " + name);
            }
            parseStatement(body);
        }
        advance();
        return new FunctionNode(name, params, modifiers, body, pos(start));
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    private void parseStatement(List<Stmt> body) {
        Token t = peek();
        if (t.kind().isControlFlow()) {
            throw new UnsupportedConstructException(t.text(), t.line(), t.column());
        }
        if (t.is(TokenKind.LBRACE)) {
            throw new UnsupportedConstructException("{", t.line(), t.column());
        }
        if (t.is(TokenKind.REQUIRE)) {
            body.add(parseRequire(body.size()));
            return;
        }
        if (t.is(TokenKind.TYPE) && !peekAt(1).is(TokenKind.LPAREN)) {
            parseDeclaration(body);
            return;
        }
        if (t.is(TokenKind.IDENT) && t.text().equals("emit") && peekAt(1).is(TokenKind.IDENT)) {
            advance();
            Expr event = parseExpression();
            endStatement();
            body.add(new Bare(new Call(CallKind.OTHER, "emit", null, List.of(event), pos(t)), body.size(), pos(t)));
            return;
        }
        if (t.is(TokenKind.IDENT) && peekAt(1).is(TokenKind.ASSIGN)) {
            advance();
            advance();
            Expr value = parseExpression();
            endStatement();
            body.add(new Assignment(null, t.text(), value, body.size(), pos(t)));
            return;
        }
        Expr value = parseExpression();
        endStatement();
        body.add(new Bare(value, body.size(), pos(t)));
    }

    private Assertion parseRequire(int ordinal) {
        Token start = advance();
        expect(TokenKind.LPAREN, "'(' after require");
        Expr predicate = parseExpression();
        String message = null;
        if (match(TokenKind.COMMA)) {
            message = expect(TokenKind.STRING, "require message string").text();
        }
        expect(TokenKind.RPAREN, "')'");
        endStatement();
        return new Assertion(predicate, message, ordinal, pos(start));
    }

    /** {@code T a = e;} or the tuple form {@code T a, T b = e;}, which binds {@code e[0]} and {@code e[1]}. */
    private void parseDeclaration(List<Stmt> body) {
        List<Token> types = new ArrayList<>();
        List<Token> names = new ArrayList<>();
        do {
            types.add(expect(TokenKind.TYPE, "type"));
            names.add(expect(TokenKind.IDENT, "variable name"));
        } while (match(TokenKind.COMMA));
        expect(TokenKind.ASSIGN, "'='");
        Expr value = parseExpression();
        endStatement();
        if (names.size() == 1) {
            body.add(new Assignment(types.get(0).text(), names.get(0).text(), value, body.size(), pos(types.get(0))));
            return;
        }
        for (int i = 0; i < names.size(); i++) {
            Expr element = new IndexAccess(value, new Literal(LiteralKind.INT, Integer.toString(i), value.pos()), value.pos());
            body.add(new Assignment(types.get(i).text(), names.get(i).text(), element, body.size(), pos(types.get(i))));
        }
    }

    private void endStatement() {
        Token t = peek();
        if (t.kind().isMutation()) {
            throw new UnsupportedConstructException(t.text(), t.line(), t.column());
        }
        expect(TokenKind.SEMI, "';'");
    }

    // -----------------------------------------------------------------------
    // Expressions, lowest precedence first
    // -----------------------------------------------------------------------

    private Expr parseExpression() {
        enter();
        Expr e = parseOr();
        if (check(TokenKind.QUESTION)) {
            Token q = peek();
            throw new UnsupportedConstructException("?:", q.line(), q.column());
        }
        depth--;
        return e;
    }

    private Expr parseOr() {
        int mark = depth;
        Expr left = parseAnd();
        while (match(TokenKind.PIPE_PIPE)) {
            enter();
            left = new Binary(BinaryOp.OR, left, parseAnd(), left.pos());
        }
        return leave(mark, left);
    }

    private Expr parseAnd() {
        int mark = depth;
        Expr left = parseBitOr();
        while (match(TokenKind.AMP_AMP)) {
            enter();
            left = new Binary(BinaryOp.AND, left, parseBitOr(), left.pos());
        }
        return leave(mark, left);
    }

    private Expr parseBitOr() {
        int mark = depth;
        Expr left = parseBitXor();
        while (match(TokenKind.PIPE)) {
            enter();
            left = new Binary(BinaryOp.BIT_OR, left, parseBitXor(), left.pos());
        }
        return leave(mark, left);
    }

    private Expr parseBitXor() {
        int mark = depth;
        Expr left = parseBitAnd();
        while (match(TokenKind.CARET)) {
            enter();
            left = new Binary(BinaryOp.BIT_XOR, left, parseBitAnd(), left.pos());
        }
        return leave(mark, left);
    }

    private Expr parseBitAnd() {
        int mark = depth;
        Expr left = parseEquality();
        while (match(TokenKind.AMP)) {
            enter();
            left = new Binary(BinaryOp.BIT_AND, left, parseEquality(), left.pos());
        }
        return leave(mark, left);
    }

    private Expr parseEquality() {
        int mark = depth;
        Expr left = parseRelational();
        while (true) {
            BinaryOp op;
            if (match(TokenKind.EQ_EQ)) op = BinaryOp.EQ;
            else if (match(TokenKind.BANG_EQ)) op = BinaryOp.NE;
            else return leave(mark, left);
            enter();
            left = new Binary(op, left, parseRelational(), left.pos());
        }
    }

    private Expr parseRelational() {
        int mark = depth;
        Expr left = parseAdditive();
        while (true) {
            BinaryOp op;
            if (match(TokenKind.LT)) op = BinaryOp.LT;
            else if (match(TokenKind.LE)) op = BinaryOp.LE;
            else if (match(TokenKind.GT)) op = BinaryOp.GT;
            else if (match(TokenKind.GE)) op = BinaryOp.GE;
            else return leave(mark, left);
            enter();
            left = new Binary(op, left, parseAdditive(), left.pos());
        }
    }

    private Expr parseAdditive() {
        int mark = depth;
        Expr left = parseMultiplicative();
        while (true) {
            BinaryOp op;
            if (match(TokenKind.PLUS)) op = BinaryOp.ADD;
            else if (match(TokenKind.MINUS)) op = BinaryOp.SUB;
            else return leave(mark, left);
            enter();
            left = new Binary(op, left, parseMultiplicative(), left.pos());
        }
    }

    private Expr parseMultiplicative() {
        int mark = depth;
        Expr left = parseUnary();
        while (true) {
            BinaryOp op;
            if (match(TokenKind.STAR)) op = BinaryOp.MUL;
            else if (match(TokenKind.SLASH)) op = BinaryOp.DIV;
            else if (match(TokenKind.PERCENT)) op = BinaryOp.MOD;
            else return leave(mark, left);
            enter();
            left = new Binary(op, left, parseUnary(), left.pos());
        }
    }

    private Expr parseUnary() {
        Token t = peek();
        if (t.kind().isMutation()) {
            throw new UnsupportedConstructException(t.text(), t.line(), t.column());
        }
        UnaryOp op = null;
        if (t.is(TokenKind.BANG)) op = UnaryOp.NOT;
        else if (t.is(TokenKind.MINUS)) op = UnaryOp.NEGATE;
        if (op == null) {
            return parsePostfix();
        }
        advance();
        enter();
        Expr operand = parseUnary();
        depth--;
        return new Unary(op, operand, pos(t));
    }

    private Expr parsePostfix() {
        int mark = depth;
        Expr e = parsePrimary();
        while (true) {
            if (check(TokenKind.DOT) || check(TokenKind.LBRACKET)) enter();
            if (match(TokenKind.DOT)) {
                Token member = expect(TokenKind.IDENT, "member name after '.'");
                if (check(TokenKind.LPAREN)) {
                    e = new Call(CallKind.METHOD, member.text(), e, parseArguments(), e.pos());
                } else {
                    e = new FieldAccess(e, member.text(), e.pos());
                }
            } else if (match(TokenKind.LBRACKET)) {
                Expr index = parseExpression();
                expect(TokenKind.RBRACKET, "']'");
                e = new IndexAccess(e, index, e.pos());
            } else {
                return leave(mark, e);
            }
        }
    }

    private Expr parsePrimary() {
        Token t = peek();
        switch (t.kind()) {
            case INT:
                advance();
                return new Literal(LiteralKind.INT, t.text(), pos(t));
            case HEX:
                advance();
                return new Literal(LiteralKind.HEX, t.text(), pos(t));
            case STRING:
                advance();
                return new Literal(LiteralKind.STRING, t.text(), pos(t));
            case TRUE:
            case FALSE:
                advance();
                return new Literal(LiteralKind.BOOL, t.text(), pos(t));
            case IDENT:
                advance();
                if (check(TokenKind.LPAREN)) {
                    return new Call(classify(t.text()), t.text(), null, parseArguments(), pos(t));
                }
                return new Identifier(t.text(), pos(t));
            case TYPE:
                advance();
                if (!check(TokenKind.LPAREN)) {
                    throw error(peek(), "'(' after type name in cast");
                }
                return new Call(CallKind.CAST, t.text(), null, parseArguments(), pos(t));
            case NEW: {
                advance();
                Token type = expect(TokenKind.IDENT, "type name after 'new'");
                CallKind kind = LOCKING_BYTECODE_TYPES.contains(type.text()) ? CallKind.LOCKING_BYTECODE : CallKind.OTHER;
                return new Call(kind, type.text(), null, parseArguments(), pos(t));
            }
            case LPAREN: {
                advance();
                Expr inner = parseExpression();
                expect(TokenKind.RPAREN, "')'");
                return inner;
            }
            case LBRACKET: {
                advance();
                List<Expr> elements = new ArrayList<>();
                if (!check(TokenKind.RBRACKET)) {
                    do {
                        elements.add(parseExpression());
                    } while (match(TokenKind.COMMA));
                }
                expect(TokenKind.RBRACKET, "']'");
                return new Call(CallKind.BUILTIN, "array", null, elements, pos(t));
            }
            default:
                if (t.kind().isControlFlow() || t.kind().isMutation()) {
                    throw new UnsupportedConstructException(t.text(), t.line(), t.column());
                }
                throw error(t, "expression");
        }
    }

    private List<Expr> parseArguments() {
        expect(TokenKind.LPAREN, "'('");
        List<Expr> args = new ArrayList<>();
        if (!check(TokenKind.RPAREN)) {
            do {
                args.add(parseExpression());
            } while (match(TokenKind.COMMA));
        }
        expect(TokenKind.RPAREN, "')'");
        return args;
    }

    static CallKind classify(String name) {
        if (HASH_FUNCTIONS.contains(name)) return CallKind.HASH;
        if (SIGNATURE_FUNCTIONS.contains(name)) return CallKind.SIGNATURE;
        if (BUILTIN_FUNCTIONS.contains(name)) return CallKind.BUILTIN;
        return CallKind.OTHER;
    }

    // -----------------------------------------------------------------------
    // Token helpers
    // -----------------------------------------------------------------------

    private void enter() {
        if (++depth > MAX_DEPTH) {
            Token t = peek();
            throw new ParseException("expression nesting exceeds " + MAX_DEPTH, t.line(), t.column(), "shallower expression");
        }
    }

    /** Every operator in a chain adds a tree level, so chains count against the nesting limit too. */
    private Expr leave(int mark, Expr e) {
        depth = mark;
        return e;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        int i = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private boolean check(TokenKind kind) {
        return peek().is(kind);
    }

    private boolean match(TokenKind kind) {
        if (!check(kind)) return false;
        advance();
        return true;
    }

    private Token advance() {
        Token t = peek();
        if (!t.is(TokenKind.EOF)) current++;
        return t;
    }

    private Token expect(TokenKind kind, String expected) {
        if (!check(kind)) {
            throw error(peek(), expected);
        }
        return advance();
    }

    private static ParseException error(Token at, String expected) {
        return new ParseException("expected " + expected + " but found " + at.describe(), at.line(), at.column(), expected);
    }

    private static SourcePos pos(Token t) {
        return new SourcePos(t.line(), t.column());
    }
}
