package com.covenantguard.parse;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Single-pass tokenizer for contract source. Linear in input length.
 */
public class Lexer {

    private static final Map<String, TokenKind> KEYWORDS = new HashMap<>();
    private static final Pattern SIZED_BYTES = Pattern.compile("bytes([1-9]|[1-5][0-9]|6[0-4])");

    // multiplier applied to an integer literal followed by the unit word
    private static final Map<String, BigInteger> UNITS = new HashMap<>();

    static {
        KEYWORDS.put("pragma", TokenKind.PRAGMA);
        KEYWORDS.put("contract", TokenKind.CONTRACT);
        KEYWORDS.put("function", TokenKind.FUNCTION);
        KEYWORDS.put("require", TokenKind.REQUIRE);
        KEYWORDS.put("new", TokenKind.NEW);
        KEYWORDS.put("true", TokenKind.TRUE);
        KEYWORDS.put("false", TokenKind.FALSE);
        KEYWORDS.put("if", TokenKind.IF);
        KEYWORDS.put("else", TokenKind.ELSE);
        KEYWORDS.put("for", TokenKind.FOR);
        KEYWORDS.put("while", TokenKind.WHILE);
        KEYWORDS.put("do", TokenKind.DO);
        KEYWORDS.put("switch", TokenKind.SWITCH);
        KEYWORDS.put("return", TokenKind.RETURN);
        for (String type : new String[]{"int", "bool", "string", "pubkey", "sig", "datasig", "bytes"}) {
            KEYWORDS.put(type, TokenKind.TYPE);
        }

        UNITS.put("satoshis", BigInteger.ONE);
        UNITS.put("sats", BigInteger.ONE);
        UNITS.put("finney", BigInteger.valueOf(10));
        UNITS.put("bits", BigInteger.valueOf(100));
        UNITS.put("bitcoin", BigInteger.valueOf(100_000_000));
        UNITS.put("seconds", BigInteger.ONE);
        UNITS.put("minutes", BigInteger.valueOf(60));
        UNITS.put("hours", BigInteger.valueOf(3_600));
        UNITS.put("days", BigInteger.valueOf(86_400));
        UNITS.put("weeks", BigInteger.valueOf(604_800));
    }

    private final String src;
    private final int len;
    private int pos = 0;
    private int line = 1;
    private int col = 1;

    public Lexer(String src) {
        this.src = src;
        this.len = src.length();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= len) {
                tokens.add(new Token(TokenKind.EOF, "", line, col));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int startLine = line;
        int startCol = col;
        char c = src.charAt(pos);

        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            while (pos < len && isWordChar(src.charAt(pos))) advance();
            String word = src.substring(start, pos);
            TokenKind kind = KEYWORDS.get(word);
            if (kind == null && SIZED_BYTES.matcher(word).matches()) kind = TokenKind.TYPE;
            return new Token(kind != null ? kind : TokenKind.IDENT, word, startLine, startCol);
        }

        if (Character.isDigit(c)) {
            return number(startLine, startCol);
        }

        if (c == '"' || c == '\'') {
            return string(c, startLine, startCol);
        }

        switch (c) {
            case '(': return single(TokenKind.LPAREN, startLine, startCol);
            case ')': return single(TokenKind.RPAREN, startLine, startCol);
            case '{': return single(TokenKind.LBRACE, startLine, startCol);
            case '}': return single(TokenKind.RBRACE, startLine, startCol);
            case '[': return single(TokenKind.LBRACKET, startLine, startCol);
            case ']': return single(TokenKind.RBRACKET, startLine, startCol);
            case ',': return single(TokenKind.COMMA, startLine, startCol);
            case ';': return single(TokenKind.SEMI, startLine, startCol);
            case '.': return single(TokenKind.DOT, startLine, startCol);
            case '?': return single(TokenKind.QUESTION, startLine, startCol);
            case ':': return single(TokenKind.COLON, startLine, startCol);
            case '^': return single(TokenKind.CARET, startLine, startCol);
            case '+':
                if (peekIs(1, '+')) return pair(TokenKind.PLUS_PLUS, startLine, startCol);
                if (peekIs(1, '=')) return pair(TokenKind.PLUS_ASSIGN, startLine, startCol);
                return single(TokenKind.PLUS, startLine, startCol);
            case '-':
                if (peekIs(1, '-')) return pair(TokenKind.MINUS_MINUS, startLine, startCol);
                if (peekIs(1, '=')) return pair(TokenKind.MINUS_ASSIGN, startLine, startCol);
                return single(TokenKind.MINUS, startLine, startCol);
            case '*':
                if (peekIs(1, '=')) return pair(TokenKind.STAR_ASSIGN, startLine, startCol);
                return single(TokenKind.STAR, startLine, startCol);
            case '/':
                if (peekIs(1, '=')) return pair(TokenKind.SLASH_ASSIGN, startLine, startCol);
                return single(TokenKind.SLASH, startLine, startCol);
            case '%':
                if (peekIs(1, '=')) return pair(TokenKind.PERCENT_ASSIGN, startLine, startCol);
                return single(TokenKind.PERCENT, startLine, startCol);
            case '!':
                if (peekIs(1, '=')) return pair(TokenKind.BANG_EQ, startLine, startCol);
                return single(TokenKind.BANG, startLine, startCol);
            case '=':
                if (peekIs(1, '=')) return pair(TokenKind.EQ_EQ, startLine, startCol);
                return single(TokenKind.ASSIGN, startLine, startCol);
            case '<':
                if (peekIs(1, '=')) return pair(TokenKind.LE, startLine, startCol);
                return single(TokenKind.LT, startLine, startCol);
            case '>':
                if (peekIs(1, '=')) return pair(TokenKind.GE, startLine, startCol);
                return single(TokenKind.GT, startLine, startCol);
            case '&':
                if (peekIs(1, '&')) return pair(TokenKind.AMP_AMP, startLine, startCol);
                return single(TokenKind.AMP, startLine, startCol);
            case '|':
                if (peekIs(1, '|')) return pair(TokenKind.PIPE_PIPE, startLine, startCol);
                return single(TokenKind.PIPE, startLine, startCol);
            default:
                throw new ParseException("unexpected character '" + c + "'", startLine, startCol, "token");
        }
    }

    /**
     * Hex ({@code 0x} with zero or more digits) or decimal. A decimal may carry an exponent
     * ({@code 1e8}) and a trailing unit word ({@code 30 days}); both are folded into the
     * token text, so the literal {@code 2 hours} lexes as {@code 7200}.
     */
    private Token number(int startLine, int startCol) {
        int start = pos;
        if (src.charAt(pos) == '0' && pos + 1 < len && (src.charAt(pos + 1) == 'x' || src.charAt(pos + 1) == 'X')) {
            advance();
            advance();
            while (pos < len && isHexDigit(src.charAt(pos))) advance();
            if (pos < len && isWordChar(src.charAt(pos))) {
                throw new ParseException("invalid hex digit '" + src.charAt(pos) + "'", line, col, "hex digit");
            }
            return new Token(TokenKind.HEX, src.substring(start, pos), startLine, startCol);
        }
        digits(startLine, startCol);
        String text = src.substring(start, pos);
        if (pos + 1 < len && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E') && Character.isDigit(src.charAt(pos + 1))) {
            advance();
            int exponentStart = pos;
            digits(startLine, startCol);
            String exponent = src.substring(exponentStart, pos).replace("_", "");
            if (exponent.length() > 4) {
                throw new ParseException("exponent too large in '" + src.substring(start, pos) + "'", startLine, startCol, "smaller exponent");
            }
            text = new BigInteger(text.replace("_", "")).multiply(BigInteger.TEN.pow(Integer.parseInt(exponent))).toString();
        }
        BigInteger unit = unitAhead();
        if (unit != null) {
            text = new BigInteger(text.replace("_", "")).multiply(unit).toString();
        }
        return new Token(TokenKind.INT, text, startLine, startCol);
    }

    private void digits(int startLine, int startCol) {
        while (pos < len && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) advance();
        if (src.charAt(pos - 1) == '_') {
            throw new ParseException("integer literal ends with '_'", startLine, startCol, "digit");
        }
    }

    /** Consumes a unit word after the current number, if one follows on the same line, and returns its multiplier. */
    private BigInteger unitAhead() {
        int p = pos;
        while (p < len && (src.charAt(p) == ' ' || src.charAt(p) == '\t')) p++;
        int wordStart = p;
        while (p < len && isWordChar(src.charAt(p))) p++;
        BigInteger unit = UNITS.get(src.substring(wordStart, p));
        if (unit == null) return null;
        while (pos < p) advance();
        return unit;
    }

    private Token string(char quote, int startLine, int startCol) {
        advance(); // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < len && src.charAt(pos) != quote) {
            char ch = src.charAt(pos);
            if (ch == '\n') {
                throw new ParseException("unterminated string literal", startLine, startCol, "closing " + quote);
            }
            if (ch == '\\' && pos + 1 < len) {
                advance();
                ch = src.charAt(pos);
            }
            sb.append(ch);
            advance();
        }
        if (pos >= len) {
            throw new ParseException("unterminated string literal", startLine, startCol, "closing " + quote);
        }
        advance(); // closing quote
        return new Token(TokenKind.STRING, sb.toString(), startLine, startCol);
    }

    private void skipWhitespaceAndComments() {
        while (pos < len) {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peekIs(1, '/')) {
                while (pos < len && src.charAt(pos) != '\n') advance();
            } else if (c == '/' && peekIs(1, '*')) {
                int startLine = line;
                int startCol = col;
                advance();
                advance();
                while (pos < len && !(src.charAt(pos) == '*' && peekIs(1, '/'))) advance();
                if (pos >= len) {
                    throw new ParseException("unterminated block comment", startLine, startCol, "*/");
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private Token single(TokenKind kind, int startLine, int startCol) {
        String text = String.valueOf(src.charAt(pos));
        advance();
        return new Token(kind, text, startLine, startCol);
    }

    private Token pair(TokenKind kind, int startLine, int startCol) {
        String text = src.substring(pos, pos + 2);
        advance();
        advance();
        return new Token(kind, text, startLine, startCol);
    }

    private boolean peekIs(int offset, char expected) {
        return pos + offset < len && src.charAt(pos + offset) == expected;
    }

    private void advance() {
        if (src.charAt(pos) == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        pos++;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isHexDigit(char c) {
        return Character.isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
