package com.covenantguard;

import com.covenantguard.parse.Lexer;
import com.covenantguard.parse.ParseException;
import com.covenantguard.parse.Token;
import com.covenantguard.parse.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<TokenKind> kinds(String src) {
        return new Lexer(src).tokenize().stream().map(Token::kind).collect(Collectors.toList());
    }

    @Test
    void keywordsTypesAndIdentifiers() {
        assertEquals(List.of(TokenKind.CONTRACT, TokenKind.IDENT, TokenKind.LPAREN, TokenKind.TYPE, TokenKind.IDENT,
                        TokenKind.RPAREN, TokenKind.EOF),
                kinds("contract P2PKH(bytes20 pkh)"));
    }

    @Test
    void sizedBytesTypesAreBounded() {
        List<Token> tokens = new Lexer("bytes32 bytes64 bytes65 bytes").tokenize();
        assertEquals(TokenKind.TYPE, tokens.get(0).kind());
        assertEquals(TokenKind.TYPE, tokens.get(1).kind());
        assertEquals(TokenKind.IDENT, tokens.get(2).kind());
        assertEquals(TokenKind.TYPE, tokens.get(3).kind());
    }

    @Test
    void twoCharacterOperatorsWinOverSingle() {
        assertEquals(List.of(TokenKind.GE, TokenKind.LE, TokenKind.EQ_EQ, TokenKind.BANG_EQ, TokenKind.AMP_AMP,
                        TokenKind.PIPE_PIPE, TokenKind.PLUS_PLUS, TokenKind.PLUS_ASSIGN, TokenKind.GT, TokenKind.EOF),
                kinds(">= <= == != && || ++ += >"));
    }

    @Test
    void numericLiterals() {
        List<Token> tokens = new Lexer("1_000 0xABcd 42").tokenize();
        assertEquals(TokenKind.INT, tokens.get(0).kind());
        assertEquals("1_000", tokens.get(0).text());
        assertEquals(TokenKind.HEX, tokens.get(1).kind());
        assertEquals("0xABcd", tokens.get(1).text());
        assertEquals(TokenKind.INT, tokens.get(2).kind());
    }

    @Test
    void emptyHexIsALiteral() {
        List<Token> tokens = new Lexer("0x)").tokenize();
        assertEquals(TokenKind.HEX, tokens.get(0).kind());
        assertEquals("0x", tokens.get(0).text());
        assertEquals(TokenKind.RPAREN, tokens.get(1).kind());
    }

    @Test
    void badHexDigitFails() {
        ParseException ex = assertThrows(ParseException.class, () -> new Lexer("0x12zz").tokenize());
        assertEquals(5, ex.column());
    }

    @Test
    void unitSuffixFoldsIntoTheLiteral() {
        List<Token> tokens = new Lexer("30 days 2 hours 1_000 sats 1 bitcoin daysLeft").tokenize();
        assertEquals(List.of("2592000", "7200", "1000", "100000000", "daysLeft"),
                tokens.subList(0, 5).stream().map(Token::text).collect(Collectors.toList()));
        assertEquals(TokenKind.INT, tokens.get(0).kind());
        assertEquals(TokenKind.IDENT, tokens.get(4).kind());
    }

    @Test
    void unitOnTheNextLineIsAnIdentifier() {
        assertEquals(List.of(TokenKind.INT, TokenKind.IDENT, TokenKind.EOF), kinds("5\ndays"));
    }

    @Test
    void exponentFoldsIntoTheLiteral() {
        List<Token> tokens = new Lexer("1e8 5e3 seconds").tokenize();
        assertEquals("100000000", tokens.get(0).text());
        assertEquals("5000", tokens.get(1).text());
        assertEquals(TokenKind.EOF, tokens.get(2).kind());
    }

    @Test
    void stringLiteralsWithEitherQuote() {
        List<Token> tokens = new Lexer("\"double\" 'single'").tokenize();
        assertEquals(TokenKind.STRING, tokens.get(0).kind());
        assertEquals("double", tokens.get(0).text());
        assertEquals("single", tokens.get(1).text());
    }

    @Test
    void commentsAreSkippedAndPositionsTracked() {
        List<Token> tokens = new Lexer("// header\n/* block\n comment */  require").tokenize();
        Token require = tokens.get(0);
        assertEquals(TokenKind.REQUIRE, require.kind());
        assertEquals(3, require.line());
        assertEquals(14, require.column());
    }

    @Test
    void controlFlowKeywordsAreDistinctKinds() {
        List<Token> tokens = new Lexer("if else for while return").tokenize();
        for (int i = 0; i < 5; i++) {
            assertTrue(tokens.get(i).kind().isControlFlow(), tokens.get(i).text());
        }
    }

    @Test
    void unterminatedBlockCommentFails() {
        ParseException ex = assertThrows(ParseException.class, () -> new Lexer("require /* never closed").tokenize());
        assertEquals(1, ex.line());
        assertEquals(9, ex.column());
    }

    @Test
    void unterminatedStringFails() {
        assertThrows(ParseException.class, () -> new Lexer("\"open").tokenize());
    }

    @Test
    void unknownCharacterFailsWithLocation() {
        ParseException ex = assertThrows(ParseException.class, () -> new Lexer("a\n  @b").tokenize());
        assertEquals(2, ex.line());
        assertEquals(3, ex.column());
        assertEquals("parse_error", ex.ruleId());
    }

    @Test
    void emptySourceYieldsOnlyEof() {
        assertEquals(List.of(TokenKind.EOF), kinds("  \n\t "));
    }
}
