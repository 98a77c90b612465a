package com.pinery.core.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Pine lexer: classification, operators and indentation layout.
 */
class LexerTest {

    private static List<TokenType> types(String source) {
        return Lexer.tokenize(source).stream().map(Token::type).toList();
    }

    @Test
    @DisplayName("Namespace call is split into namespace, dot, name and arguments")
    void namespaceCall() {
        assertEquals(List.of(
            TokenType.NAMESPACE, TokenType.DOT, TokenType.IDENTIFIER, TokenType.LPAREN,
            TokenType.BUILTIN, TokenType.COMMA, TokenType.NUMBER, TokenType.RPAREN,
            TokenType.NEWLINE, TokenType.EOF
        ), types("ta.ema(close, 14)"));
    }

    @Test
    @DisplayName("Longest operator wins")
    void longestOperator() {
        List<Token> tokens = Lexer.tokenize("x := a >= b");
        assertEquals(":=", tokens.get(1).value());
        assertEquals(">=", tokens.get(3).value());
    }

    @Test
    @DisplayName("Indented block emits INDENT and DEDENT")
    void indentation() {
        assertEquals(List.of(
            TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.NEWLINE,
            TokenType.INDENT, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.NEWLINE,
            TokenType.DEDENT, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.NUMBER, TokenType.NEWLINE,
            TokenType.EOF
        ), types("if a\n    b = 1\nc = 2"));
    }

    @Test
    @DisplayName("Off-grid indentation continues the previous line")
    void continuationLine() {
        List<TokenType> types = types("x = a +\n      b");
        assertFalse(types.contains(TokenType.INDENT));
        assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
    }

    @Test
    @DisplayName("No layout tokens inside parentheses")
    void noLayoutInsideParens() {
        List<TokenType> types = types("f(a,\n  b)");
        assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
        assertFalse(types.contains(TokenType.INDENT));
    }

    @Test
    @DisplayName("Keyword, namespace, boolean and color classification")
    void classification() {
        assertEquals(TokenType.KEYWORD, Lexer.tokenize("strategy(\"x\")").get(0).type());
        assertEquals(TokenType.NAMESPACE, Lexer.tokenize("strategy.entry(\"L\")").get(0).type());
        assertEquals(TokenType.BOOLEAN, Lexer.tokenize("na").get(0).type());
        assertEquals(TokenType.LITERAL, Lexer.tokenize("#ff0000").get(0).type());
        assertEquals(TokenType.STRING, Lexer.tokenize("'text'").get(0).type());
    }

    @Test
    @DisplayName("Comments are kept as tokens")
    void comments() {
        List<Token> tokens = Lexer.tokenize("// hello\nx = 1 /* note */");
        assertEquals(TokenType.COMMENT, tokens.get(0).type());
        assertEquals("// hello", tokens.get(0).value());
        assertTrue(tokens.stream().anyMatch(t -> t.value().equals("/* note */")));
    }

    @Test
    @DisplayName("Unknown characters never throw")
    void unknownCharacter() {
        List<Token> tokens = assertDoesNotThrow(() -> Lexer.tokenize("x = @"));
        assertTrue(tokens.stream().anyMatch(t -> t.type() == TokenType.UNKNOWN && t.value().equals("@")));
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
    }

    @Test
    @DisplayName("Empty and null input yield only EOF")
    void emptyInput() {
        assertEquals(List.of(TokenType.EOF), types(""));
        assertEquals(List.of(TokenType.EOF), new Lexer(null).tokenize().stream().map(Token::type).toList());
    }

    @Test
    @DisplayName("Numbers with fraction and exponent are one token")
    void numbers() {
        List<Token> tokens = Lexer.tokenize("1.5e3 .5 14");
        assertEquals("1.5e3", tokens.get(0).value());
        assertEquals(".5", tokens.get(1).value());
        assertEquals("14", tokens.get(2).value());
    }
}
