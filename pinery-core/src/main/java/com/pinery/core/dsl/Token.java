package com.pinery.core.dsl;

/**
 * Token produced by the lexer.
 *
 * @param position zero-based character offset into the source
 * @param line     one-based line
 * @param column   one-based column
 */
public record Token(TokenType type, String value, int position, int line, int column) {

    public static Token eof(int position, int line, int column) {
        return new Token(TokenType.EOF, "", position, line, column);
    }

    public boolean is(TokenType expected, String text) {
        return type == expected && value.equals(text);
    }

    /**
     * Offset one past the last character of this token.
     */
    public int end() {
        return position + value.length();
    }
}
