package com.pinery.core.dsl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Pine Script lexer.
 *
 * Never throws: characters it cannot place become UNKNOWN tokens and the caller decides what is fatal.
 * Tracks line indentation (a tab counts as 4 columns) and emits INDENT/DEDENT against an indentation
 * stack. Blank lines and comment-only lines leave the stack alone, and no layout tokens are produced
 * inside parentheses or brackets. A line indented deeper than the current block by a non-multiple of
 * 4 columns continues the previous line.
 */
public class Lexer {

    static final Set<String> KEYWORDS = Set.of(
        "var", "varip", "if", "else", "for", "to", "by", "in", "while", "switch", "break", "continue",
        "export", "import", "as", "return", "and", "or", "not", "type", "method",
        "int", "float", "bool", "color", "string", "line", "label", "box", "table",
        "array", "matrix", "map", "void", "series", "simple", "const",
        "strategy", "indicator", "library"
    );

    static final Set<String> NAMESPACES = Set.of(
        "ta", "math", "array", "matrix", "map", "line", "label", "box", "table", "color",
        "request", "timeframe", "ticker", "input", "str", "runtime", "session", "syminfo",
        "barstate", "strategy", "chart", "polyline"
    );

    static final Set<String> BUILTINS = Set.of(
        "open", "high", "low", "close", "volume", "time", "time_close",
        "hl2", "hlc3", "ohlc4", "hlcc4", "bar_index", "last_bar_index", "timenow",
        "year", "month", "weekofyear", "dayofmonth", "dayofweek", "hour", "minute", "second"
    );

    static final Set<String> BOOLEANS = Set.of("true", "false", "na");

    // Longest first so that ":=" wins over ":" and "=".
    private static final String[] OPERATORS = {
        ":=", "=>", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=",
        "<", ">", "+", "-", "*", "/", "%", "=", "?", ":"
    };

    private static final int TAB_WIDTH = 4;
    private static final int INDENT_UNIT = 4;

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int position = 0;
    private int line = 1;
    private int lineStart = 0;
    private int bracketDepth = 0;
    private boolean atLineStart = true;

    public Lexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenize the source. The stream always ends with exactly one EOF token.
     */
    public List<Token> tokenize() {
        tokens.clear();
        indents.clear();
        indents.push(0);
        position = 0;
        line = 1;
        lineStart = 0;
        bracketDepth = 0;
        atLineStart = true;

        while (position < source.length()) {
            if (atLineStart) {
                beginLine();
                continue;
            }

            char c = source.charAt(position);

            if (c == '\n') {
                if (bracketDepth == 0) {
                    endLogicalLine();
                    atLineStart = true;
                }
                position++;
                line++;
                lineStart = position;
                continue;
            }

            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                position++;
                continue;
            }

            if (c == '/' && peek(1) == '/') {
                readLineComment();
                continue;
            }

            if (c == '/' && peek(1) == '*') {
                readBlockComment();
                continue;
            }

            if (c == '"' || c == '\'') {
                readString(c);
                continue;
            }

            if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                readNumber();
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                readIdentifier();
                continue;
            }

            if (c == '#' && isHexDigit(peek(1))) {
                readColor();
                continue;
            }

            // Single character tokens
            switch (c) {
                case '(' -> { bracketDepth++; addSingle(TokenType.LPAREN); continue; }
                case ')' -> { bracketDepth = Math.max(0, bracketDepth - 1); addSingle(TokenType.RPAREN); continue; }
                case '[' -> { bracketDepth++; addSingle(TokenType.LBRACKET); continue; }
                case ']' -> { bracketDepth = Math.max(0, bracketDepth - 1); addSingle(TokenType.RBRACKET); continue; }
                case ',' -> { addSingle(TokenType.COMMA); continue; }
                case '.' -> {
                    char next = peek(1);
                    addSingle(Character.isLetter(next) || next == '_' ? TokenType.DOT : TokenType.UNKNOWN);
                    continue;
                }
                default -> { }
            }

            String operator = matchOperator();
            if (operator != null) {
                tokens.add(new Token(TokenType.OPERATOR, operator, position, line, column()));
                position += operator.length();
                continue;
            }

            addSingle(TokenType.UNKNOWN);
        }

        endLogicalLine();
        while (indents.size() > 1) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", position, line, column()));
        }
        tokens.add(Token.eof(position, line, column()));
        return new ArrayList<>(tokens);
    }

    // ========== Layout ==========

    /**
     * Measure indentation at the start of a physical line and emit INDENT/DEDENT.
     */
    private void beginLine() {
        atLineStart = false;
        int width = 0;
        int p = position;
        while (p < source.length() && (source.charAt(p) == ' ' || source.charAt(p) == '\t')) {
            width += source.charAt(p) == '\t' ? TAB_WIDTH : 1;
            p++;
        }
        position = p;

        if (p >= source.length()) {
            return;
        }
        char c = source.charAt(p);
        if (c == '\n' || c == '\r') {
            return; // blank line
        }
        if (c == '/' && (peek(1) == '/' || peek(1) == '*')) {
            return; // comment-only line
        }

        int current = indents.peek();
        if (width > current) {
            boolean continuation = (width - current) % INDENT_UNIT != 0;
            if (continuation && lastIs(TokenType.NEWLINE)) {
                tokens.remove(tokens.size() - 1);
            } else if (!continuation) {
                indents.push(width);
                tokens.add(new Token(TokenType.INDENT, "", position, line, column()));
            }
        } else if (width < current) {
            while (indents.size() > 1 && indents.peek() > width) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", position, line, column()));
            }
        }
    }

    private void endLogicalLine() {
        if (tokens.isEmpty()) {
            return;
        }
        TokenType last = tokens.get(tokens.size() - 1).type();
        if (last != TokenType.NEWLINE && last != TokenType.INDENT && last != TokenType.DEDENT) {
            tokens.add(new Token(TokenType.NEWLINE, "\n", position, line, column()));
        }
    }

    // ========== Readers ==========

    private void readLineComment() {
        int start = position;
        while (position < source.length() && source.charAt(position) != '\n') {
            position++;
        }
        String text = source.substring(start, position);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        tokens.add(new Token(TokenType.COMMENT, text, start, line, start - lineStart + 1));
    }

    private void readBlockComment() {
        int start = position;
        int startLine = line;
        int startColumn = column();
        position += 2;
        while (position < source.length() && !(source.charAt(position) == '*' && peek(1) == '/')) {
            if (source.charAt(position) == '\n') {
                line++;
                lineStart = position + 1;
            }
            position++;
        }
        position = Math.min(source.length(), position + 2);
        tokens.add(new Token(TokenType.COMMENT, source.substring(start, position), start, startLine, startColumn));
    }

    private void readString(char quote) {
        int start = position;
        int startColumn = column();
        position++;
        while (position < source.length()) {
            char c = source.charAt(position);
            if (c == '\\' && position + 1 < source.length() && source.charAt(position + 1) != '\n') {
                position += 2;
                continue;
            }
            if (c == '\n') {
                break; // unterminated, stop at end of line
            }
            position++;
            if (c == quote) {
                break;
            }
        }
        tokens.add(new Token(TokenType.STRING, source.substring(start, position), start, line, startColumn));
    }

    private void readNumber() {
        int start = position;
        int startColumn = column();

        while (position < source.length() && Character.isDigit(source.charAt(position))) {
            position++;
        }
        if (position < source.length() && source.charAt(position) == '.') {
            char next = peek(1);
            if (Character.isDigit(next) || !(Character.isLetter(next) || next == '_')) {
                position++;
                while (position < source.length() && Character.isDigit(source.charAt(position))) {
                    position++;
                }
            }
        }
        if (position < source.length() && (source.charAt(position) == 'e' || source.charAt(position) == 'E')) {
            int p = position + 1;
            if (p < source.length() && (source.charAt(p) == '+' || source.charAt(p) == '-')) {
                p++;
            }
            if (p < source.length() && Character.isDigit(source.charAt(p))) {
                position = p;
                while (position < source.length() && Character.isDigit(source.charAt(position))) {
                    position++;
                }
            }
        }

        tokens.add(new Token(TokenType.NUMBER, source.substring(start, position), start, line, startColumn));
    }

    private void readIdentifier() {
        int start = position;
        int startColumn = column();

        while (position < source.length()) {
            char c = source.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_') {
                position++;
            } else {
                break;
            }
        }

        String value = source.substring(start, position);
        tokens.add(new Token(classify(value), value, start, line, startColumn));
    }

    private TokenType classify(String word) {
        if (BOOLEANS.contains(word)) {
            return TokenType.BOOLEAN;
        }
        boolean memberFollows = peek(0) == '.' && (Character.isLetter(peek(1)) || peek(1) == '_');
        if (memberFollows && NAMESPACES.contains(word)) {
            return TokenType.NAMESPACE;
        }
        if (KEYWORDS.contains(word)) {
            return TokenType.KEYWORD;
        }
        if (BUILTINS.contains(word)) {
            return TokenType.BUILTIN;
        }
        return TokenType.IDENTIFIER;
    }

    private void readColor() {
        int start = position;
        int startColumn = column();
        position++;
        while (position < source.length() && isHexDigit(source.charAt(position))) {
            position++;
        }
        tokens.add(new Token(TokenType.LITERAL, source.substring(start, position), start, line, startColumn));
    }

    private String matchOperator() {
        for (String op : OPERATORS) {
            if (source.startsWith(op, position)) {
                return op;
            }
        }
        return null;
    }

    // ========== Helpers ==========

    private void addSingle(TokenType type) {
        tokens.add(new Token(type, String.valueOf(source.charAt(position)), position, line, column()));
        position++;
    }

    private boolean lastIs(TokenType type) {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == type;
    }

    private char peek(int offset) {
        int pos = position + offset;
        if (pos < 0 || pos >= source.length()) {
            return '\0';
        }
        return source.charAt(pos);
    }

    private int column() {
        return position - lineStart + 1;
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }

    /**
     * Convenience function to tokenize a string
     */
    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }
}
