package com.pinery.converter.python;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Python 3 tokenizer: names, numbers, strings (all prefixes, triple quotes), operators,
 * and NEWLINE/INDENT/DEDENT layout. Lines inside brackets or after a backslash are joined.
 */
final class PythonTokenizer {

    enum Kind { NAME, NUMBER, STRING, OP, NEWLINE, INDENT, DEDENT, END }

    record Tok(Kind kind, String text, int line) {

        boolean is(String value) {
            return (kind == Kind.OP || kind == Kind.NAME) && text.equals(value);
        }
    }

    private static final Set<String> OPERATORS_3 = Set.of("**=", "//=", ">>=", "<<=", "...");
    private static final Set<String> OPERATORS_2 = Set.of(
        "**", "//", ">>", "<<", "<=", ">=", "==", "!=", "->", "+=", "-=", "*=", "/=", "%=", "&=", "|=",
        "^=", "@=", ":="
    );
    private static final String OPERATORS_1 = "()[]{},:;.@=+-*/%&|^~<>";
    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String source;
    private final List<Tok> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Tok> brackets = new ArrayDeque<>();
    private int pos = 0;
    private int line = 1;

    private PythonTokenizer(String source) {
        this.source = source.replace("\r\n", "\n").replace('\r', '\n');
        indents.push(0);
    }

    static List<Tok> tokenize(String source) {
        return new PythonTokenizer(source).run();
    }

    private List<Tok> run() {
        boolean lineStart = true;
        while (true) {
            if (lineStart) {
                lineStart = false;
                if (!indentation()) {
                    break;
                }
            }
            if (pos >= source.length()) {
                break;
            }
            char c = source.charAt(pos);

            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                continuation();
            } else if (c == '\n') {
                pos++;
                if (brackets.isEmpty()) {
                    add(Kind.NEWLINE, "\n");
                    lineStart = true;
                }
                line++;
            } else if (Character.isLetter(c) || c == '_') {
                name();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                number();
            } else if (c == '"' || c == '\'') {
                string(pos, pos);
            } else {
                operator(c);
            }
        }
        return finish();
    }

    // ===== Layout =====

    /**
     * Measure the indentation of the next non-blank line and emit INDENT/DEDENT.
     * Returns false at end of input.
     */
    private boolean indentation() {
        while (true) {
            int column = 0;
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == ' ') {
                    column++;
                } else if (c == '\t') {
                    column = (column / 8 + 1) * 8;
                } else if (c == '\f') {
                    column = 0;
                } else {
                    break;
                }
                pos++;
            }
            if (pos >= source.length()) {
                return false;
            }
            char c = source.charAt(pos);
            if (c == '#') {
                skipComment();
                continue;
            }
            if (c == '\n') {
                pos++;
                line++;
                continue;
            }
            if (c == '\\') {
                return true;
            }
            int current = indents.peek();
            if (column > current) {
                indents.push(column);
                add(Kind.INDENT, "");
            } else if (column < current) {
                while (column < indents.peek()) {
                    indents.pop();
                    add(Kind.DEDENT, "");
                }
                if (column != indents.peek()) {
                    throw new PythonSyntaxException("unindent does not match any outer indentation level", line);
                }
            }
            return true;
        }
    }

    private void skipComment() {
        while (pos < source.length() && source.charAt(pos) != '\n') {
            pos++;
        }
    }

    private void continuation() {
        if (pos + 1 >= source.length()) {
            throw new PythonSyntaxException("unexpected EOF while parsing", line);
        }
        if (source.charAt(pos + 1) != '\n') {
            throw new PythonSyntaxException("unexpected character after line continuation character", line);
        }
        pos += 2;
        line++;
    }

    private List<Tok> finish() {
        if (!brackets.isEmpty()) {
            Tok open = brackets.peek();
            throw new PythonSyntaxException("'" + open.text() + "' was never closed", open.line());
        }
        if (!tokens.isEmpty()) {
            Kind last = tokens.get(tokens.size() - 1).kind();
            if (last != Kind.NEWLINE && last != Kind.DEDENT && last != Kind.INDENT) {
                add(Kind.NEWLINE, "");
            }
        }
        while (indents.size() > 1) {
            indents.pop();
            add(Kind.DEDENT, "");
        }
        add(Kind.END, "");
        return tokens;
    }

    // ===== Tokens =====

    private void name() {
        int start = pos;
        while (pos < source.length() && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
        String word = source.substring(start, pos);
        if (pos < source.length() && (source.charAt(pos) == '"' || source.charAt(pos) == '\'')
            && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
            string(start, pos);
            return;
        }
        add(Kind.NAME, word);
    }

    private void number() {
        int start = pos;
        if (source.charAt(pos) == '0' && pos + 1 < source.length() && "xXoObB".indexOf(source.charAt(pos + 1)) >= 0) {
            char base = Character.toLowerCase(source.charAt(pos + 1));
            pos += 2;
            int digits = pos;
            while (pos < source.length() && isDigitOf(base, source.charAt(pos))) {
                pos++;
            }
            if (pos == digits) {
                throw new PythonSyntaxException("invalid " + baseName(base) + " literal", line);
            }
            add(Kind.NUMBER, source.substring(start, pos));
            return;
        }

        boolean decimal = false;
        digits();
        if (pos < source.length() && source.charAt(pos) == '.') {
            decimal = true;
            pos++;
            digits();
        }
        if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                decimal = true;
                digits();
            } else {
                pos = mark;
            }
        }
        if (pos < source.length() && (source.charAt(pos) == 'j' || source.charAt(pos) == 'J')) {
            decimal = true;
            pos++;
        }
        String text = source.substring(start, pos);
        if (!decimal && text.length() > 1 && text.charAt(0) == '0' && !text.replace("_", "").matches("0+")) {
            throw new PythonSyntaxException("leading zeros in decimal integer literals are not permitted", line);
        }
        add(Kind.NUMBER, text);
    }

    private void digits() {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    private static boolean isDigitOf(char base, char c) {
        return switch (base) {
            case 'x' -> Character.digit(c, 16) >= 0 || c == '_';
            case 'o' -> (c >= '0' && c <= '7') || c == '_';
            default -> c == '0' || c == '1' || c == '_';
        };
    }

    private static String baseName(char base) {
        return switch (base) {
            case 'x' -> "hexadecimal";
            case 'o' -> "octal";
            default -> "binary";
        };
    }

    /**
     * String literal whose prefix starts at {@code start} and whose opening quote is at {@code quoteAt}.
     */
    private void string(int start, int quoteAt) {
        int startLine = line;
        char quote = source.charAt(quoteAt);
        boolean triple = source.startsWith(String.valueOf(quote).repeat(3), quoteAt);
        pos = quoteAt + (triple ? 3 : 1);

        while (true) {
            if (pos >= source.length()) {
                throw new PythonSyntaxException(triple ? "unterminated triple-quoted string literal"
                    : "unterminated string literal", startLine);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
                    line++;
                }
                pos += 2;
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    throw new PythonSyntaxException("unterminated string literal", startLine);
                }
                line++;
                pos++;
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (source.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
            }
            pos++;
        }
        tokens.add(new Tok(Kind.STRING, source.substring(start, pos), startLine));
    }

    private void operator(char c) {
        String op = null;
        if (pos + 3 <= source.length() && OPERATORS_3.contains(source.substring(pos, pos + 3))) {
            op = source.substring(pos, pos + 3);
        } else if (pos + 2 <= source.length() && OPERATORS_2.contains(source.substring(pos, pos + 2))) {
            op = source.substring(pos, pos + 2);
        } else if (OPERATORS_1.indexOf(c) >= 0) {
            op = String.valueOf(c);
        }
        if (op == null) {
            throw new PythonSyntaxException("invalid character '" + c + "'", line);
        }
        pos += op.length();
        Tok tok = new Tok(Kind.OP, op, line);

        switch (op) {
            case "(", "[", "{" -> brackets.push(tok);
            case ")", "]", "}" -> {
                if (brackets.isEmpty()) {
                    throw new PythonSyntaxException("unmatched '" + op + "'", line);
                }
                String open = brackets.pop().text();
                if (!closes(open, op)) {
                    throw new PythonSyntaxException("closing parenthesis '" + op +
                        "' does not match opening parenthesis '" + open + "'", line);
                }
            }
            default -> {
            }
        }
        tokens.add(tok);
    }

    private static boolean closes(String open, String close) {
        return (open.equals("(") && close.equals(")"))
            || (open.equals("[") && close.equals("]"))
            || (open.equals("{") && close.equals("}"));
    }

    private void add(Kind kind, String text) {
        tokens.add(new Tok(kind, text, line));
    }
}
