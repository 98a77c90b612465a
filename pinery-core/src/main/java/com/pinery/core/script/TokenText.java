package com.pinery.core.script;

import com.pinery.core.dsl.Token;
import com.pinery.core.dsl.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds normalized source text from a token slice and splits slices at top-level commas.
 */
final class TokenText {

    private static final Set<String> TYPE_KEYWORDS = Set.of(
        "int", "float", "bool", "string", "color", "line", "label", "box", "table", "array", "matrix", "map"
    );

    private TokenText() {
    }

    /**
     * Join tokens with canonical spacing: "ta.ema(close, 14)", "close[1] > open[1]", "a * -1".
     */
    static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token beforePrev = null;
        Token prev = null;
        for (Token token : tokens) {
            if (isLayout(token)) {
                continue;
            }
            if (prev != null && needsSpace(beforePrev, prev, token)) {
                sb.append(' ');
            }
            sb.append(token.value());
            beforePrev = prev;
            prev = token;
        }
        return sb.toString();
    }

    /**
     * Join without any spacing, for declared types such as "array<float>".
     */
    static String compact(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            if (!isLayout(token)) {
                if (sb.length() > 0 && isWord(token) && isWord(lastWordToken(tokens, token))) {
                    sb.append(' ');
                }
                sb.append(token.value());
            }
        }
        return sb.toString();
    }

    /**
     * Split a slice at commas that are not nested in brackets.
     */
    static List<List<Token>> splitTopLevel(List<Token> tokens) {
        List<List<Token>> parts = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (Token token : tokens) {
            switch (token.type()) {
                case LPAREN, LBRACKET -> depth++;
                case RPAREN, RBRACKET -> depth = Math.max(0, depth - 1);
                default -> { }
            }
            if (token.type() == TokenType.COMMA && depth == 0) {
                parts.add(current);
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        if (!current.isEmpty() || !parts.isEmpty()) {
            parts.add(current);
        }
        return parts;
    }

    /**
     * Index of the bracket closing the one at {@code openIndex}, or -1.
     */
    static int matchingClose(List<Token> tokens, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            TokenType type = tokens.get(i).type();
            if (type == TokenType.LPAREN || type == TokenType.LBRACKET) {
                depth++;
            } else if (type == TokenType.RPAREN || type == TokenType.RBRACKET) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    static boolean isStringLiteral(String text) {
        return text != null && text.length() >= 2
            && (text.charAt(0) == '"' || text.charAt(0) == '\'')
            && text.charAt(text.length() - 1) == text.charAt(0);
    }

    static String unquote(String text) {
        if (isStringLiteral(text)) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    static boolean isName(Token token) {
        return switch (token.type()) {
            case IDENTIFIER, BUILTIN, NAMESPACE, KEYWORD, BOOLEAN -> true;
            default -> false;
        };
    }

    private static boolean needsSpace(Token beforePrev, Token prev, Token token) {
        switch (token.type()) {
            case RPAREN, RBRACKET, COMMA, DOT -> {
                return false;
            }
            default -> { }
        }
        switch (prev.type()) {
            case LPAREN, LBRACKET, DOT -> {
                return false;
            }
            default -> { }
        }
        if (token.type() == TokenType.LPAREN) {
            return !(isCallee(prev) || prev.type() == TokenType.RPAREN);
        }
        if (token.type() == TokenType.LBRACKET) {
            return !(isCallee(prev) || prev.type() == TokenType.RPAREN || prev.type() == TokenType.RBRACKET);
        }
        if (prev.type() == TokenType.OPERATOR && isUnary(beforePrev, prev)) {
            return false;
        }
        return true;
    }

    private static boolean isCallee(Token token) {
        return switch (token.type()) {
            case IDENTIFIER, NAMESPACE, BUILTIN, BOOLEAN -> true;
            case KEYWORD -> TYPE_KEYWORDS.contains(token.value());
            default -> false;
        };
    }

    private static boolean isUnary(Token beforeOperator, Token operator) {
        if (!operator.value().equals("-") && !operator.value().equals("+")) {
            return false;
        }
        if (beforeOperator == null) {
            return true;
        }
        return switch (beforeOperator.type()) {
            case OPERATOR, LPAREN, LBRACKET, COMMA -> true;
            case KEYWORD -> !TYPE_KEYWORDS.contains(beforeOperator.value());
            default -> false;
        };
    }

    private static boolean isLayout(Token token) {
        return switch (token.type()) {
            case COMMENT, NEWLINE, INDENT, DEDENT, EOF -> true;
            default -> false;
        };
    }

    private static boolean isWord(Token token) {
        return token != null && isName(token);
    }

    private static Token lastWordToken(List<Token> tokens, Token before) {
        Token last = null;
        for (Token token : tokens) {
            if (token == before) {
                return last;
            }
            if (!isLayout(token)) {
                last = token;
            }
        }
        return last;
    }
}
