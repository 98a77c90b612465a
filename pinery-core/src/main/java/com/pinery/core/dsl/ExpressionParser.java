package com.pinery.core.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for Pine Script expressions.
 *
 * Grammar (lowest to highest precedence):
 * expression     = ternary
 * ternary        = logical_or ( "?" ternary ":" ternary )?
 * logical_or     = logical_and ( "or" logical_and )*
 * logical_and    = comparison ( "and" comparison )*
 * comparison     = additive ( ("==" | "!=" | "<=" | ">=" | "<" | ">") additive )*
 * additive       = multiplicative ( ("+" | "-") multiplicative )*
 * multiplicative = unary ( ("*" | "/" | "%") unary )*
 * unary          = ("not" | "-" | "+") unary | postfix
 * postfix        = primary ( "(" arguments ")" | "[" expression "]" | "." name )*
 * primary        = NUMBER | STRING | BOOLEAN | COLOR | name | "(" expression ")"
 *
 * Binary levels are left-associative, the ternary is right-associative.
 * A dotted name followed by "(" becomes a single call carrying the full name ("ta.ema").
 *
 * Every parse runs on its own token cursor, so one instance can be shared between threads.
 */
public class ExpressionParser {

    private static final Set<String> COMPARISON_OPS = Set.of("==", "!=", "<=", ">=", "<", ">");
    private static final Set<String> CALLABLE_KEYWORDS = Set.of(
        "int", "float", "bool", "string", "color", "line", "label", "box", "table", "array", "matrix", "map"
    );
    private static final Set<TokenType> SKIPPED = Set.of(
        TokenType.COMMENT, TokenType.NEWLINE, TokenType.INDENT, TokenType.DEDENT
    );

    private final List<Token> tokens;
    private int position = 0;

    public ExpressionParser() {
        this.tokens = List.of();
    }

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parse expression text into an AST.
     *
     * @throws ParseException if a primary is missing or tokens remain after the expression
     */
    public ExprNode parse(String text) {
        return parse(Lexer.tokenize(text));
    }

    /**
     * Parse an already tokenized expression. Layout and comment tokens are ignored.
     */
    public ExprNode parse(List<Token> input) {
        List<Token> filtered = new ArrayList<>();
        for (Token token : input) {
            if (!SKIPPED.contains(token.type())) {
                filtered.add(token);
            }
        }
        if (filtered.isEmpty() || filtered.get(filtered.size() - 1).type() != TokenType.EOF) {
            int end = filtered.isEmpty() ? 0 : filtered.get(filtered.size() - 1).end();
            filtered.add(Token.eof(end, 1, end + 1));
        }
        return new ExpressionParser(filtered).parseAll();
    }

    private ExprNode parseAll() {
        if (check(TokenType.EOF)) {
            throw new ParseException("Empty expression", current().position());
        }

        ExprNode ast = expression();

        // Ensure we consumed all tokens
        if (!check(TokenType.EOF)) {
            throw new ParseException("Unexpected token '" + current().value() +
                "' at position " + current().position(), current().position());
        }
        return ast;
    }

    /**
     * Parse without throwing.
     */
    public ParseResult tryParse(String text) {
        try {
            return ParseResult.success(parse(text));
        } catch (ParseException e) {
            return ParseResult.failure(e.getMessage(), e.getPosition());
        }
    }

    // ========== Parser Methods ==========

    private ExprNode expression() {
        return ternary();
    }

    private ExprNode ternary() {
        ExprNode condition = logicalOr();

        if (checkOperator("?")) {
            advance();
            ExprNode whenTrue = ternary();
            expectOperator(":", "Expected ':' in conditional expression");
            ExprNode whenFalse = ternary();
            return new ExprNode.Ternary(condition, whenTrue, whenFalse);
        }

        return condition;
    }

    private ExprNode logicalOr() {
        ExprNode left = logicalAnd();

        while (check(TokenType.KEYWORD, "or")) {
            advance();
            ExprNode right = logicalAnd();
            left = new ExprNode.Binary("or", left, right);
        }

        return left;
    }

    private ExprNode logicalAnd() {
        ExprNode left = comparison();

        while (check(TokenType.KEYWORD, "and")) {
            advance();
            ExprNode right = comparison();
            left = new ExprNode.Binary("and", left, right);
        }

        return left;
    }

    private ExprNode comparison() {
        ExprNode left = additive();

        while (check(TokenType.OPERATOR) && COMPARISON_OPS.contains(current().value())) {
            String operator = advance().value();
            ExprNode right = additive();
            left = new ExprNode.Binary(operator, left, right);
        }

        return left;
    }

    private ExprNode additive() {
        ExprNode left = multiplicative();

        while (checkOperator("+") || checkOperator("-")) {
            String operator = advance().value();
            ExprNode right = multiplicative();
            left = new ExprNode.Binary(operator, left, right);
        }

        return left;
    }

    private ExprNode multiplicative() {
        ExprNode left = unary();

        while (checkOperator("*") || checkOperator("/") || checkOperator("%")) {
            String operator = advance().value();
            ExprNode right = unary();
            left = new ExprNode.Binary(operator, left, right);
        }

        return left;
    }

    private ExprNode unary() {
        if (check(TokenType.KEYWORD, "not")) {
            advance();
            return new ExprNode.Unary("not", unary());
        }
        if (checkOperator("-") || checkOperator("+")) {
            String operator = advance().value();
            return new ExprNode.Unary(operator, unary());
        }
        return postfix();
    }

    private ExprNode postfix() {
        ExprNode expr = primary();

        while (true) {
            if (check(TokenType.LPAREN)) {
                Token open = advance();
                List<ExprNode.Argument> arguments = arguments();
                expr = call(expr, arguments, open);
            } else if (check(TokenType.LBRACKET)) {
                advance();
                ExprNode offset = expression();
                expect(TokenType.RBRACKET, "Expected ']' after history offset");
                expr = new ExprNode.ArrayAccess(expr, offset);
            } else if (check(TokenType.DOT)) {
                advance();
                Token member = current();
                if (!isName(member)) {
                    throw new ParseException("Expected member name after '.' at position " +
                        member.position(), member.position());
                }
                advance();
                expr = new ExprNode.MemberAccess(expr, member.value());
            } else {
                return expr;
            }
        }
    }

    private ExprNode call(ExprNode callee, List<ExprNode.Argument> arguments, Token open) {
        String dotted = dottedName(callee);
        if (dotted != null) {
            return new ExprNode.Call(dotted, arguments);
        }
        if (callee instanceof ExprNode.MemberAccess member) {
            return new ExprNode.Call(member.target(), member.member(), arguments);
        }
        throw new ParseException("Expression is not callable at position " + open.position(), open.position());
    }

    private List<ExprNode.Argument> arguments() {
        List<ExprNode.Argument> arguments = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            if (check(TokenType.EOF)) {
                throw new ParseException("Expected ')' after arguments", current().position());
            }
            if (isName(current()) && peekIs(1, TokenType.OPERATOR, "=")) {
                String name = advance().value();
                advance();
                arguments.add(new ExprNode.Argument(name, expression()));
            } else {
                arguments.add(ExprNode.Argument.positional(expression()));
            }
            if (check(TokenType.COMMA)) {
                advance();
            } else if (!check(TokenType.RPAREN)) {
                throw new ParseException("Expected ',' or ')' in argument list but found '" +
                    current().value() + "'", current().position());
            }
        }
        advance();
        return arguments;
    }

    private ExprNode primary() {
        Token token = current();

        switch (token.type()) {
            case LPAREN -> {
                advance();
                ExprNode expr = expression();
                expect(TokenType.RPAREN, "Expected ')' after expression");
                return expr;
            }
            case NUMBER -> {
                advance();
                return new ExprNode.Literal(token.value(), ExprNode.LiteralKind.NUMBER);
            }
            case STRING -> {
                advance();
                return new ExprNode.Literal(token.value(), ExprNode.LiteralKind.STRING);
            }
            case LITERAL -> {
                advance();
                return new ExprNode.Literal(token.value(), ExprNode.LiteralKind.COLOR);
            }
            case BOOLEAN -> {
                advance();
                if ("na".equals(token.value())) {
                    // na(x) is the na-test function, bare na is the literal
                    return check(TokenType.LPAREN)
                        ? new ExprNode.Identifier("na")
                        : new ExprNode.Literal("na", ExprNode.LiteralKind.NA);
                }
                return new ExprNode.Literal(token.value(), ExprNode.LiteralKind.BOOLEAN);
            }
            case IDENTIFIER, BUILTIN, NAMESPACE -> {
                advance();
                return new ExprNode.Identifier(token.value());
            }
            case KEYWORD -> {
                if (CALLABLE_KEYWORDS.contains(token.value()) && peekIs(1, TokenType.LPAREN, "(")) {
                    advance();
                    return new ExprNode.Identifier(token.value());
                }
                throw new ParseException("Unexpected keyword '" + token.value() + "' at position " +
                    token.position(), token.position());
            }
            case EOF -> throw new ParseException("Unexpected end of expression", token.position());
            default -> throw new ParseException("Expected expression but found '" + token.value() +
                "' at position " + token.position(), token.position());
        }
    }

    // ========== Helpers ==========

    /**
     * "ta.ema" for MemberAccess(Identifier(ta), ema); null when the chain is not made of plain names.
     */
    private static String dottedName(ExprNode node) {
        if (node instanceof ExprNode.Identifier id) {
            return id.name();
        }
        if (node instanceof ExprNode.MemberAccess member) {
            String prefix = dottedName(member.target());
            return prefix != null ? prefix + "." + member.member() : null;
        }
        return null;
    }

    private static boolean isName(Token token) {
        return switch (token.type()) {
            case IDENTIFIER, KEYWORD, BUILTIN, NAMESPACE, BOOLEAN -> true;
            default -> false;
        };
    }

    private Token current() {
        return tokens.get(Math.min(position, tokens.size() - 1));
    }

    private boolean check(TokenType type) {
        return current().type() == type;
    }

    private boolean check(TokenType type, String value) {
        return current().is(type, value);
    }

    private boolean checkOperator(String op) {
        return check(TokenType.OPERATOR, op);
    }

    private boolean peekIs(int offset, TokenType type, String value) {
        int index = position + offset;
        return index < tokens.size() && tokens.get(index).is(type, value);
    }

    private Token advance() {
        Token token = current();
        if (position < tokens.size() - 1) {
            position++;
        }
        return token;
    }

    private void expect(TokenType type, String message) {
        if (!check(type)) {
            throw new ParseException(message + " at position " + current().position(), current().position());
        }
        advance();
    }

    private void expectOperator(String op, String message) {
        if (!checkOperator(op)) {
            throw new ParseException(message + " at position " + current().position(), current().position());
        }
        advance();
    }

    /**
     * Convenience function to parse a string
     */
    public static ExprNode parseExpression(String text) {
        return new ExpressionParser().parse(text);
    }
}
