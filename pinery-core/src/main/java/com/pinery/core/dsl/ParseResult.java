package com.pinery.core.dsl;

/**
 * Result of a non-throwing parse.
 */
public record ParseResult(boolean success, ExprNode ast, String error, Integer errorPosition) {

    public static ParseResult success(ExprNode ast) {
        return new ParseResult(true, ast, null, null);
    }

    public static ParseResult failure(String error, int position) {
        return new ParseResult(false, null, error, position);
    }
}
