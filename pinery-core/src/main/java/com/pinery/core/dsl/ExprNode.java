package com.pinery.core.dsl;

import java.util.List;

/**
 * Expression AST produced by {@link ExpressionParser}.
 * Each variant carries only the fields it needs.
 */
public sealed interface ExprNode {

    /**
     * Kinds of literal values.
     */
    enum LiteralKind { NUMBER, STRING, BOOLEAN, NA, COLOR }

    /**
     * Literal: 14, 1.5, "text", true, na, #ff0000
     */
    record Literal(String value, LiteralKind kind) implements ExprNode {}

    /**
     * Identifier: close, length, myVar
     */
    record Identifier(String name) implements ExprNode {}

    /**
     * Binary operation: left + right, left and right, left >= right
     */
    record Binary(String operator, ExprNode left, ExprNode right) implements ExprNode {}

    /**
     * Unary operation: not x, -x, +x
     */
    record Unary(String operator, ExprNode operand) implements ExprNode {}

    /**
     * Function call. A call on a dotted name keeps the whole name ("ta.ema") and has no receiver;
     * a call on any other expression keeps that expression as the receiver.
     */
    record Call(ExprNode receiver, String name, List<Argument> arguments) implements ExprNode {
        public Call {
            arguments = List.copyOf(arguments);
        }

        public Call(String name, List<Argument> arguments) {
            this(null, name, arguments);
        }

        /**
         * Namespace prefix of the callee ("ta" for "ta.ema"), or empty.
         */
        public String namespace() {
            int dot = name.indexOf('.');
            return receiver == null && dot > 0 ? name.substring(0, dot) : "";
        }
    }

    /**
     * Call argument, optionally named: minval=1
     */
    record Argument(String name, ExprNode value) {
        public static Argument positional(ExprNode value) {
            return new Argument(null, value);
        }

        public boolean isNamed() {
            return name != null;
        }
    }

    /**
     * Ternary: condition ? whenTrue : whenFalse
     */
    record Ternary(ExprNode condition, ExprNode whenTrue, ExprNode whenFalse) implements ExprNode {}

    /**
     * History access: close[1] is the value one bar ago, offset 0 is the current bar.
     */
    record ArrayAccess(ExprNode target, ExprNode offset) implements ExprNode {}

    /**
     * Member access: barstate.isfirst, strategy.long
     */
    record MemberAccess(ExprNode target, String member) implements ExprNode {}
}
