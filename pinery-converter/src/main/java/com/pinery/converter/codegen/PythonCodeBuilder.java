package com.pinery.converter.codegen;

import com.pinery.converter.context.PineFunctions;
import com.pinery.converter.context.TransformationContext;
import com.pinery.core.dsl.ExprNode;
import com.pinery.core.dsl.ExpressionParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds Python expression text from Pine expression ASTs.
 *
 * Output is parenthesized by Python precedence, so the meaning never depends on how
 * operands happen to be spelled. Indicator calls become a single registry dispatch:
 * {@code self.indicators.calculate("ta.sma", self.close, 20)}. History access
 * {@code x[N]} becomes {@code x.shift(N)}: index 0 is the current bar, N bars back is N.
 *
 * Operands may be pandas Series, so logic is element-wise: {@code and}/{@code or} become
 * {@code &}/{@code |} with every comparison operand parenthesized, {@code not x} becomes
 * {@code np.logical_not(x)} and {@code c ? a : b} becomes {@code self._where(c, a, b)}.
 * Inputs and persistent variables are scalars, so history access on them yields the value itself.
 *
 * Stateless apart from what it records in the {@link TransformationContext}.
 */
public class PythonCodeBuilder {

    // Python binding power, loosest first
    static final int COMPARISON = 1;
    static final int BIT_OR = 2;
    static final int BIT_AND = 3;
    static final int ADDITIVE = 4;
    static final int MULTIPLICATIVE = 5;
    static final int UNARY = 6;
    static final int PRIMARY = 7;

    private static final Map<String, String> OPERATORS = Map.ofEntries(
        Map.entry(":=", "="),
        Map.entry("=", "="),
        Map.entry("==", "=="),
        Map.entry("!=", "!="),
        Map.entry("<", "<"),
        Map.entry(">", ">"),
        Map.entry("<=", "<="),
        Map.entry(">=", ">="),
        Map.entry("+", "+"),
        Map.entry("-", "-"),
        Map.entry("*", "*"),
        Map.entry("/", "/"),
        Map.entry("%", "%"),
        Map.entry("and", "&"),
        Map.entry("or", "|")
    );

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
        Map.entry("or", BIT_OR),
        Map.entry("and", BIT_AND),
        Map.entry("==", COMPARISON),
        Map.entry("!=", COMPARISON),
        Map.entry("<", COMPARISON),
        Map.entry(">", COMPARISON),
        Map.entry("<=", COMPARISON),
        Map.entry(">=", COMPARISON),
        Map.entry("+", ADDITIVE),
        Map.entry("-", ADDITIVE),
        Map.entry("*", MULTIPLICATIVE),
        Map.entry("/", MULTIPLICATIVE),
        Map.entry("%", MULTIPLICATIVE)
    );

    // Pine functions whose numpy counterparts take exactly two operands
    private static final Set<String> PAIRWISE = Set.of("math.max", "math.min");

    // Namespaces whose members stay as written when accessed without a call
    private static final Set<String> PINE_NAMESPACES = Set.of(
        "ta", "math", "strategy", "barstate", "syminfo", "color", "timeframe", "session", "request",
        "ticker", "str", "input", "chart", "runtime", "array", "matrix", "map", "line", "label", "box",
        "table", "polyline"
    );

    // Text that binds as a single Python atom: dotted names, optionally ending in a call
    private static final Pattern ATOM = Pattern.compile(
        "[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*(\\([^()]*\\))?|\"[^\"]*\"|[0-9.]+");

    private static final String DISPATCH = "self.indicators.calculate";

    private final ExpressionParser parser = new ExpressionParser();

    /**
     * Python operator for a Pine operator; unknown operators pass through.
     */
    public static String pythonOperator(String pineOperator) {
        return OPERATORS.getOrDefault(pineOperator, pineOperator);
    }

    /**
     * Parse Pine expression text and build it.
     *
     * @throws com.pinery.core.dsl.ParseException if the text is not a valid expression
     */
    public String build(String pineExpression, TransformationContext context) {
        return build(parser.parse(pineExpression), context);
    }

    public String build(ExprNode node, TransformationContext context) {
        return fragment(node, context).code();
    }

    // ===== Node dispatch =====

    private Fragment fragment(ExprNode node, TransformationContext context) {
        if (node instanceof ExprNode.Literal literal) {
            return literal(literal, context);
        }
        if (node instanceof ExprNode.Identifier identifier) {
            return resolved(context.resolveName(identifier.name()));
        }
        if (node instanceof ExprNode.Binary binary) {
            return binary(binary, context);
        }
        if (node instanceof ExprNode.Unary unary) {
            return unary(unary, context);
        }
        if (node instanceof ExprNode.Call call) {
            return call(call, context);
        }
        if (node instanceof ExprNode.Ternary ternary) {
            return ternary(ternary, context);
        }
        if (node instanceof ExprNode.ArrayAccess access) {
            return history(access, context);
        }
        if (node instanceof ExprNode.MemberAccess member) {
            return member(member, context);
        }
        throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
    }

    private Fragment literal(ExprNode.Literal literal, TransformationContext context) {
        String value = literal.value();
        return switch (literal.kind()) {
            case NUMBER -> new Fragment(value, PRIMARY);
            case STRING -> new Fragment(isQuoted(value) ? value : PythonLiterals.string(value), PRIMARY);
            case COLOR -> new Fragment(PythonLiterals.string(value), PRIMARY);
            case BOOLEAN, NA -> resolved(context.resolveName(value));
        };
    }

    private Fragment binary(ExprNode.Binary binary, TransformationContext context) {
        String operator = binary.operator();
        Integer precedence = BINARY_PRECEDENCE.get(operator);
        if (precedence == null) {
            throw new IllegalArgumentException("Unsupported operator: " + operator);
        }
        Fragment left = fragment(binary.left(), context);
        Fragment right = fragment(binary.right(), context);

        int leftMin;
        int rightMin;
        if (precedence == BIT_AND || precedence == BIT_OR) {
            // Only a chain of the same operator stays unwrapped: a & b & c
            leftMin = left.precedence() == precedence ? precedence : UNARY;
            rightMin = UNARY;
        } else {
            // Python chains comparisons (a < b < c), Pine does not: keep both sides atomic
            leftMin = precedence == COMPARISON ? precedence + 1 : precedence;
            rightMin = precedence + 1;
        }
        String code = left.wrapBelow(leftMin) + " " + pythonOperator(operator) + " " + right.wrapBelow(rightMin);
        return new Fragment(code, precedence);
    }

    private Fragment unary(ExprNode.Unary unary, TransformationContext context) {
        Fragment operand = fragment(unary.operand(), context);
        if ("not".equals(unary.operator())) {
            return new Fragment("np.logical_not(" + operand.code() + ")", PRIMARY);
        }
        return new Fragment(pythonOperator(unary.operator()) + operand.wrapBelow(UNARY), UNARY);
    }

    private Fragment ternary(ExprNode.Ternary ternary, TransformationContext context) {
        Fragment condition = fragment(ternary.condition(), context);
        Fragment whenTrue = fragment(ternary.whenTrue(), context);
        Fragment whenFalse = fragment(ternary.whenFalse(), context);
        String code = "self._where(" + condition.code() + ", " + whenTrue.code() + ", " + whenFalse.code() + ")";
        return new Fragment(code, PRIMARY);
    }

    private Fragment history(ExprNode.ArrayAccess access, TransformationContext context) {
        Fragment target = fragment(access.target(), context);
        if (access.offset() instanceof ExprNode.Literal literal && isZero(literal)) {
            return target;
        }
        if (access.target() instanceof ExprNode.Identifier identifier && !context.isBuiltin(identifier.name())) {
            String name = identifier.name();
            if (context.isConstant(name)) {
                return target;
            }
            if (context.isState(name)) {
                context.addWarning("History of persistent variable '" + name + "' is not kept: '" + name
                    + "[...]' reads its current value");
                return target;
            }
        }
        String offset = fragment(access.offset(), context).code();
        return new Fragment(target.wrapBelow(PRIMARY) + ".shift(" + offset + ")", PRIMARY);
    }

    private Fragment member(ExprNode.MemberAccess member, TransformationContext context) {
        String dotted = dottedName(member);
        if (dotted != null && context.isBuiltin(dotted)) {
            return resolved(context.mapBuiltin(dotted));
        }
        if (dotted != null && member.target() instanceof ExprNode.Identifier root
            && PINE_NAMESPACES.contains(root.name()) && !context.hasVariable(root.name())) {
            return new Fragment(dotted, PRIMARY);
        }
        Fragment target = fragment(member.target(), context);
        return new Fragment(target.wrapBelow(PRIMARY) + "." + member.member(), PRIMARY);
    }

    // ===== Calls =====

    private Fragment call(ExprNode.Call call, TransformationContext context) {
        String arguments = arguments(call.arguments(), context);

        if (call.receiver() != null) {
            Fragment receiver = fragment(call.receiver(), context);
            return new Fragment(receiver.wrapBelow(PRIMARY) + "." + call.name() + "(" + arguments + ")", PRIMARY);
        }

        String name = call.name();
        if ("ta".equals(call.namespace())) {
            context.addIndicator(name);
            String dispatch = DISPATCH + "(" + PythonLiterals.string(name) + (arguments.isEmpty() ? "" : ", " + arguments) + ")";
            return new Fragment(dispatch, PRIMARY);
        }

        if (PAIRWISE.contains(name) && call.arguments().size() > 1) {
            return new Fragment(fold(PineFunctions.map(name), call.arguments(), context), PRIMARY);
        }
        if ("math.avg".equals(name) && call.arguments().size() > 1) {
            return average(call.arguments(), context);
        }

        String mapped = PineFunctions.map(name);
        return new Fragment((mapped != null ? mapped : name) + "(" + arguments + ")", PRIMARY);
    }

    /**
     * {@code np.maximum(np.maximum(a, b), c)} for {@code math.max(a, b, c)}.
     */
    private String fold(String function, List<ExprNode.Argument> arguments, TransformationContext context) {
        String result = fragment(arguments.get(0).value(), context).code();
        for (int i = 1; i < arguments.size(); i++) {
            result = function + "(" + result + ", " + fragment(arguments.get(i).value(), context).code() + ")";
        }
        return result;
    }

    private Fragment average(List<ExprNode.Argument> arguments, TransformationContext context) {
        List<String> terms = new ArrayList<>(arguments.size());
        for (ExprNode.Argument argument : arguments) {
            terms.add(fragment(argument.value(), context).wrapBelow(ADDITIVE));
        }
        return new Fragment("(" + String.join(" + ", terms) + ") / " + terms.size(), MULTIPLICATIVE);
    }

    private String arguments(List<ExprNode.Argument> arguments, TransformationContext context) {
        List<String> parts = new ArrayList<>(arguments.size());
        for (ExprNode.Argument argument : arguments) {
            String value = fragment(argument.value(), context).code();
            parts.add(argument.isNamed() ? argument.name() + "=" + value : value);
        }
        return String.join(", ", parts);
    }

    // ===== Helpers =====

    /**
     * Resolved text from the context: atoms bind tightest, anything else is treated as loosest.
     */
    private static Fragment resolved(String code) {
        return new Fragment(code, ATOM.matcher(code).matches() ? PRIMARY : 0);
    }

    private static boolean isQuoted(String value) {
        return value.length() >= 2 && (value.startsWith("\"") || value.startsWith("'"));
    }

    private static boolean isZero(ExprNode.Literal literal) {
        if (literal.kind() != ExprNode.LiteralKind.NUMBER) {
            return false;
        }
        try {
            return Double.parseDouble(literal.value()) == 0.0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String dottedName(ExprNode node) {
        if (node instanceof ExprNode.Identifier identifier) {
            return identifier.name();
        }
        if (node instanceof ExprNode.MemberAccess member) {
            String prefix = dottedName(member.target());
            return prefix != null ? prefix + "." + member.member() : null;
        }
        return null;
    }

    /**
     * Built Python text and the precedence of its outermost operator.
     */
    private record Fragment(String code, int precedence) {

        String wrapBelow(int minimum) {
            return precedence < minimum ? "(" + code + ")" : code;
        }
    }
}
