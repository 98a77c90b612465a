package com.pinery.converter.codegen;

import com.pinery.converter.context.PineFunctions;
import com.pinery.converter.context.TransformationContext;
import com.pinery.core.dsl.ExprNode;
import com.pinery.core.dsl.ExpressionParser;
import com.pinery.core.dsl.ParseException;
import com.pinery.core.indicators.registry.IndicatorMapping;
import com.pinery.core.indicators.registry.IndicatorRegistry;
import com.pinery.core.script.InputType;
import com.pinery.core.script.Statement;
import com.pinery.core.script.VariableModifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Translates statement nodes into Python lines for the generated strategy class.
 *
 * Inputs and persistent variables become instance attributes set in {@code __init__}; everything
 * else becomes lines of the {@code generate_signal} body. Strategy calls produce no body lines,
 * the generator renders them as signal branches. A statement whose expression cannot be
 * translated degrades to a placeholder plus a warning instead of failing the whole script.
 */
public class NodeTranslator {

    private static final Logger log = LoggerFactory.getLogger(NodeTranslator.class);

    static final String INDENT = "    ";

    private static final Set<String> PRICE_SOURCES = Set.of(
        "open", "high", "low", "close", "volume", "hl2", "hlc3", "ohlc4", "hlcc4");

    // Attributes and helpers of the generated class that inputs and state must not shadow
    private static final Set<String> CLASS_MEMBERS = Set.of(
        "params", "name", "min_candles", "position_size", "indicators", "open", "high", "low", "close",
        "volume", "generate_signal", "_last", "_nz", "_is_na", "_fixnan", "_source", "_position_size",
        "_hold", "_signal", "_where");

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final PythonCodeBuilder builder;
    private final IndicatorRegistry registry;
    private final ExpressionParser parser = new ExpressionParser();

    public NodeTranslator(PythonCodeBuilder builder, IndicatorRegistry registry) {
        this.builder = builder;
        this.registry = registry;
    }

    // ===== Class attributes =====

    /**
     * Instance attribute name for an input or persistent variable.
     */
    public static String attributeName(String pineName) {
        String safe = PineFunctions.safeName(pineName);
        return CLASS_MEMBERS.contains(safe) ? safe + "_" : safe;
    }

    /**
     * {@code self.<name> = self.params.get("<name>", <default>)  # <title>}, registering the input
     * in the context. Source inputs resolve through {@code self._source(...)} in the body.
     */
    public Translation translateInput(Statement.InputNode input, TransformationContext context) {
        String attribute = "self." + attributeName(input.name());
        String line = attribute + " = self.params.get(" + PythonLiterals.string(input.name()) + ", "
            + pythonDefault(input) + ")" + inputComment(input);
        if (isSource(input)) {
            context.addVariable(input.name(), "self._source(" + attribute + ")");
        } else {
            context.addConstant(input.name(), attribute);
        }
        return Translation.of(line);
    }

    /**
     * Python literal for an input's default value.
     */
    public String pythonDefault(Statement.InputNode input) {
        String raw = input.defaultValue();
        if (raw == null || raw.isBlank()) {
            return "None";
        }
        String text = raw.trim();
        if (isSource(input)) {
            return PythonLiterals.string(text);
        }
        if (text.equals("na")) {
            return "None";
        }
        if (text.equals("true")) {
            return "True";
        }
        if (text.equals("false")) {
            return "False";
        }
        if (NUMBER.matcher(text).matches()) {
            return text;
        }
        return PythonLiterals.string(unquote(text));
    }

    /**
     * {@code __init__} line for a persistent ({@code var}/{@code varip}) declaration. Only literal
     * initializers are inferred; anything else starts at zero and is flagged in a comment.
     */
    public Translation translateState(Statement.VariableNode variable, TransformationContext context) {
        String attribute = "self." + attributeName(variable.name());
        context.addState(variable.name(), attribute);
        String comment = "  # State variable (" + modifierName(variable.modifier()) + ")";

        ExprNode init = tryParse(variable.valueExpr());
        if (init != null && isLiteral(init)) {
            return Translation.of(attribute + " = " + builder.build(init, context) + comment);
        }
        return Translation.warning(
            attribute + " = 0" + comment + ", initializer not inferred: " + PythonLiterals.commentText(variable.valueExpr()),
            "Line " + variable.line() + ": initial value of '" + variable.name() + "' approximated as 0");
    }

    // ===== Body =====

    /**
     * Body lines for a list of statements in source order.
     */
    public Translation translateBlock(List<Statement> statements, TransformationContext context) {
        Translation result = Translation.empty();
        for (Statement statement : statements) {
            result = result.plus(translate(statement, context));
        }
        return result;
    }

    /**
     * Body lines for one statement. Inputs yield nothing here, they are emitted by {@link #translateInput}.
     */
    public Translation translate(Statement statement, TransformationContext context) {
        if (statement instanceof Statement.InputNode) {
            return Translation.empty();
        }
        if (statement instanceof Statement.VariableNode variable) {
            return variable(variable, context);
        }
        if (statement instanceof Statement.TupleAssignmentNode tuple) {
            return tuple(tuple, context);
        }
        if (statement instanceof Statement.ConditionNode condition) {
            return condition(condition, context, false);
        }
        if (statement instanceof Statement.StrategyCallNode) {
            return Translation.empty();
        }
        if (statement instanceof Statement.PlotNode plot) {
            return plot(plot);
        }
        if (statement instanceof Statement.FunctionNode function) {
            return Translation.warning(
                "# Custom function '" + function.name() + "' (line " + function.line() + ") is not translated",
                "Line " + function.line() + ": custom function '" + function.name() + "' skipped");
        }
        if (statement instanceof Statement.CustomTypeNode type) {
            return Translation.warning(
                "# Custom type '" + type.name() + "' (line " + type.line() + ") is not translated",
                "Line " + type.line() + ": custom type '" + type.name() + "' skipped");
        }
        if (statement instanceof Statement.UnsupportedNode unsupported) {
            return Translation.warning(
                "# Unsupported " + unsupported.construct() + " (line " + unsupported.line() + "): "
                    + PythonLiterals.commentText(unsupported.text()),
                "Line " + unsupported.line() + ": unsupported " + unsupported.construct() + " skipped");
        }
        if (statement instanceof Statement.ExpressionStatement expression) {
            return Translation.of("# " + PythonLiterals.commentText(expression.expr()));
        }
        throw new IllegalArgumentException("Unknown statement type: " + statement.getClass().getSimpleName());
    }

    private Translation variable(Statement.VariableNode variable, TransformationContext context) {
        if (variable.isPersistent() && variable.isDeclaration()) {
            return Translation.empty();
        }
        String target = target(variable.name(), context);
        String value;
        try {
            value = builder.build(variable.valueExpr(), context);
        } catch (ParseException | IllegalArgumentException e) {
            return untranslatable(target, variable.valueExpr(), variable.line(), e);
        }
        if (target.startsWith("self.") && !isLiteral(tryParse(variable.valueExpr()))) {
            value = "self._last(" + value + ")";
        }
        return Translation.of(target + " " + PythonCodeBuilder.pythonOperator(variable.operator()) + " " + value);
    }

    private Translation tuple(Statement.TupleAssignmentNode tuple, TransformationContext context) {
        List<String> targets = new ArrayList<>();
        for (String name : tuple.names()) {
            targets.add(target(name, context));
        }
        String joined = String.join(", ", targets);
        ExprNode value = tryParse(tuple.valueExpr());
        if (value == null) {
            return untranslatable(joined, tuple.valueExpr(), tuple.line(), null);
        }
        String code;
        try {
            code = builder.build(value, context);
        } catch (IllegalArgumentException e) {
            return untranslatable(joined, tuple.valueExpr(), tuple.line(), e);
        }
        String comment = "";
        if (value instanceof ExprNode.Call call && "ta".equals(call.namespace())) {
            IndicatorMapping mapping = registry.get(call.name());
            if (mapping != null && mapping.multi()) {
                comment = "  # " + String.join(", ", mapping.returnNames());
            }
        }
        return Translation.of(joined + " = " + code + comment);
    }

    private Translation condition(Statement.ConditionNode node, TransformationContext context, boolean elif) {
        String condition;
        try {
            condition = builder.build(node.conditionExpr(), context);
        } catch (ParseException | IllegalArgumentException e) {
            log.debug("Condition on line {} not translated: {}", node.line(), e.getMessage());
            return Translation.warning(
                "# Skipped if block (line " + node.line() + "): " + PythonLiterals.commentText(node.conditionExpr()),
                "Line " + node.line() + ": could not translate condition '" + node.conditionExpr() + "'");
        }

        Translation whenTrue = translateBlock(node.trueBranch(), context.createChildContext());
        Translation whenFalse;
        boolean chained = node.falseBranch().size() == 1
            && node.falseBranch().get(0) instanceof Statement.ConditionNode;
        if (chained) {
            whenFalse = condition((Statement.ConditionNode) node.falseBranch().get(0), context, true);
        } else {
            whenFalse = translateBlock(node.falseBranch(), context.createChildContext());
        }
        List<String> warnings = new ArrayList<>(whenTrue.warnings());
        warnings.addAll(whenFalse.warnings());
        if (!hasCode(whenTrue.lines()) && !hasCode(whenFalse.lines())) {
            return new Translation(List.of(), warnings);
        }

        List<String> lines = new ArrayList<>();
        lines.add((elif ? "elif " : "if ") + "self._last(" + condition + "):");
        lines.addAll(body(whenTrue.lines()));
        if (hasCode(whenFalse.lines())) {
            if (chained && whenFalse.lines().get(0).startsWith("elif ")) {
                lines.addAll(whenFalse.lines());
            } else {
                lines.add("else:");
                lines.addAll(body(whenFalse.lines()));
            }
        }
        return new Translation(lines, warnings);
    }

    private Translation plot(Statement.PlotNode plot) {
        if (plot.isDrawing()) {
            return Translation.of("# Drawing: " + PythonLiterals.commentText(plot.seriesExpr()));
        }
        StringBuilder sb = new StringBuilder("# Plot: ");
        if (plot.title() != null) {
            sb.append(PythonLiterals.commentText(plot.title())).append(' ');
        }
        sb.append('(').append(PythonLiterals.commentText(plot.seriesExpr())).append(')');
        return Translation.of(sb.toString());
    }

    // ===== Helpers =====

    static List<String> indent(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(line.isBlank() ? "" : INDENT + line);
        }
        return result;
    }

    /**
     * Indented block lines, with a trailing pass when the block holds only comments.
     */
    static List<String> body(List<String> lines) {
        List<String> result = indent(lines);
        if (!hasCode(lines)) {
            result.add(INDENT + "pass");
        }
        return result;
    }

    static boolean hasCode(List<String> lines) {
        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                return true;
            }
        }
        return false;
    }

    private static String target(String name, TransformationContext context) {
        String existing = context.getVariable(name);
        return existing != null ? existing : context.declareLocal(name);
    }

    private Translation untranslatable(String target, String expression, int line, RuntimeException cause) {
        String reason = cause != null ? cause.getMessage() : "invalid expression";
        log.debug("Line {} not translated: {}", line, reason);
        return Translation.warning(
            target + " = np.nan  # could not translate: " + PythonLiterals.commentText(expression),
            "Line " + line + ": could not translate '" + expression + "' (" + reason + ")");
    }

    private ExprNode tryParse(String expression) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        try {
            return parser.parse(expression);
        } catch (ParseException e) {
            log.debug("Unparseable expression '{}': {}", expression, e.getMessage());
            return null;
        }
    }

    private static boolean isLiteral(ExprNode node) {
        if (node instanceof ExprNode.Literal) {
            return true;
        }
        if (node instanceof ExprNode.Identifier identifier) {
            String name = identifier.name();
            return name.equals("na") || name.equals("true") || name.equals("false");
        }
        return node instanceof ExprNode.Unary unary && unary.operator().equals("-")
            && unary.operand() instanceof ExprNode.Literal;
    }

    private static boolean isSource(Statement.InputNode input) {
        if (input.type() == InputType.SOURCE) {
            return true;
        }
        String value = input.defaultValue() != null ? input.defaultValue().trim() : "";
        return input.type() == InputType.GENERIC && PRICE_SOURCES.contains(value);
    }

    private static String inputComment(Statement.InputNode input) {
        List<String> parts = new ArrayList<>();
        if (input.title() != null && !input.title().isBlank()) {
            parts.add(PythonLiterals.commentText(unquote(input.title())));
        }
        if (input.minValue() != null || input.maxValue() != null) {
            parts.add("[" + (input.minValue() != null ? input.minValue() : "") + ".."
                + (input.maxValue() != null ? input.maxValue() : "") + "]");
        }
        if (!input.options().isEmpty()) {
            parts.add("options: " + PythonLiterals.commentText(String.join(", ", input.options())));
        }
        return parts.isEmpty() ? "" : "  # " + String.join(" ", parts);
    }

    private static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    private static String modifierName(VariableModifier modifier) {
        return modifier == VariableModifier.VARIP ? "varip" : "var";
    }
}
