package com.pinery.converter.codegen;

import com.pinery.converter.context.SharedScopeState;
import com.pinery.converter.context.TransformationContext;
import com.pinery.converter.python.OutputContract;
import com.pinery.converter.python.SyntaxCheckResult;
import com.pinery.core.config.PineryConfig;
import com.pinery.core.dsl.ExprNode;
import com.pinery.core.dsl.ExpressionParser;
import com.pinery.core.dsl.ParseException;
import com.pinery.core.indicators.registry.IndicatorMapping;
import com.pinery.core.indicators.registry.IndicatorRegistry;
import com.pinery.core.indicators.registry.IndicatorRegistryInitializer;
import com.pinery.core.script.PineAst;
import com.pinery.core.script.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns a validated {@link PineAst} into a Python strategy module.
 *
 * Generation is a pure function of the AST: every call starts from a fresh translation context,
 * and the output carries no timestamps, so the same script always yields the same module.
 * The rendered text is formatted and syntax-checked; one repair pass is attempted before the
 * result is reported as failed.
 */
public class CodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CodeGenerator.class);

    public static final String DEFAULT_MODE = "rule-based";

    private static final List<String> LONG_WARMUP_INDICATORS = List.of("sma", "ema", "macd", "bb");
    private static final double LONG_WARMUP_LENGTH = 50;

    private final PineryConfig.GenerationSettings settings;
    private final IndicatorRegistry registry;
    private final StrategyTemplate template;
    private final CodeFormatter formatter;
    private final PythonCodeBuilder builder = new PythonCodeBuilder();
    private final ExpressionParser parser = new ExpressionParser();

    public CodeGenerator() {
        this(PineryConfig.defaults(), IndicatorRegistryInitializer.standard());
    }

    public CodeGenerator(PineryConfig config, IndicatorRegistry registry) {
        this(config, registry, StrategyTemplate.standard(), new CodeFormatter());
    }

    public CodeGenerator(PineryConfig config, IndicatorRegistry registry, StrategyTemplate template,
                         CodeFormatter formatter) {
        this.settings = config.getGeneration();
        this.registry = registry;
        this.template = template;
        this.formatter = formatter;
    }

    public GeneratedCode generate(PineAst ast) {
        return generate(ast, DEFAULT_MODE);
    }

    /**
     * @param mode conversion mode recorded in the module docstring
     */
    public GeneratedCode generate(PineAst ast, String mode) {
        log.info("Generating Python for '{}'", ast.scriptName());

        TransformationContext context = new TransformationContext(SharedScopeState.withDefaultBuiltins());
        NodeTranslator translator = new NodeTranslator(builder, registry);
        List<String> warnings = new ArrayList<>();
        String className = className(ast.scriptName());

        // Parameters
        List<String> inputLines = new ArrayList<>();
        Map<String, String> parameters = new LinkedHashMap<>();
        for (Statement.InputNode input : ast.inputs()) {
            inputLines.addAll(translator.translateInput(input, context).lines());
            parameters.put(input.name(), translator.pythonDefault(input));
        }

        // Persistent state
        List<String> stateLines = new ArrayList<>();
        Set<String> stateNames = new HashSet<>();
        for (Statement.VariableNode variable : ast.variables()) {
            if (variable.isPersistent() && variable.isDeclaration() && stateNames.add(variable.name())) {
                Translation state = translator.translateState(variable, context);
                stateLines.addAll(state.lines());
                warnings.addAll(state.warnings());
            }
        }

        // Locals assigned only inside branches exist before the first branch runs
        List<String> variableLines = new ArrayList<>();
        Set<String> topLevel = topLevelNames(ast.statements());
        for (String name : ast.variableNames()) {
            if (context.hasVariable(name)) {
                continue;
            }
            String local = context.declareLocal(name);
            if (!topLevel.contains(name)) {
                variableLines.add(local + " = np.nan");
            }
        }

        Translation body = translator.translateBlock(ast.statements(), context);
        variableLines.addAll(body.lines());
        warnings.addAll(body.warnings());

        // Signals
        Map<String, ExitLevels> levels = exitLevels(ast.strategyCalls(), warnings);
        List<String> exitLines = new ArrayList<>();
        List<String> entryLines = new ArrayList<>();
        for (Statement.StrategyCallNode call : ast.strategyCalls()) {
            if (call.callType() == Statement.StrategyCallNode.CallType.ENTRY) {
                entryLines.addAll(entry(call, levels, context, warnings));
            } else if (call.when() != null || call.callType() == Statement.StrategyCallNode.CallType.CLOSE) {
                exitLines.addAll(exit(call, context, warnings));
            }
        }
        if (!NodeTranslator.hasCode(exitLines)) {
            exitLines.add("pass");
        }
        if (!NodeTranslator.hasCode(entryLines)) {
            entryLines.add("pass");
        }

        warnings.addAll(context.warnings());

        // Indicators
        ImportManager imports = new ImportManager(settings.getRuntimeModule(), settings.getRuntimeClass());
        List<String> indicators = new ArrayList<>(context.indicatorsUsed());
        for (String indicator : indicators) {
            imports.addIndicator(indicator);
            if (!registry.contains(indicator)) {
                warnings.add("Indicator " + indicator + " is not in the indicator registry; verify runtime support");
            }
        }

        int minCandles = minCandles(ast, indicators);
        Map<String, Object> values = new HashMap<>();
        values.put("docstring", docstring(ast, mode, indicators));
        values.put("imports", List.of(imports.generateImportBlock().split("\n")));
        values.put("class_name", className);
        values.put("class_doc", "Strategy converted from the Pine Script '"
            + PythonLiterals.commentText(ast.scriptName()).replace('"', '\'') + "'.");
        values.put("script_name", PythonLiterals.string(ast.scriptName()));
        values.put("min_candles", String.valueOf(minCandles));
        values.put("indicator_init", imports.hasIndicators()
            ? List.of("self.indicators = " + imports.runtimeClass() + "()") : List.of());
        values.put("indicator_bind", imports.hasIndicators() ? List.of("self.indicators.bind(df)") : List.of());
        values.put("inputs", inputLines);
        values.put("state", stateLines);
        values.put("variables", variableLines);
        values.put("exits", exitLines);
        values.put("entries", entryLines);
        values.put("hold_confidence", String.valueOf(settings.getHoldConfidence()));
        values.put("module_function", moduleFunction(className));

        String code = formatter.format(template.render(values));
        SyntaxCheckResult check = OutputContract.check(code);
        if (!check.valid()) {
            log.warn("Generated code for '{}' is invalid ({}), attempting repair", ast.scriptName(), check.describe());
            code = formatter.repair(code);
            check = OutputContract.check(code);
            if (!check.valid()) {
                log.error("Repair failed for '{}': {}", ast.scriptName(), check.describe());
                return GeneratedCode.failure(code, className, warnings,
                    List.of("Generated code failed validation: " + check.describe()));
            }
            warnings.add("Generated code needed an automatic formatting repair");
        }

        log.info("Generated {} ({} lines, {} indicators, {} warnings)", className,
            code.split("\n").length, indicators.size(), warnings.size());
        return new GeneratedCode(code, className, imports.generateImportBlock(), parameters, indicators,
            warnings, List.of());
    }

    // ===== Naming =====

    /**
     * Python class name for a script: words capitalized and joined, non-identifier characters dropped.
     * {@code "MA Cross"} becomes {@code MACross}, {@code "3 Bar Play"} becomes {@code Strategy3BarPlay}.
     */
    public static String className(String scriptName) {
        String cleaned = scriptName == null ? "" : scriptName.replaceAll("[^A-Za-z0-9_\\s]", "");
        StringBuilder sb = new StringBuilder();
        for (String word : cleaned.trim().split("\\s+")) {
            if (!word.isEmpty()) {
                sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        if (sb.length() == 0) {
            return "GeneratedStrategy";
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, "Strategy");
        }
        return sb.toString();
    }

    // ===== Signals =====

    private record ExitLevels(String stop, String limit) {}

    /**
     * Stop/limit levels of unconditional strategy.exit calls, keyed by entry id ("" for every entry).
     */
    private static Map<String, ExitLevels> exitLevels(List<Statement.StrategyCallNode> calls, List<String> warnings) {
        Map<String, ExitLevels> levels = new HashMap<>();
        for (Statement.StrategyCallNode call : calls) {
            if (call.callType() != Statement.StrategyCallNode.CallType.EXIT || call.when() != null) {
                continue;
            }
            if (call.stop() == null && call.limit() == null) {
                warnings.add("Line " + call.line() + ": strategy.exit without condition or levels ignored");
                continue;
            }
            levels.put(call.fromEntry() != null ? call.fromEntry() : "", new ExitLevels(call.stop(), call.limit()));
        }
        return levels;
    }

    private List<String> entry(Statement.StrategyCallNode call, Map<String, ExitLevels> levels,
                               TransformationContext context, List<String> warnings) {
        String action = call.direction() == Statement.StrategyCallNode.Direction.SHORT ? "sell" : "buy";
        String reason = call.id() != null ? call.id() : action;
        ExitLevels attached = call.id() != null && levels.containsKey(call.id()) ? levels.get(call.id()) : levels.get("");

        StringBuilder signal = new StringBuilder("return self._signal(")
            .append(PythonLiterals.string(action)).append(", ")
            .append(settings.getEntryConfidence()).append(", ")
            .append(PythonLiterals.string(reason));
        if (attached != null) {
            String stop = level(attached.stop(), context, call, warnings);
            String target = level(attached.limit(), context, call, warnings);
            if (stop != null) {
                signal.append(", stop=").append(stop);
            }
            if (target != null) {
                signal.append(", target=").append(target);
            }
        }
        signal.append(')');
        return guarded(call, signal.toString(), context, warnings);
    }

    private List<String> exit(Statement.StrategyCallNode call, TransformationContext context, List<String> warnings) {
        String reason = call.id() != null ? call.id() : "close";
        String signal = "return self._signal(\"close\", " + settings.getExitConfidence() + ", "
            + PythonLiterals.string(reason) + ")";
        return guarded(call, signal, context, warnings);
    }

    private List<String> guarded(Statement.StrategyCallNode call, String signal, TransformationContext context,
                                 List<String> warnings) {
        if (call.when() == null) {
            return List.of(signal);
        }
        try {
            String condition = builder.build(call.when(), context);
            return List.of("if self._last(" + condition + "):", NodeTranslator.INDENT + signal);
        } catch (ParseException | IllegalArgumentException e) {
            warnings.add("Line " + call.line() + ": could not translate condition '" + call.when()
                + "' of strategy." + call.callType().name().toLowerCase(Locale.ROOT) + " (" + e.getMessage() + ")");
            return List.of("# Skipped signal (line " + call.line() + "): " + PythonLiterals.commentText(call.when()));
        }
    }

    private String level(String expression, TransformationContext context, Statement.StrategyCallNode call,
                         List<String> warnings) {
        if (expression == null) {
            return null;
        }
        try {
            return builder.build(expression, context);
        } catch (ParseException | IllegalArgumentException e) {
            warnings.add("Line " + call.line() + ": could not translate exit level '" + expression + "'");
            return null;
        }
    }

    // ===== Module parts =====

    private static List<String> docstring(PineAst ast, String mode, List<String> indicators) {
        List<String> lines = new ArrayList<>();
        lines.add("\"\"\"");
        lines.add("Strategy: " + PythonLiterals.commentText(ast.scriptName()));
        lines.add("Converted from Pine Script v" + ast.version() + " ("
            + ast.scriptType().name().toLowerCase(Locale.ROOT) + ")");
        lines.add("Conversion mode: " + mode);
        lines.add("Indicators: " + (indicators.isEmpty() ? "none" : String.join(", ", indicators)));
        lines.add(String.format(Locale.ROOT, "Complexity score: %.3f", ast.complexityScore()));
        lines.add("\"\"\"");
        return lines;
    }

    private List<String> moduleFunction(String className) {
        if (!settings.isEmitModuleFunction()) {
            return List.of();
        }
        return List.of(
            "",
            "",
            "def generate_signal(current_price, candles, params=None, current_position=None):",
            "    \"\"\"Module-level entry point.\"\"\"",
            "    return " + className + "(params).generate_signal(current_price, candles, current_position)");
    }

    // ===== Warm-up =====

    /**
     * Longer warm-up for slow moving-average families and for any literal length above 50.
     */
    int minCandles(PineAst ast, List<String> indicators) {
        for (String indicator : indicators) {
            String shortName = indicator.startsWith("ta.") ? indicator.substring(3) : indicator;
            for (String slow : LONG_WARMUP_INDICATORS) {
                if (shortName.contains(slow)) {
                    return settings.getLongWarmupMinCandles();
                }
            }
        }
        Map<String, Double> inputDefaults = new HashMap<>();
        for (Statement.InputNode input : ast.inputs()) {
            Double value = number(input.defaultValue());
            if (value != null) {
                inputDefaults.put(input.name(), value);
            }
        }
        for (ExprNode.Call call : indicatorCalls(ast)) {
            IndicatorMapping mapping = registry.get(call.name());
            List<ExprNode.Argument> arguments = call.arguments();
            for (int i = 0; i < arguments.size(); i++) {
                ExprNode.Argument argument = arguments.get(i);
                String param = argument.isNamed() ? argument.name()
                    : mapping != null && i < mapping.paramNames().size() ? mapping.paramNames().get(i) : null;
                if (param == null || !(param.contains("length") || param.contains("period"))) {
                    continue;
                }
                Double value = literalValue(argument.value(), inputDefaults);
                if (value != null && value > LONG_WARMUP_LENGTH) {
                    return settings.getLongWarmupMinCandles();
                }
            }
        }
        return settings.getDefaultMinCandles();
    }

    private List<ExprNode.Call> indicatorCalls(PineAst ast) {
        Set<String> expressions = new LinkedHashSet<>();
        for (Statement.VariableNode variable : ast.variables()) {
            expressions.add(variable.valueExpr());
        }
        for (Statement.TupleAssignmentNode tuple : ast.tupleAssignments()) {
            expressions.add(tuple.valueExpr());
        }
        for (Statement.ConditionNode condition : ast.conditions()) {
            expressions.add(condition.conditionExpr());
        }
        for (Statement.StrategyCallNode call : ast.strategyCalls()) {
            expressions.add(call.when());
        }
        List<ExprNode.Call> calls = new ArrayList<>();
        for (String expression : expressions) {
            if (expression == null || expression.isBlank()) {
                continue;
            }
            try {
                collectIndicatorCalls(parser.parse(expression), calls);
            } catch (ParseException e) {
                log.debug("Skipping unparseable expression in warm-up scan: {}", e.getMessage());
            }
        }
        return calls;
    }

    private static void collectIndicatorCalls(ExprNode node, List<ExprNode.Call> out) {
        if (node instanceof ExprNode.Call call) {
            if ("ta".equals(call.namespace())) {
                out.add(call);
            }
            if (call.receiver() != null) {
                collectIndicatorCalls(call.receiver(), out);
            }
            for (ExprNode.Argument argument : call.arguments()) {
                collectIndicatorCalls(argument.value(), out);
            }
        } else if (node instanceof ExprNode.Binary binary) {
            collectIndicatorCalls(binary.left(), out);
            collectIndicatorCalls(binary.right(), out);
        } else if (node instanceof ExprNode.Unary unary) {
            collectIndicatorCalls(unary.operand(), out);
        } else if (node instanceof ExprNode.Ternary ternary) {
            collectIndicatorCalls(ternary.condition(), out);
            collectIndicatorCalls(ternary.whenTrue(), out);
            collectIndicatorCalls(ternary.whenFalse(), out);
        } else if (node instanceof ExprNode.ArrayAccess access) {
            collectIndicatorCalls(access.target(), out);
            collectIndicatorCalls(access.offset(), out);
        } else if (node instanceof ExprNode.MemberAccess member) {
            collectIndicatorCalls(member.target(), out);
        }
    }

    private static Double literalValue(ExprNode node, Map<String, Double> inputDefaults) {
        if (node instanceof ExprNode.Literal literal && literal.kind() == ExprNode.LiteralKind.NUMBER) {
            return number(literal.value());
        }
        if (node instanceof ExprNode.Identifier identifier) {
            return inputDefaults.get(identifier.name());
        }
        return null;
    }

    private static Double number(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Set<String> topLevelNames(List<Statement> statements) {
        Set<String> names = new HashSet<>();
        for (Statement statement : statements) {
            if (statement instanceof Statement.VariableNode variable) {
                names.add(variable.name());
            } else if (statement instanceof Statement.TupleAssignmentNode tuple) {
                names.addAll(tuple.names());
            }
        }
        return names;
    }
}
