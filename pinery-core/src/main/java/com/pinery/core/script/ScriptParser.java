package com.pinery.core.script;

import com.pinery.core.config.PineryConfig;
import com.pinery.core.dsl.Lexer;
import com.pinery.core.dsl.Token;
import com.pinery.core.dsl.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the whole-script AST from Pine source and scores its complexity.
 *
 * Works on logical lines of the token stream; INDENT/DEDENT delimit blocks. Expressions are not
 * parsed here, they are kept as normalized text on the nodes. Never throws on malformed input:
 * anything it cannot classify becomes an {@link Statement.ExpressionStatement} or an
 * {@link Statement.UnsupportedNode}.
 *
 * Instances are immutable and safe to share; each call to {@link #parse(String)} uses its own state.
 */
public class ScriptParser {

    private static final Logger log = LoggerFactory.getLogger(ScriptParser.class);

    private static final Pattern VERSION = Pattern.compile("//\\s*@version\\s*=\\s*(\\d+)");
    private static final int DEFAULT_VERSION = 5;

    private static final Set<String> ASSIGNMENT_OPS = Set.of("=", ":=", "+=", "-=", "*=", "/=", "%=");
    private static final Set<String> PLOT_FUNCTIONS = Set.of(
        "plot", "plotshape", "plotchar", "plotcandle", "plotbar", "plotarrow", "hline", "fill",
        "bgcolor", "barcolor", "alertcondition", "alert"
    );
    private static final Set<String> DRAWING_NAMESPACES = Set.of("line", "label", "box", "table", "polyline");
    private static final Set<String> COLLECTION_NAMESPACES = Set.of("array", "matrix", "map");
    private static final Set<String> TYPE_KEYWORDS = Set.of(
        "int", "float", "bool", "string", "color", "line", "label", "box", "table"
    );
    private static final Set<String> SOURCE_NAMES = Set.of(
        "open", "high", "low", "close", "volume", "hl2", "hlc3", "ohlc4", "hlcc4"
    );
    private static final Pattern INT_LITERAL = Pattern.compile("-?\\d+");
    private static final Pattern FLOAT_LITERAL = Pattern.compile("-?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");

    private final PineryConfig config;
    private final ComplexityScorer scorer;

    public ScriptParser() {
        this(PineryConfig.defaults());
    }

    public ScriptParser(PineryConfig config) {
        this.config = config;
        this.scorer = new ComplexityScorer(config.getComplexity());
    }

    public PineryConfig config() {
        return config;
    }

    /**
     * Parse a script. A null source is treated as empty.
     */
    public PineAst parse(String source) {
        String text = source != null ? source : "";
        PineAst ast = new Run(text).parse();
        log.debug("Parsed '{}' ({} statements, {} indicators, score {})", ast.scriptName(),
            ast.statements().size(), ast.indicatorsUsed().size(), ast.complexityScore());
        return ast;
    }

    // ========== One parse ==========

    private final class Run {

        private final String source;
        private final List<Token> tokens = new ArrayList<>();
        private int position = 0;

        private String scriptName = "Unknown";
        private ScriptType scriptType = ScriptType.INDICATOR;
        private final Map<String, String> settings = new LinkedHashMap<>();
        private final List<Statement.InputNode> inputs = new ArrayList<>();
        private final List<Statement.VariableNode> variables = new ArrayList<>();
        private final List<Statement.TupleAssignmentNode> tuples = new ArrayList<>();
        private final List<Statement.ConditionNode> conditions = new ArrayList<>();
        private final List<Statement.FunctionNode> functions = new ArrayList<>();
        private final List<Statement.CustomTypeNode> customTypes = new ArrayList<>();
        private final List<Statement.StrategyCallNode> strategyCalls = new ArrayList<>();
        private final List<Statement.PlotNode> plots = new ArrayList<>();
        private final List<Statement.UnsupportedNode> unsupported = new ArrayList<>();
        private int maxNesting = 0;

        Run(String source) {
            this.source = source;
            for (Token token : Lexer.tokenize(source)) {
                if (token.type() != TokenType.COMMENT) {
                    tokens.add(token);
                }
            }
        }

        PineAst parse() {
            List<Statement> statements = parseStatements(0, List.of(), false);

            Map<String, Integer> indicatorCalls = new TreeMap<>();
            int arrayRefs = 0;
            int drawings = 0;
            for (int i = 0; i < tokens.size(); i++) {
                Token token = tokens.get(i);
                if (token.type() == TokenType.NAMESPACE && memberAt(i) != null) {
                    String member = memberAt(i);
                    if (token.value().equals("ta")) {
                        indicatorCalls.merge("ta." + member, 1, Integer::sum);
                    } else if (COLLECTION_NAMESPACES.contains(token.value())) {
                        arrayRefs++;
                    } else if (DRAWING_NAMESPACES.contains(token.value()) && member.equals("new")) {
                        drawings++;
                    }
                } else if (token.type() == TokenType.KEYWORD && isCollectionType(i)) {
                    arrayRefs++;
                }
            }

            Set<String> inputNames = new LinkedHashSet<>();
            inputs.forEach(input -> inputNames.add(input.name()));
            Set<String> variableNames = new LinkedHashSet<>();
            variables.forEach(v -> variableNames.add(v.name()));
            tuples.forEach(t -> variableNames.addAll(t.names()));
            variableNames.removeAll(inputNames);

            int totalLines = (int) source.lines().count();
            int codeLines = (int) source.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty() && !line.startsWith("//"))
                .count();

            ComplexityScorer.Score score = scorer.score(new ComplexityScorer.Counts(
                codeLines, functions.size(), customTypes.size(), arrayRefs, drawings,
                maxNesting, indicatorCalls.size(), variableNames.size()));

            return new PineAst(scriptName, version(), scriptType, settings, statements, inputs, variables,
                tuples, conditions, functions, customTypes, strategyCalls, plots, unsupported,
                new ArrayList<>(indicatorCalls.keySet()), indicatorCalls, arrayRefs, drawings, maxNesting,
                totalLines, codeLines, score.value(), score.factors(), source);
        }

        private int version() {
            Matcher matcher = VERSION.matcher(source);
            if (!matcher.find()) {
                return DEFAULT_VERSION;
            }
            try {
                return Integer.parseInt(matcher.group(1));
            } catch (NumberFormatException e) {
                log.warn("Ignoring out-of-range version header '{}', assuming v{}", matcher.group(1), DEFAULT_VERSION);
                return DEFAULT_VERSION;
            }
        }

        // ========== Blocks ==========

        /**
         * Statements until the DEDENT closing this block (consumed) or EOF.
         */
        private List<Statement> parseStatements(int depth, List<String> guards, boolean nested) {
            List<Statement> out = new ArrayList<>();
            while (true) {
                skipNewlines();
                if (check(TokenType.EOF)) {
                    return out;
                }
                if (check(TokenType.DEDENT)) {
                    advance();
                    if (nested) {
                        return out;
                    }
                    continue;
                }
                if (check(TokenType.INDENT)) {
                    // indentation without a block header
                    advance();
                    out.addAll(parseStatements(depth, guards, true));
                    continue;
                }
                List<Token> line = readLine();
                if (!line.isEmpty()) {
                    parseLine(line, depth, guards, out);
                }
            }
        }

        private List<Statement> parseBody(int depth, List<String> guards) {
            int save = position;
            skipNewlines();
            if (!check(TokenType.INDENT)) {
                position = save;
                return List.of();
            }
            advance();
            return parseStatements(depth, guards, true);
        }

        /**
         * Consume an indented block without interpreting it.
         */
        private Block readBlock() {
            int save = position;
            skipNewlines();
            if (!check(TokenType.INDENT)) {
                position = save;
                return Block.EMPTY;
            }
            advance();
            List<List<Token>> lines = new ArrayList<>();
            List<Token> current = new ArrayList<>();
            Token first = null;
            Token last = null;
            int level = 1;
            int deepest = 1;
            while (!check(TokenType.EOF) && level > 0) {
                Token token = advance();
                switch (token.type()) {
                    case INDENT -> deepest = Math.max(deepest, ++level);
                    case DEDENT -> level--;
                    case NEWLINE -> {
                        if (!current.isEmpty()) {
                            lines.add(current);
                            current = new ArrayList<>();
                        }
                    }
                    default -> {
                        current.add(token);
                        if (first == null) {
                            first = token;
                        }
                        last = token;
                    }
                }
            }
            if (!current.isEmpty()) {
                lines.add(current);
            }
            String text = first == null ? "" : source.substring(first.position(), last.end());
            return new Block(lines, deepest, text);
        }

        // ========== Lines ==========

        private void parseLine(List<Token> line, int depth, List<String> guards, List<Statement> out) {
            Token first = line.get(0);
            int lineNo = first.line();

            if (first.type() == TokenType.KEYWORD) {
                switch (first.value()) {
                    case "if" -> {
                        parseIf(line, depth, guards, out);
                        return;
                    }
                    case "else" -> {
                        Block block = readBlock();
                        addUnsupported("else without if", joinWithBlock(line, block), lineNo, out);
                        return;
                    }
                    case "for", "while" -> {
                        Block block = readBlock();
                        maxNesting = Math.max(maxNesting, depth + block.depth());
                        addUnsupported(first.value() + " loop", joinWithBlock(line, block), lineNo, out);
                        return;
                    }
                    case "switch" -> {
                        Block block = readBlock();
                        addUnsupported("switch", joinWithBlock(line, block), lineNo, out);
                        return;
                    }
                    case "import" -> {
                        addUnsupported("import", TokenText.join(line), lineNo, out);
                        return;
                    }
                    case "export" -> {
                        if (line.size() > 1) {
                            parseLine(line.subList(1, line.size()), depth, guards, out);
                        }
                        return;
                    }
                    case "type" -> {
                        if (line.size() > 1 && TokenText.isName(line.get(1))) {
                            parseCustomType(line, out);
                            return;
                        }
                    }
                    case "method" -> {
                        if (parseFunction(line.subList(1, line.size()), true, out)) {
                            return;
                        }
                    }
                    case "indicator", "strategy", "library" -> {
                        if (line.size() > 1 && line.get(1).type() == TokenType.LPAREN) {
                            parseDeclaration(line);
                            return;
                        }
                    }
                    default -> { }
                }
            }

            if (parseFunction(line, false, out)) {
                return;
            }
            if (first.type() == TokenType.LBRACKET && parseTuple(line, out)) {
                return;
            }
            int assignment = findAssignment(line);
            if (assignment > 0) {
                parseAssignment(line, assignment, guards, out);
                return;
            }
            if (parseCallStatement(line, guards, out)) {
                return;
            }
            out.add(new Statement.ExpressionStatement(TokenText.join(line), lineNo));
        }

        private void parseIf(List<Token> line, int depth, List<String> guards, List<Statement> out) {
            int lineNo = line.get(0).line();
            String condition = TokenText.join(line.subList(1, line.size()));
            int bodyDepth = depth + 1;
            maxNesting = Math.max(maxNesting, bodyDepth);

            int slot = conditions.size();
            List<Statement> trueBranch = parseBody(bodyDepth, withGuard(guards, condition));
            List<String> elseGuards = withGuard(guards, condition.isEmpty() ? "" : "not (" + condition + ")");
            List<Statement> falseBranch = List.of();

            int save = position;
            skipNewlines();
            if (check(TokenType.KEYWORD, "else")) {
                List<Token> elseLine = readLine();
                if (elseLine.size() > 1 && elseLine.get(1).is(TokenType.KEYWORD, "if")) {
                    List<Statement> chained = new ArrayList<>();
                    parseIf(elseLine.subList(1, elseLine.size()), depth, elseGuards, chained);
                    falseBranch = chained;
                } else {
                    falseBranch = parseBody(bodyDepth, elseGuards);
                }
            } else {
                position = save;
            }

            Statement.ConditionNode node = new Statement.ConditionNode(condition, trueBranch, falseBranch, lineNo);
            conditions.add(slot, node);
            out.add(node);
        }

        private void parseCustomType(List<Token> line, List<Statement> out) {
            String name = line.get(1).value();
            Block block = readBlock();
            List<String> fields = new ArrayList<>();
            for (List<Token> fieldLine : block.lines()) {
                fields.add(TokenText.join(fieldLine));
            }
            Statement.CustomTypeNode node = new Statement.CustomTypeNode(name, fields, line.get(0).line());
            customTypes.add(node);
            out.add(node);
        }

        /**
         * name(params) => body, inline or as an indented block.
         */
        private boolean parseFunction(List<Token> line, boolean method, List<Statement> out) {
            if (line.size() < 4 || !TokenText.isName(line.get(0)) || line.get(1).type() != TokenType.LPAREN) {
                return false;
            }
            int close = TokenText.matchingClose(line, 1);
            if (close < 0 || close + 1 >= line.size() || !line.get(close + 1).is(TokenType.OPERATOR, "=>")) {
                return false;
            }

            List<Statement.FunctionNode.Parameter> parameters = new ArrayList<>();
            for (List<Token> part : TokenText.splitTopLevel(line.subList(2, close))) {
                if (!part.isEmpty()) {
                    parameters.add(parameter(part));
                }
            }

            String body;
            if (close + 2 < line.size()) {
                body = TokenText.join(line.subList(close + 2, line.size()));
            } else {
                body = readBlock().text();
            }

            Statement.FunctionNode node = new Statement.FunctionNode(line.get(0).value(), parameters, body,
                null, method, line.get(0).line());
            functions.add(node);
            out.add(node);
            return true;
        }

        private Statement.FunctionNode.Parameter parameter(List<Token> part) {
            int equals = -1;
            for (int i = 0; i < part.size(); i++) {
                if (part.get(i).is(TokenType.OPERATOR, "=")) {
                    equals = i;
                    break;
                }
            }
            List<Token> head = equals >= 0 ? part.subList(0, equals) : part;
            String defaultValue = equals >= 0 ? TokenText.join(part.subList(equals + 1, part.size())) : null;
            if (head.isEmpty()) {
                return new Statement.FunctionNode.Parameter("", null, defaultValue);
            }
            String name = head.get(head.size() - 1).value();
            String type = head.size() > 1 ? TokenText.compact(head.subList(0, head.size() - 1)) : null;
            return new Statement.FunctionNode.Parameter(name, type, defaultValue);
        }

        private void parseDeclaration(List<Token> line) {
            scriptType = switch (line.get(0).value()) {
                case "strategy" -> ScriptType.STRATEGY;
                case "library" -> ScriptType.LIBRARY;
                default -> ScriptType.INDICATOR;
            };
            CallArguments args = CallArguments.parse(line, 1);
            String title = args.get("title", 0);
            if (title != null) {
                scriptName = TokenText.unquote(title);
            }
            args.namedArguments().forEach((name, value) -> {
                if (!name.equals("title")) {
                    settings.put(name, value);
                }
            });
        }

        private boolean parseTuple(List<Token> line, List<Statement> out) {
            int close = TokenText.matchingClose(line, 0);
            if (close < 0 || close + 1 >= line.size()) {
                return false;
            }
            Token op = line.get(close + 1);
            if (!op.is(TokenType.OPERATOR, "=") && !op.is(TokenType.OPERATOR, ":=")) {
                return false;
            }
            List<String> names = new ArrayList<>();
            for (List<Token> part : TokenText.splitTopLevel(line.subList(1, close))) {
                if (!part.isEmpty()) {
                    names.add(TokenText.join(part));
                }
            }
            String value = TokenText.join(line.subList(close + 2, line.size()));
            Statement.TupleAssignmentNode node = new Statement.TupleAssignmentNode(names, value, line.get(0).line());
            tuples.add(node);
            out.add(node);
            return true;
        }

        private void parseAssignment(List<Token> line, int opIndex, List<String> guards, List<Statement> out) {
            int lineNo = line.get(0).line();
            Token nameToken = line.get(opIndex - 1);
            if (nameToken.type() != TokenType.IDENTIFIER && nameToken.type() != TokenType.BUILTIN) {
                out.add(new Statement.ExpressionStatement(TokenText.join(line), lineNo));
                return;
            }

            VariableModifier modifier = VariableModifier.NONE;
            int typeStart = 0;
            if (line.get(0).is(TokenType.KEYWORD, "var")) {
                modifier = VariableModifier.VAR;
                typeStart = 1;
            } else if (line.get(0).is(TokenType.KEYWORD, "varip")) {
                modifier = VariableModifier.VARIP;
                typeStart = 1;
            }
            String declaredType = opIndex - 1 > typeStart
                ? TokenText.compact(line.subList(typeStart, opIndex - 1))
                : null;
            String operator = line.get(opIndex).value();
            List<Token> value = line.subList(opIndex + 1, line.size());

            if (value.isEmpty()) {
                Block block = readBlock();
                if (block.text().isEmpty()) {
                    out.add(new Statement.ExpressionStatement(TokenText.join(line), lineNo));
                    return;
                }
                addVariable(new Statement.VariableNode(modifier, nameToken.value(), block.text(),
                    declaredType, operator, lineNo), out);
                return;
            }

            Token head = value.get(0);
            if (head.type() == TokenType.KEYWORD && Set.of("if", "switch", "for", "while").contains(head.value())) {
                Block block = readBlock();
                addUnsupported(head.value() + " expression", joinWithBlock(line, block), lineNo, out);
                return;
            }
            if (head.value().equals("input") && head.type() != TokenType.STRING && isInputCall(value)) {
                Statement.InputNode input = parseInput(nameToken.value(), value, lineNo);
                inputs.add(input);
                out.add(input);
                return;
            }
            if (parseCallStatement(value, guards, out)) {
                return;
            }
            addVariable(new Statement.VariableNode(modifier, nameToken.value(), TokenText.join(value),
                declaredType, operator, lineNo), out);
        }

        private void addVariable(Statement.VariableNode node, List<Statement> out) {
            variables.add(node);
            out.add(node);
        }

        private boolean isInputCall(List<Token> value) {
            int open;
            if (value.size() > 1 && value.get(1).type() == TokenType.LPAREN) {
                open = 1;
            } else if (value.size() > 3 && value.get(1).type() == TokenType.DOT
                && value.get(3).type() == TokenType.LPAREN) {
                open = 3;
            } else {
                return false;
            }
            return TokenText.matchingClose(value, open) == value.size() - 1;
        }

        private Statement.InputNode parseInput(String name, List<Token> value, int lineNo) {
            String member = value.get(1).type() == TokenType.DOT ? value.get(2).value() : null;
            int open = member == null ? 1 : 3;
            InputType type = InputType.fromMember(member);
            CallArguments args = CallArguments.parse(value, open);

            String defaultValue = args.get("defval", 0);
            String title = args.get("title", 1);
            boolean numeric = type == InputType.INT || type == InputType.FLOAT;
            String min = numeric ? args.get("minval", 2) : args.named("minval");
            String max = numeric ? args.get("maxval", 3) : args.named("maxval");
            String step = numeric ? args.get("step", 4) : args.named("step");
            List<String> options = listItems(args.named("options"));

            if (type == InputType.GENERIC) {
                type = inferType(defaultValue);
            }
            return new Statement.InputNode(name, type, defaultValue,
                title != null ? TokenText.unquote(title) : null, min, max, step, options, lineNo);
        }

        private List<String> listItems(String text) {
            if (text == null) {
                return List.of();
            }
            List<Token> listTokens = new ArrayList<>(Lexer.tokenize(text));
            listTokens.removeIf(t -> t.type() == TokenType.EOF || t.type() == TokenType.NEWLINE);
            if (listTokens.isEmpty() || listTokens.get(0).type() != TokenType.LBRACKET) {
                return List.of(text);
            }
            int close = TokenText.matchingClose(listTokens, 0);
            List<String> items = new ArrayList<>();
            int end = close < 0 ? listTokens.size() : close;
            for (List<Token> part : TokenText.splitTopLevel(listTokens.subList(1, end))) {
                if (!part.isEmpty()) {
                    items.add(TokenText.join(part));
                }
            }
            return items;
        }

        private InputType inferType(String defaultValue) {
            if (defaultValue == null) {
                return InputType.GENERIC;
            }
            if (defaultValue.equals("true") || defaultValue.equals("false")) {
                return InputType.BOOL;
            }
            if (TokenText.isStringLiteral(defaultValue)) {
                return InputType.STRING;
            }
            if (INT_LITERAL.matcher(defaultValue).matches()) {
                return InputType.INT;
            }
            if (FLOAT_LITERAL.matcher(defaultValue).matches()) {
                return InputType.FLOAT;
            }
            if (SOURCE_NAMES.contains(defaultValue)) {
                return InputType.SOURCE;
            }
            return InputType.GENERIC;
        }

        // ========== Calls ==========

        /**
         * Strategy, plot and drawing calls. The call must span the whole slice.
         */
        private boolean parseCallStatement(List<Token> line, List<String> guards, List<Statement> out) {
            if (line.size() < 2) {
                return false;
            }
            Token first = line.get(0);
            int lineNo = first.line();

            if (first.type() == TokenType.NAMESPACE && line.size() > 3
                && line.get(1).type() == TokenType.DOT && line.get(3).type() == TokenType.LPAREN
                && TokenText.matchingClose(line, 3) == line.size() - 1) {
                String member = line.get(2).value();
                if (first.value().equals("strategy")) {
                    Statement.StrategyCallNode call = strategyCall(member, CallArguments.parse(line, 3), guards, lineNo);
                    if (call == null) {
                        return false;
                    }
                    strategyCalls.add(call);
                    out.add(call);
                    return true;
                }
                if (DRAWING_NAMESPACES.contains(first.value()) && member.equals("new")) {
                    addPlot(new Statement.PlotNode(first.value() + ".new", null, TokenText.join(line), lineNo), out);
                    return true;
                }
                return false;
            }

            if (first.type() == TokenType.IDENTIFIER && PLOT_FUNCTIONS.contains(first.value())
                && line.get(1).type() == TokenType.LPAREN && TokenText.matchingClose(line, 1) == line.size() - 1) {
                CallArguments args = CallArguments.parse(line, 1);
                String title = args.named("title");
                if (title == null && TokenText.isStringLiteral(args.positional(1))) {
                    title = args.positional(1);
                }
                addPlot(new Statement.PlotNode(first.value(), title != null ? TokenText.unquote(title) : null,
                    args.positional(0), lineNo), out);
                return true;
            }
            return false;
        }

        private void addPlot(Statement.PlotNode plot, List<Statement> out) {
            plots.add(plot);
            out.add(plot);
        }

        private Statement.StrategyCallNode strategyCall(String member, CallArguments args, List<String> guards,
                                                        int lineNo) {
            String when = combineGuards(guards, args.named("when"));
            return switch (member) {
                case "entry", "order" -> new Statement.StrategyCallNode(
                    Statement.StrategyCallNode.CallType.ENTRY,
                    idText(args.get("id", 0)),
                    direction(args.get("direction", 1)),
                    when,
                    args.get("qty", 2),
                    args.get("limit", 3),
                    args.get("stop", 4),
                    null,
                    lineNo);
                case "exit" -> new Statement.StrategyCallNode(
                    Statement.StrategyCallNode.CallType.EXIT,
                    idText(args.get("id", 0)),
                    null,
                    when,
                    args.get("qty", 2),
                    args.get("limit", 5),
                    args.get("stop", 7),
                    idText(args.get("from_entry", 1)),
                    lineNo);
                case "close" -> new Statement.StrategyCallNode(
                    Statement.StrategyCallNode.CallType.CLOSE,
                    idText(args.get("id", 0)),
                    null, when, args.get("qty", 2), null, null, null, lineNo);
                case "close_all" -> new Statement.StrategyCallNode(
                    Statement.StrategyCallNode.CallType.CLOSE,
                    "all", null, when, null, null, null, null, lineNo);
                default -> null;
            };
        }

        private String idText(String text) {
            return text != null ? TokenText.unquote(text) : null;
        }

        private Statement.StrategyCallNode.Direction direction(String text) {
            if (text != null && (text.equals("strategy.short") || text.equals("strategy.direction.short"))) {
                return Statement.StrategyCallNode.Direction.SHORT;
            }
            return Statement.StrategyCallNode.Direction.LONG;
        }

        // ========== Helpers ==========

        private List<String> withGuard(List<String> guards, String condition) {
            if (condition.isEmpty()) {
                return guards;
            }
            List<String> result = new ArrayList<>(guards);
            result.add(condition);
            return result;
        }

        private String combineGuards(List<String> guards, String explicitWhen) {
            List<String> parts = new ArrayList<>(guards);
            if (explicitWhen != null && !explicitWhen.isEmpty()) {
                parts.add(explicitWhen);
            }
            if (parts.isEmpty()) {
                return null;
            }
            if (parts.size() == 1) {
                return parts.get(0);
            }
            StringBuilder sb = new StringBuilder();
            for (String part : parts) {
                if (sb.length() > 0) {
                    sb.append(" and ");
                }
                sb.append('(').append(part).append(')');
            }
            return sb.toString();
        }

        private int findAssignment(List<Token> line) {
            int depth = 0;
            for (int i = 0; i < line.size(); i++) {
                Token token = line.get(i);
                switch (token.type()) {
                    case LPAREN, LBRACKET -> depth++;
                    case RPAREN, RBRACKET -> depth--;
                    case OPERATOR -> {
                        if (depth == 0 && ASSIGNMENT_OPS.contains(token.value())) {
                            return i;
                        }
                    }
                    default -> { }
                }
            }
            return -1;
        }

        private void addUnsupported(String construct, String text, int line, List<Statement> out) {
            Statement.UnsupportedNode node = new Statement.UnsupportedNode(construct, text, line);
            unsupported.add(node);
            out.add(node);
        }

        private String joinWithBlock(List<Token> line, Block block) {
            String head = TokenText.join(line);
            return block.text().isEmpty() ? head : head + "\n" + block.text();
        }

        private String memberAt(int index) {
            if (index + 2 < tokens.size() && tokens.get(index + 1).type() == TokenType.DOT
                && TokenText.isName(tokens.get(index + 2))) {
                return tokens.get(index + 2).value();
            }
            return null;
        }

        /**
         * array&lt;float&gt;, matrix&lt;int&gt;, map&lt;string, float&gt; or float[].
         */
        private boolean isCollectionType(int index) {
            Token token = tokens.get(index);
            if (index + 1 >= tokens.size()) {
                return false;
            }
            Token next = tokens.get(index + 1);
            if (COLLECTION_NAMESPACES.contains(token.value())) {
                return next.is(TokenType.OPERATOR, "<");
            }
            return TYPE_KEYWORDS.contains(token.value()) && next.type() == TokenType.LBRACKET
                && index + 2 < tokens.size() && tokens.get(index + 2).type() == TokenType.RBRACKET;
        }

        private List<Token> readLine() {
            List<Token> line = new ArrayList<>();
            while (!check(TokenType.EOF) && !check(TokenType.NEWLINE)
                && !check(TokenType.INDENT) && !check(TokenType.DEDENT)) {
                line.add(advance());
            }
            if (check(TokenType.NEWLINE)) {
                advance();
            }
            return line;
        }

        private void skipNewlines() {
            while (check(TokenType.NEWLINE)) {
                advance();
            }
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

        private Token advance() {
            Token token = current();
            if (position < tokens.size() - 1) {
                position++;
            }
            return token;
        }
    }

    private record Block(List<List<Token>> lines, int depth, String text) {
        static final Block EMPTY = new Block(List.of(), 0, "");
    }
}
