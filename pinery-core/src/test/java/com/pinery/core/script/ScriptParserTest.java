package com.pinery.core.script;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for whole-script parsing.
 */
class ScriptParserTest {

    private static final String MA_CROSS = """
        //@version=5
        strategy("MA Cross", overlay=true, initial_capital=10000)
        fastLength = input.int(9, "Fast Length", minval=1)
        slowLength = input.int(21, "Slow Length")
        fastMA = ta.sma(close, fastLength)
        slowMA = ta.sma(close, slowLength)
        if ta.crossover(fastMA, slowMA)
            strategy.entry("Long", strategy.long)
        if ta.crossunder(fastMA, slowMA)
            strategy.close("Long")
        plot(fastMA, "Fast", color=color.blue)
        """;

    private ScriptParser parser;

    @BeforeEach
    void setUp() {
        parser = new ScriptParser();
    }

    @Nested
    @DisplayName("Simple strategy")
    class SimpleStrategy {

        private PineAst ast;

        @BeforeEach
        void parse() {
            ast = parser.parse(MA_CROSS);
        }

        @Test
        @DisplayName("Declaration fills name, type, version and settings")
        void declaration() {
            assertEquals("MA Cross", ast.scriptName());
            assertEquals(5, ast.version());
            assertEquals(ScriptType.STRATEGY, ast.scriptType());
            assertTrue(ast.isStrategy());
            assertEquals("true", ast.settings().get("overlay"));
            assertEquals("10000", ast.settings().get("initial_capital"));
        }

        @Test
        @DisplayName("Inputs carry type, default, title and bounds")
        void inputs() {
            assertEquals(2, ast.inputs().size());
            Statement.InputNode fast = ast.inputs().get(0);
            assertEquals("fastLength", fast.name());
            assertEquals(InputType.INT, fast.type());
            assertEquals("9", fast.defaultValue());
            assertEquals("Fast Length", fast.title());
            assertEquals("1", fast.minValue());
            assertNull(fast.maxValue());
        }

        @Test
        @DisplayName("Variables keep normalized expression text")
        void variables() {
            assertEquals(2, ast.variables().size());
            assertEquals("fastMA", ast.variables().get(0).name());
            assertEquals("ta.sma(close, fastLength)", ast.variables().get(0).valueExpr());
            assertEquals(List.of("fastMA", "slowMA"), ast.variableNames());
        }

        @Test
        @DisplayName("Strategy calls inherit the enclosing condition")
        void strategyCalls() {
            assertEquals(2, ast.strategyCalls().size());
            Statement.StrategyCallNode entry = ast.strategyCalls().get(0);
            assertEquals(Statement.StrategyCallNode.CallType.ENTRY, entry.callType());
            assertEquals("Long", entry.id());
            assertEquals(Statement.StrategyCallNode.Direction.LONG, entry.direction());
            assertEquals("ta.crossover(fastMA, slowMA)", entry.when());

            Statement.StrategyCallNode close = ast.strategyCalls().get(1);
            assertEquals(Statement.StrategyCallNode.CallType.CLOSE, close.callType());
            assertEquals("ta.crossunder(fastMA, slowMA)", close.when());
        }

        @Test
        @DisplayName("Indicator usage is counted and sorted")
        void indicators() {
            assertEquals(List.of("ta.crossover", "ta.crossunder", "ta.sma"), ast.indicatorsUsed());
            assertEquals(2, ast.indicatorCalls().get("ta.sma"));
        }

        @Test
        @DisplayName("Plots, nesting and low complexity")
        void summary() {
            assertEquals(1, ast.plots().size());
            assertEquals("Fast", ast.plots().get(0).title());
            assertEquals("fastMA", ast.plots().get(0).seriesExpr());
            assertEquals(2, ast.conditions().size());
            assertEquals(1, ast.maxNestingDepth());
            assertTrue(ast.unsupported().isEmpty());
            assertFalse(ast.hasFunctions());
            assertTrue(ast.complexityScore() < 0.3, "score was " + ast.complexityScore());
            assertEquals(11, ast.totalLines());
            assertEquals(10, ast.codeLines());
        }
    }

    @Test
    @DisplayName("Else-if chain nests in the false branch, parents listed first")
    void elseIfChain() {
        PineAst ast = parser.parse("""
            x = 0.0
            if close > open
                x := 1
            else if close < open
                x := -1
            else
                x := 0
            """);

        assertEquals(2, ast.statements().size());
        Statement.ConditionNode outer = (Statement.ConditionNode) ast.statements().get(1);
        assertEquals("close > open", outer.conditionExpr());
        assertEquals(1, outer.trueBranch().size());
        assertEquals(1, outer.falseBranch().size());

        Statement.ConditionNode inner = (Statement.ConditionNode) outer.falseBranch().get(0);
        assertEquals("close < open", inner.conditionExpr());
        assertEquals("-1", ((Statement.VariableNode) inner.trueBranch().get(0)).valueExpr());
        assertEquals(":=", ((Statement.VariableNode) inner.falseBranch().get(0)).operator());

        assertEquals(List.of(outer, inner), ast.conditions());
        assertEquals(1, ast.maxNestingDepth());
        assertEquals(List.of("x"), ast.variableNames());
    }

    @Test
    @DisplayName("Nested guards and explicit when combine")
    void nestedGuards() {
        PineAst ast = parser.parse("""
            strategy("T")
            if close > open
                if volume > 0
                    strategy.entry("L", strategy.long, when=barstate.isconfirmed)
            """);

        assertEquals("(close > open) and (volume > 0) and (barstate.isconfirmed)",
            ast.strategyCalls().get(0).when());
        assertEquals(2, ast.maxNestingDepth());
    }

    @Test
    @DisplayName("Short entry and exit arguments")
    void exitArguments() {
        PineAst ast = parser.parse("""
            strategy("T")
            strategy.entry("S", strategy.short)
            strategy.exit("X", "S", stop=close * 0.98, limit=close * 1.04)
            """);

        Statement.StrategyCallNode entry = ast.strategyCalls().get(0);
        assertEquals(Statement.StrategyCallNode.Direction.SHORT, entry.direction());
        assertNull(entry.when());

        Statement.StrategyCallNode exit = ast.strategyCalls().get(1);
        assertEquals(Statement.StrategyCallNode.CallType.EXIT, exit.callType());
        assertEquals("S", exit.fromEntry());
        assertEquals("close * 0.98", exit.stop());
        assertEquals("close * 1.04", exit.limit());
    }

    @Test
    @DisplayName("Functions, types, loops and collections are detected")
    void advancedConstructs() {
        PineAst ast = parser.parse("""
            indicator("F")
            f(x) => x * 2
            type Pivot
                float price
                int bar
            for i = 0 to 10
                y = i
            var float[] arr = array.new_float(0)
            """);

        assertEquals(ScriptType.INDICATOR, ast.scriptType());
        assertEquals(1, ast.functions().size());
        Statement.FunctionNode f = ast.functions().get(0);
        assertEquals("f", f.name());
        assertEquals("x * 2", f.body());
        assertEquals("x", f.parameters().get(0).name());

        assertEquals(1, ast.customTypes().size());
        assertEquals(List.of("float price", "int bar"), ast.customTypes().get(0).fields());

        assertEquals(1, ast.unsupported().size());
        assertEquals("for loop", ast.unsupported().get(0).construct());

        Statement.VariableNode arr = ast.variables().get(0);
        assertEquals("arr", arr.name());
        assertEquals("float[]", arr.declaredType());
        assertTrue(arr.isPersistent());
        assertEquals(2, ast.arrayMatrixReferences());
        assertTrue(ast.hasArrayMatrixOps());
    }

    @Test
    @DisplayName("Tuple assignment")
    void tuple() {
        PineAst ast = parser.parse("[m, s, h] = ta.macd(close, 12, 26, 9)");
        assertEquals(List.of("m", "s", "h"), ast.tupleAssignments().get(0).names());
        assertEquals("ta.macd(close, 12, 26, 9)", ast.tupleAssignments().get(0).valueExpr());
        assertEquals(List.of("m", "s", "h"), ast.variableNames());
    }

    @Test
    @DisplayName("Drawing objects are captured as plots and counted")
    void drawings() {
        PineAst ast = parser.parse("""
            line.new(bar_index, high, bar_index + 1, low)
            lbl = label.new(bar_index, high, "x")
            """);
        assertEquals(2, ast.drawingObjects());
        assertEquals(2, ast.plots().size());
        assertTrue(ast.plots().get(0).isDrawing());
        assertEquals("label.new", ast.plots().get(1).kind());
    }

    @Test
    @DisplayName("if-expression is unsupported")
    void ifExpression() {
        PineAst ast = parser.parse("""
            x = if close > open
                1
            else
                0
            """);
        assertTrue(ast.unsupported().stream().anyMatch(u -> u.construct().equals("if expression")));
    }

    @Test
    @DisplayName("Empty and null sources parse to an empty AST")
    void emptySource() {
        PineAst empty = parser.parse("");
        assertEquals("Unknown", empty.scriptName());
        assertEquals(5, empty.version());
        assertTrue(empty.statements().isEmpty());
        assertEquals(0.0, empty.complexityScore());

        assertTrue(parser.parse(null).statements().isEmpty());
    }

    @Test
    @DisplayName("Version header is read, an out-of-range one falls back to the default")
    void versionHeader() {
        assertEquals(4, parser.parse("//@version=4\nx = close\n").version());

        PineAst overlong = assertDoesNotThrow(() -> parser.parse("//@version=99999999999\nx = close\n"));
        assertEquals(5, overlong.version());
        assertEquals(List.of("x"), overlong.variableNames());
    }

    @Test
    @DisplayName("Malformed lines never throw")
    void malformed() {
        assertDoesNotThrow(() -> parser.parse("x = (\n)))\nif\n    @@\nstrategy.entry("));
    }
}
