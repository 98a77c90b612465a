package com.pinery.converter.codegen;

import com.pinery.converter.context.TransformationContext;
import com.pinery.converter.python.PythonSyntaxValidator;
import com.pinery.converter.python.SyntaxCheckResult;
import com.pinery.core.dsl.ExprNode;
import com.pinery.core.dsl.ExpressionParser;
import com.pinery.core.dsl.ParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Pine expression to Python expression building.
 */
class PythonCodeBuilderTest {

    private PythonCodeBuilder builder;
    private TransformationContext context;

    @BeforeEach
    void setUp() {
        builder = new PythonCodeBuilder();
        context = new TransformationContext();
    }

    private String build(String pine) {
        return builder.build(pine, context);
    }

    private String buildWithState(String pine) {
        context.addState("peak", "self.peak");
        return build(pine);
    }

    @Nested
    @DisplayName("History access")
    class History {

        @Test
        @DisplayName("Offset 1 on both operands reads the previous bar")
        void previousBar() {
            ExprNode node = new ExpressionParser().parse("close[1] > open[1]");
            ExprNode.Binary binary = assertInstanceOf(ExprNode.Binary.class, node);
            assertInstanceOf(ExprNode.ArrayAccess.class, binary.left());
            assertInstanceOf(ExprNode.ArrayAccess.class, binary.right());

            assertEquals("self.close.shift(1) > self.open.shift(1)", builder.build(node, context));
        }

        @Test
        @DisplayName("Offset 0 is the current bar")
        void currentBar() {
            assertEquals("self.close", build("close[0]"));
        }

        @Test
        @DisplayName("Composite targets are parenthesized before shifting")
        void compositeTarget() {
            assertEquals("((self.high + self.low) / 2).shift(2)", build("hl2[2]"));
            assertEquals("myValue.shift(length)", build("myValue[length]"));
        }
    }

    @Nested
    @DisplayName("Precedence")
    class Precedence {

        @Test
        @DisplayName("Grouping survives when it changes meaning")
        void grouping() {
            assertEquals("(a + b) * c", build("(a + b) * c"));
            assertEquals("a + b * c", build("a + b * c"));
            assertEquals("a - (b - c)", build("a - (b - c)"));
            assertEquals("a - b - c", build("a - b - c"));
        }

        @Test
        @DisplayName("Comparisons never chain")
        void comparisons() {
            assertEquals("(a < b) == c", build("(a < b) == c"));
        }

        @Test
        @DisplayName("Multi-term built-ins are wrapped when nested")
        void builtinText() {
            assertEquals("(len(self.close) - 1) * 2", build("bar_index * 2"));
            assertEquals("len(self.close) - 1", build("bar_index"));
        }

        @Test
        @DisplayName("Unary minus binds to its operand")
        void unaryMinus() {
            assertEquals("-self.close", build("-close"));
            assertEquals("-(self.close - self.open)", build("-(close - open)"));
        }
    }

    @Nested
    @DisplayName("Series logic")
    class SeriesLogic {

        @Test
        @DisplayName("and/or become element-wise operators with comparisons parenthesized")
        void compound() {
            context.addVariable("ma", "ma");
            assertEquals("(self.close > ma) & (self.close > self.open)", build("close > ma and close > open"));
            assertEquals("(self.close < ma) | (self.volume > 0)", build("close < ma or volume > 0"));
        }

        @Test
        @DisplayName("Mixed and/or keep Pine grouping explicitly")
        void mixed() {
            assertEquals("a | (b & c)", build("a or b and c"));
            assertEquals("(a | b) & c", build("(a or b) and c"));
            assertEquals("a & b & c", build("a and b and c"));
        }

        @Test
        @DisplayName("not becomes np.logical_not")
        void negation() {
            assertEquals("np.logical_not(a & b)", build("not (a and b)"));
            assertEquals("np.logical_not(self.close > self.open)", build("not (close > open)"));
            assertEquals("np.logical_not((self.close > 1) & (self.open > 1))", build("not (close > 1 and open > 1)"));
        }

        @Test
        @DisplayName("Conditional expressions go through the element-wise helper")
        void conditional() {
            assertEquals("self._where(self.close > self.open, 1, 0)", build("close > open ? 1 : 0"));
            assertEquals("self._where(a, self._where(b, 1, 2), 3)", build("a ? b ? 1 : 2 : 3"));
            assertEquals("self._where(a, 1, 2) + 1", build("(a ? 1 : 2) + 1"));
        }

        @Test
        @DisplayName("No Python boolean keyword survives in built conditions")
        void noKeywords() {
            String python = build("not na(x) and (close > open or close[1] > open[1]) ? 1 : 0");
            assertFalse(python.matches(".*\\b(and|or|not|if|else)\\b.*"), python);
        }
    }

    @Nested
    @DisplayName("Scalars")
    class Scalars {

        @Test
        @DisplayName("History on a persistent variable reads the value and warns")
        void persistentHistory() {
            context.addState("peak", "self.peak");
            assertEquals("self.close < self.peak", build("close < peak[1]"));
            assertEquals(1, context.warnings().size());
            assertTrue(context.warnings().get(0).contains("'peak'"));

            build("peak[2] > 0");
            assertEquals(1, context.warnings().size());
        }

        @Test
        @DisplayName("History on a non-source input is the input itself")
        void constantHistory() {
            context.addConstant("length", "self.length");
            assertEquals("self.length", build("length[1]"));
            assertTrue(context.warnings().isEmpty());
        }

        @Test
        @DisplayName("Series variables still shift")
        void seriesHistory() {
            context.addVariable("src", "self._source(self.src)");
            assertEquals("self._source(self.src).shift(1)", build("src[1]"));
        }
    }

    @Nested
    @DisplayName("Calls")
    class Calls {

        @Test
        @DisplayName("Indicators become one registry dispatch and are recorded")
        void indicatorDispatch() {
            assertEquals("self.indicators.calculate(\"ta.sma\", self.close, 20)", build("ta.sma(close, 20)"));
            assertEquals("self.indicators.calculate(\"ta.rsi\", source=self.close, length=14)",
                build("ta.rsi(source=close, length=14)"));
            assertEquals(List.of("ta.rsi", "ta.sma"), List.copyOf(context.indicatorsUsed()));
        }

        @Test
        @DisplayName("Unknown indicators are dispatched the same way")
        void unknownIndicator() {
            assertEquals("self.indicators.calculate(\"ta.mystery\", self.close)", build("ta.mystery(close)"));
            assertTrue(context.indicatorsUsed().contains("ta.mystery"));
        }

        @Test
        @DisplayName("Math and helper functions map to Python equivalents")
        void helpers() {
            assertEquals("abs(self.close - self.open)", build("math.abs(close - open)"));
            assertEquals("np.power(x, 2)", build("math.pow(x, 2)"));
            assertEquals("np.maximum(self.peak, self.high)", buildWithState("math.max(peak, high)"));
            assertEquals("np.minimum(np.minimum(self.low, a), b)", build("math.min(low, a, b)"));
            assertEquals("(self.high + self.low) / 2", build("math.avg(high, low)"));
            assertEquals("self._nz(x, 0)", build("nz(x, 0)"));
            assertEquals("self._is_na(x)", build("na(x)"));
            assertEquals("myFunc(1)", build("myFunc(1)"));
        }

        @Test
        @DisplayName("User variables shadow namespace roots")
        void variableMember() {
            context.declareLocal("ta");
            assertEquals("ta.value", build("ta.value"));
        }
    }

    @Test
    @DisplayName("Literals and variables")
    void literals() {
        context.addVariable("length", "self.length");
        assertEquals("self.length", build("length"));
        assertEquals("\"abc\"", build("\"abc\""));
        assertEquals("np.nan", build("na"));
        assertEquals("True", build("true"));
        assertEquals("1.5", build("1.5"));
    }

    @Test
    @DisplayName("Assignment operator maps to plain assignment")
    void operators() {
        assertEquals("=", PythonCodeBuilder.pythonOperator(":="));
        assertEquals("+=", PythonCodeBuilder.pythonOperator("+="));
    }

    @Test
    @DisplayName("Malformed input raises a parse error")
    void malformed() {
        assertThrows(ParseException.class, () -> build("close +"));
    }

    @ParameterizedTest
    @DisplayName("Built expressions are valid Python")
    @ValueSource(strings = {
        "close[1] > open[1]",
        "ta.crossover(ta.ema(close, 9), ta.ema(close, 21))",
        "(high - low) / close * 100",
        "rsi < 30 and close > ta.sma(close, 200)",
        "not na(x) ? nz(x[1]) : -1",
        "math.max(high, close[2]) - math.min(low, low[1])",
        "bar_index % 2 == 0 or barstate.islast",
        "a ? b ? 1 : 2 : 3",
        "hlc3[3] >= ohlc4",
        "ta.macd(close, 12, 26, 9)",
        "strategy.position_size > 0",
        "close - close[10] != 0",
        "close > open and not (high[1] > high) or volume > 0",
        "math.max(high, low, close) - math.avg(open, close)"
    })
    void validPython(String pine) {
        String python = build(pine);
        SyntaxCheckResult result = new PythonSyntaxValidator().validateExpression(python);
        assertTrue(result.valid(), python + " -> " + result.describe());
    }
}
