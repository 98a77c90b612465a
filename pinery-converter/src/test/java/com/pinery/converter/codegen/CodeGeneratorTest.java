package com.pinery.converter.codegen;

import com.pinery.converter.python.OutputContract;
import com.pinery.converter.python.SyntaxCheckResult;
import com.pinery.core.config.PineryConfig;
import com.pinery.core.indicators.registry.IndicatorRegistryInitializer;
import com.pinery.core.script.PineAst;
import com.pinery.core.script.ScriptParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for whole-module Python generation.
 */
class CodeGeneratorTest {

    private static final String SMA_CROSS = """
        //@version=5
        strategy("SMA Cross")
        length = input(20)
        ma = ta.sma(close, length)
        if ta.crossover(close, ma)
            strategy.entry("Long", strategy.long)
        """;

    private ScriptParser parser;
    private CodeGenerator generator;

    @BeforeEach
    void setUp() {
        parser = new ScriptParser();
        generator = new CodeGenerator();
    }

    private GeneratedCode generate(String source) {
        GeneratedCode code = generator.generate(parser.parse(source));
        assertTrue(code.isSuccess(), () -> code.errors() + "\n" + code.fullCode());
        SyntaxCheckResult check = OutputContract.check(code.fullCode());
        assertTrue(check.valid(), () -> check.describe() + "\n" + code.fullCode());
        return code;
    }

    @Nested
    @DisplayName("Crossover strategy")
    class Crossover {

        private GeneratedCode code;

        @BeforeEach
        void generateOnce() {
            code = generate(SMA_CROSS);
        }

        @Test
        @DisplayName("Input becomes a parameter with its default")
        void parameter() {
            assertTrue(code.fullCode().contains("self.length = self.params.get(\"length\", 20)"));
            assertEquals(Map.of("length", "20"), code.parameters());
        }

        @Test
        @DisplayName("One registry dispatch for the moving average")
        void dispatch() {
            String full = code.fullCode();
            assertTrue(full.contains("ma = self.indicators.calculate(\"ta.sma\", self.close, self.length)"));
            assertEquals(full.indexOf("calculate(\"ta.sma\""), full.lastIndexOf("calculate(\"ta.sma\""));
            assertEquals(List.of("ta.crossover", "ta.sma"), code.indicatorsUsed());
            assertTrue(full.contains("from indicator_runtime import IndicatorRegistry"));
            assertTrue(full.contains("self.indicators = IndicatorRegistry()"));
            assertTrue(full.contains("self.indicators.bind(df)"));
        }

        @Test
        @DisplayName("One buy branch guarded by the crossover")
        void entry() {
            String full = code.fullCode();
            assertTrue(full.contains(
                "            if self._last(self.indicators.calculate(\"ta.crossover\", self.close, ma)):\n"
                    + "                return self._signal(\"buy\", 0.75, \"Long\")\n"));
            assertEquals(full.indexOf("\"buy\""), full.lastIndexOf("\"buy\""));
        }

        @Test
        @DisplayName("Class, metadata and warm-up")
        void metadata() {
            String full = code.fullCode();
            assertEquals("SMACross", code.className());
            assertTrue(full.startsWith("\"\"\"\nStrategy: SMA Cross\n"));
            assertTrue(full.contains("class SMACross:"));
            assertTrue(full.contains("Conversion mode: rule-based"));
            assertTrue(full.contains("self.min_candles = 100"));
            assertTrue(full.contains("def generate_signal(current_price, candles, params=None, current_position=None):"));
            assertTrue(full.endsWith("return SMACross(params).generate_signal(current_price, candles, current_position)\n"));
            assertTrue(code.imports().startsWith("import pandas as pd\nimport numpy as np"));
        }
    }

    @Test
    @DisplayName("MACD tuple keeps its three outputs in order")
    void macdTuple() {
        GeneratedCode code = generate("""
            strategy("MACD")
            [m, s, h] = ta.macd(close, 12, 26, 9)
            if ta.crossover(m, s)
                strategy.entry("L", strategy.long)
            """);
        assertTrue(code.fullCode().contains(
            "m, s, h = self.indicators.calculate(\"ta.macd\", self.close, 12, 26, 9)  # macd, signal, histogram"));
        assertEquals(List.of("ta.crossover", "ta.macd"), code.indicatorsUsed());
    }

    @Test
    @DisplayName("Exit levels attach to their entry, closes go under the open-position branch")
    void exits() {
        GeneratedCode code = generate("""
            strategy("Bracket")
            fast = ta.ema(close, 9)
            slow = ta.ema(close, 21)
            if ta.crossunder(fast, slow)
                strategy.entry("S", strategy.short)
            strategy.exit("X", "S", stop=close * 1.02, limit=close * 0.96)
            if ta.crossover(fast, slow)
                strategy.close("S")
            """);
        String full = code.fullCode();
        assertTrue(full.contains(
            "return self._signal(\"sell\", 0.75, \"S\", stop=self.close * 1.02, target=self.close * 0.96)"));
        assertTrue(full.contains(
            "        if current_position:\n"
                + "            if self._last(self.indicators.calculate(\"ta.crossover\", fast, slow)):\n"
                + "                return self._signal(\"close\", 0.8, \"S\")\n"));
    }

    @Test
    @DisplayName("Else-if chains become elif")
    void elseIf() {
        String full = generate("""
            strategy("Chain")
            x = 0.0
            if close > open
                x := 1
            else if close < open
                x := -1
            else
                x := 0
            if x > 0
                strategy.entry("L", strategy.long)
            """).fullCode();
        assertTrue(full.contains("""
                    if self._last(self.close > self.open):
                        x = 1
                    elif self._last(self.close < self.open):
                        x = -1
                    else:
                        x = 0
            """));
    }

    @Nested
    @DisplayName("Element-wise conditions")
    class Conditions {

        @Test
        @DisplayName("Compound condition and its else branch")
        void compoundAndElse() {
            String full = generate("""
                strategy("Logic")
                ma = ta.sma(close, 20)
                if close > ma and close > open
                    strategy.entry("L", strategy.long)
                else
                    strategy.entry("S", strategy.short)
                """).fullCode();
            assertTrue(full.contains("if self._last((self.close > ma) & (self.close > self.open)):\n"), full);
            assertTrue(full.contains(
                "if self._last(np.logical_not((self.close > ma) & (self.close > self.open))):\n"), full);
            assertFalse(full.contains("self.close > ma and"), full);
        }

        @Test
        @DisplayName("Nested if guards are joined element-wise")
        void nestedGuards() {
            String full = generate("""
                strategy("Nested")
                ma = ta.sma(close, 20)
                if close > ma
                    if volume > 0
                        strategy.entry("L", strategy.long)
                """).fullCode();
            assertTrue(full.contains("if self._last((self.close > ma) & (self.volume > 0)):\n"), full);
        }

        @Test
        @DisplayName("Conditional expression uses the element-wise helper")
        void ternary() {
            String full = generate("""
                strategy("Side")
                side = close > open ? 1 : -1
                if side > 0
                    strategy.entry("L", strategy.long)
                """).fullCode();
            assertTrue(full.contains("side = self._where(self.close > self.open, 1, -1)"), full);
            assertTrue(full.contains("def _where(self, condition, when_true, when_false):"));
        }
    }

    @Test
    @DisplayName("Persistent maximum with history access")
    void persistentPeak() {
        GeneratedCode code = generate("""
            strategy("Peak")
            var float peak = 0.0
            peak := math.max(peak, high)
            if close < peak[1]
                strategy.entry("S", strategy.short)
            """);
        String full = code.fullCode();
        assertTrue(full.contains("self.peak = 0.0  # State variable (var)"), full);
        assertTrue(full.contains("self.peak = self._last(np.maximum(self.peak, self.high))"), full);
        assertTrue(full.contains("if self._last(self.close < self.peak):"), full);
        assertFalse(full.contains("self.peak.shift"), full);
        assertTrue(code.warnings().stream().anyMatch(w -> w.contains("persistent variable 'peak'")));
    }

    @Test
    @DisplayName("One generator serves concurrent conversions")
    void concurrentGeneration() throws Exception {
        List<String> sources = List.of(
            SMA_CROSS,
            "strategy(\"R\")\nr = ta.rsi(close, 14)\nif r < 30 and close > open\n    strategy.entry(\"L\", strategy.long)\n",
            "strategy(\"M\")\n[m, s, h] = ta.macd(close, 12, 26, 9)\nif ta.crossover(m, s)\n    strategy.entry(\"L\", strategy.long)\n",
            "strategy(\"E\")\nlen = input.int(30, \"Len\")\ne = ta.ema(close, len)\nx = close > e ? 1 : 0\n");
        List<String> expected = new ArrayList<>();
        for (String source : sources) {
            expected.add(generate(source).fullCode());
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> futures = new ArrayList<>();
            for (int round = 0; round < 25; round++) {
                for (String source : sources) {
                    futures.add(pool.submit(() -> generator.generate(parser.parse(source)).fullCode()));
                }
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(expected.get(i % sources.size()), futures.get(i).get());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Persistent variables live on the instance")
    void persistentState() {
        GeneratedCode code = generate("""
            strategy("Count")
            var int count = 0
            var float anchor = close
            if close > open
                count := count + 1
            """);
        String full = code.fullCode();
        assertTrue(full.contains("self.count = 0  # State variable (var)"));
        assertTrue(full.contains("self.anchor = 0  # State variable (var), initializer not inferred: close"));
        assertTrue(full.contains("self.count = self._last(self.count + 1)"));
        assertTrue(code.warnings().stream().anyMatch(w -> w.contains("'anchor' approximated as 0")));
    }

    @Test
    @DisplayName("Source inputs resolve through the source helper")
    void sourceInput() {
        GeneratedCode code = generate("""
            strategy("Src")
            src = input(close, "Source")
            ma = ta.sma(src, 10)
            """);
        String full = code.fullCode();
        assertTrue(full.contains("self.src = self.params.get(\"src\", \"close\")  # Source"));
        assertTrue(full.contains("ma = self.indicators.calculate(\"ta.sma\", self._source(self.src), 10)"));
    }

    @Test
    @DisplayName("An untranslatable expression degrades to a placeholder")
    void placeholder() {
        GeneratedCode code = generate("""
            strategy("Broken")
            x = close + * open
            y = close * 2
            """);
        assertTrue(code.fullCode().contains("x = np.nan  # could not translate"));
        assertTrue(code.fullCode().contains("y = self.close * 2"));
        assertTrue(code.warnings().stream().anyMatch(w -> w.contains("could not translate")));
    }

    @Test
    @DisplayName("Unknown indicators are dispatched and reported")
    void unknownIndicator() {
        GeneratedCode code = generate("""
            strategy("Mystery")
            v = ta.mystery(close)
            """);
        assertTrue(code.fullCode().contains("v = self.indicators.calculate(\"ta.mystery\", self.close)"));
        assertTrue(code.warnings().stream().anyMatch(w -> w.contains("ta.mystery")));
    }

    @Test
    @DisplayName("Same AST, same bytes")
    void deterministic() {
        PineAst ast = parser.parse(SMA_CROSS);
        String first = generator.generate(ast).fullCode();
        String second = generator.generate(ast).fullCode();
        String third = new CodeGenerator().generate(parser.parse(SMA_CROSS)).fullCode();
        assertEquals(first, second);
        assertEquals(first, third);
    }

    @Nested
    @DisplayName("Warm-up length")
    class WarmUp {

        @Test
        @DisplayName("Short oscillator keeps the default")
        void shortLength() {
            assertTrue(generate("strategy(\"R\")\nr = ta.rsi(close, 14)\n").fullCode().contains("self.min_candles = 50"));
        }

        @Test
        @DisplayName("Literal length above 50")
        void longLiteral() {
            assertTrue(generate("strategy(\"R\")\nr = ta.rsi(close, 60)\n").fullCode().contains("self.min_candles = 100"));
        }

        @Test
        @DisplayName("Length taken from an input default")
        void longInput() {
            String full = generate("strategy(\"A\")\nperiod = input.int(200, \"Period\")\na = ta.atr(period)\n").fullCode();
            assertTrue(full.contains("self.min_candles = 100"));
        }
    }

    @Nested
    @DisplayName("Validation and repair")
    class Repair {

        private final PineAst ast = new ScriptParser().parse("strategy(\"T\")\nx = close\n");

        @Test
        @DisplayName("Indentation off by one is repaired once")
        void repaired() {
            StrategyTemplate template = new StrategyTemplate(
                "def generate_signal(current_price):\n    x = 1\n     return x\n");
            CodeGenerator custom = new CodeGenerator(PineryConfig.defaults(), IndicatorRegistryInitializer.standard(),
                template, new CodeFormatter());
            GeneratedCode code = custom.generate(ast);

            assertTrue(code.isSuccess(), code.errors()::toString);
            assertEquals("def generate_signal(current_price):\n    x = 1\n    return x\n", code.fullCode());
            assertTrue(code.warnings().stream().anyMatch(w -> w.contains("repair")));
        }

        @Test
        @DisplayName("Code that stays invalid is an error result with the draft")
        void failed() {
            StrategyTemplate template = new StrategyTemplate("def generate_signal(current_price):\n{{variables}}\n");
            CodeGenerator custom = new CodeGenerator(PineryConfig.defaults(), IndicatorRegistryInitializer.standard(),
                template, new CodeFormatter());
            GeneratedCode code = custom.generate(ast);

            assertFalse(code.isSuccess());
            assertTrue(code.errors().get(0).startsWith("Generated code failed validation"));
            assertTrue(code.fullCode().contains("x = self.close"));
        }
    }

    @ParameterizedTest
    @DisplayName("Class names")
    @CsvSource(delimiter = '|', value = {
        "MA Cross|MACross",
        "3 Bar Play|Strategy3BarPlay",
        "my-strategy v2|MystrategyV2",
        "rsi_divergence|Rsi_divergence",
        "!!!|GeneratedStrategy"
    })
    void classNames(String scriptName, String expected) {
        assertEquals(expected, CodeGenerator.className(scriptName));
    }

    @Test
    @DisplayName("Empty name falls back to the generic class")
    void emptyClassName() {
        assertEquals("GeneratedStrategy", CodeGenerator.className(""));
        assertEquals("GeneratedStrategy", CodeGenerator.className(null));
    }
}
