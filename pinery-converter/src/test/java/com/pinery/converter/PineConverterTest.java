package com.pinery.converter;

import com.pinery.converter.codegen.GeneratedCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for source-text conversion.
 */
class PineConverterTest {

    private final PineConverter converter = new PineConverter();

    @Test
    @DisplayName("RSI reversal script converts from source text")
    void convertsSource() throws ConverterException {
        GeneratedCode code = converter.convert("""
            //@version=5
            strategy("RSI Reversal", overlay=true)
            rsiLength = input.int(14, "RSI Length", minval=1)
            oversold = input.int(30, "Oversold")
            r = ta.rsi(close, rsiLength)
            if ta.crossover(r, oversold)
                strategy.entry("Long", strategy.long)
            if ta.crossunder(r, 70)
                strategy.close("Long")
            """);

        assertTrue(code.isSuccess());
        assertEquals("RSIReversal", code.className());
        assertEquals("14", code.parameters().get("rsiLength"));
        assertTrue(code.fullCode().contains("self.rsiLength = self.params.get(\"rsiLength\", 14)  # RSI Length [1..]"));
        assertTrue(code.fullCode().contains("self.min_candles = 50"));
        assertTrue(code.fullCode().contains("return self._signal(\"close\", 0.8, \"Long\")"));
    }

    @Test
    @DisplayName("canConvert reports reasons without generating")
    void canConvert() {
        assertFalse(converter.canConvert("""
            strategy("Types")
            type Pivot
                float price
                int index
            """).valid());
    }
}
