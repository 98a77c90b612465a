package com.pinery.converter.context;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for scoped name resolution and the shared indicator set.
 */
class TransformationContextTest {

    private TransformationContext context;

    @BeforeEach
    void setUp() {
        context = new TransformationContext();
    }

    @Nested
    @DisplayName("Built-ins")
    class Builtins {

        @Test
        @DisplayName("Price series map to instance attributes")
        void priceSeries() {
            assertEquals("self.close", context.resolveName("close"));
            assertEquals("(self.high + self.low) / 2", context.resolveName("hl2"));
            assertEquals("np.nan", context.resolveName("na"));
            assertEquals("True", context.resolveName("true"));
        }

        @Test
        @DisplayName("Dotted built-ins resolve as a whole")
        void dotted() {
            assertTrue(context.isBuiltin("barstate.isconfirmed"));
            assertEquals("self.position_size", context.mapBuiltin("strategy.position_size"));
            assertEquals("np.pi", context.mapBuiltin("math.pi"));
        }

        @Test
        @DisplayName("Unknown built-in is rejected, unknown names pass through")
        void unknown() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> context.mapBuiltin("nope"));
            assertTrue(e.getMessage().contains("Unknown built-in"));
            assertEquals("myValue", context.resolveName("myValue"));
        }
    }

    @Nested
    @DisplayName("Scopes")
    class Scopes {

        @Test
        @DisplayName("Child scope sees parent variables, parent does not see child's")
        void lookup() {
            context.addVariable("length", "self.length");
            TransformationContext child = context.createChildContext();
            child.declareLocal("inner");

            assertEquals(1, child.scopeLevel());
            assertSame(context, child.parent());
            assertEquals("self.length", child.resolveName("length"));
            assertTrue(child.hasVariable("inner"));
            assertFalse(context.hasVariable("inner"));
        }

        @Test
        @DisplayName("Indicators recorded in a child are visible to the parent")
        void sharedIndicators() {
            TransformationContext child = context.createChildContext().createChildContext();
            child.addIndicator("ta.sma");
            context.addIndicator("ta.ema");

            assertSame(context.shared(), child.shared());
            assertEquals(List.of("ta.ema", "ta.sma"), List.copyOf(context.indicatorsUsed()));
        }

        @Test
        @DisplayName("Merging an independent context copies its indicators")
        void mergeIndependent() {
            TransformationContext other = new TransformationContext();
            other.addIndicator("ta.rsi");
            context.mergeFromChild(other);
            assertTrue(context.indicatorsUsed().contains("ta.rsi"));
        }
    }

    @Test
    @DisplayName("Reserved Python names get a trailing underscore")
    void reservedNames() {
        assertEquals("len_", context.declareLocal("len"));
        assertEquals("lambda_", context.declareLocal("lambda"));
        assertEquals("fastMA", context.declareLocal("fastMA"));
        assertEquals("len_", context.resolveName("len"));
    }

    @Test
    @DisplayName("Function mapping")
    void functions() {
        assertEquals("self._nz", PineFunctions.map("nz"));
        assertEquals("abs", PineFunctions.map("math.abs"));
        assertEquals("np.power", PineFunctions.map("math.pow"));
        assertEquals("np.sqrt", PineFunctions.map("math.sqrt"));
        assertEquals("np.maximum", PineFunctions.map("math.max"));
        assertEquals("np.minimum", PineFunctions.map("math.min"));
        assertNull(PineFunctions.map("myFunction"));
    }

    @Test
    @DisplayName("Constant and state markers are visible from child scopes")
    void scalarMarkers() {
        context.addConstant("length", "self.length");
        context.addState("peak", "self.peak");
        TransformationContext child = context.createChildContext();
        child.declareLocal("local");

        assertTrue(child.isConstant("length"));
        assertTrue(child.isState("peak"));
        assertFalse(child.isState("length"));
        assertFalse(child.isConstant("local"));
        assertFalse(context.isState("unknown"));
        assertEquals("self.peak", child.resolveName("peak"));
    }

    @Test
    @DisplayName("Warnings are shared across scopes and recorded once")
    void sharedWarnings() {
        context.createChildContext().addWarning("first");
        context.addWarning("first");
        context.addWarning("second");
        assertEquals(List.of("first", "second"), context.warnings());
    }
}
