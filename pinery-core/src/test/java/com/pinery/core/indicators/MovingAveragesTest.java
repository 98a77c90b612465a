package com.pinery.core.indicators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for moving averages.
 */
class MovingAveragesTest {

    private static final double NaN = Double.NaN;
    private static final double[] ONE_TO_FIVE = {1, 2, 3, 4, 5};

    @Test
    @DisplayName("SMA is NaN until the window fills")
    void sma() {
        assertArrayEquals(new double[]{NaN, NaN, 2, 3, 4}, MovingAverages.sma(ONE_TO_FIVE, 3), 1e-9);
    }

    @Test
    @DisplayName("EMA is seeded with the SMA and uses alpha 2/(n+1)")
    void ema() {
        assertArrayEquals(new double[]{NaN, NaN, 2, 3, 4}, MovingAverages.ema(ONE_TO_FIVE, 3), 1e-9);
    }

    @Test
    @DisplayName("RMA uses alpha 1/n and differs from EMA")
    void rma() {
        double[] rma = MovingAverages.rma(ONE_TO_FIVE, 3);
        assertEquals(2.0, rma[2], 1e-9);
        assertEquals(8.0 / 3.0, rma[3], 1e-9);
        assertEquals(31.0 / 9.0, rma[4], 1e-9);
        assertNotEquals(MovingAverages.ema(ONE_TO_FIVE, 3)[4], rma[4]);
    }

    @Test
    @DisplayName("Leading NaN shifts the seed")
    void leadingNaN() {
        double[] ema = MovingAverages.ema(new double[]{NaN, 1, 2, 3}, 2);
        assertTrue(Double.isNaN(ema[1]));
        assertEquals(1.5, ema[2], 1e-9);
        assertEquals(2.5, ema[3], 1e-9);
    }

    @Test
    @DisplayName("WMA weights the newest bar most")
    void wma() {
        assertEquals(14.0 / 6.0, MovingAverages.wma(new double[]{1, 2, 3}, 3)[2], 1e-9);
    }

    @Test
    @DisplayName("HMA is wma(2 * wma(n/2) - wma(n), round(sqrt(n)))")
    void hma() {
        double[] src = SampleBars.wave(40).close();
        double[] raw = new double[src.length];
        double[] half = MovingAverages.wma(src, 4);
        double[] full = MovingAverages.wma(src, 9);
        for (int i = 0; i < src.length; i++) {
            raw[i] = 2 * half[i] - full[i];
        }
        assertArrayEquals(MovingAverages.wma(raw, 3), MovingAverages.hma(src, 9), 1e-9);
    }

    @Test
    @DisplayName("Output length always equals input length")
    void lengthPreserved() {
        double[] src = SampleBars.wave(30).close();
        assertEquals(30, MovingAverages.dema(src, 5).length);
        assertEquals(30, MovingAverages.tema(src, 5).length);
        assertEquals(30, MovingAverages.alma(src, 9, 0.85, 6).length);
        assertEquals(30, MovingAverages.swma(src).length);
    }

    @Test
    @DisplayName("Linear regression of a straight line reproduces it")
    void linreg() {
        double[] line = {1, 3, 5, 7, 9, 11};
        double[] result = MovingAverages.linreg(line, 4, 0);
        assertEquals(11.0, result[5], 1e-9);
        assertEquals(9.0, MovingAverages.linreg(line, 4, 1)[5], 1e-9);
    }
}
