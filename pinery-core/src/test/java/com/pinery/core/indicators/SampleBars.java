package com.pinery.core.indicators;

/**
 * Deterministic OHLCV fixture: a gently rising sine wave.
 */
public final class SampleBars {

    private SampleBars() {}

    public static Bars wave(int n) {
        double[] open = new double[n];
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        double[] volume = new double[n];
        for (int i = 0; i < n; i++) {
            close[i] = 100 + 10 * Math.sin(i / 5.0) + i * 0.2;
            open[i] = close[i] - 0.5;
            high[i] = close[i] + 1;
            low[i] = close[i] - 1;
            volume[i] = 1000 + i;
        }
        return Bars.of(open, high, low, close, volume);
    }
}
