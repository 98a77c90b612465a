package com.pinery.core.indicators;

import java.util.Arrays;
import java.util.function.IntToDoubleFunction;

/**
 * Aligned OHLCV columns, oldest bar first.
 */
public record Bars(double[] open, double[] high, double[] low, double[] close, double[] volume) {

    public Bars {
        int n = close.length;
        if (open.length != n || high.length != n || low.length != n || volume.length != n) {
            throw new IllegalArgumentException("OHLCV columns must have equal length");
        }
    }

    public static Bars of(double[] open, double[] high, double[] low, double[] close, double[] volume) {
        return new Bars(open, high, low, close, volume);
    }

    /**
     * Bars built from a close series only: open, high and low equal close and volume is zero.
     */
    public static Bars ofClose(double... close) {
        double[] copy = close.clone();
        return new Bars(copy, copy, copy, copy, new double[copy.length]);
    }

    public static Bars empty() {
        return new Bars(new double[0], new double[0], new double[0], new double[0], new double[0]);
    }

    public int size() {
        return close.length;
    }

    /**
     * Price series by Pine name, derived sources included.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public double[] series(String name) {
        return switch (name) {
            case "open" -> open;
            case "high" -> high;
            case "low" -> low;
            case "close" -> close;
            case "volume" -> volume;
            case "hl2" -> combine(i -> (high[i] + low[i]) / 2);
            case "hlc3" -> combine(i -> (high[i] + low[i] + close[i]) / 3);
            case "ohlc4" -> combine(i -> (open[i] + high[i] + low[i] + close[i]) / 4);
            case "hlcc4" -> combine(i -> (high[i] + low[i] + close[i] + close[i]) / 4);
            default -> throw new IllegalArgumentException("Unknown price series: " + name);
        };
    }

    private double[] combine(IntToDoubleFunction f) {
        double[] result = new double[size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = f.applyAsDouble(i);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Bars other
            && Arrays.equals(open, other.open) && Arrays.equals(high, other.high)
            && Arrays.equals(low, other.low) && Arrays.equals(close, other.close)
            && Arrays.equals(volume, other.volume);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(close);
    }

    @Override
    public String toString() {
        return "Bars[" + size() + "]";
    }
}
