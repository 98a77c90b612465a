package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

import java.util.Arrays;

/**
 * Moving averages: sma, ema, wma, rma, hma, vwma, swma, alma, dema, tema, linreg.
 *
 * EMA and RMA share one recurrence and differ only in alpha: 2 / (length + 1) for EMA,
 * 1 / length (Wilder) for RMA. Both are seeded with the SMA of the first {@code length}
 * valid values, so leading NaNs (an EMA of an EMA) just move the seed.
 */
public final class MovingAverages {

    private MovingAverages() {}

    public static final Indicator SMA = SimpleIndicator.of(IndicatorId.SMA, "Simple Moving Average",
        "Arithmetic mean over the trailing window",
        a -> sma(a.series("source"), a.length("length")));

    public static final Indicator EMA = SimpleIndicator.of(IndicatorId.EMA, "Exponential Moving Average",
        "Exponential smoothing with alpha = 2 / (length + 1)",
        a -> ema(a.series("source"), a.length("length")));

    public static final Indicator WMA = SimpleIndicator.of(IndicatorId.WMA, "Weighted Moving Average",
        "Linearly weighted mean, newest bar weighted highest",
        a -> wma(a.series("source"), a.length("length")));

    public static final Indicator RMA = SimpleIndicator.of(IndicatorId.RMA, "Wilder's Moving Average",
        "Exponential smoothing with alpha = 1 / length",
        a -> rma(a.series("source"), a.length("length")));

    public static final Indicator HMA = SimpleIndicator.of(IndicatorId.HMA, "Hull Moving Average",
        "wma(2 * wma(n / 2) - wma(n), round(sqrt(n)))",
        a -> hma(a.series("source"), a.length("length")));

    public static final Indicator VWMA = SimpleIndicator.of(IndicatorId.VWMA, "Volume Weighted Moving Average",
        "sma(source * volume) / sma(volume)",
        a -> vwma(a.series("source"), a.bars().volume(), a.length("length")));

    public static final Indicator SWMA = SimpleIndicator.of(IndicatorId.SWMA, "Symmetrically Weighted Moving Average",
        "Fixed four-bar window with weights 1/6, 2/6, 2/6, 1/6",
        a -> swma(a.series("source")));

    public static final Indicator ALMA = SimpleIndicator.of(IndicatorId.ALMA, "Arnaud Legoux Moving Average",
        "Gaussian weighted mean with offset and sigma",
        a -> alma(a.series("source"), a.length("length"), a.doubleValue("offset"), a.doubleValue("sigma")));

    public static final Indicator DEMA = SimpleIndicator.of(IndicatorId.DEMA, "Double Exponential Moving Average",
        "2 * ema - ema(ema)",
        a -> dema(a.series("source"), a.length("length")));

    public static final Indicator TEMA = SimpleIndicator.of(IndicatorId.TEMA, "Triple Exponential Moving Average",
        "3 * (ema - ema(ema)) + ema(ema(ema))",
        a -> tema(a.series("source"), a.length("length")));

    public static final Indicator LINREG = SimpleIndicator.of(IndicatorId.LINREG, "Linear Regression",
        "Least squares line over the window, evaluated at length - 1 - offset",
        a -> linreg(a.series("source"), a.length("length"), a.intValue("offset")));

    // ===== Static calculation methods =====

    public static double[] sma(double[] src, int length) {
        double[] sums = SeriesOps.rollingSum(src, length);
        return SeriesOps.scale(sums, 1.0 / length);
    }

    public static double[] ema(double[] src, int length) {
        return exponential(src, length, 2.0 / (length + 1));
    }

    public static double[] rma(double[] src, int length) {
        return exponential(src, length, 1.0 / length);
    }

    /**
     * Shared EMA/RMA recurrence: out = alpha * src + (1 - alpha) * out[prev], seeded with an SMA.
     * A NaN input after the seed yields NaN for that bar and leaves the state untouched.
     */
    static double[] exponential(double[] src, int length, double alpha) {
        int n = src.length;
        double[] result = SeriesOps.nan(n);
        int start = SeriesOps.firstValid(src);
        int seedIndex = start + length - 1;
        if (seedIndex >= n) {
            return result;
        }

        double sum = 0;
        for (int i = start; i <= seedIndex; i++) {
            if (Double.isNaN(src[i])) {
                // gap inside the seed window: restart after it
                double[] rest = exponential(Arrays.copyOfRange(src, i + 1, n), length, alpha);
                System.arraycopy(rest, 0, result, i + 1, rest.length);
                return result;
            }
            sum += src[i];
        }
        double prev = sum / length;
        result[seedIndex] = prev;

        for (int i = seedIndex + 1; i < n; i++) {
            if (Double.isNaN(src[i])) {
                continue;
            }
            prev = alpha * src[i] + (1 - alpha) * prev;
            result[i] = prev;
        }
        return result;
    }

    public static double[] wma(double[] src, int length) {
        double[] result = SeriesOps.nan(src.length);
        double norm = length * (length + 1) / 2.0;
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window == null) {
                continue;
            }
            double sum = 0;
            for (int j = 0; j < length; j++) {
                sum += window[j] * (j + 1);
            }
            result[i] = sum / norm;
        }
        return result;
    }

    public static double[] hma(double[] src, int length) {
        int half = Math.max(1, length / 2);
        int sqrt = Math.max(1, (int) Math.round(Math.sqrt(length)));
        double[] raw = SeriesOps.subtract(SeriesOps.scale(wma(src, half), 2.0), wma(src, length));
        return wma(raw, sqrt);
    }

    public static double[] vwma(double[] src, double[] volume, int length) {
        double[] weighted = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            weighted[i] = src[i] * volume[i];
        }
        double[] num = sma(weighted, length);
        double[] den = sma(volume, length);
        double[] result = SeriesOps.nan(src.length);
        for (int i = 0; i < src.length; i++) {
            if (den[i] != 0) {
                result[i] = num[i] / den[i];
            }
        }
        return result;
    }

    public static double[] swma(double[] src) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = 3; i < src.length; i++) {
            result[i] = src[i - 3] / 6 + src[i - 2] * 2 / 6 + src[i - 1] * 2 / 6 + src[i] / 6;
        }
        return result;
    }

    public static double[] alma(double[] src, int length, double offset, double sigma) {
        double[] result = SeriesOps.nan(src.length);
        double m = Math.floor(offset * (length - 1));
        double s = length / sigma;
        double[] weights = new double[length];
        double norm = 0;
        for (int j = 0; j < length; j++) {
            weights[j] = Math.exp(-((j - m) * (j - m)) / (2 * s * s));
            norm += weights[j];
        }
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window == null) {
                continue;
            }
            double sum = 0;
            for (int j = 0; j < length; j++) {
                sum += window[j] * weights[j];
            }
            result[i] = sum / norm;
        }
        return result;
    }

    public static double[] dema(double[] src, int length) {
        double[] e1 = ema(src, length);
        double[] e2 = ema(e1, length);
        return SeriesOps.subtract(SeriesOps.scale(e1, 2.0), e2);
    }

    public static double[] tema(double[] src, int length) {
        double[] e1 = ema(src, length);
        double[] e2 = ema(e1, length);
        double[] e3 = ema(e2, length);
        double[] result = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            result[i] = 3 * (e1[i] - e2[i]) + e3[i];
        }
        return result;
    }

    public static double[] linreg(double[] src, int length, int offset) {
        double[] result = SeriesOps.nan(src.length);
        double xMean = (length - 1) / 2.0;
        double xVar = 0;
        for (int x = 0; x < length; x++) {
            xVar += (x - xMean) * (x - xMean);
        }
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window == null) {
                continue;
            }
            double yMean = 0;
            for (double y : window) {
                yMean += y;
            }
            yMean /= length;
            double cov = 0;
            for (int x = 0; x < length; x++) {
                cov += (x - xMean) * (window[x] - yMean);
            }
            double slope = xVar == 0 ? 0 : cov / xVar;
            double intercept = yMean - slope * xMean;
            result[i] = intercept + slope * (length - 1 - offset);
        }
        return result;
    }
}
