package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

/**
 * Momentum oscillators: rsi, roc, mom, change, cci, cmo, mfi, wpr, tsi.
 */
public final class Oscillators {

    private Oscillators() {}

    public static final Indicator RSI = SimpleIndicator.of(IndicatorId.RSI, "Relative Strength Index",
        "Wilder RSI (0-100) from RMA-smoothed gains and losses",
        a -> rsi(a.series("source"), a.length("length")));

    public static final Indicator ROC = SimpleIndicator.of(IndicatorId.ROC, "Rate of Change",
        "100 * (source - source[length]) / source[length]",
        a -> roc(a.series("source"), a.length("length")));

    public static final Indicator MOM = SimpleIndicator.of(IndicatorId.MOM, "Momentum",
        "source - source[length]",
        a -> SeriesOps.change(a.series("source"), a.length("length")));

    public static final Indicator CHANGE = SimpleIndicator.of(IndicatorId.CHANGE, "Change",
        "Difference between the current value and the value length bars ago",
        a -> SeriesOps.change(a.series("source"), a.length("length")));

    public static final Indicator CCI = SimpleIndicator.of(IndicatorId.CCI, "Commodity Channel Index",
        "(source - sma) / (0.015 * mean absolute deviation)",
        a -> cci(a.series("source"), a.length("length")));

    public static final Indicator CMO = SimpleIndicator.of(IndicatorId.CMO, "Chande Momentum Oscillator",
        "100 * (sum of gains - sum of losses) / (sum of gains + sum of losses)",
        a -> cmo(a.series("source"), a.length("length")));

    public static final Indicator MFI = SimpleIndicator.of(IndicatorId.MFI, "Money Flow Index",
        "Volume-weighted RSI over the source",
        a -> mfi(a.series("source"), a.bars().volume(), a.length("length")));

    public static final Indicator WPR = SimpleIndicator.of(IndicatorId.WPR, "Williams %R",
        "100 * (close - highest high) / (highest high - lowest low), -100 to 0",
        a -> wpr(a.bars().high(), a.bars().low(), a.bars().close(), a.length("length")));

    public static final Indicator TSI = SimpleIndicator.of(IndicatorId.TSI, "True Strength Index",
        "Double-smoothed momentum over double-smoothed absolute momentum, -1 to 1",
        a -> tsi(a.series("source"), a.length("short_length"), a.length("long_length")));

    // ===== Static calculation methods =====

    public static double[] rsi(double[] src, int length) {
        int n = src.length;
        double[] change = SeriesOps.change(src, 1);
        double[] gains = SeriesOps.nan(n);
        double[] losses = SeriesOps.nan(n);
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(change[i])) {
                gains[i] = Math.max(change[i], 0);
                losses[i] = -Math.min(change[i], 0);
            }
        }
        double[] up = MovingAverages.rma(gains, length);
        double[] down = MovingAverages.rma(losses, length);
        double[] result = SeriesOps.nan(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(up[i]) || Double.isNaN(down[i])) {
                continue;
            }
            if (down[i] == 0) {
                result[i] = 100.0;
            } else if (up[i] == 0) {
                result[i] = 0.0;
            } else {
                result[i] = 100.0 - 100.0 / (1.0 + up[i] / down[i]);
            }
        }
        return result;
    }

    public static double[] roc(double[] src, int length) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = length; i < src.length; i++) {
            double previous = src[i - length];
            if (previous != 0) {
                result[i] = 100.0 * (src[i] - previous) / previous;
            }
        }
        return result;
    }

    public static double[] cci(double[] src, int length) {
        double[] ma = MovingAverages.sma(src, length);
        double[] dev = RollingStatistics.dev(src, length);
        double[] result = SeriesOps.nan(src.length);
        for (int i = 0; i < src.length; i++) {
            if (!Double.isNaN(dev[i]) && dev[i] != 0) {
                result[i] = (src[i] - ma[i]) / (0.015 * dev[i]);
            }
        }
        return result;
    }

    public static double[] cmo(double[] src, int length) {
        int n = src.length;
        double[] change = SeriesOps.change(src, 1);
        double[] gains = SeriesOps.nan(n);
        double[] losses = SeriesOps.nan(n);
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(change[i])) {
                gains[i] = change[i] >= 0 ? change[i] : 0;
                losses[i] = change[i] >= 0 ? 0 : -change[i];
            }
        }
        double[] sumGains = SeriesOps.rollingSum(gains, length);
        double[] sumLosses = SeriesOps.rollingSum(losses, length);
        double[] result = SeriesOps.nan(n);
        for (int i = 0; i < n; i++) {
            double total = sumGains[i] + sumLosses[i];
            if (!Double.isNaN(total) && total != 0) {
                result[i] = 100.0 * (sumGains[i] - sumLosses[i]) / total;
            }
        }
        return result;
    }

    public static double[] mfi(double[] src, double[] volume, int length) {
        int n = src.length;
        double[] change = SeriesOps.change(src, 1);
        double[] upper = SeriesOps.nan(n);
        double[] lower = SeriesOps.nan(n);
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(change[i])) {
                upper[i] = change[i] <= 0 ? 0 : volume[i] * src[i];
                lower[i] = change[i] >= 0 ? 0 : volume[i] * src[i];
            }
        }
        double[] upperSum = SeriesOps.rollingSum(upper, length);
        double[] lowerSum = SeriesOps.rollingSum(lower, length);
        double[] result = SeriesOps.nan(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(upperSum[i]) || Double.isNaN(lowerSum[i])) {
                continue;
            }
            result[i] = lowerSum[i] == 0 ? 100.0 : 100.0 - 100.0 / (1.0 + upperSum[i] / lowerSum[i]);
        }
        return result;
    }

    public static double[] wpr(double[] high, double[] low, double[] close, int length) {
        double[] highest = RollingStatistics.highest(high, length);
        double[] lowest = RollingStatistics.lowest(low, length);
        double[] result = SeriesOps.nan(close.length);
        for (int i = 0; i < close.length; i++) {
            double range = highest[i] - lowest[i];
            if (!Double.isNaN(range) && range != 0) {
                result[i] = 100.0 * (close[i] - highest[i]) / range;
            }
        }
        return result;
    }

    public static double[] tsi(double[] src, int shortLength, int longLength) {
        double[] pc = SeriesOps.change(src, 1);
        double[] absPc = new double[pc.length];
        for (int i = 0; i < pc.length; i++) {
            absPc[i] = Math.abs(pc[i]);
        }
        double[] smoothed = MovingAverages.ema(MovingAverages.ema(pc, longLength), shortLength);
        double[] absSmoothed = MovingAverages.ema(MovingAverages.ema(absPc, longLength), shortLength);
        double[] result = SeriesOps.nan(src.length);
        for (int i = 0; i < src.length; i++) {
            if (!Double.isNaN(absSmoothed[i]) && absSmoothed[i] != 0) {
                result[i] = smoothed[i] / absSmoothed[i];
            }
        }
        return result;
    }
}
