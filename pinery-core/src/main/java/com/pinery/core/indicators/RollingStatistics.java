package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

import java.util.Arrays;

/**
 * Trailing-window statistics. Every window has a fixed length and ends at the current bar, inclusive.
 * A bar whose window is incomplete or holds a NaN yields NaN.
 */
public final class RollingStatistics {

    private RollingStatistics() {}

    public static final Indicator STDEV = SimpleIndicator.of(IndicatorId.STDEV, "Standard Deviation",
        "Population (biased) or sample standard deviation",
        a -> stdev(a.series("source"), a.length("length"), a.boolValue("biased")));

    public static final Indicator VARIANCE = SimpleIndicator.of(IndicatorId.VARIANCE, "Variance",
        "Population (biased) or sample variance",
        a -> variance(a.series("source"), a.length("length"), a.boolValue("biased")));

    public static final Indicator DEV = SimpleIndicator.of(IndicatorId.DEV, "Mean Absolute Deviation",
        "Mean absolute distance from the window mean",
        a -> dev(a.series("source"), a.length("length")));

    public static final Indicator HIGHEST = SimpleIndicator.of(IndicatorId.HIGHEST, "Highest",
        "Highest value in the window; highest(length) reads high",
        a -> highest(sourceOrDefault(a, "high"), lengthOrFirst(a)));

    public static final Indicator LOWEST = SimpleIndicator.of(IndicatorId.LOWEST, "Lowest",
        "Lowest value in the window; lowest(length) reads low",
        a -> lowest(sourceOrDefault(a, "low"), lengthOrFirst(a)));

    public static final Indicator HIGHESTBARS = SimpleIndicator.of(IndicatorId.HIGHESTBARS, "Highest Bars",
        "Offset (zero or negative) to the highest bar in the window",
        a -> highestBars(sourceOrDefault(a, "high"), lengthOrFirst(a)));

    public static final Indicator LOWESTBARS = SimpleIndicator.of(IndicatorId.LOWESTBARS, "Lowest Bars",
        "Offset (zero or negative) to the lowest bar in the window",
        a -> lowestBars(sourceOrDefault(a, "low"), lengthOrFirst(a)));

    public static final Indicator MEDIAN = SimpleIndicator.of(IndicatorId.MEDIAN, "Median",
        "Median of the window",
        a -> median(a.series("source"), a.length("length")));

    public static final Indicator MODE = SimpleIndicator.of(IndicatorId.MODE, "Mode",
        "Most frequent value of the window, smallest on ties",
        a -> mode(a.series("source"), a.length("length")));

    public static final Indicator PERCENTRANK = SimpleIndicator.of(IndicatorId.PERCENTRANK, "Percent Rank",
        "Percent of the previous length values less than or equal to the current one",
        a -> percentRank(a.series("source"), a.length("length")));

    public static final Indicator RANGE = SimpleIndicator.of(IndicatorId.RANGE, "Range",
        "highest - lowest over the window",
        a -> range(a.series("source"), a.length("length")));

    public static final Indicator CORRELATION = SimpleIndicator.of(IndicatorId.CORRELATION, "Correlation",
        "Pearson correlation of two series over the window",
        a -> correlation(a.series("source1"), a.series("source2"), a.length("length")));

    public static final Indicator COV = SimpleIndicator.of(IndicatorId.COV, "Covariance",
        "Population (biased) or sample covariance of two series",
        a -> covariance(a.series("source1"), a.series("source2"), a.length("length"), a.boolValue("biased")));

    public static final Indicator CUM = SimpleIndicator.of(IndicatorId.CUM, "Cumulative Sum",
        "Running total; NaN counts as zero",
        a -> SeriesOps.cumulative(a.series("source")));

    // ===== Static calculation methods =====

    public static double[] variance(double[] src, int length, boolean biased) {
        double[] result = SeriesOps.nan(src.length);
        int divisor = biased ? length : length - 1;
        if (divisor <= 0) {
            return result;
        }
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window == null) {
                continue;
            }
            double mean = mean(window);
            double sum = 0;
            for (double v : window) {
                sum += (v - mean) * (v - mean);
            }
            result[i] = sum / divisor;
        }
        return result;
    }

    public static double[] stdev(double[] src, int length, boolean biased) {
        double[] var = variance(src, length, biased);
        double[] result = new double[var.length];
        for (int i = 0; i < var.length; i++) {
            result[i] = Math.sqrt(var[i]);
        }
        return result;
    }

    public static double[] dev(double[] src, int length) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window == null) {
                continue;
            }
            double mean = mean(window);
            double sum = 0;
            for (double v : window) {
                sum += Math.abs(v - mean);
            }
            result[i] = sum / length;
        }
        return result;
    }

    public static double[] highest(double[] src, int length) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window != null) {
                result[i] = Arrays.stream(window).max().orElse(Double.NaN);
            }
        }
        return result;
    }

    public static double[] lowest(double[] src, int length) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window != null) {
                result[i] = Arrays.stream(window).min().orElse(Double.NaN);
            }
        }
        return result;
    }

    /**
     * Offset to the most recent highest bar: 0 for the current bar, -k for k bars ago.
     */
    public static double[] highestBars(double[] src, int length) {
        return extremeBars(src, length, true);
    }

    public static double[] lowestBars(double[] src, int length) {
        return extremeBars(src, length, false);
    }

    private static double[] extremeBars(double[] src, int length, boolean highest) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window == null) {
                continue;
            }
            int best = 0;
            for (int j = 1; j < length; j++) {
                if (highest ? window[j] >= window[best] : window[j] <= window[best]) {
                    best = j;
                }
            }
            result[i] = best - (length - 1);
        }
        return result;
    }

    public static double[] median(double[] src, int length) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window == null) {
                continue;
            }
            Arrays.sort(window);
            int mid = length / 2;
            result[i] = length % 2 == 1 ? window[mid] : (window[mid - 1] + window[mid]) / 2;
        }
        return result;
    }

    public static double[] mode(double[] src, int length) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double[] window = SeriesOps.window(src, i, length);
            if (window == null) {
                continue;
            }
            Arrays.sort(window);
            double best = window[0];
            int bestCount = 0;
            int j = 0;
            while (j < length) {
                int k = j;
                while (k < length && window[k] == window[j]) {
                    k++;
                }
                if (k - j > bestCount) {
                    bestCount = k - j;
                    best = window[j];
                }
                j = k;
            }
            result[i] = best;
        }
        return result;
    }

    public static double[] percentRank(double[] src, int length) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = length; i < src.length; i++) {
            if (Double.isNaN(src[i])) {
                continue;
            }
            int count = 0;
            boolean valid = true;
            for (int k = 1; k <= length; k++) {
                double previous = src[i - k];
                if (Double.isNaN(previous)) {
                    valid = false;
                    break;
                }
                if (previous <= src[i]) {
                    count++;
                }
            }
            if (valid) {
                result[i] = 100.0 * count / length;
            }
        }
        return result;
    }

    public static double[] range(double[] src, int length) {
        return SeriesOps.subtract(highest(src, length), lowest(src, length));
    }

    public static double[] correlation(double[] a, double[] b, int length) {
        double[] result = SeriesOps.nan(a.length);
        for (int i = length - 1; i < a.length; i++) {
            double[] wa = SeriesOps.window(a, i, length);
            double[] wb = SeriesOps.window(b, i, length);
            if (wa == null || wb == null) {
                continue;
            }
            double ma = mean(wa);
            double mb = mean(wb);
            double cov = 0;
            double va = 0;
            double vb = 0;
            for (int j = 0; j < length; j++) {
                cov += (wa[j] - ma) * (wb[j] - mb);
                va += (wa[j] - ma) * (wa[j] - ma);
                vb += (wb[j] - mb) * (wb[j] - mb);
            }
            if (va > 0 && vb > 0) {
                result[i] = cov / Math.sqrt(va * vb);
            }
        }
        return result;
    }

    public static double[] covariance(double[] a, double[] b, int length, boolean biased) {
        double[] result = SeriesOps.nan(a.length);
        int divisor = biased ? length : length - 1;
        if (divisor <= 0) {
            return result;
        }
        for (int i = length - 1; i < a.length; i++) {
            double[] wa = SeriesOps.window(a, i, length);
            double[] wb = SeriesOps.window(b, i, length);
            if (wa == null || wb == null) {
                continue;
            }
            double ma = mean(wa);
            double mb = mean(wb);
            double cov = 0;
            for (int j = 0; j < length; j++) {
                cov += (wa[j] - ma) * (wb[j] - mb);
            }
            result[i] = cov / divisor;
        }
        return result;
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * highest(length) and lowest(length) take the length as their only positional argument.
     */
    private static double[] sourceOrDefault(IndicatorArgs a, String priceSeries) {
        if (a.positionalCount() == 1 && a.isScalar("source")) {
            return a.bars().series(priceSeries);
        }
        return a.series("source");
    }

    private static int lengthOrFirst(IndicatorArgs a) {
        if (a.positionalCount() == 1 && a.isScalar("source")) {
            return a.length("source");
        }
        return a.length("length");
    }
}
