package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

/**
 * Bar-to-bar events: crossover, crossunder, cross, rising, falling, barssince, valuewhen.
 *
 * crossover(a, b) is true on bar i iff a[i] > b[i] and a[i-1] <= b[i-1]. Any comparison with
 * NaN is false, so the first bar never crosses.
 */
public final class CrossSignals {

    private CrossSignals() {}

    public static final Indicator CROSSOVER = SimpleIndicator.signals(IndicatorId.CROSSOVER, "Crossover",
        "First series crosses above the second",
        a -> crossover(a.series("source1"), a.series("source2")));

    public static final Indicator CROSSUNDER = SimpleIndicator.signals(IndicatorId.CROSSUNDER, "Crossunder",
        "First series crosses below the second",
        a -> crossunder(a.series("source1"), a.series("source2")));

    public static final Indicator CROSS = SimpleIndicator.signals(IndicatorId.CROSS, "Cross",
        "Crossover or crossunder",
        a -> cross(a.series("source1"), a.series("source2")));

    public static final Indicator RISING = SimpleIndicator.signals(IndicatorId.RISING, "Rising",
        "Current value above every value of the previous length bars",
        a -> rising(a.series("source"), a.length("length")));

    public static final Indicator FALLING = SimpleIndicator.signals(IndicatorId.FALLING, "Falling",
        "Current value below every value of the previous length bars",
        a -> falling(a.series("source"), a.length("length")));

    public static final Indicator BARSSINCE = SimpleIndicator.of(IndicatorId.BARSSINCE, "Bars Since",
        "Bars since the condition was last true, NaN before the first occurrence",
        a -> barsSince(a.signals("condition")));

    public static final Indicator VALUEWHEN = SimpleIndicator.of(IndicatorId.VALUEWHEN, "Value When",
        "Source value at the n-th most recent bar where the condition was true",
        a -> valueWhen(a.signals("condition"), a.series("source"), a.intValue("occurrence")));

    // ===== Static calculation methods =====

    public static boolean[] crossover(double[] a, double[] b) {
        boolean[] result = new boolean[a.length];
        for (int i = 1; i < a.length; i++) {
            result[i] = a[i] > b[i] && a[i - 1] <= b[i - 1];
        }
        return result;
    }

    public static boolean[] crossunder(double[] a, double[] b) {
        boolean[] result = new boolean[a.length];
        for (int i = 1; i < a.length; i++) {
            result[i] = a[i] < b[i] && a[i - 1] >= b[i - 1];
        }
        return result;
    }

    public static boolean[] cross(double[] a, double[] b) {
        boolean[] over = crossover(a, b);
        boolean[] under = crossunder(a, b);
        boolean[] result = new boolean[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = over[i] || under[i];
        }
        return result;
    }

    public static boolean[] rising(double[] src, int length) {
        return monotonic(src, length, true);
    }

    public static boolean[] falling(double[] src, int length) {
        return monotonic(src, length, false);
    }

    private static boolean[] monotonic(double[] src, int length, boolean up) {
        boolean[] result = new boolean[src.length];
        for (int i = length; i < src.length; i++) {
            boolean all = true;
            for (int k = 1; k <= length && all; k++) {
                all = up ? src[i] > src[i - k] : src[i] < src[i - k];
            }
            result[i] = all;
        }
        return result;
    }

    public static double[] barsSince(boolean[] condition) {
        double[] result = SeriesOps.nan(condition.length);
        int last = -1;
        for (int i = 0; i < condition.length; i++) {
            if (condition[i]) {
                last = i;
            }
            if (last >= 0) {
                result[i] = i - last;
            }
        }
        return result;
    }

    public static double[] valueWhen(boolean[] condition, double[] src, int occurrence) {
        if (occurrence < 0) {
            throw new IllegalArgumentException("occurrence must be >= 0 but was " + occurrence);
        }
        double[] result = SeriesOps.nan(condition.length);
        int[] recent = new int[occurrence + 1];
        int seen = 0;
        for (int i = 0; i < condition.length; i++) {
            if (condition[i]) {
                // shift the ring of most recent hits, newest first
                System.arraycopy(recent, 0, recent, 1, occurrence);
                recent[0] = i;
                seen++;
            }
            if (seen > occurrence) {
                result[i] = src[recent[occurrence]];
            }
        }
        return result;
    }
}
