package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

/**
 * Pivot points. A pivot is confirmed right_bars after it happens, so the value appears on the
 * confirming bar and every other bar is NaN.
 */
public final class Pivots {

    private Pivots() {}

    public static final Indicator PIVOTHIGH = SimpleIndicator.of(IndicatorId.PIVOTHIGH, "Pivot High",
        "Value strictly above left_bars before and right_bars after",
        a -> pivotHigh(source(a, "high"), bars(a, "left_bars"), bars(a, "right_bars")));

    public static final Indicator PIVOTLOW = SimpleIndicator.of(IndicatorId.PIVOTLOW, "Pivot Low",
        "Value strictly below left_bars before and right_bars after",
        a -> pivotLow(source(a, "low"), bars(a, "left_bars"), bars(a, "right_bars")));

    // ===== Static calculation methods =====

    public static double[] pivotHigh(double[] src, int left, int right) {
        return pivots(src, left, right, true);
    }

    public static double[] pivotLow(double[] src, int left, int right) {
        return pivots(src, left, right, false);
    }

    private static double[] pivots(double[] src, int left, int right, boolean high) {
        double[] result = SeriesOps.nan(src.length);
        for (int i = left + right; i < src.length; i++) {
            int pivot = i - right;
            double value = src[pivot];
            if (Double.isNaN(value)) {
                continue;
            }
            boolean isPivot = true;
            for (int j = pivot - left; j <= pivot + right && isPivot; j++) {
                if (j != pivot) {
                    isPivot = high ? value > src[j] : value < src[j];
                }
            }
            if (isPivot) {
                result[i] = value;
            }
        }
        return result;
    }

    /**
     * pivothigh(leftbars, rightbars) reads high; the three-argument form takes an explicit source.
     */
    private static double[] source(IndicatorArgs a, String priceSeries) {
        if (shortForm(a)) {
            return a.bars().series(priceSeries);
        }
        return a.series("source");
    }

    private static int bars(IndicatorArgs a, String name) {
        if (shortForm(a)) {
            // two-argument form: values landed in source and left_bars
            return a.intValue(name.equals("left_bars") ? "source" : "left_bars");
        }
        return a.intValue(name);
    }

    private static boolean shortForm(IndicatorArgs a) {
        return a.positionalCount() == 2 && a.isScalar("source");
    }
}
