package com.pinery.core.indicators;

import java.util.Arrays;

/**
 * Small element-wise helpers shared by the indicator families.
 */
final class SeriesOps {

    private SeriesOps() {}

    static double[] nan(int n) {
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);
        return result;
    }

    /**
     * Index of the first non-NaN value, or n when there is none.
     */
    static int firstValid(double[] src) {
        for (int i = 0; i < src.length; i++) {
            if (!Double.isNaN(src[i])) {
                return i;
            }
        }
        return src.length;
    }

    /**
     * src[i] - src[i - length]; NaN for the first {@code length} bars.
     */
    static double[] change(double[] src, int length) {
        double[] result = nan(src.length);
        for (int i = length; i < src.length; i++) {
            result[i] = src[i] - src[i - length];
        }
        return result;
    }

    static double[] subtract(double[] a, double[] b) {
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] - b[i];
        }
        return result;
    }

    static double[] scale(double[] a, double factor) {
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] * factor;
        }
        return result;
    }

    /**
     * Sum over the trailing window ending at each bar; NaN while the window is short or holds a NaN.
     */
    static double[] rollingSum(double[] src, int length) {
        double[] result = nan(src.length);
        for (int i = length - 1; i < src.length; i++) {
            double sum = 0;
            boolean valid = true;
            for (int j = i - length + 1; j <= i; j++) {
                if (Double.isNaN(src[j])) {
                    valid = false;
                    break;
                }
                sum += src[j];
            }
            if (valid) {
                result[i] = sum;
            }
        }
        return result;
    }

    /**
     * Window values ending at {@code end}, or null if the window is short or holds a NaN.
     */
    static double[] window(double[] src, int end, int length) {
        if (end - length + 1 < 0) {
            return null;
        }
        double[] values = new double[length];
        for (int j = 0; j < length; j++) {
            double value = src[end - length + 1 + j];
            if (Double.isNaN(value)) {
                return null;
            }
            values[j] = value;
        }
        return values;
    }

    /**
     * Cumulative sum; NaN inputs count as zero.
     */
    static double[] cumulative(double[] src) {
        double[] result = new double[src.length];
        double sum = 0;
        for (int i = 0; i < src.length; i++) {
            if (!Double.isNaN(src[i])) {
                sum += src[i];
            }
            result[i] = sum;
        }
        return result;
    }
}
