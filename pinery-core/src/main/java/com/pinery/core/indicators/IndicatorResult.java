package com.pinery.core.indicators;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one indicator evaluation.
 */
public sealed interface IndicatorResult {

    int size();

    /**
     * Single numeric series. Warm-up bars are NaN.
     */
    record Series(double[] values) implements IndicatorResult {
        @Override
        public int size() {
            return values.length;
        }

        public double last() {
            return values.length == 0 ? Double.NaN : values[values.length - 1];
        }
    }

    /**
     * Boolean series such as crossover results.
     */
    record Signals(boolean[] values) implements IndicatorResult {
        @Override
        public int size() {
            return values.length;
        }

        public boolean last() {
            return values.length > 0 && values[values.length - 1];
        }
    }

    /**
     * Several named series in a fixed order, e.g. macd / signal / histogram.
     */
    record Multi(List<String> names, List<double[]> series) implements IndicatorResult {
        public Multi {
            if (names.size() != series.size()) {
                throw new IllegalArgumentException("Names and series must have equal length");
            }
            names = List.copyOf(names);
            series = List.copyOf(new ArrayList<>(series));
        }

        @Override
        public int size() {
            return series.isEmpty() ? 0 : series.get(0).length;
        }

        /**
         * @throws IllegalArgumentException if no series has that name
         */
        public double[] get(String name) {
            int index = names.indexOf(name);
            if (index < 0) {
                throw new IllegalArgumentException("No series named '" + name + "' in " + names);
            }
            return series.get(index);
        }
    }
}
