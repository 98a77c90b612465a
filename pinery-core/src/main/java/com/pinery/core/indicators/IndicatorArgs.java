package com.pinery.core.indicators;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved arguments of one indicator call, keyed by parameter name.
 *
 * Values may be series ({@code double[]} or {@code boolean[]}), scalars ({@code Number}, {@code Boolean})
 * or price-series names ("close", "hl2"). Accessors coerce to what the implementation needs:
 * a scalar passed where a series is expected becomes a constant series.
 */
public final class IndicatorArgs {

    private final Bars bars;
    private final Map<String, Object> values;
    private final int positionalCount;

    public IndicatorArgs(Bars bars, Map<String, Object> values, int positionalCount) {
        this.bars = bars != null ? bars : Bars.empty();
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.positionalCount = positionalCount;
    }

    public Bars bars() {
        return bars;
    }

    /**
     * Number of positional arguments the caller supplied, before defaults.
     */
    public int positionalCount() {
        return positionalCount;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Object raw(String name) {
        return values.get(name);
    }

    /**
     * Bar count: the bound bars, or the longest series argument when no bars are bound.
     */
    public int size() {
        if (bars.size() > 0) {
            return bars.size();
        }
        int size = 0;
        for (Object value : values.values()) {
            if (value instanceof double[] array) {
                size = Math.max(size, array.length);
            } else if (value instanceof boolean[] array) {
                size = Math.max(size, array.length);
            }
        }
        return size;
    }

    public double[] series(String name) {
        Object value = require(name);
        if (value instanceof double[] array) {
            return array;
        }
        if (value instanceof boolean[] flags) {
            double[] result = new double[flags.length];
            for (int i = 0; i < flags.length; i++) {
                result[i] = flags[i] ? 1.0 : 0.0;
            }
            return result;
        }
        if (value instanceof Number number) {
            double[] result = new double[size()];
            Arrays.fill(result, number.doubleValue());
            return result;
        }
        if (value instanceof Boolean flag) {
            double[] result = new double[size()];
            Arrays.fill(result, flag ? 1.0 : 0.0);
            return result;
        }
        if (value instanceof String source) {
            return bars.series(source);
        }
        throw new IllegalArgumentException("Argument '" + name + "' is not a series: " + value.getClass().getSimpleName());
    }

    /**
     * Boolean view of a series: true where the value is non-zero and not NaN.
     */
    public boolean[] signals(String name) {
        Object value = require(name);
        if (value instanceof boolean[] flags) {
            return flags;
        }
        if (value instanceof Boolean flag) {
            boolean[] result = new boolean[size()];
            Arrays.fill(result, flag);
            return result;
        }
        double[] series = series(name);
        boolean[] result = new boolean[series.length];
        for (int i = 0; i < series.length; i++) {
            result[i] = !Double.isNaN(series[i]) && series[i] != 0.0;
        }
        return result;
    }

    public double doubleValue(String name) {
        Object value = require(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof double[] array && array.length > 0) {
            return array[array.length - 1];
        }
        throw new IllegalArgumentException("Argument '" + name + "' is not numeric: " + value);
    }

    public int intValue(String name) {
        return (int) Math.round(doubleValue(name));
    }

    /**
     * A window length: integer, at least 1.
     */
    public int length(String name) {
        int length = intValue(name);
        if (length < 1) {
            throw new IllegalArgumentException("Argument '" + name + "' must be >= 1 but was " + length);
        }
        return length;
    }

    public boolean boolValue(String name) {
        Object value = require(name);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        throw new IllegalArgumentException("Argument '" + name + "' is not a boolean: " + value);
    }

    public boolean isScalar(String name) {
        Object value = values.get(name);
        return value instanceof Number || value instanceof Boolean;
    }

    private Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Missing argument: " + name);
        }
        return value;
    }

    @Override
    public String toString() {
        return "IndicatorArgs" + values.keySet();
    }
}
