package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

import java.util.function.Function;

/**
 * Base class for indicators that return a single series.
 * Subclasses just implement {@link #series(IndicatorArgs)}.
 */
public abstract class SimpleIndicator implements Indicator {

    private final IndicatorId id;
    private final String name;
    private final String description;

    protected SimpleIndicator(IndicatorId id, String name, String description) {
        this.id = id;
        this.name = name;
        this.description = description;
    }

    /**
     * Wrap a series function as an indicator.
     */
    public static Indicator of(IndicatorId id, String name, String description,
                               Function<IndicatorArgs, double[]> function) {
        return new SimpleIndicator(id, name, description) {
            @Override
            protected double[] series(IndicatorArgs args) {
                return function.apply(args);
            }
        };
    }

    /**
     * Wrap a boolean series function as an indicator.
     */
    public static Indicator signals(IndicatorId id, String name, String description,
                                    Function<IndicatorArgs, boolean[]> function) {
        return new Indicator() {
            @Override
            public IndicatorId id() { return id; }

            @Override
            public String name() { return name; }

            @Override
            public String description() { return description; }

            @Override
            public IndicatorResult compute(IndicatorArgs args) {
                return new IndicatorResult.Signals(function.apply(args));
            }
        };
    }

    protected abstract double[] series(IndicatorArgs args);

    @Override
    public final IndicatorResult compute(IndicatorArgs args) {
        return new IndicatorResult.Series(series(args));
    }

    @Override
    public IndicatorId id() { return id; }

    @Override
    public String name() { return name; }

    @Override
    public String description() { return description; }
}
