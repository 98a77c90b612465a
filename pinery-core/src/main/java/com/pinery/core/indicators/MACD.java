package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

import java.util.List;

/**
 * Moving Average Convergence Divergence.
 */
public final class MACD implements Indicator {

    public static final MACD INSTANCE = new MACD();

    public static final List<String> SERIES = List.of("macd", "signal", "histogram");

    private MACD() {}

    /**
     * MACD line, signal line and histogram, in that order.
     */
    public record Result(double[] macd, double[] signal, double[] histogram) {
        public IndicatorResult.Multi toMulti() {
            return new IndicatorResult.Multi(SERIES, List.of(macd, signal, histogram));
        }
    }

    @Override
    public IndicatorId id() { return IndicatorId.MACD; }

    @Override
    public String name() { return "MACD"; }

    @Override
    public String description() { return "ema(fast) - ema(slow), its EMA signal line and the histogram"; }

    @Override
    public IndicatorResult compute(IndicatorArgs args) {
        return calculate(args.series("source"), args.length("fast_length"), args.length("slow_length"),
            args.length("signal_length")).toMulti();
    }

    // ===== Static calculation methods =====

    public static Result calculate(double[] src, int fastPeriod, int slowPeriod, int signalPeriod) {
        double[] macd = SeriesOps.subtract(MovingAverages.ema(src, fastPeriod), MovingAverages.ema(src, slowPeriod));
        double[] signal = MovingAverages.ema(macd, signalPeriod);
        double[] histogram = SeriesOps.subtract(macd, signal);
        return new Result(macd, signal, histogram);
    }
}
