package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

import java.util.List;

/**
 * Stochastic Oscillator - measures momentum by comparing the source to the high-low range.
 */
public final class Stochastic implements Indicator {

    public static final Stochastic INSTANCE = new Stochastic();

    public static final List<String> SERIES = List.of("k", "d");

    private Stochastic() {}

    /**
     * Smoothed %K and its %D signal line.
     */
    public record Result(double[] k, double[] d) {
        public IndicatorResult.Multi toMulti() {
            return new IndicatorResult.Multi(SERIES, List.of(k, d));
        }
    }

    @Override
    public IndicatorId id() { return IndicatorId.STOCH; }

    @Override
    public String name() { return "Stochastic Oscillator"; }

    @Override
    public String description() { return "Momentum indicator comparing the source to the high-low range (0-100)"; }

    @Override
    public IndicatorResult compute(IndicatorArgs args) {
        return calculate(args.series("source"), args.series("high"), args.series("low"), args.length("length"),
            args.length("smooth_k"), args.length("smooth_d")).toMulti();
    }

    // ===== Static calculation methods =====

    /**
     * Raw stochastic: 100 * (source - lowest low) / (highest high - lowest low); 50 on a flat range.
     */
    public static double[] raw(double[] src, double[] high, double[] low, int period) {
        double[] highest = RollingStatistics.highest(high, period);
        double[] lowest = RollingStatistics.lowest(low, period);
        double[] result = SeriesOps.nan(src.length);
        for (int i = 0; i < src.length; i++) {
            if (Double.isNaN(highest[i]) || Double.isNaN(lowest[i]) || Double.isNaN(src[i])) {
                continue;
            }
            double range = highest[i] - lowest[i];
            result[i] = range <= 0 ? 50.0 : (src[i] - lowest[i]) / range * 100.0;
        }
        return result;
    }

    public static Result calculate(double[] src, double[] high, double[] low, int period, int smoothK, int smoothD) {
        double[] raw = raw(src, high, low, period);
        double[] k = smoothK > 1 ? MovingAverages.sma(raw, smoothK) : raw;
        double[] d = MovingAverages.sma(k, smoothD);
        return new Result(k, d);
    }
}
