package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

import java.util.List;

/**
 * Bollinger Bands: SMA basis with bands at mult population standard deviations.
 */
public final class BollingerBands implements Indicator {

    public static final BollingerBands INSTANCE = new BollingerBands();

    public static final List<String> SERIES = List.of("basis", "upper", "lower");

    /**
     * Band width relative to the basis: (upper - lower) / basis.
     */
    public static final Indicator WIDTH = SimpleIndicator.of(IndicatorId.BBW, "Bollinger Bands Width",
        "(upper - lower) / basis",
        a -> width(calculate(a.series("source"), a.length("length"), a.doubleValue("mult"))));

    private BollingerBands() {}

    public record Result(double[] basis, double[] upper, double[] lower) {
        public IndicatorResult.Multi toMulti() {
            return new IndicatorResult.Multi(SERIES, List.of(basis, upper, lower));
        }
    }

    @Override
    public IndicatorId id() { return IndicatorId.BB; }

    @Override
    public String name() { return "Bollinger Bands"; }

    @Override
    public String description() { return "SMA basis with bands at mult standard deviations"; }

    @Override
    public IndicatorResult compute(IndicatorArgs args) {
        return calculate(args.series("source"), args.length("length"), args.doubleValue("mult")).toMulti();
    }

    // ===== Static calculation methods =====

    public static Result calculate(double[] src, int period, double mult) {
        double[] basis = MovingAverages.sma(src, period);
        double[] stdev = RollingStatistics.stdev(src, period, true);
        double[] upper = new double[src.length];
        double[] lower = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            upper[i] = basis[i] + mult * stdev[i];
            lower[i] = basis[i] - mult * stdev[i];
        }
        return new Result(basis, upper, lower);
    }

    static double[] width(Result bands) {
        double[] result = SeriesOps.nan(bands.basis().length);
        for (int i = 0; i < result.length; i++) {
            if (bands.basis()[i] != 0) {
                result[i] = (bands.upper()[i] - bands.lower()[i]) / bands.basis()[i];
            }
        }
        return result;
    }
}
