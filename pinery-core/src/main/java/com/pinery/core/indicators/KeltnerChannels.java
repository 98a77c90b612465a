package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

import java.util.List;

/**
 * Keltner Channels: EMA basis with bands at mult times the EMA of the range.
 */
public final class KeltnerChannels implements Indicator {

    public static final KeltnerChannels INSTANCE = new KeltnerChannels();

    public static final List<String> SERIES = List.of("basis", "upper", "lower");

    public static final Indicator WIDTH = SimpleIndicator.of(IndicatorId.KCW, "Keltner Channels Width",
        "(upper - lower) / basis",
        a -> BollingerBands.width(toBands(calculate(a.bars(), a.series("source"), a.length("length"),
            a.doubleValue("mult"), a.boolValue("use_true_range")))));

    private KeltnerChannels() {}

    public record Result(double[] basis, double[] upper, double[] lower) {
        public IndicatorResult.Multi toMulti() {
            return new IndicatorResult.Multi(SERIES, List.of(basis, upper, lower));
        }
    }

    @Override
    public IndicatorId id() { return IndicatorId.KC; }

    @Override
    public String name() { return "Keltner Channels"; }

    @Override
    public String description() { return "EMA basis with bands at mult times the smoothed range"; }

    @Override
    public IndicatorResult compute(IndicatorArgs args) {
        return calculate(args.bars(), args.series("source"), args.length("length"), args.doubleValue("mult"),
            args.boolValue("use_true_range")).toMulti();
    }

    // ===== Static calculation methods =====

    public static Result calculate(Bars bars, double[] src, int period, double mult, boolean useTrueRange) {
        double[] basis = MovingAverages.ema(src, period);
        double[] range = useTrueRange
            ? ATR.trueRange(bars, true)
            : SeriesOps.subtract(bars.high(), bars.low());
        double[] rangeEma = MovingAverages.ema(range, period);
        double[] upper = new double[src.length];
        double[] lower = new double[src.length];
        for (int i = 0; i < src.length; i++) {
            upper[i] = basis[i] + rangeEma[i] * mult;
            lower[i] = basis[i] - rangeEma[i] * mult;
        }
        return new Result(basis, upper, lower);
    }

    private static BollingerBands.Result toBands(Result channels) {
        return new BollingerBands.Result(channels.basis(), channels.upper(), channels.lower());
    }
}
