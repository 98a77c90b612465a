package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

import java.util.List;

/**
 * Directional Movement Index: +DI, -DI and ADX, all RMA-smoothed.
 */
public final class DMI implements Indicator {

    public static final DMI INSTANCE = new DMI();

    public static final List<String> SERIES = List.of("plus_di", "minus_di", "adx");

    /**
     * ADX alone.
     */
    public static final Indicator ADX = SimpleIndicator.of(IndicatorId.ADX, "Average Directional Index",
        "Trend strength (0-100) from the directional indices",
        a -> calculate(a.bars(), a.length("di_length"), a.length("adx_smoothing")).adx());

    private DMI() {}

    public record Result(double[] plusDi, double[] minusDi, double[] adx) {
        public IndicatorResult.Multi toMulti() {
            return new IndicatorResult.Multi(SERIES, List.of(plusDi, minusDi, adx));
        }
    }

    @Override
    public IndicatorId id() { return IndicatorId.DMI; }

    @Override
    public String name() { return "Directional Movement Index"; }

    @Override
    public String description() { return "+DI, -DI and ADX"; }

    @Override
    public IndicatorResult compute(IndicatorArgs args) {
        return calculate(args.bars(), args.length("di_length"), args.length("adx_smoothing")).toMulti();
    }

    // ===== Static calculation methods =====

    public static Result calculate(Bars bars, int diLength, int adxSmoothing) {
        int n = bars.size();
        double[] high = bars.high();
        double[] low = bars.low();
        double[] plusDm = SeriesOps.nan(n);
        double[] minusDm = SeriesOps.nan(n);
        for (int i = 1; i < n; i++) {
            double up = high[i] - high[i - 1];
            double down = low[i - 1] - low[i];
            plusDm[i] = up > down && up > 0 ? up : 0;
            minusDm[i] = down > up && down > 0 ? down : 0;
        }

        double[] trur = MovingAverages.rma(ATR.trueRange(bars, false), diLength);
        double[] plusSmoothed = MovingAverages.rma(plusDm, diLength);
        double[] minusSmoothed = MovingAverages.rma(minusDm, diLength);

        double[] plus = SeriesOps.nan(n);
        double[] minus = SeriesOps.nan(n);
        double[] dx = SeriesOps.nan(n);
        for (int i = 0; i < n; i++) {
            if (Double.isNaN(trur[i]) || trur[i] == 0) {
                continue;
            }
            plus[i] = 100.0 * plusSmoothed[i] / trur[i];
            minus[i] = 100.0 * minusSmoothed[i] / trur[i];
            double sum = plus[i] + minus[i];
            dx[i] = Math.abs(plus[i] - minus[i]) / (sum == 0 ? 1 : sum);
        }
        double[] adx = SeriesOps.scale(MovingAverages.rma(dx, adxSmoothing), 100.0);
        return new Result(plus, minus, adx);
    }
}
