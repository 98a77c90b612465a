package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

import java.util.List;

/**
 * Supertrend indicator - trend-following bands around hl2 based on ATR.
 * Direction is -1 in an uptrend (line below price) and 1 in a downtrend.
 */
public final class Supertrend implements Indicator {

    public static final Supertrend INSTANCE = new Supertrend();

    public static final List<String> SERIES = List.of("supertrend", "direction");

    private Supertrend() {}

    public record Result(double[] supertrend, double[] direction) {
        public IndicatorResult.Multi toMulti() {
            return new IndicatorResult.Multi(SERIES, List.of(supertrend, direction));
        }
    }

    @Override
    public IndicatorId id() { return IndicatorId.SUPERTREND; }

    @Override
    public String name() { return "Supertrend"; }

    @Override
    public String description() { return "ATR-based trend following line (-1 = up, 1 = down)"; }

    @Override
    public IndicatorResult compute(IndicatorArgs args) {
        return calculate(args.bars(), args.doubleValue("factor"), args.length("atr_period")).toMulti();
    }

    // ===== Static calculation methods =====

    public static Result calculate(Bars bars, double factor, int atrPeriod) {
        int n = bars.size();
        double[] close = bars.close();
        double[] hl2 = bars.series("hl2");
        double[] atr = ATR.calculate(bars, atrPeriod);

        double[] supertrend = SeriesOps.nan(n);
        double[] direction = SeriesOps.nan(n);
        double[] upperBand = SeriesOps.nan(n);
        double[] lowerBand = SeriesOps.nan(n);

        for (int i = 0; i < n; i++) {
            if (Double.isNaN(atr[i])) {
                continue;
            }
            double upper = hl2[i] + factor * atr[i];
            double lower = hl2[i] - factor * atr[i];
            double prevUpper = i > 0 && !Double.isNaN(upperBand[i - 1]) ? upperBand[i - 1] : 0;
            double prevLower = i > 0 && !Double.isNaN(lowerBand[i - 1]) ? lowerBand[i - 1] : 0;
            double prevClose = i > 0 ? close[i - 1] : Double.NaN;

            lowerBand[i] = lower > prevLower || prevClose < prevLower ? lower : prevLower;
            upperBand[i] = upper < prevUpper || prevClose > prevUpper ? upper : prevUpper;

            if (i == 0 || Double.isNaN(atr[i - 1])) {
                direction[i] = 1;
            } else if (supertrend[i - 1] == prevUpper) {
                direction[i] = close[i] > upperBand[i] ? -1 : 1;
            } else {
                direction[i] = close[i] < lowerBand[i] ? 1 : -1;
            }
            supertrend[i] = direction[i] == -1 ? lowerBand[i] : upperBand[i];
        }
        return new Result(supertrend, direction);
    }
}
