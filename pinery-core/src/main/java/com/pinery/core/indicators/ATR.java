package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

/**
 * Average True Range indicator.
 */
public final class ATR extends SimpleIndicator {

    public static final ATR INSTANCE = new ATR();

    /**
     * True range. With handle_na the first bar is high - low, otherwise NaN.
     */
    public static final Indicator TRUE_RANGE = SimpleIndicator.of(IndicatorId.TR, "True Range",
        "max(high - low, |high - close[1]|, |low - close[1]|)",
        a -> trueRange(a.bars(), a.boolValue("handle_na")));

    private ATR() {
        super(IndicatorId.ATR, "Average True Range", "Volatility indicator: RMA of the true range");
    }

    @Override
    protected double[] series(IndicatorArgs args) {
        return calculate(args.bars(), args.length("length"));
    }

    // ===== Static calculation methods =====

    public static double[] calculate(Bars bars, int period) {
        return MovingAverages.rma(trueRange(bars, true), period);
    }

    public static double[] trueRange(Bars bars, boolean handleNa) {
        int n = bars.size();
        double[] high = bars.high();
        double[] low = bars.low();
        double[] close = bars.close();
        double[] tr = SeriesOps.nan(n);
        if (n == 0) {
            return tr;
        }
        if (handleNa) {
            tr[0] = high[0] - low[0];
        }
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }
        return tr;
    }
}
