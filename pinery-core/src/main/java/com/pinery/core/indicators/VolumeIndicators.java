package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

/**
 * Cumulative volume indicators: vwap, obv, accdist, pvt.
 * All accumulate from the first bar; there are no session resets.
 */
public final class VolumeIndicators {

    private VolumeIndicators() {}

    public static final Indicator VWAP = SimpleIndicator.of(IndicatorId.VWAP, "Volume Weighted Average Price",
        "Cumulative source * volume over cumulative volume",
        a -> vwap(a.series("source"), a.bars().volume()));

    public static final Indicator OBV = SimpleIndicator.of(IndicatorId.OBV, "On Balance Volume",
        "Cumulative volume signed by the close-to-close change",
        a -> obv(a.bars().close(), a.bars().volume()));

    public static final Indicator ACCDIST = SimpleIndicator.of(IndicatorId.ACCDIST, "Accumulation/Distribution",
        "Cumulative close location value times volume",
        a -> accdist(a.bars()));

    public static final Indicator PVT = SimpleIndicator.of(IndicatorId.PVT, "Price Volume Trend",
        "Cumulative relative close change times volume",
        a -> pvt(a.bars().close(), a.bars().volume()));

    // ===== Static calculation methods =====

    public static double[] vwap(double[] src, double[] volume) {
        double[] result = SeriesOps.nan(src.length);
        double weighted = 0;
        double total = 0;
        for (int i = 0; i < src.length; i++) {
            if (!Double.isNaN(src[i]) && !Double.isNaN(volume[i])) {
                weighted += src[i] * volume[i];
                total += volume[i];
            }
            if (total != 0) {
                result[i] = weighted / total;
            }
        }
        return result;
    }

    public static double[] obv(double[] close, double[] volume) {
        double[] flow = new double[close.length];
        for (int i = 1; i < close.length; i++) {
            flow[i] = Math.signum(close[i] - close[i - 1]) * volume[i];
        }
        return SeriesOps.cumulative(flow);
    }

    public static double[] accdist(Bars bars) {
        int n = bars.size();
        double[] flow = new double[n];
        for (int i = 0; i < n; i++) {
            double range = bars.high()[i] - bars.low()[i];
            if (range != 0) {
                double location = ((bars.close()[i] - bars.low()[i]) - (bars.high()[i] - bars.close()[i])) / range;
                flow[i] = location * bars.volume()[i];
            }
        }
        return SeriesOps.cumulative(flow);
    }

    public static double[] pvt(double[] close, double[] volume) {
        double[] flow = new double[close.length];
        for (int i = 1; i < close.length; i++) {
            if (close[i - 1] != 0) {
                flow[i] = (close[i] - close[i - 1]) / close[i - 1] * volume[i];
            }
        }
        return SeriesOps.cumulative(flow);
    }
}
