package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

/**
 * Parabolic SAR, following Pine's reference implementation (first trend decided on bar 1).
 */
public final class ParabolicSar extends SimpleIndicator {

    public static final ParabolicSar INSTANCE = new ParabolicSar();

    private ParabolicSar() {
        super(IndicatorId.SAR, "Parabolic SAR", "Stop and reverse points with accelerating factor");
    }

    @Override
    protected double[] series(IndicatorArgs args) {
        return calculate(args.bars(), args.doubleValue("start"), args.doubleValue("increment"),
            args.doubleValue("maximum"));
    }

    // ===== Static calculation methods =====

    public static double[] calculate(Bars bars, double start, double increment, double maximum) {
        int n = bars.size();
        double[] high = bars.high();
        double[] low = bars.low();
        double[] close = bars.close();
        double[] result = SeriesOps.nan(n);
        if (n < 2) {
            return result;
        }

        double sar;
        double extreme;
        double acceleration = start;
        boolean below;
        if (close[1] > close[0]) {
            below = true;
            extreme = high[1];
            sar = low[0];
        } else {
            below = false;
            extreme = low[1];
            sar = high[0];
        }

        for (int i = 1; i < n; i++) {
            boolean firstTrendBar = i == 1;
            sar = sar + acceleration * (extreme - sar);

            if (below) {
                if (sar > low[i]) {
                    firstTrendBar = true;
                    below = false;
                    sar = Math.max(high[i], extreme);
                    extreme = low[i];
                    acceleration = start;
                }
            } else if (sar < high[i]) {
                firstTrendBar = true;
                below = true;
                sar = Math.min(low[i], extreme);
                extreme = high[i];
                acceleration = start;
            }

            if (!firstTrendBar) {
                if (below && high[i] > extreme) {
                    extreme = high[i];
                    acceleration = Math.min(acceleration + increment, maximum);
                } else if (!below && low[i] < extreme) {
                    extreme = low[i];
                    acceleration = Math.min(acceleration + increment, maximum);
                }
            }

            if (below) {
                sar = Math.min(sar, low[i - 1]);
                if (i > 1) {
                    sar = Math.min(sar, low[i - 2]);
                }
            } else {
                sar = Math.max(sar, high[i - 1]);
                if (i > 1) {
                    sar = Math.max(sar, high[i - 2]);
                }
            }
            result[i] = sar;
        }
        return result;
    }
}
