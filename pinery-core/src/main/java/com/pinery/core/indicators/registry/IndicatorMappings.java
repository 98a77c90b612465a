package com.pinery.core.indicators.registry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The built-in mapping table. Parameters follow Pine's own signatures; OHLCV inputs that Pine
 * reads implicitly (ta.atr, ta.dmi, ta.supertrend) come from the bound bars instead.
 */
public final class IndicatorMappings {

    private static final List<String> NONE = List.of();

    private IndicatorMappings() {}

    public static List<IndicatorMapping> all() {
        List<IndicatorMapping> m = new ArrayList<>();

        // ===== Moving averages =====
        m.add(map("ta.sma", IndicatorId.SMA, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Simple Moving Average"));
        m.add(map("ta.ema", IndicatorId.EMA, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Exponential Moving Average"));
        m.add(map("ta.wma", IndicatorId.WMA, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Weighted Moving Average"));
        m.add(map("ta.rma", IndicatorId.RMA, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Wilder's Moving Average"));
        m.add(map("ta.hma", IndicatorId.HMA, params("source", "length"), defaults("source", "close", "length", 9), NONE, "Hull Moving Average"));
        m.add(map("ta.vwma", IndicatorId.VWMA, params("source", "length"), defaults("source", "close", "length", 20), NONE, "Volume Weighted Moving Average"));
        m.add(map("ta.swma", IndicatorId.SWMA, params("source"), defaults("source", "close"), NONE, "Symmetrically Weighted Moving Average"));
        m.add(map("ta.alma", IndicatorId.ALMA, params("source", "length", "offset", "sigma"),
            defaults("source", "close", "length", 9, "offset", 0.85, "sigma", 6.0), NONE, "Arnaud Legoux Moving Average"));
        m.add(map("ta.dema", IndicatorId.DEMA, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Double Exponential Moving Average"));
        m.add(map("ta.tema", IndicatorId.TEMA, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Triple Exponential Moving Average"));
        m.add(map("ta.linreg", IndicatorId.LINREG, params("source", "length", "offset"),
            defaults("source", "close", "length", 14, "offset", 0), NONE, "Linear Regression"));

        // ===== Momentum =====
        m.add(map("ta.rsi", IndicatorId.RSI, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Relative Strength Index"));
        m.add(map("ta.roc", IndicatorId.ROC, params("source", "length"), defaults("source", "close", "length", 10), NONE, "Rate of Change"));
        m.add(map("ta.mom", IndicatorId.MOM, params("source", "length"), defaults("source", "close", "length", 10), NONE, "Momentum"));
        m.add(map("ta.change", IndicatorId.CHANGE, params("source", "length"), defaults("source", "close", "length", 1), NONE, "Change"));
        m.add(map("ta.cci", IndicatorId.CCI, params("source", "length"), defaults("source", "close", "length", 20), NONE, "Commodity Channel Index"));
        m.add(map("ta.cmo", IndicatorId.CMO, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Chande Momentum Oscillator"));
        m.add(map("ta.mfi", IndicatorId.MFI, params("source", "length"), defaults("source", "hlc3", "length", 14), NONE, "Money Flow Index"));
        m.add(map("ta.wpr", IndicatorId.WPR, params("length"), defaults("length", 14), NONE, "Williams %R"));
        m.add(map("ta.tsi", IndicatorId.TSI, params("source", "short_length", "long_length"),
            defaults("source", "close", "short_length", 13, "long_length", 25), NONE, "True Strength Index"));
        m.add(map("ta.stoch", IndicatorId.STOCH, params("source", "high", "low", "length", "smooth_k", "smooth_d"),
            defaults("source", "close", "high", "high", "low", "low", "length", 14, "smooth_k", 3, "smooth_d", 3),
            List.of("k", "d"), "Stochastic Oscillator"));
        m.add(map("ta.macd", IndicatorId.MACD, params("source", "fast_length", "slow_length", "signal_length"),
            defaults("source", "close", "fast_length", 12, "slow_length", 26, "signal_length", 9),
            List.of("macd", "signal", "histogram"), "Moving Average Convergence Divergence"));

        // ===== Volatility =====
        m.add(map("ta.bb", IndicatorId.BB, params("source", "length", "mult"),
            defaults("source", "close", "length", 20, "mult", 2.0), List.of("basis", "upper", "lower"), "Bollinger Bands"));
        m.add(map("ta.bbw", IndicatorId.BBW, params("source", "length", "mult"),
            defaults("source", "close", "length", 20, "mult", 2.0), NONE, "Bollinger Bands Width"));
        m.add(map("ta.kc", IndicatorId.KC, params("source", "length", "mult", "use_true_range"),
            defaults("source", "close", "length", 20, "mult", 2.0, "use_true_range", true),
            List.of("basis", "upper", "lower"), "Keltner Channels"));
        m.add(map("ta.kcw", IndicatorId.KCW, params("source", "length", "mult", "use_true_range"),
            defaults("source", "close", "length", 20, "mult", 2.0, "use_true_range", true), NONE, "Keltner Channels Width"));
        m.add(map("ta.atr", IndicatorId.ATR, params("length"), defaults("length", 14), NONE, "Average True Range"));
        m.add(map("ta.tr", IndicatorId.TR, params("handle_na"), defaults("handle_na", false), NONE, "True Range"));
        m.add(map("ta.stdev", IndicatorId.STDEV, params("source", "length", "biased"),
            defaults("source", "close", "length", 20, "biased", true), NONE, "Standard Deviation"));
        m.add(map("ta.variance", IndicatorId.VARIANCE, params("source", "length", "biased"),
            defaults("source", "close", "length", 20, "biased", true), NONE, "Variance"));
        m.add(map("ta.dev", IndicatorId.DEV, params("source", "length"), defaults("source", "close", "length", 20), NONE, "Mean Absolute Deviation"));

        // ===== Rolling statistics =====
        m.add(map("ta.highest", IndicatorId.HIGHEST, params("source", "length"), defaults("source", "high", "length", 14), NONE, "Highest"));
        m.add(map("ta.lowest", IndicatorId.LOWEST, params("source", "length"), defaults("source", "low", "length", 14), NONE, "Lowest"));
        m.add(map("ta.highestbars", IndicatorId.HIGHESTBARS, params("source", "length"), defaults("source", "high", "length", 14), NONE, "Highest Bars Offset"));
        m.add(map("ta.lowestbars", IndicatorId.LOWESTBARS, params("source", "length"), defaults("source", "low", "length", 14), NONE, "Lowest Bars Offset"));
        m.add(map("ta.median", IndicatorId.MEDIAN, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Median"));
        m.add(map("ta.mode", IndicatorId.MODE, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Mode"));
        m.add(map("ta.percentrank", IndicatorId.PERCENTRANK, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Percent Rank"));
        m.add(map("ta.range", IndicatorId.RANGE, params("source", "length"), defaults("source", "close", "length", 14), NONE, "Range"));
        m.add(map("ta.correlation", IndicatorId.CORRELATION, params("source1", "source2", "length"), defaults("length", 20), NONE, "Correlation"));
        m.add(map("ta.cov", IndicatorId.COV, params("source1", "source2", "length", "biased"),
            defaults("length", 20, "biased", true), NONE, "Covariance"));
        m.add(map("ta.cum", IndicatorId.CUM, params("source"), defaults("source", "close"), NONE, "Cumulative Sum"));

        // ===== Volume =====
        m.add(map("ta.vwap", IndicatorId.VWAP, params("source"), defaults("source", "hlc3"), NONE, "Volume Weighted Average Price"));
        m.add(map("ta.obv", IndicatorId.OBV, NONE, defaults(), NONE, "On Balance Volume"));
        m.add(map("ta.accdist", IndicatorId.ACCDIST, NONE, defaults(), NONE, "Accumulation/Distribution"));
        m.add(map("ta.pvt", IndicatorId.PVT, NONE, defaults(), NONE, "Price Volume Trend"));

        // ===== Trend =====
        m.add(map("ta.adx", IndicatorId.ADX, params("di_length", "adx_smoothing"),
            defaults("di_length", 14, "adx_smoothing", 14), NONE, "Average Directional Index"));
        m.add(map("ta.dmi", IndicatorId.DMI, params("di_length", "adx_smoothing"),
            defaults("di_length", 14, "adx_smoothing", 14), List.of("plus_di", "minus_di", "adx"), "Directional Movement Index"));
        m.add(map("ta.supertrend", IndicatorId.SUPERTREND, params("factor", "atr_period"),
            defaults("factor", 3.0, "atr_period", 10), List.of("supertrend", "direction"), "Supertrend"));
        m.add(map("ta.sar", IndicatorId.SAR, params("start", "increment", "maximum"),
            defaults("start", 0.02, "increment", 0.02, "maximum", 0.2), NONE, "Parabolic SAR"));

        // ===== Signals =====
        m.add(map("ta.crossover", IndicatorId.CROSSOVER, params("source1", "source2"), defaults(), NONE, "Crossover"));
        m.add(map("ta.crossunder", IndicatorId.CROSSUNDER, params("source1", "source2"), defaults(), NONE, "Crossunder"));
        m.add(map("ta.cross", IndicatorId.CROSS, params("source1", "source2"), defaults(), NONE, "Cross"));
        m.add(map("ta.rising", IndicatorId.RISING, params("source", "length"), defaults("source", "close", "length", 1), NONE, "Rising"));
        m.add(map("ta.falling", IndicatorId.FALLING, params("source", "length"), defaults("source", "close", "length", 1), NONE, "Falling"));
        m.add(map("ta.pivothigh", IndicatorId.PIVOTHIGH, params("source", "left_bars", "right_bars"),
            defaults("source", "high", "left_bars", 5, "right_bars", 5), NONE, "Pivot High"));
        m.add(map("ta.pivotlow", IndicatorId.PIVOTLOW, params("source", "left_bars", "right_bars"),
            defaults("source", "low", "left_bars", 5, "right_bars", 5), NONE, "Pivot Low"));
        m.add(map("ta.barssince", IndicatorId.BARSSINCE, params("condition"), defaults(), NONE, "Bars Since"));
        m.add(map("ta.valuewhen", IndicatorId.VALUEWHEN, params("condition", "source", "occurrence"),
            defaults("occurrence", 0), NONE, "Value When"));

        return List.copyOf(m);
    }

    // ===== Table helpers =====

    private static IndicatorMapping map(String name, IndicatorId id, List<String> params, Map<String, Object> defaults,
                                        List<String> returns, String description) {
        return new IndicatorMapping(name, id, params, defaults, returns, description);
    }

    private static List<String> params(String... names) {
        return Arrays.asList(names);
    }

    private static Map<String, Object> defaults(Object... keyValues) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            result.put((String) keyValues[i], keyValues[i + 1]);
        }
        return result;
    }
}
