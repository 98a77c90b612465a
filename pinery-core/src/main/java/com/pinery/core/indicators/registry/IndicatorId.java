package com.pinery.core.indicators.registry;

/**
 * One constant per numeric implementation. Canonical Pine names map onto these through
 * {@link IndicatorMapping}; the registry verifies at startup that every mapped id is implemented.
 */
public enum IndicatorId {
    // Moving averages
    SMA, EMA, WMA, RMA, HMA, VWMA, SWMA, ALMA, DEMA, TEMA, LINREG,

    // Momentum and oscillators
    RSI, ROC, MOM, CHANGE, CCI, CMO, MFI, WPR, TSI, STOCH, MACD,

    // Volatility and bands
    BB, BBW, KC, KCW, ATR, TR, STDEV, VARIANCE, DEV,

    // Rolling window statistics
    HIGHEST, LOWEST, HIGHESTBARS, LOWESTBARS, MEDIAN, MODE, PERCENTRANK, RANGE, CORRELATION, COV, CUM,

    // Volume
    VWAP, OBV, ACCDIST, PVT,

    // Trend
    ADX, DMI, SUPERTREND, SAR,

    // Signals and events
    CROSSOVER, CROSSUNDER, CROSS, RISING, FALLING, PIVOTHIGH, PIVOTLOW, BARSSINCE, VALUEWHEN
}
