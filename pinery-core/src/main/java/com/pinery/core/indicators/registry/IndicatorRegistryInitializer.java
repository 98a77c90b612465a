package com.pinery.core.indicators.registry;

import com.pinery.core.indicators.ATR;
import com.pinery.core.indicators.BollingerBands;
import com.pinery.core.indicators.CrossSignals;
import com.pinery.core.indicators.DMI;
import com.pinery.core.indicators.KeltnerChannels;
import com.pinery.core.indicators.MACD;
import com.pinery.core.indicators.MovingAverages;
import com.pinery.core.indicators.Oscillators;
import com.pinery.core.indicators.ParabolicSar;
import com.pinery.core.indicators.Pivots;
import com.pinery.core.indicators.RollingStatistics;
import com.pinery.core.indicators.Stochastic;
import com.pinery.core.indicators.Supertrend;
import com.pinery.core.indicators.VolumeIndicators;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the indicator registry with every built-in implementation and mapping.
 */
public final class IndicatorRegistryInitializer {

    private static final Logger log = LoggerFactory.getLogger(IndicatorRegistryInitializer.class);
    private static volatile IndicatorRegistry shared;

    private IndicatorRegistryInitializer() {}

    /**
     * Shared, verified registry. Safe to call multiple times - only initializes once.
     */
    public static IndicatorRegistry standard() {
        IndicatorRegistry result = shared;
        if (result == null) {
            synchronized (IndicatorRegistryInitializer.class) {
                result = shared;
                if (result == null) {
                    result = create();
                    shared = result;
                }
            }
        }
        return result;
    }

    /**
     * A fresh, verified registry.
     *
     * @throws IllegalStateException if a mapping has no implementation
     */
    public static IndicatorRegistry create() {
        IndicatorRegistry registry = new IndicatorRegistry();
        log.info("Initializing indicator registry...");
        registerImplementations(registry);
        registry.addMappings(IndicatorMappings.all());
        registry.verify();
        log.info("Indicator registry initialized with {} indicators", registry.size());
        return registry;
    }

    static void registerImplementations(IndicatorRegistry registry) {
        // ===== Moving Averages =====
        registry.registerAll(
            MovingAverages.SMA,
            MovingAverages.EMA,
            MovingAverages.WMA,
            MovingAverages.RMA,
            MovingAverages.HMA,
            MovingAverages.VWMA,
            MovingAverages.SWMA,
            MovingAverages.ALMA,
            MovingAverages.DEMA,
            MovingAverages.TEMA,
            MovingAverages.LINREG
        );

        // ===== Oscillators =====
        registry.registerAll(
            Oscillators.RSI,
            Oscillators.ROC,
            Oscillators.MOM,
            Oscillators.CHANGE,
            Oscillators.CCI,
            Oscillators.CMO,
            Oscillators.MFI,
            Oscillators.WPR,
            Oscillators.TSI
        );

        // ===== Composite Indicators =====
        registry.registerAll(
            MACD.INSTANCE,
            Stochastic.INSTANCE,
            BollingerBands.INSTANCE,
            BollingerBands.WIDTH,
            KeltnerChannels.INSTANCE,
            KeltnerChannels.WIDTH
        );

        // ===== Volatility =====
        registry.registerAll(
            ATR.INSTANCE,
            ATR.TRUE_RANGE,
            RollingStatistics.STDEV,
            RollingStatistics.VARIANCE,
            RollingStatistics.DEV
        );

        // ===== Rolling Statistics =====
        registry.registerAll(
            RollingStatistics.HIGHEST,
            RollingStatistics.LOWEST,
            RollingStatistics.HIGHESTBARS,
            RollingStatistics.LOWESTBARS,
            RollingStatistics.MEDIAN,
            RollingStatistics.MODE,
            RollingStatistics.PERCENTRANK,
            RollingStatistics.RANGE,
            RollingStatistics.CORRELATION,
            RollingStatistics.COV,
            RollingStatistics.CUM
        );

        // ===== Volume =====
        registry.registerAll(
            VolumeIndicators.VWAP,
            VolumeIndicators.OBV,
            VolumeIndicators.ACCDIST,
            VolumeIndicators.PVT
        );

        // ===== Trend =====
        registry.registerAll(
            DMI.INSTANCE,
            DMI.ADX,
            Supertrend.INSTANCE,
            ParabolicSar.INSTANCE
        );

        // ===== Signals =====
        registry.registerAll(
            CrossSignals.CROSSOVER,
            CrossSignals.CROSSUNDER,
            CrossSignals.CROSS,
            CrossSignals.RISING,
            CrossSignals.FALLING,
            CrossSignals.BARSSINCE,
            CrossSignals.VALUEWHEN,
            Pivots.PIVOTHIGH,
            Pivots.PIVOTLOW
        );
    }
}
