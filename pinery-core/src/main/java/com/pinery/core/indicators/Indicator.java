package com.pinery.core.indicators;

import com.pinery.core.indicators.registry.IndicatorId;

/**
 * A numeric indicator implementation, looked up by {@link IndicatorId}.
 */
public interface Indicator {

    /**
     * Implementation id this indicator is registered under.
     */
    IndicatorId id();

    /**
     * Human-readable name (e.g., "Relative Strength Index").
     */
    String name();

    /**
     * Short description.
     */
    String description();

    /**
     * Evaluate over every bar. Implementations never mutate their inputs.
     */
    IndicatorResult compute(IndicatorArgs args);
}
