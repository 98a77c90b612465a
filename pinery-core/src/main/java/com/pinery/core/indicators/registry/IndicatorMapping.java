package com.pinery.core.indicators.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of one Pine indicator: canonical name, implementation, parameter order,
 * defaults and the names of its returned series.
 *
 * @param returnNames empty for single-series indicators, ordered names for tuple results
 */
public record IndicatorMapping(
    String canonicalName,
    IndicatorId implementationId,
    List<String> paramNames,
    Map<String, Object> defaults,
    List<String> returnNames,
    String description
) {

    public IndicatorMapping {
        paramNames = List.copyOf(paramNames);
        defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        returnNames = List.copyOf(returnNames);
        for (String key : defaults.keySet()) {
            if (!paramNames.contains(key)) {
                throw new IllegalArgumentException(canonicalName + ": default for unknown parameter " + key);
            }
        }
    }

    public boolean multi() {
        return returnNames.size() > 1;
    }

    /**
     * Name without the "ta." prefix.
     */
    public String shortName() {
        int dot = canonicalName.indexOf('.');
        return dot >= 0 ? canonicalName.substring(dot + 1) : canonicalName;
    }
}
