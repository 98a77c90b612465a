package com.pinery.core.indicators.registry;

import com.pinery.core.indicators.Bars;
import com.pinery.core.indicators.Indicator;
import com.pinery.core.indicators.IndicatorArgs;
import com.pinery.core.indicators.IndicatorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Registry of Pine indicator mappings and the numeric implementations behind them.
 *
 * Populated once, then {@link #verify() verified}: every mapping must resolve to a registered
 * implementation before any calculation runs. After verification the registry is sealed and
 * read-only, so it can be shared across threads without locking.
 */
public final class IndicatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(IndicatorRegistry.class);
    private static final String PREFIX = "ta.";

    private final Map<IndicatorId, Indicator> implementations = new EnumMap<>(IndicatorId.class);
    private final Map<String, IndicatorMapping> mappings = new TreeMap<>();
    private volatile boolean sealed;

    /**
     * Register an implementation. Overwrites any existing one with the same id.
     */
    public synchronized void register(Indicator indicator) {
        ensureOpen();
        implementations.put(indicator.id(), indicator);
        log.debug("Registered indicator: {}", indicator.id());
    }

    /**
     * Register multiple implementations at once.
     */
    public void registerAll(Indicator... indicators) {
        for (Indicator indicator : indicators) {
            register(indicator);
        }
    }

    public synchronized void addMapping(IndicatorMapping mapping) {
        ensureOpen();
        mappings.put(mapping.canonicalName(), mapping);
    }

    public void addMappings(Collection<IndicatorMapping> toAdd) {
        for (IndicatorMapping mapping : toAdd) {
            addMapping(mapping);
        }
    }

    /**
     * Check that every mapping resolves to an implementation, then seal the registry.
     *
     * @throws IllegalStateException naming every mapping without an implementation
     */
    public synchronized void verify() {
        List<String> missing = new ArrayList<>();
        for (IndicatorMapping mapping : mappings.values()) {
            if (!implementations.containsKey(mapping.implementationId())) {
                missing.add(mapping.canonicalName() + " -> " + mapping.implementationId());
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Indicator mappings without implementation: " + missing);
        }
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Get a mapping by name. Accepts "ta.rsi" or the bare "rsi".
     *
     * @return the mapping, or null if not found
     */
    public IndicatorMapping get(String name) {
        if (name == null) {
            return null;
        }
        return mappings.get(canonical(name));
    }

    /**
     * Get a mapping by name, throwing if not found.
     */
    public IndicatorMapping getOrThrow(String name) {
        IndicatorMapping mapping = get(name);
        if (mapping == null) {
            throw new IllegalArgumentException("Unknown indicator: " + name);
        }
        return mapping;
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public Indicator implementation(IndicatorId id) {
        return implementations.get(id);
    }

    /**
     * All mappings, sorted by canonical name.
     */
    public Collection<IndicatorMapping> mappings() {
        return Collections.unmodifiableCollection(mappings.values());
    }

    /**
     * Count of canonical names.
     */
    public int size() {
        return mappings.size();
    }

    /**
     * Clear all registrations and unseal (mainly for testing).
     */
    public synchronized void clear() {
        implementations.clear();
        mappings.clear();
        sealed = false;
    }

    // ===== Calculation =====

    /**
     * Evaluate an indicator. Parameters resolve as defaults, then positional arguments in
     * declared order, then named overrides.
     *
     * @throws IllegalArgumentException for an unknown name, too many positional arguments or an unknown parameter name
     * @throws IllegalStateException    if the registry has not been verified
     */
    public IndicatorResult calculate(String name, Bars bars, List<Object> args, Map<String, Object> overrides) {
        if (!sealed) {
            throw new IllegalStateException("Indicator registry used before verify()");
        }
        IndicatorMapping mapping = getOrThrow(name);
        List<Object> positional = args != null ? args : List.of();
        Map<String, Object> named = overrides != null ? overrides : Map.of();

        if (positional.size() > mapping.paramNames().size()) {
            throw new IllegalArgumentException(mapping.canonicalName() + " takes at most "
                + mapping.paramNames().size() + " arguments, got " + positional.size());
        }
        Map<String, Object> values = new LinkedHashMap<>(mapping.defaults());
        for (int i = 0; i < positional.size(); i++) {
            values.put(mapping.paramNames().get(i), positional.get(i));
        }
        for (Map.Entry<String, Object> entry : named.entrySet()) {
            if (!mapping.paramNames().contains(entry.getKey())) {
                throw new IllegalArgumentException(mapping.canonicalName() + " has no parameter '"
                    + entry.getKey() + "'; expected one of " + mapping.paramNames());
            }
            values.put(entry.getKey(), entry.getValue());
        }

        Indicator indicator = implementations.get(mapping.implementationId());
        return indicator.compute(new IndicatorArgs(bars, values, positional.size()));
    }

    /**
     * Positional-only convenience form.
     */
    public IndicatorResult calculate(String name, Bars bars, Object... args) {
        return calculate(name, bars, Arrays.asList(args), Map.of());
    }

    private static String canonical(String name) {
        return name.startsWith(PREFIX) ? name : PREFIX + name;
    }

    private void ensureOpen() {
        if (sealed) {
            throw new IllegalStateException("Indicator registry is sealed");
        }
    }
}
