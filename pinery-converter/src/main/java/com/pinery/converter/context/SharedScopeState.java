package com.pinery.converter.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * State shared by every scope of one translation: the built-in table, the indicators-used set and
 * the warnings raised while building expressions.
 *
 * A child {@link TransformationContext} receives the same instance as its parent, so an indicator
 * recorded in a nested scope is visible to the parent without copying. Create one per conversion.
 */
public final class SharedScopeState {

    private final Map<String, String> builtins;
    private final SortedSet<String> indicatorsUsed = new TreeSet<>();
    private final List<String> warnings = new ArrayList<>();

    public SharedScopeState(Map<String, String> builtins) {
        this.builtins = Collections.unmodifiableMap(new LinkedHashMap<>(builtins));
    }

    /**
     * Fresh state with the standard Pine built-in table.
     */
    public static SharedScopeState withDefaultBuiltins() {
        return new SharedScopeState(defaultBuiltins());
    }

    public Map<String, String> builtins() {
        return builtins;
    }

    public synchronized void recordIndicator(String name) {
        indicatorsUsed.add(name);
    }

    /**
     * Snapshot of the indicators recorded so far, sorted by name.
     */
    public synchronized SortedSet<String> indicatorsUsed() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(indicatorsUsed));
    }

    /**
     * Record a warning once; repeats of the same text are dropped.
     */
    public synchronized void recordWarning(String warning) {
        if (!warnings.contains(warning)) {
            warnings.add(warning);
        }
    }

    public synchronized List<String> warnings() {
        return List.copyOf(warnings);
    }

    /**
     * Pine built-in names and their Python equivalents inside the generated class.
     */
    public static Map<String, String> defaultBuiltins() {
        Map<String, String> map = new LinkedHashMap<>();

        // ===== Price series =====
        map.put("open", "self.open");
        map.put("high", "self.high");
        map.put("low", "self.low");
        map.put("close", "self.close");
        map.put("volume", "self.volume");
        map.put("hl2", "(self.high + self.low) / 2");
        map.put("hlc3", "(self.high + self.low + self.close) / 3");
        map.put("ohlc4", "(self.open + self.high + self.low + self.close) / 4");
        map.put("hlcc4", "(self.high + self.low + self.close + self.close) / 4");

        // ===== Bar state =====
        map.put("bar_index", "len(self.close) - 1");
        map.put("last_bar_index", "len(self.close) - 1");
        map.put("barstate.isfirst", "len(self.close) == 1");
        map.put("barstate.islast", "True");
        map.put("barstate.isconfirmed", "True");
        map.put("barstate.isnew", "True");
        map.put("barstate.isrealtime", "False");
        map.put("barstate.ishistory", "True");

        // ===== Strategy state =====
        map.put("strategy.position_size", "self.position_size");
        map.put("strategy.long", "\"long\"");
        map.put("strategy.short", "\"short\"");

        // ===== Constants =====
        map.put("math.pi", "np.pi");
        map.put("math.e", "np.e");
        map.put("true", "True");
        map.put("false", "False");
        map.put("na", "np.nan");
        return map;
    }
}
