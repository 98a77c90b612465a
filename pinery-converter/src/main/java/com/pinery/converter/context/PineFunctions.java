package com.pinery.converter.context;

import java.util.Map;
import java.util.Set;

/**
 * Python equivalents of Pine helper and math functions.
 * Indicator calls (ta.*) are not listed here, they go through the runtime registry.
 */
public final class PineFunctions {

    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
        Map.entry("nz", "self._nz"),
        Map.entry("na", "self._is_na"),
        Map.entry("fixnan", "self._fixnan"),
        Map.entry("str.tostring", "str"),
        Map.entry("math.abs", "abs"),
        Map.entry("math.max", "np.maximum"),
        Map.entry("math.min", "np.minimum"),
        Map.entry("math.round", "round"),
        Map.entry("math.pow", "np.power"),
        Map.entry("math.avg", "np.mean")
    );

    private static final Set<String> RESERVED = Set.of(
        // Python keywords
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
        "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
        "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield",
        // names the generated code relies on
        "len", "abs", "max", "min", "round", "int", "float", "str", "bool", "sum", "range", "list", "dict",
        "type", "self", "np", "pd"
    );

    private PineFunctions() {
    }

    /**
     * Python callee for a Pine function name, or null when the call passes through unchanged.
     */
    public static String map(String pineName) {
        String mapped = FUNCTIONS.get(pineName);
        if (mapped != null) {
            return mapped;
        }
        if (pineName.startsWith("math.")) {
            return "np." + pineName.substring("math.".length());
        }
        return null;
    }

    /**
     * True if a user name would shadow a Python keyword or a name the generated code uses.
     */
    public static boolean isReserved(String name) {
        return RESERVED.contains(name);
    }

    /**
     * Python-safe spelling of a user identifier: reserved names get a trailing underscore.
     */
    public static String safeName(String name) {
        return isReserved(name) ? name + "_" : name;
    }
}
