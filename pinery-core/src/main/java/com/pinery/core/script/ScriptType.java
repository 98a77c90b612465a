package com.pinery.core.script;

/**
 * Kind of script declared by indicator(...), strategy(...) or library(...).
 */
public enum ScriptType {
    INDICATOR,
    STRATEGY,
    LIBRARY
}
