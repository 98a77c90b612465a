package com.pinery.core.script;

/**
 * Declaration modifiers. VAR survives across bars, VARIP also across realtime ticks.
 */
public enum VariableModifier {
    NONE,
    VAR,
    VARIP
}
