package com.pinery.core.script;

import java.util.Locale;

/**
 * Pine input kinds. GENERIC is the untyped input(...) form.
 */
public enum InputType {
    GENERIC, INT, FLOAT, BOOL, STRING, SOURCE, TIMEFRAME, SESSION, COLOR, PRICE, SYMBOL, TIME, TEXT_AREA;

    /**
     * Map the member of input.xxx to a type; unknown members fall back to GENERIC.
     */
    public static InputType fromMember(String member) {
        if (member == null || member.isEmpty()) {
            return GENERIC;
        }
        return switch (member.toLowerCase(Locale.ROOT)) {
            case "int" -> INT;
            case "float" -> FLOAT;
            case "bool" -> BOOL;
            case "string" -> STRING;
            case "source" -> SOURCE;
            case "timeframe" -> TIMEFRAME;
            case "session" -> SESSION;
            case "color" -> COLOR;
            case "price" -> PRICE;
            case "symbol" -> SYMBOL;
            case "time" -> TIME;
            case "text_area" -> TEXT_AREA;
            default -> GENERIC;
        };
    }
}
