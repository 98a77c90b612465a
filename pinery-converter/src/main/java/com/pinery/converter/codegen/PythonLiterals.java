package com.pinery.converter.codegen;

/**
 * Python literal spelling helpers.
 */
public final class PythonLiterals {

    private PythonLiterals() {
    }

    /**
     * Double-quoted Python string literal.
     */
    public static String string(String value) {
        if (value == null) {
            return "None";
        }
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Double spelled the way Python prints it for the values used in generated code.
     */
    public static String number(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return (long) value + ".0";
        }
        return Double.toString(value);
    }

    /**
     * Text safe to place on one line inside a comment or docstring.
     */
    public static String commentText(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\"\"\"", "'''").replace("\\", "/").replaceAll("[\\r\\n]+", " ").trim();
    }
}
