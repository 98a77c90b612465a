package com.pinery.converter.python;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry-point contract every generated module must satisfy, whichever path produced it:
 * a {@code generate_signal} function taking {@code current_price}, defined at module level
 * or as a method of a top-level class.
 */
public final class OutputContract {

    public static final String ENTRY_POINT = "generate_signal";

    private static final Pattern ENTRY = Pattern.compile(
        "^([ \\t]*)(?:async[ \\t]+)?def[ \\t]+" + ENTRY_POINT + "[ \\t]*\\(([^)]*)\\)", Pattern.MULTILINE);
    private static final Pattern PRICE_PARAM = Pattern.compile("(^|[\\s,(])current_price\\b");

    private static final PythonSyntaxValidator VALIDATOR = new PythonSyntaxValidator();

    private OutputContract() {
    }

    /**
     * Check that the entry point exists with the required parameter. Does not check syntax.
     */
    public static SyntaxCheckResult checkEntryPoint(String code) {
        if (code == null || code.isBlank()) {
            return SyntaxCheckResult.error("Empty code", 0);
        }
        Matcher matcher = ENTRY.matcher(code);
        boolean found = false;
        while (matcher.find()) {
            found = true;
            String indent = matcher.group(1).replace("\t", "    ");
            if (indent.length() > 4) {
                continue;
            }
            if (PRICE_PARAM.matcher(matcher.group(2)).find()) {
                return SyntaxCheckResult.ok();
            }
        }
        if (found) {
            return SyntaxCheckResult.error("def " + ENTRY_POINT + "(...) does not take current_price at module or class level", 0);
        }
        return SyntaxCheckResult.error("Missing required entry point: def " + ENTRY_POINT + "(...)", 0);
    }

    /**
     * Full acceptance check: Python syntax first, then the entry point.
     */
    public static SyntaxCheckResult check(String code) {
        SyntaxCheckResult syntax = VALIDATOR.validate(code);
        if (!syntax.valid()) {
            return syntax;
        }
        return checkEntryPoint(code);
    }
}
