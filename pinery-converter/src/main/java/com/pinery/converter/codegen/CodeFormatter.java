package com.pinery.converter.codegen;

import com.pinery.converter.python.PythonSyntaxValidator;
import com.pinery.converter.python.SyntaxCheckResult;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Whitespace normalization, syntax validation and the single repair pass for generated Python.
 */
public class CodeFormatter {

    private static final int INDENT = 4;

    private final PythonSyntaxValidator validator;

    public CodeFormatter() {
        this(new PythonSyntaxValidator());
    }

    public CodeFormatter(PythonSyntaxValidator validator) {
        this.validator = validator;
    }

    /**
     * Normalize line endings, expand tabs, strip trailing whitespace, de-duplicate top-level
     * imports, keep at most two consecutive blank lines and end with exactly one newline.
     */
    public String format(String code) {
        String text = code.replace("\r\n", "\n").replace('\r', '\n');
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(stripTrailing(expandTabs(line)));
        }
        lines = removeDuplicateImports(lines);
        return finish(collapseBlankLines(lines, 2));
    }

    public SyntaxCheckResult validateSyntax(String code) {
        return validator.validate(code);
    }

    /**
     * Repair pass: round leading indentation down to a multiple of four and keep at most one blank line.
     */
    public String repair(String code) {
        List<String> lines = new ArrayList<>();
        for (String line : code.split("\n", -1)) {
            int leading = 0;
            while (leading < line.length() && line.charAt(leading) == ' ') {
                leading++;
            }
            int rounded = leading / INDENT * INDENT;
            lines.add(" ".repeat(rounded) + line.substring(leading));
        }
        return finish(collapseBlankLines(lines, 1));
    }

    public String removeDuplicateBlankLines(String code) {
        return finish(collapseBlankLines(List.of(code.split("\n", -1)), 2));
    }

    // ===== Steps =====

    private static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                int spaces = INDENT - sb.length() % INDENT;
                sb.append(" ".repeat(spaces));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String stripTrailing(String line) {
        return line.stripTrailing();
    }

    /**
     * Drop repeated column-0 import lines outside docstrings, keeping the first occurrence.
     */
    private static List<String> removeDuplicateImports(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        Set<String> seen = new HashSet<>();
        boolean inDocstring = false;
        for (String line : lines) {
            boolean isImport = !inDocstring && (line.startsWith("import ") || (line.startsWith("from ") && line.contains(" import ")));
            if (countOf(line, "\"\"\"") % 2 == 1) {
                inDocstring = !inDocstring;
            }
            if (isImport && !seen.add(line)) {
                continue;
            }
            result.add(line);
        }
        return result;
    }

    private static List<String> collapseBlankLines(List<String> lines, int maxBlank) {
        List<String> result = new ArrayList<>(lines.size());
        int blanks = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                blanks++;
                if (blanks > maxBlank) {
                    continue;
                }
                result.add("");
            } else {
                blanks = 0;
                result.add(line);
            }
        }
        return result;
    }

    private static String finish(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isBlank()) {
            start++;
        }
        while (end > start && lines.get(end - 1).isBlank()) {
            end--;
        }
        if (start == end) {
            return "";
        }
        return String.join("\n", lines.subList(start, end)) + "\n";
    }

    private static int countOf(String text, String part) {
        int count = 0;
        int index = text.indexOf(part);
        while (index >= 0) {
            count++;
            index = text.indexOf(part, index + part.length());
        }
        return count;
    }
}
