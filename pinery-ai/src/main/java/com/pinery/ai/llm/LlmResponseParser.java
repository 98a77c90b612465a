package com.pinery.ai.llm;

import com.pinery.converter.codegen.CodeFormatter;
import com.pinery.converter.codegen.GeneratedCode;
import com.pinery.converter.python.OutputContract;
import com.pinery.converter.python.SyntaxCheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts Python code from LLM answers and validates it with the same checks as rule-based output.
 */
public class LlmResponseParser {

    private static final Logger log = LoggerFactory.getLogger(LlmResponseParser.class);

    private static final Pattern CLASS_PATTERN = Pattern.compile("^class\\s+(\\w+)", Pattern.MULTILINE);
    private static final Pattern CODE_START = Pattern.compile("^(from |import |class |def |@)");
    private static final Pattern INDICATOR = Pattern.compile("\\bta\\.([A-Za-z_][A-Za-z0-9_]*)");
    private static final Pattern BULLET = Pattern.compile("^([-*]|\\d+[.)])\\s+");

    private final CodeFormatter formatter;

    public LlmResponseParser() {
        this(new CodeFormatter());
    }

    public LlmResponseParser(CodeFormatter formatter) {
        this.formatter = formatter;
    }

    /**
     * Code candidate extracted from an answer. {@code success} only when it passed validation.
     */
    public record ParsedResponse(boolean success, String code, String className, String imports,
                                 List<String> indicatorsUsed, List<String> errors) {

        public ParsedResponse {
            indicatorsUsed = List.copyOf(indicatorsUsed);
            errors = List.copyOf(errors);
        }

        public GeneratedCode toGeneratedCode(List<String> warnings) {
            return new GeneratedCode(code, className, imports, Map.of(), indicatorsUsed, warnings, errors);
        }
    }

    /**
     * Verdict on a verification prompt. Issues are empty when the answer was CORRECT.
     */
    public record Verification(boolean correct, List<String> issues, String correctedCode) {

        public Verification {
            issues = List.copyOf(issues);
        }
    }

    public ParsedResponse parse(String response, String fallbackClassName) {
        List<String> errors = new ArrayList<>();
        String code = extractCode(response);
        if (code.isBlank()) {
            errors.add("No Python code found in LLM response");
            return new ParsedResponse(false, "", fallbackClassName, "", List.of(), errors);
        }
        code = formatter.format(code);

        SyntaxCheckResult check = OutputContract.check(code);
        if (!check.valid()) {
            errors.add(check.line() > 0 ? "Python syntax error: " + check.describe() : check.describe());
        }
        String className = extractClassName(code);
        ParsedResponse parsed = new ParsedResponse(errors.isEmpty(), code,
            className != null ? className : fallbackClassName, extractImports(code), extractIndicators(code), errors);
        log.debug("Parsed LLM response: {} chars, {} errors", code.length(), errors.size());
        return parsed;
    }

    public Verification parseVerification(String response) {
        String text = response == null ? "" : response.strip();
        String upper = text.toUpperCase(Locale.ROOT);
        String corrected = extractFencedBlocks(text).stream()
            .max((a, b) -> Integer.compare(a.length(), b.length()))
            .orElse(null);

        if (upper.contains("INCORRECT")) {
            List<String> issues = new ArrayList<>();
            boolean inBlock = false;
            for (String line : text.split("\n")) {
                String trimmed = line.trim();
                if (trimmed.startsWith("```")) {
                    inBlock = !inBlock;
                    continue;
                }
                if (inBlock || trimmed.isEmpty()) {
                    continue;
                }
                String issue = trimmed.replaceFirst("(?i)^\"?INCORRECT\"?:?\\s*", "");
                issue = BULLET.matcher(issue).replaceFirst("").trim();
                if (!issue.isEmpty()) {
                    issues.add(issue);
                }
            }
            if (issues.isEmpty()) {
                issues.add("Verification reported the conversion as incorrect without details");
            }
            return new Verification(false, issues, corrected);
        }
        if (upper.contains("CORRECT")) {
            return new Verification(true, List.of(), null);
        }
        String excerpt = text.length() <= 80 ? text : text.substring(0, 80) + "...";
        return new Verification(false, List.of("Verification answer not understood: " + excerpt), corrected);
    }

    // ===== Extraction =====

    /**
     * Longest fenced python block, or the raw code from the first import/class/def line.
     */
    String extractCode(String response) {
        if (response == null) {
            return "";
        }
        String normalized = response.replace("\r\n", "\n");
        List<String> blocks = extractFencedBlocks(normalized);
        if (!blocks.isEmpty()) {
            String longest = blocks.get(0);
            for (String block : blocks) {
                if (block.length() > longest.length()) {
                    longest = block;
                }
            }
            return longest.strip();
        }
        List<String> code = new ArrayList<>();
        boolean inCode = false;
        for (String line : normalized.split("\n", -1)) {
            if (!inCode && CODE_START.matcher(line).find()) {
                inCode = true;
            }
            if (inCode) {
                code.add(line);
            }
        }
        return String.join("\n", code).strip();
    }

    private static List<String> extractFencedBlocks(String text) {
        List<String> blocks = new ArrayList<>();
        StringBuilder current = null;
        boolean skipping = false;
        for (String line : text.split("\n", -1)) {
            String trimmed = line.trim();
            if (skipping) {
                skipping = !trimmed.equals("```");
            } else if (current == null) {
                if (trimmed.startsWith("```")) {
                    String lang = trimmed.substring(3).trim().toLowerCase(Locale.ROOT);
                    if (lang.isEmpty() || lang.equals("python") || lang.equals("py") || lang.equals("python3")) {
                        current = new StringBuilder();
                    } else {
                        skipping = true;
                    }
                }
            } else if (trimmed.equals("```")) {
                if (!current.toString().isBlank()) {
                    blocks.add(current.toString());
                }
                current = null;
            } else {
                current.append(line).append('\n');
            }
        }
        return blocks;
    }

    static String extractClassName(String code) {
        Matcher m = CLASS_PATTERN.matcher(code);
        return m.find() ? m.group(1) : null;
    }

    public static String extractImports(String code) {
        List<String> imports = new ArrayList<>();
        for (String line : code.split("\n")) {
            if (line.startsWith("import ") || (line.startsWith("from ") && line.contains(" import "))) {
                imports.add(line);
            }
        }
        return String.join("\n", imports);
    }

    static List<String> extractIndicators(String code) {
        SortedSet<String> names = new TreeSet<>();
        Matcher m = INDICATOR.matcher(code);
        while (m.find()) {
            names.add("ta." + m.group(1));
        }
        return List.copyOf(names);
    }
}
