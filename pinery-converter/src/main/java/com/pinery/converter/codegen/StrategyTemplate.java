package com.pinery.converter.codegen;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python module template with {{name}} placeholders.
 *
 * A placeholder alone on its line is a block: it takes a list of lines, each indented like the
 * placeholder, and an empty list removes the line. Any other placeholder is replaced inline by a string.
 */
public class StrategyTemplate {

    public static final String DEFAULT_RESOURCE = "/templates/strategy.py.tmpl";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");
    private static final Pattern BLOCK_LINE = Pattern.compile("^([ \\t]*)\\{\\{(\\w+)}}[ \\t]*$");

    private final List<String> lines;

    public StrategyTemplate(String text) {
        this.lines = List.of(text.replace("\r\n", "\n").split("\n", -1));
    }

    /**
     * Template bundled with the converter.
     */
    public static StrategyTemplate standard() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static StrategyTemplate fromClasspath(String resource) {
        try (InputStream in = StrategyTemplate.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Template not found on classpath: " + resource);
            }
            return new StrategyTemplate(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read template " + resource, e);
        }
    }

    /**
     * Fill every placeholder. Values are {@code String} for inline and {@code List<String>} for block placeholders.
     *
     * @throws IllegalArgumentException if a placeholder has no value or a value of the wrong kind
     */
    public String render(Map<String, Object> values) {
        List<String> out = new ArrayList<>(lines.size() + 64);
        for (String line : lines) {
            Matcher block = BLOCK_LINE.matcher(line);
            if (block.matches()) {
                Object value = require(values, block.group(2));
                if (value instanceof List<?> blockLines) {
                    String indent = block.group(1);
                    for (Object blockLine : blockLines) {
                        String text = String.valueOf(blockLine);
                        out.add(text.isBlank() ? "" : indent + text);
                    }
                    continue;
                }
                out.add(block.group(1) + value);
                continue;
            }
            out.add(inline(line, values));
        }
        return String.join("\n", out);
    }

    private static String inline(String line, Map<String, Object> values) {
        Matcher matcher = PLACEHOLDER.matcher(line);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            Object value = require(values, matcher.group(1));
            if (value instanceof List<?>) {
                throw new IllegalArgumentException("Block value used inline for placeholder: " + matcher.group(1));
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(value)));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static Object require(Map<String, Object> values, String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("No value for template placeholder: " + name);
        }
        return value;
    }
}
