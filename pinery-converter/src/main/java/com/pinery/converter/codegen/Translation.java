package com.pinery.converter.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * Python lines produced for one statement, relative to the enclosing block, plus any warnings.
 */
public record Translation(List<String> lines, List<String> warnings) {

    public Translation {
        lines = List.copyOf(lines);
        warnings = List.copyOf(warnings);
    }

    public static Translation empty() {
        return new Translation(List.of(), List.of());
    }

    public static Translation of(String line) {
        return new Translation(List.of(line), List.of());
    }

    public static Translation warning(String line, String warning) {
        return new Translation(List.of(line), List.of(warning));
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * Lines of this translation followed by the other's; warnings likewise.
     */
    public Translation plus(Translation other) {
        List<String> mergedLines = new ArrayList<>(lines);
        mergedLines.addAll(other.lines);
        List<String> mergedWarnings = new ArrayList<>(warnings);
        mergedWarnings.addAll(other.warnings);
        return new Translation(mergedLines, mergedWarnings);
    }
}
