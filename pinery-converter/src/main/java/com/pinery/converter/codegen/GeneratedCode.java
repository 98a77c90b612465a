package com.pinery.converter.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one code generation run.
 *
 * A failed run keeps the rejected draft in {@code fullCode} and lists why in {@code errors};
 * callers must check {@link #isSuccess()} before handing the code on.
 *
 * @param parameters Pine input name to the Python literal used as its default
 */
public record GeneratedCode(
    String fullCode,
    String className,
    String imports,
    Map<String, String> parameters,
    List<String> indicatorsUsed,
    List<String> warnings,
    List<String> errors
) {

    public GeneratedCode {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        indicatorsUsed = List.copyOf(indicatorsUsed);
        warnings = List.copyOf(warnings);
        errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /**
     * Failed result carrying the draft that did not pass validation.
     */
    public static GeneratedCode failure(String draft, String className, List<String> warnings, List<String> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A failed result needs at least one error");
        }
        return new GeneratedCode(draft, className, "", Map.of(), List.of(), warnings, errors);
    }

    /**
     * Copy with extra warnings appended.
     */
    public GeneratedCode withWarnings(List<String> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(extra);
        return new GeneratedCode(fullCode, className, imports, parameters, indicatorsUsed, merged, errors);
    }
}
