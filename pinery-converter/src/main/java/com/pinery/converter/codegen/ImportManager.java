package com.pinery.converter.codegen;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collects the import statements a generated module needs.
 * Base imports come first in a fixed order, additional modules follow sorted by name.
 */
public class ImportManager {

    private static final List<String> BASE_IMPORTS = List.of(
        "import pandas as pd",
        "import numpy as np",
        "from typing import Dict, List, Optional"
    );

    private final String runtimeModule;
    private final String runtimeClass;
    private final SortedSet<String> indicators = new TreeSet<>();
    private final Map<String, Set<String>> fromImports = new TreeMap<>();
    private final Map<String, String> moduleImports = new TreeMap<>();

    public ImportManager(String runtimeModule, String runtimeClass) {
        this.runtimeModule = runtimeModule;
        this.runtimeClass = runtimeClass;
    }

    /**
     * Record an indicator; any indicator pulls in the runtime registry class.
     */
    public void addIndicator(String indicatorName) {
        indicators.add(indicatorName);
        addFrom(runtimeModule, runtimeClass);
    }

    /**
     * from module import name
     */
    public void addFrom(String module, String... names) {
        Set<String> set = fromImports.computeIfAbsent(module, k -> new LinkedHashSet<>());
        for (String name : names) {
            set.add(name);
        }
    }

    /**
     * import module [as alias]; alias may be null.
     */
    public void addModule(String module, String alias) {
        moduleImports.put(module, alias);
    }

    public boolean hasIndicators() {
        return !indicators.isEmpty();
    }

    public String indicatorsSummary() {
        return String.join(", ", indicators);
    }

    public String runtimeClass() {
        return runtimeClass;
    }

    /**
     * Packages the generated module needs at runtime, besides the indicator runtime itself.
     */
    public List<String> requiredPackages() {
        return List.of("pandas", "numpy");
    }

    public String generateImportBlock() {
        List<String> lines = new ArrayList<>(BASE_IMPORTS);
        for (Map.Entry<String, String> entry : moduleImports.entrySet()) {
            lines.add(entry.getValue() != null
                ? "import " + entry.getKey() + " as " + entry.getValue()
                : "import " + entry.getKey());
        }
        for (Map.Entry<String, Set<String>> entry : fromImports.entrySet()) {
            lines.add("from " + entry.getKey() + " import " + String.join(", ", new TreeSet<>(entry.getValue())));
        }
        return String.join("\n", lines);
    }
}
