package com.pinery.ai.llm;

import com.pinery.converter.codegen.CodeGenerator;
import com.pinery.core.script.PineAst;
import com.pinery.core.script.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prompts for the assisted conversion paths: conversion, verification of a rule-based result,
 * and refinement of a rejected candidate.
 */
public class PromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(PromptBuilder.class);

    static final String SYSTEM_INSTRUCTIONS = """
        You convert TradingView Pine Script strategies into Python modules for a backtesting and live-trading engine.

        Key requirements:
        1. Preserve ALL strategy logic, parameters and conditions from the Pine Script
        2. Use pandas and numpy only, plus the indicator runtime described below
        3. Follow the output contract exactly; callers depend on its shape
        4. Output ONLY Python code in a single ```python block, without explanations""";

    static final String VERDICT_CORRECT = "CORRECT";
    static final String VERDICT_INCORRECT = "INCORRECT:";

    /**
     * Prompt for a full conversion.
     *
     * @param priorAttempt best-effort rule-based code to patch, or null
     */
    public String buildConversionPrompt(PineAst ast, String priorAttempt) {
        List<String> sections = new ArrayList<>();
        String type = ast.scriptType().name().toLowerCase(Locale.ROOT);
        sections.add(SYSTEM_INSTRUCTIONS);
        sections.add("");
        sections.add("# Task");
        sections.add("Convert the following Pine Script " + type + " to Python.");
        sections.add("");
        sections.add("# Pine Script Code");
        sections.add("```pinescript");
        sections.add(ast.source().strip());
        sections.add("```");
        sections.add("");
        sections.add("# Strategy Metadata");
        sections.add("- Name: " + ast.scriptName());
        sections.add("- Type: " + type);
        sections.add("- Pine Version: v" + ast.version());
        sections.add(String.format(Locale.ROOT, "- Complexity: %.3f", ast.complexityScore()));
        sections.add("");

        if (!ast.inputs().isEmpty()) {
            sections.addAll(inputsSection(ast.inputs()));
        }
        if (!ast.indicatorsUsed().isEmpty()) {
            sections.addAll(indicatorsSection(ast.indicatorsUsed()));
        }
        if (!ast.functions().isEmpty()) {
            sections.addAll(functionsSection(ast.functions()));
        }
        if (priorAttempt != null && !priorAttempt.isBlank()) {
            sections.add("# Prior Rule-Based Attempt");
            sections.add("A deterministic converter produced the draft below but could not translate everything.");
            sections.add("Keep what is correct, complete what is missing and fix what is wrong.");
            sections.add("");
            sections.add("```python");
            sections.add(priorAttempt.strip());
            sections.add("```");
            sections.add("");
        }
        sections.addAll(outputContract(CodeGenerator.className(ast.scriptName())));

        String prompt = String.join("\n", sections);
        log.debug("Built conversion prompt ({} chars, ~{} tokens)", prompt.length(), CostEstimator.tokens(prompt));
        return prompt;
    }

    /**
     * Prompt asking whether a converted module implements the script.
     * The answer starts with CORRECT, or INCORRECT: followed by the issues.
     */
    public String buildVerificationPrompt(String pineSource, String pythonCode) {
        return """
            Compare the following Pine Script and Python implementations.

            # Original Pine Script
            ```pinescript
            %s
            ```

            # Generated Python Code
            ```python
            %s
            ```

            # Task
            Verify that the Python code correctly implements the Pine Script strategy.
            Report any discrepancies in logic, calculations, or strategy behavior.

            Answer with:
            - "CORRECT" if implementations match
            - "INCORRECT: [specific issue]" with one issue per line if there are problems""".formatted(
            pineSource.strip(), pythonCode.strip());
    }

    /**
     * Prompt to fix a candidate that failed validation.
     */
    public String buildRefinementPrompt(PineAst ast, String previousCode, List<String> errors) {
        List<String> sections = new ArrayList<>();
        sections.add(SYSTEM_INSTRUCTIONS);
        sections.add("");
        sections.add("# Task: Fix Validation Errors");
        sections.add("The previous conversion attempt for " + ast.scriptName() + " failed validation.");
        sections.add("Fix the errors listed below and regenerate the complete Python module.");
        sections.add("");
        sections.add("# Validation Errors");
        for (int i = 0; i < errors.size(); i++) {
            sections.add((i + 1) + ". " + errors.get(i));
        }
        sections.add("");
        sections.add("# Previous Generated Code");
        sections.add("```python");
        sections.add(previousCode == null ? "" : previousCode.strip());
        sections.add("```");
        sections.add("");
        sections.add("# Original Pine Script");
        sections.add("```pinescript");
        sections.add(ast.source().strip());
        sections.add("```");
        sections.add("");
        sections.addAll(outputContract(CodeGenerator.className(ast.scriptName())));

        String prompt = String.join("\n", sections);
        log.debug("Built refinement prompt with {} errors ({} chars)", errors.size(), prompt.length());
        return prompt;
    }

    // ===== Sections =====

    private static List<String> inputsSection(List<Statement.InputNode> inputs) {
        List<String> section = new ArrayList<>();
        section.add("# Strategy Parameters (Inputs)");
        section.add("Read each from params with the Pine default:");
        for (Statement.InputNode input : inputs) {
            StringBuilder line = new StringBuilder("- ").append(input.name()).append(": ")
                .append(input.type().name().toLowerCase(Locale.ROOT))
                .append(" = ").append(input.defaultValue());
            if (input.title() != null) {
                line.append(" (title: '").append(input.title()).append("')");
            }
            section.add(line.toString());
        }
        section.add("");
        return section;
    }

    private static List<String> indicatorsSection(List<String> indicators) {
        List<String> section = new ArrayList<>();
        section.add("# Technical Indicators Used");
        section.add("Compute them with self.indicators.calculate(\"<name>\", *args) from the indicator runtime:");
        for (String indicator : indicators) {
            section.add("- " + indicator);
        }
        section.add("");
        return section;
    }

    private static List<String> functionsSection(List<Statement.FunctionNode> functions) {
        List<String> section = new ArrayList<>();
        section.add("# Custom Functions");
        section.add("Implement these user-defined functions as methods or module functions:");
        for (Statement.FunctionNode function : functions) {
            List<String> params = new ArrayList<>();
            for (Statement.FunctionNode.Parameter p : function.parameters()) {
                params.add(p.name() + ": " + (p.type() != null ? p.type() : "Any"));
            }
            section.add("- " + function.name() + "(" + String.join(", ", params) + ")"
                + (function.returnType() != null ? " -> " + function.returnType() : ""));
        }
        section.add("");
        return section;
    }

    private static List<String> outputContract(String className) {
        return List.of(
            "# Output Contract",
            "Generate one complete Python module:",
            "",
            "```python",
            "import pandas as pd",
            "import numpy as np",
            "from indicator_runtime import IndicatorRegistry",
            "",
            "",
            "class " + className + ":",
            "    def __init__(self, params=None):",
            "        self.params = params or {}",
            "        self.indicators = IndicatorRegistry()",
            "",
            "    def generate_signal(self, current_price, candles, current_position=None):",
            "        # candles: list of dicts with open, high, low, close, volume (oldest first)",
            "        # return {\"action\": \"hold\" | \"buy\" | \"sell\" | \"close\", \"confidence\": float,",
            "        #         \"reason\": str, optional \"stop\": float, optional \"target\": float}",
            "        ...",
            "",
            "",
            "def generate_signal(current_price, candles, params=None, current_position=None):",
            "    return " + className + "(params).generate_signal(current_price, candles, current_position)",
            "```",
            "",
            "Critical:",
            "- generate_signal must take current_price and return the decision dict on every path",
            "- return action \"hold\" while there are not enough candles for the indicators",
            "- never look ahead: only use candles up to the last one",
            "",
            "Output the complete, runnable Python code now:");
    }
}
