package com.pinery.core.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whole-script AST. Built once per conversion by {@link ScriptParser} and never mutated.
 *
 * @param statements       top-level statements in source order (branches hang off ConditionNodes)
 * @param variables        every variable declaration/assignment, including those inside branches
 * @param strategyCalls    every strategy call, with its enclosing conditions folded into {@code when}
 * @param indicatorsUsed   distinct ta.* names, sorted
 * @param indicatorCalls   call count per ta.* name, sorted by name
 * @param complexityFactors normalized factor values keyed by {@link ComplexityFactor#key()}
 */
public record PineAst(
    String scriptName,
    int version,
    ScriptType scriptType,
    Map<String, String> settings,
    List<Statement> statements,
    List<Statement.InputNode> inputs,
    List<Statement.VariableNode> variables,
    List<Statement.TupleAssignmentNode> tupleAssignments,
    List<Statement.ConditionNode> conditions,
    List<Statement.FunctionNode> functions,
    List<Statement.CustomTypeNode> customTypes,
    List<Statement.StrategyCallNode> strategyCalls,
    List<Statement.PlotNode> plots,
    List<Statement.UnsupportedNode> unsupported,
    List<String> indicatorsUsed,
    Map<String, Integer> indicatorCalls,
    int arrayMatrixReferences,
    int drawingObjects,
    int maxNestingDepth,
    int totalLines,
    int codeLines,
    double complexityScore,
    Map<String, Double> complexityFactors,
    String source
) {

    public PineAst {
        settings = unmodifiableCopy(settings);
        statements = List.copyOf(statements);
        inputs = List.copyOf(inputs);
        variables = List.copyOf(variables);
        tupleAssignments = List.copyOf(tupleAssignments);
        conditions = List.copyOf(conditions);
        functions = List.copyOf(functions);
        customTypes = List.copyOf(customTypes);
        strategyCalls = List.copyOf(strategyCalls);
        plots = List.copyOf(plots);
        unsupported = List.copyOf(unsupported);
        indicatorsUsed = List.copyOf(indicatorsUsed);
        indicatorCalls = unmodifiableCopy(indicatorCalls);
        complexityFactors = unmodifiableCopy(complexityFactors);
    }

    public boolean isStrategy() {
        return scriptType == ScriptType.STRATEGY;
    }

    public boolean hasFunctions() {
        return !functions.isEmpty();
    }

    public boolean hasCustomTypes() {
        return !customTypes.isEmpty();
    }

    public boolean hasArrayMatrixOps() {
        return arrayMatrixReferences > 0;
    }

    /**
     * Distinct variable names in first-declaration order, tuple targets included.
     */
    public List<String> variableNames() {
        LinkedHashMap<String, Boolean> names = new LinkedHashMap<>();
        for (Statement.VariableNode v : variables) {
            names.putIfAbsent(v.name(), Boolean.TRUE);
        }
        for (Statement.TupleAssignmentNode t : tupleAssignments) {
            for (String name : t.names()) {
                names.putIfAbsent(name, Boolean.TRUE);
            }
        }
        return List.copyOf(names.keySet());
    }

    private static <K, V> Map<K, V> unmodifiableCopy(Map<K, V> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
