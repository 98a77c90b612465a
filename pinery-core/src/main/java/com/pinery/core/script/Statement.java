package com.pinery.core.script;

import java.util.List;

/**
 * Top-level AST nodes, one per recognized Pine statement.
 * Expressions are kept as normalized source text and parsed again where they are translated,
 * so a malformed expression only affects its own statement.
 */
public sealed interface Statement {

    /**
     * One-based source line of the statement.
     */
    int line();

    /**
     * Input declaration: length = input.int(20, "Length", minval=1)
     */
    record InputNode(String name, InputType type, String defaultValue, String title,
                     String minValue, String maxValue, String step, List<String> options,
                     int line) implements Statement {
        public InputNode {
            options = options != null ? List.copyOf(options) : List.of();
        }
    }

    /**
     * Variable declaration or assignment: var float total = 0.0, x := x + 1, count += 1
     *
     * @param operator "=", ":=" or a compound operator such as "+="
     */
    record VariableNode(VariableModifier modifier, String name, String valueExpr, String declaredType,
                        String operator, int line) implements Statement {

        public boolean isPersistent() {
            return modifier != VariableModifier.NONE;
        }

        public boolean isDeclaration() {
            return "=".equals(operator);
        }
    }

    /**
     * Tuple declaration: [macdLine, signalLine, hist] = ta.macd(close, 12, 26, 9)
     */
    record TupleAssignmentNode(List<String> names, String valueExpr, int line) implements Statement {
        public TupleAssignmentNode {
            names = List.copyOf(names);
        }
    }

    /**
     * Conditional block with independently translated branches. An else-if chain is a
     * single nested ConditionNode in the false branch.
     */
    record ConditionNode(String conditionExpr, List<Statement> trueBranch, List<Statement> falseBranch,
                         int line) implements Statement {
        public ConditionNode {
            trueBranch = List.copyOf(trueBranch);
            falseBranch = List.copyOf(falseBranch);
        }
    }

    /**
     * User function or method definition. Never translated by the rule-based path.
     */
    record FunctionNode(String name, List<Parameter> parameters, String body, String returnType,
                        boolean method, int line) implements Statement {
        public FunctionNode {
            parameters = List.copyOf(parameters);
        }

        public record Parameter(String name, String type, String defaultValue) {}
    }

    /**
     * User type definition: type Pivot / float price / int bar
     */
    record CustomTypeNode(String name, List<String> fields, int line) implements Statement {
        public CustomTypeNode {
            fields = List.copyOf(fields);
        }
    }

    /**
     * strategy.entry / strategy.exit / strategy.close call.
     *
     * @param when guard condition: the explicit when= argument combined with enclosing if conditions,
     *             or null when the call is unconditional
     */
    record StrategyCallNode(CallType callType, String id, Direction direction, String when, String qty,
                            String limit, String stop, String fromEntry, int line) implements Statement {

        public enum CallType { ENTRY, EXIT, CLOSE }

        public enum Direction { LONG, SHORT }
    }

    /**
     * Plot, alert or drawing call. Captured for reporting, semantically inert.
     */
    record PlotNode(String kind, String title, String seriesExpr, int line) implements Statement {

        public boolean isDrawing() {
            return kind.endsWith(".new");
        }
    }

    /**
     * Construct the rule-based path cannot translate: loops, switch, if-expressions, library imports.
     */
    record UnsupportedNode(String construct, String text, int line) implements Statement {}

    /**
     * Any other statement, typically a bare call such as alert(...) or runtime.error(...).
     */
    record ExpressionStatement(String expr, int line) implements Statement {}
}
