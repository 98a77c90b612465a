package com.pinery.converter.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * Scoped symbol table for one Pine to Python translation.
 *
 * Names resolve in this order: built-in table, this scope's variables, parent scopes,
 * otherwise the name passes through unchanged. Child scopes start with an empty variable
 * map but share the parent's {@link SharedScopeState}.
 */
public class TransformationContext {

    private static final Logger log = LoggerFactory.getLogger(TransformationContext.class);

    private final SharedScopeState shared;
    private final Map<String, String> variables = new LinkedHashMap<>();
    private final Set<String> constants = new HashSet<>();
    private final Set<String> states = new HashSet<>();
    private final int scopeLevel;
    private final TransformationContext parent;

    public TransformationContext() {
        this(SharedScopeState.withDefaultBuiltins());
    }

    public TransformationContext(SharedScopeState shared) {
        this(shared, 0, null);
    }

    private TransformationContext(SharedScopeState shared, int scopeLevel, TransformationContext parent) {
        this.shared = shared;
        this.scopeLevel = scopeLevel;
        this.parent = parent;
    }

    // ===== Variables =====

    public void addVariable(String pineName, String pythonName) {
        variables.put(pineName, pythonName);
        log.debug("Added variable: {} -> {}", pineName, pythonName);
    }

    /**
     * Register a plain local variable under its Python-safe name and return that name.
     */
    public String declareLocal(String pineName) {
        String pythonName = PineFunctions.safeName(pineName);
        addVariable(pineName, pythonName);
        return pythonName;
    }

    /**
     * Python name for a user variable, searching parent scopes; null if unknown.
     */
    public String getVariable(String pineName) {
        String value = variables.get(pineName);
        if (value != null) {
            return value;
        }
        return parent != null ? parent.getVariable(pineName) : null;
    }

    public boolean hasVariable(String pineName) {
        return getVariable(pineName) != null;
    }

    /**
     * Register a scalar that keeps one value for the whole run (a non-source input).
     */
    public void addConstant(String pineName, String pythonName) {
        addVariable(pineName, pythonName);
        constants.add(pineName);
    }

    /**
     * Register a persistent scalar carried from bar to bar ({@code var}/{@code varip}).
     */
    public void addState(String pineName, String pythonName) {
        addVariable(pineName, pythonName);
        states.add(pineName);
    }

    public boolean isConstant(String pineName) {
        TransformationContext scope = owner(pineName);
        return scope != null && scope.constants.contains(pineName);
    }

    public boolean isState(String pineName) {
        TransformationContext scope = owner(pineName);
        return scope != null && scope.states.contains(pineName);
    }

    private TransformationContext owner(String pineName) {
        if (variables.containsKey(pineName)) {
            return this;
        }
        return parent != null ? parent.owner(pineName) : null;
    }

    // ===== Built-ins =====

    public boolean isBuiltin(String name) {
        return shared.builtins().containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if the name is not a built-in
     */
    public String mapBuiltin(String name) {
        String mapped = shared.builtins().get(name);
        if (mapped == null) {
            throw new IllegalArgumentException("Unknown built-in: " + name);
        }
        return mapped;
    }

    /**
     * Resolve a Pine identifier: built-ins first, then user variables, otherwise unchanged.
     */
    public String resolveName(String name) {
        if (isBuiltin(name)) {
            return mapBuiltin(name);
        }
        String variable = getVariable(name);
        return variable != null ? variable : name;
    }

    // ===== Indicators =====

    public void addIndicator(String indicatorName) {
        shared.recordIndicator(indicatorName);
        log.debug("Indicator used: {}", indicatorName);
    }

    public SortedSet<String> indicatorsUsed() {
        return shared.indicatorsUsed();
    }

    // ===== Warnings =====

    public void addWarning(String warning) {
        shared.recordWarning(warning);
    }

    public List<String> warnings() {
        return shared.warnings();
    }

    // ===== Scopes =====

    /**
     * Nested scope with an empty variable map and this scope's shared state.
     */
    public TransformationContext createChildContext() {
        return new TransformationContext(shared, scopeLevel + 1, this);
    }

    /**
     * Fold a child's indicator usage into this scope. A child made by {@link #createChildContext()}
     * already records into the same set, so this only matters for contexts built independently.
     */
    public void mergeFromChild(TransformationContext child) {
        if (child.shared != shared) {
            child.indicatorsUsed().forEach(shared::recordIndicator);
        }
    }

    public SharedScopeState shared() {
        return shared;
    }

    public int scopeLevel() {
        return scopeLevel;
    }

    public TransformationContext parent() {
        return parent;
    }

    @Override
    public String toString() {
        return "TransformationContext(scopeLevel=" + scopeLevel + ", variables=" + variables.size() +
            ", indicators=" + shared.indicatorsUsed().size() + ")";
    }
}
