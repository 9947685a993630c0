package com.driftql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Node dropping every row for which its input variable is falsy
 * ({@code FILTER tmp}).
 */
public final class FilterNode extends ExecutionNode {

    private final Variable inVariable;

    /**
     * Creates a filter.
     *
     * @param inVariable the variable holding the filter condition
     */
    public FilterNode(Variable inVariable) {
        this.inVariable = Objects.requireNonNull(inVariable, "inVariable must not be null");
    }

    public Variable inVariable() {
        return inVariable;
    }

    @Override
    public NodeType type() {
        return NodeType.FILTER;
    }

    @Override
    public List<Variable> variablesUsedHere() {
        return List.of(inVariable);
    }

    @Override
    public List<Variable> variablesSetHere() {
        return List.of();
    }

    @Override
    protected ExecutionNode copyPayload() {
        return new FilterNode(inVariable);
    }

    @Override
    public String describe() {
        return inVariable.name();
    }
}
