package com.driftql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Terminal node emitting the value of its input variable per row.
 */
public final class ReturnNode extends ExecutionNode {

    private final Variable inVariable;

    public ReturnNode(Variable inVariable) {
        this.inVariable = Objects.requireNonNull(inVariable, "inVariable must not be null");
    }

    public Variable inVariable() {
        return inVariable;
    }

    @Override
    public NodeType type() {
        return NodeType.RETURN;
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
        return new ReturnNode(inVariable);
    }

    @Override
    public String describe() {
        return inVariable.name();
    }
}
