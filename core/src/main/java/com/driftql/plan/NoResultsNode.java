package com.driftql.plan;

import java.util.List;

/**
 * Node that produces no rows, whatever its input.
 *
 * <p>Inserted by the optimizer in place of filters that can never pass.
 */
public final class NoResultsNode extends ExecutionNode {

    @Override
    public NodeType type() {
        return NodeType.NO_RESULTS;
    }

    @Override
    public List<Variable> variablesUsedHere() {
        return List.of();
    }

    @Override
    public List<Variable> variablesSetHere() {
        return List.of();
    }

    @Override
    protected ExecutionNode copyPayload() {
        return new NoResultsNode();
    }

    @Override
    public String describe() {
        return "";
    }
}
