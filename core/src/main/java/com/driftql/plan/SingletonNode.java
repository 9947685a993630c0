package com.driftql.plan;

import java.util.List;

/**
 * Start-of-plan node producing a single empty row.
 */
public final class SingletonNode extends ExecutionNode {

    @Override
    public NodeType type() {
        return NodeType.SINGLETON;
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
        return new SingletonNode();
    }

    @Override
    public String describe() {
        return "";
    }
}
