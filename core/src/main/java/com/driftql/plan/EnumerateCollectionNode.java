package com.driftql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Node iterating all documents of a collection, binding each to its output
 * variable ({@code FOR x IN users}).
 */
public final class EnumerateCollectionNode extends ExecutionNode {

    private final String collection;
    private final Variable outVariable;

    /**
     * Creates a collection scan.
     *
     * @param collection the collection name
     * @param outVariable the iteration variable
     */
    public EnumerateCollectionNode(String collection, Variable outVariable) {
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
        this.outVariable = Objects.requireNonNull(outVariable, "outVariable must not be null");
    }

    public String collection() {
        return collection;
    }

    public Variable outVariable() {
        return outVariable;
    }

    @Override
    public NodeType type() {
        return NodeType.ENUMERATE_COLLECTION;
    }

    @Override
    public List<Variable> variablesUsedHere() {
        return List.of();
    }

    @Override
    public List<Variable> variablesSetHere() {
        return List.of(outVariable);
    }

    @Override
    protected ExecutionNode copyPayload() {
        return new EnumerateCollectionNode(collection, outVariable);
    }

    @Override
    public String describe() {
        return outVariable.name() + " IN " + collection;
    }
}
