package com.driftql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Node running a subquery per input row and binding its result list to the
 * output variable ({@code LET sub = (FOR y IN ... RETURN y)}).
 *
 * <p>The subquery is a separate chain of nodes in the same plan, ending in the
 * node identified by {@link #subqueryRootId()}. The variables the subquery
 * reads from the enclosing query depend on those nodes, so
 * {@link #variablesUsedHere()} reports none and callers ask
 * {@link ExecutionPlan#getVariablesUsedBy(ExecutionNode)} instead.
 */
public final class SubqueryNode extends ExecutionNode {

    private int subqueryRootId;
    private final Variable outVariable;

    /**
     * Creates a subquery node.
     *
     * @param subqueryRootId the id of the subquery's root node
     * @param outVariable the variable receiving the subquery result
     */
    public SubqueryNode(int subqueryRootId, Variable outVariable) {
        this.subqueryRootId = subqueryRootId;
        this.outVariable = Objects.requireNonNull(outVariable, "outVariable must not be null");
    }

    public int subqueryRootId() {
        return subqueryRootId;
    }

    void setSubqueryRootId(int subqueryRootId) {
        this.subqueryRootId = subqueryRootId;
    }

    public Variable outVariable() {
        return outVariable;
    }

    @Override
    public NodeType type() {
        return NodeType.SUBQUERY;
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
        return new SubqueryNode(subqueryRootId, outVariable);
    }

    @Override
    public String describe() {
        return outVariable.name() + " = subquery #" + subqueryRootId;
    }
}
