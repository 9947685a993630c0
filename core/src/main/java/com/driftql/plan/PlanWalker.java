package com.driftql.plan;

/**
 * Callback for {@link ExecutionPlan#walk(ExecutionNode, PlanWalker)}.
 */
@FunctionalInterface
public interface PlanWalker {

    /**
     * Called for each visited node, before moving on to its dependency.
     *
     * @param node the visited node
     */
    void before(ExecutionNode node);
}
