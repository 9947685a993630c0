package com.driftql.validation;

import com.driftql.exception.PlanInvariantException;
import com.driftql.plan.ExecutionNode;
import com.driftql.plan.ExecutionPlan;
import com.driftql.plan.NodeType;
import com.driftql.plan.SubqueryNode;
import com.driftql.plan.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks the structural integrity of execution plans.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>The plan has a registered root node</li>
 *   <li>Every dependency and parent id refers to a registered node</li>
 *   <li>Edges are symmetric: a node lists each of its dependencies' ids as a
 *       dependency exactly when that dependency lists it as a parent</li>
 *   <li>Every subquery root id refers to a registered node</li>
 *   <li>Filter nodes consume exactly one variable</li>
 *   <li>Calculation nodes define exactly one variable</li>
 *   <li>No variable is defined by more than one node</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   PlanValidator.validate(plan);   // throws PlanInvariantException
 *   List&lt;String&gt; problems = PlanValidator.findProblems(plan);
 * </pre>
 */
public final class PlanValidator {

    private PlanValidator() {}

    /**
     * Validates a plan.
     *
     * @param plan the plan
     * @throws PlanInvariantException describing the first problem found
     */
    public static void validate(ExecutionPlan plan) {
        List<String> problems = findProblems(plan);
        if (!problems.isEmpty()) {
            throw new PlanInvariantException("invalid plan: " + problems.get(0)
                + (problems.size() > 1 ? " (and " + (problems.size() - 1) + " more)" : ""));
        }
    }

    /**
     * Collects all integrity problems of a plan.
     *
     * @param plan the plan
     * @return human-readable problem descriptions, empty for a valid plan
     */
    public static List<String> findProblems(ExecutionPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        List<String> problems = new ArrayList<>();

        if (!plan.hasRoot()) {
            problems.add("plan has no root");
        }

        Map<Integer, ExecutionNode> byId = new HashMap<>();
        for (ExecutionNode node : plan.nodes()) {
            byId.put(node.id(), node);
        }

        Map<Integer, Integer> definedBy = new HashMap<>();
        for (ExecutionNode node : plan.nodes()) {
            for (int depId : node.dependencies()) {
                ExecutionNode dep = byId.get(depId);
                if (dep == null) {
                    problems.add(node + " depends on unknown node #" + depId);
                } else if (!dep.parents().contains(node.id())) {
                    problems.add(node + " depends on " + dep + " which does not list it as parent");
                }
            }
            for (int parentId : node.parents()) {
                ExecutionNode parent = byId.get(parentId);
                if (parent == null) {
                    problems.add(node + " has unknown parent #" + parentId);
                } else if (!parent.dependencies().contains(node.id())) {
                    problems.add(node + " lists parent " + parent + " which does not depend on it");
                }
            }

            if (node instanceof SubqueryNode sub && !byId.containsKey(sub.subqueryRootId())) {
                problems.add(node + " refers to unknown subquery root #" + sub.subqueryRootId());
            }
            if (node.type() == NodeType.FILTER && node.variablesUsedHere().size() != 1) {
                problems.add(node + " must consume exactly one variable");
            }
            if (node.type() == NodeType.CALCULATION && node.variablesSetHere().size() != 1) {
                problems.add(node + " must define exactly one variable");
            }

            for (Variable variable : node.variablesSetHere()) {
                Integer previous = definedBy.put(variable.id(), node.id());
                if (previous != null) {
                    problems.add("variable " + variable + " is defined by #" + previous + " and #" + node.id());
                }
            }
        }
        return problems;
    }
}
