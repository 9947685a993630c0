package com.driftql.plan;

import java.util.List;

/**
 * Renders execution plans as indented text, one node per line, from the root
 * towards the start of the plan. Subqueries are indented below their
 * {@link SubqueryNode}.
 *
 * <pre>
 *   ReturnNode#5(x)
 *   FilterNode#4(tmp1)
 *   CalculationNode#3(tmp1 = (x.age == 42))
 *   EnumerateCollectionNode#2(x IN users)
 *   SingletonNode#1
 * </pre>
 */
public final class PlanPrinter {

    private PlanPrinter() {}

    /**
     * Renders a plan.
     *
     * @param plan the plan
     * @return the rendered text
     */
    public static String explain(ExecutionPlan plan) {
        StringBuilder sb = new StringBuilder();
        render(plan, plan.root(), 0, sb);
        return sb.toString();
    }

    private static void render(ExecutionPlan plan, ExecutionNode start, int depth, StringBuilder sb) {
        ExecutionNode current = start;
        while (current != null) {
            sb.append("  ".repeat(depth)).append(current).append('\n');
            if (current instanceof SubqueryNode sub) {
                render(plan, plan.getNodeById(sub.subqueryRootId()), depth + 1, sb);
            }
            List<ExecutionNode> deps = plan.getDependencies(current);
            if (deps.size() > 1) {
                for (ExecutionNode dep : deps) {
                    render(plan, dep, depth + 1, sb);
                }
                return;
            }
            current = deps.isEmpty() ? null : deps.get(0);
        }
    }
}
