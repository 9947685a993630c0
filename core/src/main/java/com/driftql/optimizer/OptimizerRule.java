package com.driftql.optimizer;

import com.driftql.plan.ExecutionPlan;
import java.util.List;

/**
 * A rewrite applied by the {@link Optimizer} to one candidate plan at a time.
 *
 * <p>A rule may:
 * <ul>
 *   <li>Mutate the plan in place</li>
 *   <li>Append independently owned clones of the plan to {@code out}, each an
 *       alternative rewrite</li>
 *   <li>Report through {@link RuleResult#keepOriginal()} whether the
 *       (possibly mutated) input plan stays a candidate</li>
 * </ul>
 *
 * <p>A rule signals failure by throwing
 * {@link com.driftql.exception.OptimizerException}. Partial edits are not
 * rolled back, so a rule must leave the plan structurally valid on every exit
 * path.
 */
public interface OptimizerRule {

    /**
     * Applies this rule to a plan.
     *
     * @param optimizer the driving optimizer
     * @param plan the plan to rewrite
     * @param out receives alternative plans created by the rule
     * @return whether the input plan remains a candidate
     */
    RuleResult apply(Optimizer optimizer, ExecutionPlan plan, List<ExecutionPlan> out);

    /**
     * Returns the name of this rule.
     *
     * <p>Used for configuration, logging and the plan's applied-rules list.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
