package com.driftql.optimizer;

import com.driftql.exception.PlanInvariantException;
import com.driftql.expression.ExpressionEvaluator;
import com.driftql.plan.CalculationNode;
import com.driftql.plan.ExecutionNode;
import com.driftql.plan.ExecutionPlan;
import com.driftql.plan.NodeType;
import com.driftql.plan.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Optimization rule that removes calculations whose result is never used.
 *
 * <p>A calculation is removed when its output variable is not consumed by any
 * node downstream of it. Calculations whose expression can throw are always
 * kept, because removing them would change which queries fail. The rule
 * modifies the plan in place and always keeps it.
 */
public class RemoveUnnecessaryCalculationsRule implements OptimizerRule {

    private static final Logger logger = LoggerFactory.getLogger(RemoveUnnecessaryCalculationsRule.class);

    public static final String NAME = "remove-unnecessary-calculations";

    private final ExpressionEvaluator evaluator;

    public RemoveUnnecessaryCalculationsRule(ExpressionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    @Override
    public RuleResult apply(Optimizer optimizer, ExecutionPlan plan, List<ExecutionPlan> out) {
        Set<ExecutionNode> toUnlink = new LinkedHashSet<>();

        for (ExecutionNode node : plan.findNodesOfType(NodeType.CALCULATION, true)) {
            CalculationNode calculation = (CalculationNode) node;
            if (evaluator.canThrow(calculation.expression())) {
                continue;
            }

            List<Variable> defined = calculation.variablesSetHere();
            if (defined.size() != 1) {
                throw new PlanInvariantException("calculation must define exactly one variable, found "
                    + defined.size(), calculation.id());
            }

            if (!plan.getVarsUsedAfter(calculation).contains(defined.get(0).id())) {
                toUnlink.add(calculation);
            }
        }

        if (!toUnlink.isEmpty()) {
            logger.debug("Removing {} unnecessary calculation nodes: {}", toUnlink.size(), toUnlink);
            plan.unlinkNodes(toUnlink);
        }
        return RuleResult.keep();
    }

    @Override
    public String name() {
        return NAME;
    }
}
