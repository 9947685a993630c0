package com.driftql.optimizer;

import com.driftql.exception.ExpressionEvaluationException;
import com.driftql.exception.OptimizerException;
import com.driftql.exception.PlanInvariantException;
import com.driftql.expression.Expression;
import com.driftql.expression.ExpressionEvaluator;
import com.driftql.plan.CalculationNode;
import com.driftql.plan.ExecutionNode;
import com.driftql.plan.ExecutionPlan;
import com.driftql.plan.NoResultsNode;
import com.driftql.plan.NodeType;
import com.driftql.plan.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Optimization rule that removes filters whose outcome is known at optimize time.
 *
 * <p>The rule modifies the plan in place:
 * <pre>
 *   // Filter that always passes: removed
 *   LET tmp = true  FILTER tmp  -&gt;  LET tmp = true
 *
 *   // Filter that never passes: replaced by a NoResults node
 *   LET tmp = 1 &gt; 2  FILTER tmp  -&gt;  LET tmp = 1 &gt; 2  NoResults
 * </pre>
 *
 * <p>Only filters fed by a calculation whose expression is constant and
 * cannot throw are touched; the calculation itself is left for
 * {@link RemoveUnnecessaryCalculationsRule}. The original plan is always kept.
 */
public class RemoveUnnecessaryFiltersRule implements OptimizerRule {

    private static final Logger logger = LoggerFactory.getLogger(RemoveUnnecessaryFiltersRule.class);

    public static final String NAME = "remove-unnecessary-filters";

    private final ExpressionEvaluator evaluator;

    public RemoveUnnecessaryFiltersRule(ExpressionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    @Override
    public RuleResult apply(Optimizer optimizer, ExecutionPlan plan, List<ExecutionPlan> out) {
        Set<ExecutionNode> toUnlink = new LinkedHashSet<>();

        for (ExecutionNode filter : plan.findNodesOfType(NodeType.FILTER, true)) {
            List<Variable> used = filter.variablesUsedHere();
            if (used.size() != 1) {
                throw new PlanInvariantException("filter must consume exactly one variable, found " + used.size(),
                    filter.id());
            }

            Optional<ExecutionNode> setter = plan.getVarSetBy(used.get(0).id());
            if (setter.isEmpty() || setter.get().type() != NodeType.CALCULATION) {
                // filter variable was not introduced by a calculation
                continue;
            }

            Expression expression = ((CalculationNode) setter.get()).expression();
            if (!evaluator.isConstant(expression) || evaluator.canThrow(expression)) {
                // can only be decided at runtime
                continue;
            }

            if (evaluate(expression)) {
                logger.debug("Filter {} always passes, removing it", filter);
                toUnlink.add(filter);
            } else {
                List<ExecutionNode> parents = plan.getParents(filter);
                if (parents.size() != 1) {
                    throw new PlanInvariantException("filter must have exactly one parent, found " + parents.size(),
                        filter.id());
                }
                NoResultsNode noResults = new NoResultsNode();
                plan.registerNode(noResults);
                plan.replaceNode(filter, noResults, parents.get(0));
                logger.debug("Filter {} never passes, replaced by {}", filter, noResults);
            }
        }

        if (!toUnlink.isEmpty()) {
            plan.unlinkNodes(toUnlink);
        }
        return RuleResult.keep();
    }

    private boolean evaluate(Expression expression) {
        try {
            return evaluator.evaluateToBoolean(expression);
        } catch (ExpressionEvaluationException e) {
            throw new OptimizerException("Failed to evaluate constant filter condition "
                + expression.toAql(), e, NAME);
        }
    }

    @Override
    public String name() {
        return NAME;
    }
}
