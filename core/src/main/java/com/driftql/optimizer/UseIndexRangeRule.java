package com.driftql.optimizer;

import com.driftql.exception.PlanInvariantException;
import com.driftql.expression.ExpressionEvaluator;
import com.driftql.index.IndexCatalog;
import com.driftql.plan.ExecutionNode;
import com.driftql.plan.ExecutionPlan;
import com.driftql.plan.NodeType;
import com.driftql.plan.Variable;

import java.util.List;
import java.util.Objects;

/**
 * Optimization rule that proposes index range scans for filtered collection scans.
 *
 * <p>For every filter, a {@link CalculationNodeFinder} walks from the filter
 * towards the start of the plan, turns the filter condition into attribute
 * ranges and emits one plan per usable index, in which the collection scan is
 * replaced by an index range scan:
 * <pre>
 *   FOR x IN users FILTER x.age == 42 RETURN x
 *   -&gt; EnumerateCollection(users) ... (kept)
 *   -&gt; IndexRange(users, hash[age], age in [42, 42]) ... (added)
 * </pre>
 * Scans below a LIMIT or a calculation that can throw are left alone.
 * The input plan is never modified and always kept as the full-scan fallback.
 */
public class UseIndexRangeRule implements OptimizerRule {

    public static final String NAME = "use-index-range";

    private final ExpressionEvaluator evaluator;
    private final IndexCatalog indexCatalog;

    public UseIndexRangeRule(ExpressionEvaluator evaluator, IndexCatalog indexCatalog) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.indexCatalog = Objects.requireNonNull(indexCatalog, "indexCatalog must not be null");
    }

    @Override
    public RuleResult apply(Optimizer optimizer, ExecutionPlan plan, List<ExecutionPlan> out) {
        for (ExecutionNode filter : plan.findNodesOfType(NodeType.FILTER, true)) {
            List<Variable> used = filter.variablesUsedHere();
            if (used.size() != 1) {
                throw new PlanInvariantException("filter must consume exactly one variable, found " + used.size(),
                    filter.id());
            }
            plan.walk(filter, new CalculationNodeFinder(plan, used.get(0), out, indexCatalog, evaluator));
        }
        return RuleResult.keep();
    }

    @Override
    public String name() {
        return NAME;
    }
}
