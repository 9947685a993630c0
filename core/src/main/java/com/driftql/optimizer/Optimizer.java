package com.driftql.optimizer;

import com.driftql.expression.ExpressionEvaluator;
import com.driftql.index.IndexCatalog;
import com.driftql.plan.ExecutionPlan;
import com.driftql.validation.PlanValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Rule-based optimizer that turns one execution plan into a list of
 * equivalent candidate plans.
 *
 * <p>Each rule is applied, in order, to every current candidate. A candidate
 * survives if the rule keeps it, and the plans a rule emits join the
 * candidate list. Choosing among the candidates is left to the caller's
 * cost model.
 *
 * <p>Example usage:
 * <pre>
 *   Optimizer optimizer = Optimizer.withDefaultRules(evaluator, catalog, OptimizerConfig.load());
 *   List&lt;ExecutionPlan&gt; candidates = optimizer.createPlans(plan);
 * </pre>
 *
 * <p>The default rules, in order:
 * <ul>
 *   <li>{@value RemoveUnnecessaryFiltersRule#NAME} - drop filters that always
 *       pass, cut off filters that never pass</li>
 *   <li>{@value RemoveUnnecessaryCalculationsRule#NAME} - drop calculations
 *       whose result is unused, including those exposed by the previous rule</li>
 *   <li>{@value UseIndexRangeRule#NAME} - propose index range scans</li>
 * </ul>
 */
public class Optimizer {

    private static final Logger logger = LoggerFactory.getLogger(Optimizer.class);

    private final List<OptimizerRule> rules;
    private final OptimizerConfig config;

    /**
     * Creates an optimizer with custom rules.
     *
     * @param rules the rules, in application order
     * @param config the optimizer settings
     */
    public Optimizer(List<OptimizerRule> rules, OptimizerConfig config) {
        this.rules = new ArrayList<>(Objects.requireNonNull(rules, "rules must not be null"));
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Creates an optimizer with the default rules.
     *
     * @param evaluator the expression evaluator used by the rules
     * @param indexCatalog the index catalog used by the rules
     * @param config the optimizer settings
     * @return the optimizer
     */
    public static Optimizer withDefaultRules(ExpressionEvaluator evaluator, IndexCatalog indexCatalog,
                                             OptimizerConfig config) {
        return new Optimizer(createDefaultRules(evaluator, indexCatalog), config);
    }

    private static List<OptimizerRule> createDefaultRules(ExpressionEvaluator evaluator, IndexCatalog indexCatalog) {
        return Arrays.asList(
            new RemoveUnnecessaryFiltersRule(evaluator),
            new RemoveUnnecessaryCalculationsRule(evaluator),
            new UseIndexRangeRule(evaluator, indexCatalog)
        );
    }

    /**
     * Applies all enabled rules and returns the resulting candidate plans.
     *
     * <p>The input plan may be modified in place by the rules.
     *
     * @param plan the plan to optimize
     * @return the candidate plans; never empty unless a rule dropped every plan
     * @throws com.driftql.exception.OptimizerException if a rule fails
     */
    public List<ExecutionPlan> createPlans(ExecutionPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");

        List<ExecutionPlan> current = new ArrayList<>();
        current.add(plan);

        for (OptimizerRule rule : rules) {
            if (config.isRuleDisabled(rule.name())) {
                logger.debug("Skipping disabled rule {}", rule.name());
                continue;
            }

            List<ExecutionPlan> next = new ArrayList<>();
            for (ExecutionPlan candidate : current) {
                List<ExecutionPlan> out = new ArrayList<>();
                RuleResult result = rule.apply(this, candidate, out);

                if (result.keepOriginal()) {
                    candidate.addAppliedRule(rule.name());
                    next.add(candidate);
                }
                for (ExecutionPlan alternative : out) {
                    alternative.addAppliedRule(rule.name());
                    next.add(alternative);
                }
            }

            if (config.validatePlans()) {
                for (ExecutionPlan candidate : next) {
                    PlanValidator.validate(candidate);
                }
            }

            if (next.size() > config.maxNumberOfPlans()) {
                logger.warn("Rule {} produced {} candidate plans, keeping the first {}",
                    rule.name(), next.size(), config.maxNumberOfPlans());
                next = new ArrayList<>(next.subList(0, config.maxNumberOfPlans()));
            }
            current = next;
        }

        logger.info("Optimization produced {} candidate plan(s) using rules {}", current.size(), ruleNames());
        return current;
    }

    /**
     * Returns the rules of this optimizer.
     *
     * @return the rules, in application order
     */
    public List<OptimizerRule> rules() {
        return new ArrayList<>(rules);
    }

    public OptimizerConfig config() {
        return config;
    }

    private List<String> ruleNames() {
        List<String> names = new ArrayList<>();
        for (OptimizerRule rule : rules) {
            if (!config.isRuleDisabled(rule.name())) {
                names.add(rule.name());
            }
        }
        return names;
    }
}
