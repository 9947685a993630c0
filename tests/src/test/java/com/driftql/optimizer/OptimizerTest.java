package com.driftql.optimizer;

import com.driftql.exception.OptimizerException;
import com.driftql.exception.PlanInvariantException;
import com.driftql.expression.AttributeAccess;
import com.driftql.expression.BinaryExpression;
import com.driftql.expression.DefaultExpressionEvaluator;
import com.driftql.expression.Literal;
import com.driftql.expression.VariableReference;
import com.driftql.index.IndexDescriptor;
import com.driftql.index.InMemoryIndexCatalog;
import com.driftql.plan.CalculationNode;
import com.driftql.plan.ExecutionPlan;
import com.driftql.plan.IndexRangeNode;
import com.driftql.plan.NodeType;
import com.driftql.plan.PlanBuilder;
import com.driftql.plan.PlanPrinter;
import com.driftql.plan.Variable;
import com.driftql.test.PlanInterpreter;
import com.driftql.test.TestBase;
import com.driftql.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for the {@link Optimizer} driver with the default rules.
 */
@TestCategories.Tier2
@TestCategories.Integration
@TestCategories.Optimizer
@DisplayName("Optimizer Tests")
public class OptimizerTest extends TestBase {

    private static final Map<String, List<Map<String, Object>>> DATA = Map.of(
        "users", List.of(
            Map.of("a", 3, "name", "ann"),
            Map.of("a", 5, "name", "bob"),
            Map.of("a", 5, "name", "cid"),
            Map.of("a", 8, "name", "dan")));

    private static final List<String> DEFAULT_RULE_NAMES = List.of(
        RemoveUnnecessaryFiltersRule.NAME, RemoveUnnecessaryCalculationsRule.NAME, UseIndexRangeRule.NAME);

    private DefaultExpressionEvaluator evaluator;
    private InMemoryIndexCatalog catalog;
    private PlanInterpreter interpreter;

    @Override
    protected void doSetUp() {
        evaluator = new DefaultExpressionEvaluator();
        catalog = new InMemoryIndexCatalog()
            .addIndex("users", IndexDescriptor.hash("users-a", "a"))
            .addIndex("users", IndexDescriptor.skiplist("users-a-sorted", "a"));
        interpreter = new PlanInterpreter(DATA);
    }

    /**
     * FOR x IN users FILTER true FILTER x.a == 5 LET name = x.name RETURN name
     */
    private static ExecutionPlan samplePlan() {
        PlanBuilder builder = new PlanBuilder();
        Variable x = builder.enumerateCollection("users", "x");
        builder.filter(builder.calculate(Literal.of(true)));
        builder.filter(builder.calculate(BinaryExpression.equal(
            new AttributeAccess(new VariableReference(x), "a"), Literal.of(5))));
        Variable name = builder.let("name", new AttributeAccess(new VariableReference(x), "name"));
        return builder.returning(name);
    }

    private Optimizer optimizer(OptimizerConfig config) {
        return Optimizer.withDefaultRules(evaluator, catalog, config);
    }

    @Nested
    @DisplayName("Default rules")
    class DefaultRuleTests {

        @Test
        @DisplayName("Default rules run in order")
        void testRuleOrder() {
            assertThat(optimizer(OptimizerConfig.defaults()).rules())
                .extracting(OptimizerRule::name)
                .containsExactlyElementsOf(DEFAULT_RULE_NAMES);
        }

        @Test
        @DisplayName("Candidates are simplified, indexed and return the same rows")
        void testCreatePlans() {
            ExecutionPlan plan = samplePlan();
            List<Object> expected = interpreter.execute(plan.clone());
            logStep("optimizing");

            List<ExecutionPlan> candidates = optimizer(OptimizerConfig.defaults()).createPlans(plan);

            assertThat(candidates).hasSize(3);
            assertThat(candidates.get(0)).isSameAs(plan);
            for (ExecutionPlan candidate : candidates) {
                logData("candidate", PlanPrinter.explain(candidate));
                assertThat(candidate.findNodesOfType(NodeType.FILTER, true)).hasSize(1);
                assertThat(candidate.findNodesOfType(NodeType.CALCULATION, true)).hasSize(2);
                assertThat(candidate.appliedRules()).containsExactlyElementsOf(DEFAULT_RULE_NAMES);
                assertThat(interpreter.execute(candidate)).isEqualTo(expected);
            }
            assertThat(expected).containsExactly("bob", "cid");
            assertThat(candidates.get(1).findNodesOfType(NodeType.INDEX_RANGE, true)).hasSize(1);
        }

        @Test
        @DisplayName("A never-passing filter leaves a plan returning no rows")
        void testNeverPassing() {
            PlanBuilder builder = new PlanBuilder();
            Variable x = builder.enumerateCollection("users", "x");
            builder.filter(builder.calculate(BinaryExpression.equal(Literal.of(1), Literal.of(2))));
            ExecutionPlan plan = builder.returning(x);

            List<ExecutionPlan> candidates = optimizer(OptimizerConfig.defaults()).createPlans(plan);

            assertThat(candidates).hasSize(1);
            assertThat(plan.findNodesOfType(NodeType.NO_RESULTS, true)).hasSize(1);
            assertThat(interpreter.execute(plan)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("The candidate list is truncated to the configured maximum")
        void testMaxPlans() {
            List<ExecutionPlan> candidates = optimizer(OptimizerConfig.of(2, Set.of(), false))
                .createPlans(samplePlan());

            assertThat(candidates).hasSize(2);
            assertThat(candidates.get(0).findNodesOfType(NodeType.INDEX_RANGE, true)).isEmpty();
            IndexRangeNode kept = (IndexRangeNode) candidates.get(1).findNodesOfType(NodeType.INDEX_RANGE, true).get(0);
            assertThat(kept.index().id()).isEqualTo("users-a");
        }

        @Test
        @DisplayName("Disabled rules are skipped")
        void testDisabledRules() {
            ExecutionPlan plan = samplePlan();

            List<ExecutionPlan> candidates = optimizer(
                OptimizerConfig.of(OptimizerConfig.DEFAULT_MAX_PLANS, Set.of(UseIndexRangeRule.NAME), false))
                .createPlans(plan);

            assertThat(candidates).containsExactly(plan);
            assertThat(plan.appliedRules())
                .containsExactly(RemoveUnnecessaryFiltersRule.NAME, RemoveUnnecessaryCalculationsRule.NAME);
        }

        @Test
        @DisplayName("Validation rejects a rule that corrupts the plan")
        void testValidatePlans() {
            OptimizerRule corrupting = (optimizer, plan, out) -> {
                CalculationNode node = (CalculationNode) plan.findNodesOfType(NodeType.CALCULATION, true).get(0);
                plan.registerNode(new CalculationNode(node.outVariable(), Literal.of(1)));
                return RuleResult.keep();
            };
            Optimizer optimizer = new Optimizer(List.of(corrupting), OptimizerConfig.of(10, Set.of(), true));

            assertThatThrownBy(() -> optimizer.createPlans(samplePlan()))
                .isInstanceOf(PlanInvariantException.class)
                .hasMessageContaining("invalid plan");
        }
    }

    @Nested
    @DisplayName("Rule contract")
    class RuleContractTests {

        @Test
        @DisplayName("Rules may replace the input plan with alternatives")
        void testDropOriginal() {
            OptimizerRule replacing = new OptimizerRule() {
                @Override
                public RuleResult apply(Optimizer optimizer, ExecutionPlan plan, List<ExecutionPlan> out) {
                    out.add(plan.clone());
                    out.add(plan.clone());
                    return RuleResult.drop();
                }

                @Override
                public String name() {
                    return "replace";
                }
            };
            ExecutionPlan plan = samplePlan();

            List<ExecutionPlan> candidates = new Optimizer(List.of(replacing, replacing), OptimizerConfig.defaults())
                .createPlans(plan);

            assertThat(candidates).hasSize(4).doesNotContain(plan);
            assertThat(candidates.get(0).appliedRules()).containsExactly("replace", "replace");
            assertThat(plan.appliedRules()).isEmpty();
        }

        @Test
        @DisplayName("Rule failures propagate to the caller")
        void testRuleFailure() {
            OptimizerRule failing = (optimizer, plan, out) -> {
                throw new OptimizerException("cannot rewrite", "failing");
            };

            assertThatThrownBy(() -> new Optimizer(List.of(failing), OptimizerConfig.defaults())
                    .createPlans(samplePlan()))
                .isInstanceOf(OptimizerException.class)
                .satisfies(e -> assertThat(((OptimizerException) e).getRuleName()).isEqualTo("failing"));
        }
    }
}
