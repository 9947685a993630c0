package com.driftql.plan;

import com.driftql.exception.PlanInvariantException;
import com.driftql.expression.AttributeAccess;
import com.driftql.expression.BinaryExpression;
import com.driftql.expression.Literal;
import com.driftql.expression.VariableReference;
import com.driftql.test.TestBase;
import com.driftql.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ExecutionPlan} structural queries and edits.
 *
 * <p>Most tests use the plan
 * <pre>
 *   FOR x IN users LET tmp1 = x.a == 5 FILTER tmp1 RETURN x
 *   Singleton#1 &lt;- Enumerate#2 &lt;- Calculation#3 &lt;- Filter#4 &lt;- Return#5
 * </pre>
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ExecutionPlan Tests")
public class ExecutionPlanTest extends TestBase {

    private ExecutionPlan plan;
    private Variable x;
    private Variable tmp;

    @Override
    protected void doSetUp() {
        PlanBuilder builder = new PlanBuilder();
        x = builder.enumerateCollection("users", "x");
        tmp = builder.calculate(BinaryExpression.equal(
            new AttributeAccess(new VariableReference(x), "a"), Literal.of(5)));
        builder.filter(tmp);
        plan = builder.returning(x);
    }

    private List<Integer> ids(List<ExecutionNode> nodes) {
        return nodes.stream().map(ExecutionNode::id).toList();
    }

    /**
     * FOR x IN users LET sub = (FOR y IN orders FILTER y.b == x.a RETURN y) RETURN sub
     */
    private ExecutionPlan subqueryPlan() {
        PlanBuilder builder = new PlanBuilder();
        Variable outer = builder.enumerateCollection("users", "x");
        Variable sub = builder.subquery("sub", nested -> {
            Variable y = nested.enumerateCollection("orders", "y");
            Variable cond = nested.calculate(BinaryExpression.equal(
                new AttributeAccess(new VariableReference(y), "b"),
                new AttributeAccess(new VariableReference(outer), "a")));
            nested.filter(cond);
            return y;
        });
        return builder.returning(sub);
    }

    // ==================== Registration ====================

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Nodes receive sequential ids")
        void testSequentialIds() {
            assertThat(plan.nodes()).extracting(ExecutionNode::id).containsExactly(1, 2, 3, 4, 5);
            assertThat(plan.root().id()).isEqualTo(5);

            int id = plan.registerNode(new NoResultsNode());

            assertThat(id).isEqualTo(6);
            assertThat(plan.size()).isEqualTo(6);
        }

        @Test
        @DisplayName("Registering a node twice is rejected")
        void testDoubleRegistration() {
            ExecutionNode filter = plan.getNodeById(4);

            assertThatThrownBy(() -> plan.registerNode(filter))
                .isInstanceOf(PlanInvariantException.class)
                .hasMessageContaining("already registered");
        }

        @Test
        @DisplayName("Looking up an unknown id is rejected")
        void testUnknownId() {
            assertThatThrownBy(() -> plan.getNodeById(42))
                .isInstanceOf(PlanInvariantException.class)
                .satisfies(e -> assertThat(((PlanInvariantException) e).getNodeId()).isEqualTo(42));
        }

        @Test
        @DisplayName("A plan without root rejects root()")
        void testMissingRoot() {
            ExecutionPlan empty = new ExecutionPlan();

            assertThat(empty.hasRoot()).isFalse();
            assertThatThrownBy(empty::root).isInstanceOf(PlanInvariantException.class);
        }

        @Test
        @DisplayName("Nodes of another plan cannot be connected")
        void testForeignNode() {
            ExecutionPlan other = new ExecutionPlan();
            SingletonNode foreign = new SingletonNode();
            other.registerNode(foreign);

            assertThatThrownBy(() -> plan.addDependency(plan.getNodeById(1), foreign))
                .isInstanceOf(PlanInvariantException.class)
                .hasMessageContaining("does not belong");
        }

        @Test
        @DisplayName("Adding an existing dependency again is a no-op")
        void testAddDependencyIdempotent() {
            ExecutionNode filter = plan.getNodeById(4);
            ExecutionNode calc = plan.getNodeById(3);

            plan.addDependency(filter, calc);

            assertThat(filter.dependencies()).containsExactly(3);
            assertThat(calc.parents()).containsExactly(4);
        }
    }

    // ==================== Structural queries ====================

    @Nested
    @DisplayName("findNodesOfType")
    class FindNodesOfTypeTests {

        @Test
        @DisplayName("Nodes are returned from the root towards the start of the plan")
        void testRootToLeafOrder() {
            PlanBuilder builder = new PlanBuilder();
            Variable v = builder.enumerateCollection("users", "x");
            builder.filter(builder.calculate(Literal.of(true)));
            builder.filter(builder.calculate(Literal.of(true)));
            ExecutionPlan twoFilters = builder.returning(v);

            assertThat(ids(twoFilters.findNodesOfType(NodeType.FILTER, false))).containsExactly(6, 4);
        }

        @Test
        @DisplayName("Subqueries are only searched when recursive")
        void testRecursive() {
            ExecutionPlan withSubquery = subqueryPlan();

            assertThat(withSubquery.findNodesOfType(NodeType.FILTER, false)).isEmpty();
            assertThat(ids(withSubquery.findNodesOfType(NodeType.FILTER, true))).containsExactly(6);
        }

        @Test
        @DisplayName("Subquery nodes are visited before the nodes the subquery node depends on")
        void testSubqueryVisitedFirst() {
            ExecutionPlan withSubquery = subqueryPlan();

            assertThat(ids(withSubquery.findNodesOfType(NodeType.SINGLETON, true))).containsExactly(3, 1);
            assertThat(ids(withSubquery.findNodesOfType(NodeType.ENUMERATE_COLLECTION, true))).containsExactly(4, 2);
        }
    }

    @Nested
    @DisplayName("Variable queries")
    class VariableQueryTests {

        @Test
        @DisplayName("getVarSetBy returns the defining node")
        void testVarSetBy() {
            assertThat(plan.getVarSetBy(x.id())).map(ExecutionNode::id).contains(2);
            assertThat(plan.getVarSetBy(tmp.id())).map(ExecutionNode::id).contains(3);
            assertThat(plan.getVarSetBy(99)).isEmpty();
        }

        @Test
        @DisplayName("getVarSetBy rejects variables defined twice")
        void testDoubleDefinition() {
            plan.registerNode(new CalculationNode(tmp, Literal.of(1)));

            assertThatThrownBy(() -> plan.getVarSetBy(tmp.id()))
                .isInstanceOf(PlanInvariantException.class)
                .hasMessageContaining("also defined");
        }

        @Test
        @DisplayName("getVarsUsedAfter collects variables used by all downstream nodes")
        void testVarsUsedAfter() {
            assertThat(plan.getVarsUsedAfter(plan.getNodeById(2))).containsExactlyInAnyOrder(x.id(), tmp.id());
            assertThat(plan.getVarsUsedAfter(plan.getNodeById(3))).containsExactlyInAnyOrder(x.id(), tmp.id());
            assertThat(plan.getVarsUsedAfter(plan.getNodeById(4))).containsExactly(x.id());
            assertThat(plan.getVarsUsedAfter(plan.getNodeById(5))).isEmpty();
        }

        @Test
        @DisplayName("Variables used inside a subquery count as used by the subquery node")
        void testSubqueryUsage() {
            ExecutionPlan withSubquery = subqueryPlan();
            ExecutionNode subqueryNode = withSubquery.getNodeById(8);
            Variable outer = withSubquery.getNodeById(2).variablesSetHere().get(0);
            Variable sub = subqueryNode.variablesSetHere().get(0);

            assertThat(withSubquery.getVariablesUsedBy(subqueryNode)).containsExactly(outer);
            assertThat(withSubquery.getVarsUsedAfter(withSubquery.getNodeById(2)))
                .containsExactlyInAnyOrder(outer.id(), sub.id());
        }

        @Test
        @DisplayName("Structural edits refresh the variable indexes")
        void testCachesRefreshed() {
            assertThat(plan.getVarSetBy(tmp.id())).isPresent();

            plan.unlinkNode(plan.getNodeById(3));

            assertThat(plan.getVarSetBy(tmp.id())).isEmpty();
            assertThat(plan.getVarsUsedAfter(plan.getNodeById(2))).containsExactlyInAnyOrder(x.id(), tmp.id());
        }
    }

    @Nested
    @DisplayName("walk")
    class WalkTests {

        @Test
        @DisplayName("Walk follows the dependency chain to the singleton")
        void testWalk() {
            List<Integer> visited = new ArrayList<>();

            plan.walk(plan.getNodeById(4), node -> visited.add(node.id()));

            assertThat(visited).containsExactly(4, 3, 2, 1);
        }

        @Test
        @DisplayName("Walk does not enter subqueries")
        void testWalkSkipsSubqueries() {
            ExecutionPlan withSubquery = subqueryPlan();
            List<Integer> visited = new ArrayList<>();

            withSubquery.walk(withSubquery.root(), node -> visited.add(node.id()));

            assertThat(visited).containsExactly(9, 8, 2, 1);
        }
    }

    // ==================== Structural edits ====================

    @Nested
    @DisplayName("replaceNode")
    class ReplaceNodeTests {

        @Test
        @DisplayName("The replacement takes over dependencies and parent")
        void testReplace() {
            ExecutionNode filter = plan.getNodeById(4);
            NoResultsNode noResults = new NoResultsNode();
            int newId = plan.registerNode(noResults);

            plan.replaceNode(filter, noResults, plan.getNodeById(5));

            assertThat(plan.contains(filter)).isFalse();
            assertThat(noResults.dependencies()).containsExactly(3);
            assertThat(noResults.parents()).containsExactly(5);
            assertThat(plan.getNodeById(3).parents()).containsExactly(newId);
            assertThat(plan.getNodeById(5).dependencies()).containsExactly(newId);
        }

        @Test
        @DisplayName("A node with several parents cannot be replaced")
        void testMultipleParents() {
            ExecutionPlan shared = new ExecutionPlan();
            SingletonNode singleton = new SingletonNode();
            Variable v = new VariableGenerator().createVariable("v");
            CalculationNode calc = new CalculationNode(v, Literal.of(true));
            FilterNode first = new FilterNode(v);
            FilterNode second = new FilterNode(v);
            for (ExecutionNode node : List.of(singleton, calc, first, second)) {
                shared.registerNode(node);
            }
            shared.addDependency(calc, singleton);
            shared.addDependency(first, calc);
            shared.addDependency(second, calc);

            NoResultsNode replacement = new NoResultsNode();
            shared.registerNode(replacement);

            assertThatThrownBy(() -> shared.replaceNode(calc, replacement, first))
                .isInstanceOf(PlanInvariantException.class)
                .hasMessageContaining("exactly the parent");
        }

        @Test
        @DisplayName("A connected replacement is rejected")
        void testConnectedReplacement() {
            ExecutionNode filter = plan.getNodeById(4);
            ExecutionNode calc = plan.getNodeById(3);

            assertThatThrownBy(() -> plan.replaceNode(filter, calc, plan.getNodeById(5)))
                .isInstanceOf(PlanInvariantException.class)
                .hasMessageContaining("must not be connected");
        }
    }

    @Nested
    @DisplayName("unlinkNode")
    class UnlinkNodeTests {

        @Test
        @DisplayName("Unlinking connects parents to the dependency")
        void testUnlink() {
            plan.unlinkNode(plan.getNodeById(4));

            assertThat(plan.getNodeById(5).dependencies()).containsExactly(3);
            assertThat(plan.getNodeById(3).parents()).containsExactly(5);
            assertThat(plan.size()).isEqualTo(4);
        }

        @Test
        @DisplayName("Unlinking the root makes its dependency the root")
        void testUnlinkRoot() {
            plan.unlinkNode(plan.root());

            assertThat(plan.root().id()).isEqualTo(4);
            assertThat(plan.root().parents()).isEmpty();
        }

        @Test
        @DisplayName("Unlinking a subquery root updates the subquery node")
        void testUnlinkSubqueryRoot() {
            ExecutionPlan withSubquery = subqueryPlan();

            withSubquery.unlinkNode(withSubquery.getNodeById(7));

            assertThat(((SubqueryNode) withSubquery.getNodeById(8)).subqueryRootId()).isEqualTo(6);
        }

        @Test
        @DisplayName("Nodes without exactly one dependency cannot be unlinked")
        void testUnlinkSingleton() {
            assertThatThrownBy(() -> plan.unlinkNode(plan.getNodeById(1)))
                .isInstanceOf(PlanInvariantException.class)
                .hasMessageContaining("exactly one dependency");
        }

        @Test
        @DisplayName("Unlinking adjacent nodes together keeps the chain connected")
        void testUnlinkNodes() {
            ExecutionNode filter = plan.getNodeById(4);
            ExecutionNode calc = plan.getNodeById(3);

            plan.unlinkNodes(List.of(filter, calc));

            assertThat(plan.getNodeById(5).dependencies()).containsExactly(2);
            assertThat(plan.getNodeById(2).parents()).containsExactly(5);
            assertThat(plan.nodes()).extracting(ExecutionNode::id).containsExactly(1, 2, 5);
        }
    }

    @Nested
    @DisplayName("clone")
    class CloneTests {

        @Test
        @DisplayName("Clones keep ids and topology with distinct node objects")
        void testClone() {
            plan.addAppliedRule("some-rule");

            ExecutionPlan copy = plan.clone();

            assertThat(copy.nodes()).extracting(ExecutionNode::id).containsExactly(1, 2, 3, 4, 5);
            assertThat(copy.root().id()).isEqualTo(5);
            assertThat(copy.getNodeById(3).parents()).containsExactly(4);
            assertThat(copy.getNodeById(3)).isNotSameAs(plan.getNodeById(3));
            assertThat(copy.contains(plan.getNodeById(3))).isFalse();
            assertThat(copy.appliedRules()).containsExactly("some-rule");
        }

        @Test
        @DisplayName("Edits to a clone do not affect the original")
        void testCloneIndependence() {
            ExecutionPlan copy = plan.clone();

            copy.unlinkNode(copy.getNodeById(4));
            copy.addAppliedRule("later");

            assertThat(plan.size()).isEqualTo(5);
            assertThat(plan.getNodeById(5).dependencies()).containsExactly(4);
            assertThat(plan.getNodeById(3).parents()).containsExactly(4);
            assertThat(plan.appliedRules()).isEmpty();
        }

        @Test
        @DisplayName("Clones continue the id sequence of the original")
        void testCloneIdSequence() {
            ExecutionPlan copy = plan.clone();

            assertThat(copy.registerNode(new NoResultsNode())).isEqualTo(6);
            assertThat(plan.registerNode(new NoResultsNode())).isEqualTo(6);
        }

        @Test
        @DisplayName("Cloned subquery nodes keep their subquery root")
        void testCloneSubquery() {
            ExecutionPlan copy = subqueryPlan().clone();

            SubqueryNode sub = (SubqueryNode) copy.getNodeById(8);
            assertThat(sub.subqueryRootId()).isEqualTo(7);
            assertThat(copy.findNodesOfType(NodeType.FILTER, true)).hasSize(1);
        }
    }
}
