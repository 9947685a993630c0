package com.driftql.optimizer;

import com.driftql.exception.OptimizerException;
import com.driftql.exception.PlanInvariantException;
import com.driftql.expression.AttributeAccess;
import com.driftql.expression.BinaryExpression;
import com.driftql.expression.Expression;
import com.driftql.expression.ExpressionEvaluator;
import com.driftql.expression.Literal;
import com.driftql.expression.VariableReference;
import com.driftql.index.IndexCatalog;
import com.driftql.index.IndexDescriptor;
import com.driftql.plan.CalculationNode;
import com.driftql.plan.EnumerateCollectionNode;
import com.driftql.plan.ExecutionNode;
import com.driftql.plan.ExecutionPlan;
import com.driftql.plan.IndexRangeNode;
import com.driftql.plan.NodeType;
import com.driftql.plan.PlanPrinter;
import com.driftql.plan.PlanWalker;
import com.driftql.plan.SubqueryNode;
import com.driftql.plan.Variable;
import com.driftql.ranges.RangeInfo;
import com.driftql.ranges.RangeInfoBound;
import com.driftql.ranges.RangesInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Walks from a filter towards the start of the plan, collecting range
 * constraints on collection attributes and proposing index-range plans.
 *
 * <p>On its way up the dependency chain the finder:
 * <ul>
 *   <li>decomposes the expression of the calculation defining the filter
 *       variable into per-attribute ranges</li>
 *   <li>for each collection scan whose variable has ranges, asks the index
 *       catalog for usable indexes and emits one cloned plan per index, with
 *       the scan replaced by an {@link IndexRangeNode}</li>
 * </ul>
 *
 * <p>Only conjunctions of comparisons between an attribute path of a
 * collection variable and a constant value contribute ranges:
 * <pre>
 *   x.a == 5                   -- a in [5, 5]
 *   x.a &gt; 1 AND x.a &lt; 10       -- a in (1, 10)
 *   10 &gt;= x.b.c                -- b.c in (-inf, 10]
 * </pre>
 * Disjunctions, function calls and comparisons between two attributes are
 * ignored. The constant side must be a bare literal, so {@code x.a > -5}
 * written as a negated literal contributes no range either.
 *
 * <p>An index range drops rows before they reach the nodes between the scan
 * and the filter. No plans are proposed for scans further up than a node that
 * changes the number of rows (such as a LIMIT) or a calculation that can
 * throw, including calculations inside subqueries on the chain.
 */
public class CalculationNodeFinder implements PlanWalker {

    private static final Logger logger = LoggerFactory.getLogger(CalculationNodeFinder.class);

    /** Node types that pass every row through and can be crossed by an index range */
    private static final EnumSet<NodeType> ROW_PRESERVING = EnumSet.of(
        NodeType.SINGLETON, NodeType.ENUMERATE_COLLECTION, NodeType.INDEX_RANGE,
        NodeType.CALCULATION, NodeType.FILTER, NodeType.SUBQUERY);

    private final ExecutionPlan plan;
    private final Variable variable;
    private final List<ExecutionPlan> out;
    private final IndexCatalog indexCatalog;
    private final ExpressionEvaluator evaluator;
    private final RangesInfo ranges = new RangesInfo();

    /** The first node on the chain that rows must not be removed below, null if none */
    private ExecutionNode barrier;

    /** The node visited before the current one, i.e. its parent on the chain */
    private ExecutionNode previous;

    /**
     * Creates a finder for one filter.
     *
     * @param plan the plan being optimized; it is never modified
     * @param variable the variable consumed by the filter
     * @param out receives the index-range plans
     * @param indexCatalog the source of usable indexes
     * @param evaluator decides which calculations can throw
     */
    public CalculationNodeFinder(ExecutionPlan plan, Variable variable, List<ExecutionPlan> out,
                                 IndexCatalog indexCatalog, ExpressionEvaluator evaluator) {
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.indexCatalog = Objects.requireNonNull(indexCatalog, "indexCatalog must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /**
     * Returns the ranges collected so far.
     *
     * @return the range map
     */
    public RangesInfo ranges() {
        return ranges;
    }

    @Override
    public void before(ExecutionNode node) {
        if (barrier == null && isBarrier(node)) {
            barrier = node;
        }

        if (node.type() == NodeType.CALCULATION) {
            List<Variable> defined = node.variablesSetHere();
            if (defined.size() != 1) {
                throw new PlanInvariantException("calculation must define exactly one variable, found "
                    + defined.size(), node.id());
            }
            if (defined.get(0).id() == variable.id()) {
                buildRangeInfo(((CalculationNode) node).expression(), new AccessPath());
            }
        } else if (node.type() == NodeType.ENUMERATE_COLLECTION) {
            EnumerateCollectionNode scan = (EnumerateCollectionNode) node;
            ranges.find(scan.outVariable().name())
                .ifPresent(byAttribute -> proposeIndexPlans(scan, byAttribute));
        }
        previous = node;
    }

    private void proposeIndexPlans(EnumerateCollectionNode scan, Map<String, RangeInfo> byAttribute) {
        List<String> attributes = new ArrayList<>(byAttribute.keySet());
        List<RangeInfo> rangeInfo = new ArrayList<>(byAttribute.values());

        List<IndexDescriptor> indexes = indexCatalog.usableIndexes(scan.collection(), attributes);
        if (indexes.isEmpty()) {
            return;
        }
        if (barrier != null) {
            logger.debug("Not replacing {}: rows must reach {} unfiltered", scan, barrier);
            return;
        }
        if (previous == null || !scan.parents().equals(List.of(previous.id()))) {
            logger.debug("Not replacing {}: it does not have a single parent on the walked chain", scan);
            return;
        }

        for (IndexDescriptor index : indexes) {
            out.add(createIndexRangePlan(scan, index, rangeInfo));
        }
    }

    private boolean isBarrier(ExecutionNode node) {
        if (!ROW_PRESERVING.contains(node.type())) {
            return true;
        }
        if (node.type() == NodeType.CALCULATION) {
            return evaluator.canThrow(((CalculationNode) node).expression());
        }
        if (node.type() == NodeType.SUBQUERY) {
            return subqueryCanThrow((SubqueryNode) node);
        }
        return false;
    }

    private boolean subqueryCanThrow(SubqueryNode subquery) {
        List<ExecutionNode> chain = new ArrayList<>();
        plan.walk(plan.getNodeById(subquery.subqueryRootId()), chain::add);
        for (ExecutionNode node : chain) {
            if (node.type() == NodeType.CALCULATION && evaluator.canThrow(((CalculationNode) node).expression())) {
                return true;
            }
            if (node.type() == NodeType.SUBQUERY && subqueryCanThrow((SubqueryNode) node)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Clones the plan and replaces the scan with an index range node in the clone.
     * The clone is only handed out once it is complete.
     */
    private ExecutionPlan createIndexRangePlan(EnumerateCollectionNode scan, IndexDescriptor index,
                                               List<RangeInfo> rangeInfo) {
        ExecutionPlan newPlan = plan.clone();
        IndexRangeNode newNode;
        try {
            newNode = new IndexRangeNode(scan.collection(), scan.outVariable(), index, rangeInfo);
            newPlan.registerNode(newNode);
            newPlan.replaceNode(newPlan.getNodeById(scan.id()), newNode, newPlan.getNodeById(previous.id()));
        } catch (PlanInvariantException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new OptimizerException("Failed to build index range plan for " + scan + " using " + index,
                e, UseIndexRangeRule.NAME);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Created index range plan using {}:\n{}", index, PlanPrinter.explain(newPlan));
        }
        return newPlan;
    }

    // ==================== Expression decomposition ====================

    /**
     * Records the ranges implied by an expression.
     *
     * @param node the expression node
     * @param access the attribute path collected for the current operand
     */
    void buildRangeInfo(Expression node, AccessPath access) {
        if (node instanceof VariableReference ref) {
            plan.getVarSetBy(ref.variable().id())
                .filter(setter -> setter.type() == NodeType.ENUMERATE_COLLECTION)
                .ifPresent(setter -> access.variable = ref.variable().name());
            return;
        }

        if (node instanceof AttributeAccess attribute) {
            buildRangeInfo(attribute.base(), access);
            if (access.variable != null) {
                access.append(attribute.name());
            }
            return;
        }

        if (!(node instanceof BinaryExpression bin)) {
            return;
        }

        BinaryExpression.Operator op = bin.operator();
        if (op == BinaryExpression.Operator.AND) {
            buildRangeInfo(bin.left(), new AccessPath());
            buildRangeInfo(bin.right(), new AccessPath());
            return;
        }
        if (op != BinaryExpression.Operator.EQUAL && !op.isOrdering()) {
            return;
        }

        Literal value;
        Expression attributeSide;
        boolean attributeOnLeft;
        if (bin.left() instanceof AttributeAccess && bin.right() instanceof Literal lit) {
            value = lit;
            attributeSide = bin.left();
            attributeOnLeft = true;
        } else if (bin.right() instanceof AttributeAccess && bin.left() instanceof Literal lit) {
            value = lit;
            attributeSide = bin.right();
            attributeOnLeft = false;
        } else {
            return;
        }

        RangeInfoBound low = null;
        RangeInfoBound high = null;
        if (op == BinaryExpression.Operator.EQUAL) {
            low = new RangeInfoBound(value, true);
            high = new RangeInfoBound(value, true);
        } else {
            RangeInfoBound bound = new RangeInfoBound(value, op.isNonStrict());
            boolean greater = op == BinaryExpression.Operator.GREATER_THAN
                || op == BinaryExpression.Operator.GREATER_THAN_OR_EQUAL;
            // attribute > value and value < attribute both bound the attribute from below
            if (greater == attributeOnLeft) {
                low = bound;
            } else {
                high = bound;
            }
        }

        AccessPath path = new AccessPath();
        buildRangeInfo(attributeSide, path);
        if (path.variable != null) {
            ranges.insert(path.variable, path.toString(), low, high);
        }
    }

    /**
     * Collection variable and dotted attribute path of the operand being
     * decomposed.
     */
    static final class AccessPath {

        /** Name of the collection variable, null until one is found */
        String variable;

        private final StringBuilder path = new StringBuilder();

        void append(String attribute) {
            if (path.length() > 0) {
                path.append('.');
            }
            path.append(attribute);
        }

        @Override
        public String toString() {
            return path.toString();
        }
    }
}
