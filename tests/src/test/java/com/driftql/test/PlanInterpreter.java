package com.driftql.test;

import com.driftql.expression.DefaultExpressionEvaluator;
import com.driftql.plan.CalculationNode;
import com.driftql.plan.EnumerateCollectionNode;
import com.driftql.plan.ExecutionNode;
import com.driftql.plan.ExecutionPlan;
import com.driftql.plan.FilterNode;
import com.driftql.plan.IndexRangeNode;
import com.driftql.plan.LimitNode;
import com.driftql.plan.ReturnNode;
import com.driftql.plan.SubqueryNode;
import com.driftql.plan.Variable;
import com.driftql.ranges.RangeInfo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs execution plans against in-memory collections, so tests can check that
 * rewritten plans return the same rows as the originals.
 *
 * <p>Rows are variable bindings; the result of a plan is the list of values
 * its root {@link ReturnNode} emits, in order. Index range nodes scan the
 * collection in document order and keep the documents inside all ranges.
 */
public final class PlanInterpreter {

    private final Map<String, List<Map<String, Object>>> collections;
    private final DefaultExpressionEvaluator evaluator = new DefaultExpressionEvaluator();

    public PlanInterpreter(Map<String, List<Map<String, Object>>> collections) {
        this.collections = collections;
    }

    /**
     * Executes a plan.
     *
     * @param plan the plan
     * @return the returned values
     */
    public List<Object> execute(ExecutionPlan plan) {
        return execute(plan, plan.root(), new HashMap<>());
    }

    private List<Object> execute(ExecutionPlan plan, ExecutionNode root, Map<Variable, Object> outer) {
        if (!(root instanceof ReturnNode ret)) {
            throw new IllegalArgumentException("plan root must be a ReturnNode: " + root);
        }
        List<Object> values = new ArrayList<>();
        for (Map<Variable, Object> row : rows(plan, root, outer)) {
            values.add(row.get(ret.inVariable()));
        }
        return values;
    }

    private List<Map<Variable, Object>> rows(ExecutionPlan plan, ExecutionNode node, Map<Variable, Object> outer) {
        switch (node.type()) {
            case SINGLETON:
                return List.of(new HashMap<>(outer));
            case NO_RESULTS:
                return List.of();
            default:
                break;
        }

        List<Map<Variable, Object>> input = rows(plan, plan.getDependencies(node).get(0), outer);
        List<Map<Variable, Object>> output = new ArrayList<>();

        switch (node.type()) {
            case ENUMERATE_COLLECTION: {
                EnumerateCollectionNode scan = (EnumerateCollectionNode) node;
                for (Map<Variable, Object> row : input) {
                    for (Map<String, Object> doc : documents(scan.collection())) {
                        output.add(bind(row, scan.outVariable(), doc));
                    }
                }
                return output;
            }
            case INDEX_RANGE: {
                IndexRangeNode scan = (IndexRangeNode) node;
                for (Map<Variable, Object> row : input) {
                    for (Map<String, Object> doc : documents(scan.collection())) {
                        if (inRanges(doc, scan.ranges())) {
                            output.add(bind(row, scan.outVariable(), doc));
                        }
                    }
                }
                return output;
            }
            case CALCULATION: {
                CalculationNode calc = (CalculationNode) node;
                for (Map<Variable, Object> row : input) {
                    output.add(bind(row, calc.outVariable(), evaluator.evaluate(calc.expression(), row)));
                }
                return output;
            }
            case FILTER: {
                FilterNode filter = (FilterNode) node;
                for (Map<Variable, Object> row : input) {
                    if (DefaultExpressionEvaluator.toBoolean(row.get(filter.inVariable()))) {
                        output.add(row);
                    }
                }
                return output;
            }
            case LIMIT: {
                LimitNode limit = (LimitNode) node;
                int from = (int) Math.min(limit.offset(), input.size());
                int to = (int) Math.min(limit.offset() + limit.count(), input.size());
                return new ArrayList<>(input.subList(from, to));
            }
            case SUBQUERY: {
                SubqueryNode sub = (SubqueryNode) node;
                for (Map<Variable, Object> row : input) {
                    List<Object> result = execute(plan, plan.getNodeById(sub.subqueryRootId()), row);
                    output.add(bind(row, sub.outVariable(), result));
                }
                return output;
            }
            case RETURN:
                return input;
            default:
                throw new IllegalArgumentException("cannot execute " + node);
        }
    }

    private List<Map<String, Object>> documents(String collection) {
        List<Map<String, Object>> docs = collections.get(collection);
        if (docs == null) {
            throw new IllegalArgumentException("unknown collection " + collection);
        }
        return docs;
    }

    private static boolean inRanges(Map<String, Object> doc, List<RangeInfo> ranges) {
        for (RangeInfo range : ranges) {
            if (!range.contains(attributeValue(doc, range.attribute()))) {
                return false;
            }
        }
        return true;
    }

    private static Object attributeValue(Map<String, Object> doc, String path) {
        Object current = doc;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }

    private static Map<Variable, Object> bind(Map<Variable, Object> row, Variable variable, Object value) {
        Map<Variable, Object> result = new HashMap<>(row);
        result.put(variable, value);
        return result;
    }
}
