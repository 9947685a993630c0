package com.driftql.plan;

import com.driftql.expression.Expression;
import java.util.Objects;
import java.util.function.Function;

/**
 * Assembles linear execution plans, one pipeline stage at a time.
 *
 * <p>Each stage reads from the previously added node:
 * <pre>
 *   PlanBuilder builder = new PlanBuilder();
 *   Variable x = builder.enumerateCollection("users", "x");
 *   Variable cond = builder.calculate(BinaryExpression.equal(
 *       new AttributeAccess(new VariableReference(x), "age"), Literal.of(42)));
 *   builder.filter(cond);
 *   ExecutionPlan plan = builder.returning(x);
 * </pre>
 * The builder starts every pipeline with a {@link SingletonNode}.
 */
public final class PlanBuilder {

    private final ExecutionPlan plan;
    private final VariableGenerator variables;
    private ExecutionNode last;

    /**
     * Creates a builder for a new plan.
     */
    public PlanBuilder() {
        this(new ExecutionPlan(), new VariableGenerator());
    }

    private PlanBuilder(ExecutionPlan plan, VariableGenerator variables) {
        this.plan = plan;
        this.variables = variables;
        this.last = append(new SingletonNode());
    }

    public ExecutionPlan plan() {
        return plan;
    }

    public VariableGenerator variables() {
        return variables;
    }

    /**
     * Returns the most recently added node.
     *
     * @return the current end of the pipeline
     */
    public ExecutionNode last() {
        return last;
    }

    /**
     * Adds {@code FOR name IN collection}.
     *
     * @return the iteration variable
     */
    public Variable enumerateCollection(String collection, String name) {
        Variable out = variables.createVariable(name);
        last = append(new EnumerateCollectionNode(collection, out));
        return out;
    }

    /**
     * Adds a calculation into a fresh temporary variable.
     *
     * @return the temporary variable
     */
    public Variable calculate(Expression expression) {
        Variable out = variables.createTemporaryVariable();
        last = append(new CalculationNode(out, expression));
        return out;
    }

    /**
     * Adds {@code LET name = expression}.
     *
     * @return the defined variable
     */
    public Variable let(String name, Expression expression) {
        Variable out = variables.createVariable(name);
        last = append(new CalculationNode(out, expression));
        return out;
    }

    public PlanBuilder filter(Variable condition) {
        last = append(new FilterNode(condition));
        return this;
    }

    public PlanBuilder limit(long offset, long count) {
        last = append(new LimitNode(offset, count));
        return this;
    }

    /**
     * Adds {@code LET name = (subquery)}. The subquery is built by
     * {@code body} on a nested builder sharing this plan; it must return the
     * variable its {@code RETURN} emits.
     *
     * @return the subquery result variable
     */
    public Variable subquery(String name, Function<PlanBuilder, Variable> body) {
        Objects.requireNonNull(body, "body must not be null");
        PlanBuilder nested = new PlanBuilder(plan, variables);
        Variable result = body.apply(nested);
        ReturnNode subqueryRoot = new ReturnNode(result);
        nested.append(subqueryRoot);

        Variable out = variables.createVariable(name);
        last = append(new SubqueryNode(subqueryRoot.id(), out));
        return out;
    }

    /**
     * Adds {@code RETURN variable}, makes it the plan root and returns the plan.
     *
     * @return the finished plan
     */
    public ExecutionPlan returning(Variable variable) {
        last = append(new ReturnNode(variable));
        plan.setRoot(last);
        return plan;
    }

    private ExecutionNode append(ExecutionNode node) {
        plan.registerNode(node);
        if (last != null) {
            plan.addDependency(node, last);
        }
        return node;
    }
}
