package com.driftql.plan;

import com.driftql.expression.Expression;
import com.driftql.expression.ExpressionUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node computing an expression per row and binding the result to its output
 * variable ({@code LET tmp = x.age > 18}).
 */
public final class CalculationNode extends ExecutionNode {

    private final Variable outVariable;
    private final Expression expression;

    /**
     * Creates a calculation.
     *
     * @param outVariable the variable receiving the result
     * @param expression the expression to compute
     */
    public CalculationNode(Variable outVariable, Expression expression) {
        this.outVariable = Objects.requireNonNull(outVariable, "outVariable must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public Variable outVariable() {
        return outVariable;
    }

    public Expression expression() {
        return expression;
    }

    @Override
    public NodeType type() {
        return NodeType.CALCULATION;
    }

    @Override
    public List<Variable> variablesUsedHere() {
        return new ArrayList<>(ExpressionUtils.variablesUsed(expression));
    }

    @Override
    public List<Variable> variablesSetHere() {
        return List.of(outVariable);
    }

    @Override
    protected ExecutionNode copyPayload() {
        // Expressions are immutable and shared between clones
        return new CalculationNode(outVariable, expression);
    }

    @Override
    public String describe() {
        return outVariable.name() + " = " + expression.toAql();
    }
}
