package com.driftql.expression;

/**
 * Compile-time facts about expressions that the optimizer relies on.
 *
 * <p>The optimizer never evaluates an expression unless
 * {@link #isConstant(Expression)} is true and {@link #canThrow(Expression)}
 * is false for it.
 */
public interface ExpressionEvaluator {

    /**
     * Returns whether the expression's value is known without any runtime input.
     *
     * @param expression the expression
     * @return true if the expression is a compile-time constant
     */
    boolean isConstant(Expression expression);

    /**
     * Returns whether evaluating the expression may raise an error.
     *
     * @param expression the expression
     * @return true if evaluation may fail
     */
    boolean canThrow(Expression expression);

    /**
     * Evaluates a constant, non-throwing expression to a boolean.
     *
     * @param expression the expression
     * @return the truth value of the expression
     * @throws IllegalArgumentException if the expression is not constant or can throw
     */
    boolean evaluateToBoolean(Expression expression);
}
