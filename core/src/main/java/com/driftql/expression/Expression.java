package com.driftql.expression;

/**
 * Base interface for all nodes of the query AST consumed by the optimizer.
 *
 * <p>Expressions are immutable. Calculation nodes of an execution plan own one
 * expression tree each, and cloned plans share the same trees read-only.
 *
 * <p>Expression kinds:
 * <ul>
 *   <li>{@link Literal} - constant values</li>
 *   <li>{@link VariableReference} - a reference to a plan variable</li>
 *   <li>{@link AttributeAccess} - {@code base.name}</li>
 *   <li>{@link BinaryExpression} - comparisons, arithmetic, AND/OR</li>
 *   <li>{@link UnaryExpression} - NOT, negation</li>
 *   <li>{@link FunctionCall} - function invocation</li>
 *   <li>{@link ArrayLiteralExpression} - {@code [a, b, c]}</li>
 * </ul>
 */
public interface Expression {

    /**
     * Renders this expression as query text.
     *
     * @return the query text
     */
    String toAql();
}
