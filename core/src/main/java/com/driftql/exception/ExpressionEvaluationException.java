package com.driftql.exception;

import com.driftql.expression.Expression;

/**
 * Exception raised when evaluating an expression fails at runtime, e.g. a
 * division by zero or an explicit {@code FAIL()} call.
 */
public class ExpressionEvaluationException extends RuntimeException {

    private final String expressionText;

    public ExpressionEvaluationException(String message, Expression expression) {
        super(message + " in " + expression.toAql());
        this.expressionText = expression.toAql();
    }

    /**
     * Returns the query text of the expression that failed.
     *
     * @return the expression text
     */
    public String getExpressionText() {
        return expressionText;
    }
}
