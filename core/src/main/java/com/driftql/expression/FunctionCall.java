package com.driftql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing a function call.
 *
 * <p>Function names are case-insensitive and stored in upper case, the way
 * query text usually spells them:
 * <pre>
 *   LENGTH(x.tags)
 *   CONCAT(x.first, " ", x.last)
 *   FAIL("boom")
 * </pre>
 *
 * <p>The optimizer never folds function calls; whether a call may raise an
 * error is decided by the {@link ExpressionEvaluator}.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;

    /**
     * Creates a function call.
     *
     * @param functionName the function name
     * @param arguments the arguments
     */
    public FunctionCall(String functionName, List<Expression> arguments) {
        Objects.requireNonNull(functionName, "functionName must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        this.functionName = functionName.toUpperCase();
        this.arguments = new ArrayList<>(arguments);
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns the arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public String toAql() {
        return functionName + "(" +
            arguments.stream().map(Expression::toAql).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String toString() {
        return toAql();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) && arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }

    public static FunctionCall of(String functionName, Expression... arguments) {
        return new FunctionCall(functionName, List.of(arguments));
    }
}
