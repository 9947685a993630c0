package com.driftql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression building an array from member expressions, e.g. {@code [x.a, 1, "b"]}.
 */
public final class ArrayLiteralExpression implements Expression {

    private final List<Expression> elements;

    public ArrayLiteralExpression(List<Expression> elements) {
        this.elements = new ArrayList<>(Objects.requireNonNull(elements, "elements must not be null"));
    }

    public List<Expression> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public String toAql() {
        return elements.stream().map(Expression::toAql).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        return toAql();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ArrayLiteralExpression)) return false;
        return elements.equals(((ArrayLiteralExpression) obj).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }
}
