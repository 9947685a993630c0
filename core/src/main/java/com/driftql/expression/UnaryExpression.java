package com.driftql.expression;

import java.util.Objects;

/**
 * Expression representing a unary operation (operation with one operand).
 *
 * <p>Unary expressions include:
 * <ul>
 *   <li>Arithmetic negation: -a</li>
 *   <li>Logical negation: NOT a</li>
 * </ul>
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NEGATE("-", "negation"),
        NOT("NOT ", "logical NOT");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }
    }

    private final Operator operator;
    private final Expression operand;

    /**
     * Creates a unary expression.
     *
     * @param operator the operator
     * @param operand the operand
     */
    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public String toAql() {
        return operator.symbol() + operand.toAql();
    }

    @Override
    public String toString() {
        return toAql();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand);
    }
}
