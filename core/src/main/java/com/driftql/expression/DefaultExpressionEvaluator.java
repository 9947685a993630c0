package com.driftql.expression;

import com.driftql.exception.ExpressionEvaluationException;
import com.driftql.plan.Variable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reference {@link ExpressionEvaluator} over the driftql AST.
 *
 * <p>Constant analysis:
 * <ul>
 *   <li>Literals are constant; operators and array literals are constant when
 *       all of their operands are.</li>
 *   <li>Variable references, attribute accesses and function calls are never
 *       constant.</li>
 * </ul>
 *
 * <p>Error analysis: division and modulo can throw unless the divisor is a
 * non-zero number literal; function calls can throw unless the function is
 * one of the known-safe functions and its arguments cannot throw.
 *
 * <p>{@link #evaluate(Expression, Map)} also evaluates non-constant
 * expressions against variable bindings; it follows the document-value
 * semantics used by {@link ValueComparator} and {@link #toBoolean(Object)}.
 */
public class DefaultExpressionEvaluator implements ExpressionEvaluator {

    /** Functions that never raise an error for any input. */
    public static final Set<String> SAFE_FUNCTIONS = Set.of(
        "LENGTH", "CONCAT", "LOWER", "UPPER", "IS_NULL", "TO_BOOL"
    );

    @Override
    public boolean isConstant(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (expression instanceof Literal) {
            return true;
        }
        if (expression instanceof BinaryExpression bin) {
            return isConstant(bin.left()) && isConstant(bin.right());
        }
        if (expression instanceof UnaryExpression unary) {
            return isConstant(unary.operand());
        }
        if (expression instanceof ArrayLiteralExpression array) {
            for (Expression element : array.elements()) {
                if (!isConstant(element)) return false;
            }
            return true;
        }
        return false;
    }

    @Override
    public boolean canThrow(Expression expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (expression instanceof FunctionCall func) {
            if (!SAFE_FUNCTIONS.contains(func.functionName())) {
                return true;
            }
            for (Expression arg : func.arguments()) {
                if (canThrow(arg)) return true;
            }
            return false;
        }
        if (expression instanceof BinaryExpression bin) {
            BinaryExpression.Operator op = bin.operator();
            if ((op == BinaryExpression.Operator.DIVIDE || op == BinaryExpression.Operator.MODULO)
                    && !isNonZeroNumber(bin.right())) {
                return true;
            }
            return canThrow(bin.left()) || canThrow(bin.right());
        }
        if (expression instanceof UnaryExpression unary) {
            return canThrow(unary.operand());
        }
        if (expression instanceof AttributeAccess access) {
            return canThrow(access.base());
        }
        if (expression instanceof ArrayLiteralExpression array) {
            for (Expression element : array.elements()) {
                if (canThrow(element)) return true;
            }
        }
        return false;
    }

    private static boolean isNonZeroNumber(Expression expression) {
        return expression instanceof Literal lit
            && lit.value() instanceof Number n
            && n.doubleValue() != 0.0;
    }

    @Override
    public boolean evaluateToBoolean(Expression expression) {
        if (!isConstant(expression)) {
            throw new IllegalArgumentException("expression is not constant: " + expression.toAql());
        }
        if (canThrow(expression)) {
            throw new IllegalArgumentException("expression can throw: " + expression.toAql());
        }
        return toBoolean(evaluate(expression, Collections.emptyMap()));
    }

    /**
     * Evaluates an expression against variable bindings.
     *
     * @param expression the expression
     * @param bindings values of the variables the expression references
     * @return the resulting document value
     * @throws ExpressionEvaluationException if evaluation fails
     */
    public Object evaluate(Expression expression, Map<Variable, Object> bindings) {
        Objects.requireNonNull(bindings, "bindings must not be null");

        if (expression instanceof Literal lit) {
            return lit.value();
        }
        if (expression instanceof VariableReference ref) {
            if (!bindings.containsKey(ref.variable())) {
                throw new ExpressionEvaluationException("unbound variable " + ref.variable(), expression);
            }
            return bindings.get(ref.variable());
        }
        if (expression instanceof AttributeAccess access) {
            Object base = evaluate(access.base(), bindings);
            return base instanceof Map<?, ?> doc ? doc.get(access.name()) : null;
        }
        if (expression instanceof UnaryExpression unary) {
            Object operand = evaluate(unary.operand(), bindings);
            if (unary.operator() == UnaryExpression.Operator.NOT) {
                return !toBoolean(operand);
            }
            return operand instanceof Number n ? normalize(-n.doubleValue()) : null;
        }
        if (expression instanceof BinaryExpression bin) {
            return evaluateBinary(bin, bindings);
        }
        if (expression instanceof ArrayLiteralExpression array) {
            List<Object> values = new ArrayList<>();
            for (Expression element : array.elements()) {
                values.add(evaluate(element, bindings));
            }
            return values;
        }
        if (expression instanceof FunctionCall func) {
            return evaluateFunction(func, bindings);
        }
        throw new ExpressionEvaluationException("unsupported expression type "
            + expression.getClass().getSimpleName(), expression);
    }

    private Object evaluateBinary(BinaryExpression bin, Map<Variable, Object> bindings) {
        BinaryExpression.Operator op = bin.operator();

        // Short-circuit operators return one of their operands
        if (op == BinaryExpression.Operator.AND) {
            Object left = evaluate(bin.left(), bindings);
            return toBoolean(left) ? evaluate(bin.right(), bindings) : left;
        }
        if (op == BinaryExpression.Operator.OR) {
            Object left = evaluate(bin.left(), bindings);
            return toBoolean(left) ? left : evaluate(bin.right(), bindings);
        }

        Object left = evaluate(bin.left(), bindings);
        Object right = evaluate(bin.right(), bindings);

        if (op.isComparison()) {
            int cmp = ValueComparator.INSTANCE.compare(left, right);
            switch (op) {
                case EQUAL: return cmp == 0;
                case NOT_EQUAL: return cmp != 0;
                case LESS_THAN: return cmp < 0;
                case LESS_THAN_OR_EQUAL: return cmp <= 0;
                case GREATER_THAN: return cmp > 0;
                default: return cmp >= 0;
            }
        }

        if (!(left instanceof Number) || !(right instanceof Number)) {
            return null;
        }
        double l = ((Number) left).doubleValue();
        double r = ((Number) right).doubleValue();
        switch (op) {
            case ADD: return normalize(l + r);
            case SUBTRACT: return normalize(l - r);
            case MULTIPLY: return normalize(l * r);
            case DIVIDE:
                if (r == 0.0) {
                    throw new ExpressionEvaluationException("division by zero", bin);
                }
                return normalize(l / r);
            default:
                if (r == 0.0) {
                    throw new ExpressionEvaluationException("division by zero", bin);
                }
                return normalize(l % r);
        }
    }

    private Object evaluateFunction(FunctionCall func, Map<Variable, Object> bindings) {
        List<Object> args = new ArrayList<>();
        for (Expression arg : func.arguments()) {
            args.add(evaluate(arg, bindings));
        }

        switch (func.functionName()) {
            case "LENGTH": {
                Object value = args.isEmpty() ? null : args.get(0);
                if (value instanceof String s) return (long) s.length();
                if (value instanceof List<?> list) return (long) list.size();
                if (value instanceof Map<?, ?> map) return (long) map.size();
                return 0L;
            }
            case "CONCAT": {
                StringBuilder sb = new StringBuilder();
                for (Object arg : args) {
                    if (arg != null) sb.append(arg);
                }
                return sb.toString();
            }
            case "LOWER":
                return args.isEmpty() || args.get(0) == null ? "" : String.valueOf(args.get(0)).toLowerCase();
            case "UPPER":
                return args.isEmpty() || args.get(0) == null ? "" : String.valueOf(args.get(0)).toUpperCase();
            case "IS_NULL":
                return !args.isEmpty() && args.get(0) == null;
            case "TO_BOOL":
                return !args.isEmpty() && toBoolean(args.get(0));
            case "FAIL":
                throw new ExpressionEvaluationException(
                    args.isEmpty() ? "FAIL() called" : String.valueOf(args.get(0)), func);
            default:
                throw new ExpressionEvaluationException("unknown function " + func.functionName(), func);
        }
    }

    /**
     * Converts a document value to its truth value.
     *
     * <p>null, false, 0 and the empty string are false; every other value,
     * including empty arrays and objects, is true.
     *
     * @param value a document value
     * @return the truth value
     */
    public static boolean toBoolean(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof String s) return !s.isEmpty();
        return true;
    }

    private static Object normalize(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }
}
