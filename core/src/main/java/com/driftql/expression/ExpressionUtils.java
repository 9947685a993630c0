package com.driftql.expression;

import com.driftql.plan.Variable;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Utility methods for inspecting expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns the variables referenced anywhere in the expression tree, in
     * first-reference order.
     *
     * @param expr the expression to inspect
     * @return the referenced variables
     */
    public static Set<Variable> variablesUsed(Expression expr) {
        Set<Variable> result = new LinkedHashSet<>();
        collectVariables(expr, result);
        return result;
    }

    private static void collectVariables(Expression expr, Set<Variable> out) {
        if (expr instanceof VariableReference ref) {
            out.add(ref.variable());
        } else if (expr instanceof AttributeAccess access) {
            collectVariables(access.base(), out);
        } else if (expr instanceof BinaryExpression bin) {
            collectVariables(bin.left(), out);
            collectVariables(bin.right(), out);
        } else if (expr instanceof UnaryExpression unary) {
            collectVariables(unary.operand(), out);
        } else if (expr instanceof FunctionCall func) {
            for (Expression arg : func.arguments()) {
                collectVariables(arg, out);
            }
        } else if (expr instanceof ArrayLiteralExpression array) {
            for (Expression element : array.elements()) {
                collectVariables(element, out);
            }
        }
        // Literals reference nothing
    }
}
