package com.driftql.expression;

import com.driftql.plan.Variable;
import java.util.Objects;

/**
 * Expression referencing a plan variable by identity.
 *
 * <p>Examples:
 * <pre>
 *   x                 -- the iteration variable of FOR x IN users
 *   tmp1              -- an optimizer temporary
 * </pre>
 */
public final class VariableReference implements Expression {

    private final Variable variable;

    /**
     * Creates a variable reference.
     *
     * @param variable the referenced variable
     */
    public VariableReference(Variable variable) {
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
    }

    /**
     * Returns the referenced variable.
     *
     * @return the variable
     */
    public Variable variable() {
        return variable;
    }

    @Override
    public String toAql() {
        return variable.name();
    }

    @Override
    public String toString() {
        return toAql();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VariableReference)) return false;
        return variable.equals(((VariableReference) obj).variable);
    }

    @Override
    public int hashCode() {
        return variable.hashCode();
    }
}
