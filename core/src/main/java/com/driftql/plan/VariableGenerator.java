package com.driftql.plan;

import java.util.Objects;

/**
 * Hands out variables with query-unique ids.
 */
public final class VariableGenerator {

    private int nextId;

    /**
     * Creates a user-named variable.
     *
     * @param name the variable name
     * @return the variable
     */
    public Variable createVariable(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return new Variable(nextId++, name);
    }

    /**
     * Creates a temporary variable with a generated name.
     *
     * @return the variable
     */
    public Variable createTemporaryVariable() {
        int id = nextId++;
        return new Variable(id, "tmp" + id);
    }
}
