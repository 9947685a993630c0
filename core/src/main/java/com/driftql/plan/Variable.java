package com.driftql.plan;

import java.util.Objects;

/**
 * A value produced exactly once in an execution plan.
 *
 * <p>Variables are identified by their id; the name is what the query text
 * used (e.g. {@code x} in {@code FOR x IN users}) or a generated name for
 * temporaries. Each variable is defined by exactly one node of a plan.
 */
public record Variable(int id, String name) {

    /**
     * Creates a variable.
     *
     * @param id the plan-wide variable id
     * @param name the variable name
     */
    public Variable {
        Objects.requireNonNull(name, "name must not be null");
        if (id < 0) {
            throw new IllegalArgumentException("variable id must be non-negative: " + id);
        }
    }

    @Override
    public String toString() {
        return name + "#" + id;
    }
}
