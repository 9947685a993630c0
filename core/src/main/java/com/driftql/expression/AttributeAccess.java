package com.driftql.expression;

import java.util.Objects;

/**
 * Expression accessing a named attribute of a document.
 *
 * <p>Nested accesses form chains: {@code x.address.city} is
 * {@code AttributeAccess(AttributeAccess(x, "address"), "city")}.
 */
public final class AttributeAccess implements Expression {

    private final Expression base;
    private final String name;

    /**
     * Creates an attribute access.
     *
     * @param base the expression producing the document
     * @param name the attribute name
     */
    public AttributeAccess(Expression base, String name) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("attribute name must not be empty");
        }
    }

    /**
     * Returns the expression whose attribute is accessed.
     *
     * @return the base expression
     */
    public Expression base() {
        return base;
    }

    /**
     * Returns the attribute name.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    @Override
    public String toAql() {
        return base.toAql() + "." + name;
    }

    @Override
    public String toString() {
        return toAql();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AttributeAccess)) return false;
        AttributeAccess that = (AttributeAccess) obj;
        return base.equals(that.base) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, name);
    }

    /**
     * Creates a chain of attribute accesses from a dotted path.
     *
     * @param base the base expression
     * @param path the dotted path, e.g. {@code "address.city"}
     * @return the outermost attribute access
     */
    public static AttributeAccess path(Expression base, String path) {
        Objects.requireNonNull(path, "path must not be null");
        Expression current = base;
        for (String part : path.split("\\.")) {
            current = new AttributeAccess(current, part);
        }
        return (AttributeAccess) current;
    }
}
