package com.driftql.expression;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expression representing a constant document value.
 *
 * <p>Supported values:
 * <ul>
 *   <li>{@code null}</li>
 *   <li>booleans</li>
 *   <li>numbers ({@link Long} for integers, {@link Double} otherwise)</li>
 *   <li>strings</li>
 *   <li>lists and maps of the above</li>
 * </ul>
 *
 * <p>Examples in query text:
 * <pre>
 *   FILTER x.age == 42
 *   FILTER x.name == "alice"
 *   FILTER true
 * </pre>
 */
public final class Literal implements Expression {

    private static final Literal NULL = new Literal(null);
    private static final Literal TRUE = new Literal(Boolean.TRUE);
    private static final Literal FALSE = new Literal(Boolean.FALSE);

    private final Object value;

    private Literal(Object value) {
        this.value = value;
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for the null literal
     */
    public Object value() {
        return value;
    }

    /**
     * Returns whether this is the null literal.
     *
     * @return true if value is null
     */
    public boolean isNull() {
        return value == null;
    }

    @Override
    public String toAql() {
        return render(value);
    }

    private static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        if (value instanceof List<?> list) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(render(list.get(i)));
            }
            return sb.append("]").toString();
        }
        if (value instanceof Map<?, ?> map) {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!first) sb.append(", ");
                first = false;
                sb.append(render(String.valueOf(entry.getKey()))).append(": ").append(render(entry.getValue()));
            }
            return sb.append("}").toString();
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return toAql();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    // ==================== Factory Methods ====================

    public static Literal of(long value) {
        return new Literal(value);
    }

    public static Literal of(double value) {
        return new Literal(value);
    }

    public static Literal of(String value) {
        return new Literal(Objects.requireNonNull(value, "value must not be null"));
    }

    public static Literal of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Literal nullValue() {
        return NULL;
    }

    /**
     * Creates a literal from an arbitrary document value.
     *
     * <p>Integral numbers are normalized to {@link Long}, other numbers to
     * {@link Double}.
     *
     * @param value the value
     * @return the literal
     * @throws IllegalArgumentException if the value is not a document value
     */
    public static Literal ofValue(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Boolean b) {
            return of(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new Literal(((Number) value).longValue());
        }
        if (value instanceof Number n) {
            return new Literal(n.doubleValue());
        }
        if (value instanceof String || value instanceof List<?> || value instanceof Map<?, ?>) {
            return new Literal(value);
        }
        throw new IllegalArgumentException("Not a document value: " + value.getClass().getName());
    }
}
