package com.driftql.ranges;

import com.driftql.expression.Literal;
import com.driftql.expression.ValueComparator;
import java.util.Objects;

/**
 * One side (low or high) of an interval constraint on an attribute.
 *
 * <p>The bound refers to the constant AST node it was taken from; the node is
 * immutable and may be shared by cloned plans.
 */
public record RangeInfoBound(Literal bound, boolean inclusive) {

    /**
     * Creates a range bound.
     *
     * @param bound the constant bounding value
     * @param inclusive whether the bounding value itself is inside the range
     */
    public RangeInfoBound {
        Objects.requireNonNull(bound, "bound must not be null");
    }

    /**
     * Returns the bounding document value.
     *
     * @return the value
     */
    public Object value() {
        return bound.value();
    }

    /**
     * Returns the tighter of two low bounds: the greater value, or for equal
     * values the exclusive one.
     *
     * @param a a low bound, may be null
     * @param b a low bound, may be null
     * @return the tighter bound, or null if both are null
     */
    public static RangeInfoBound tighterLow(RangeInfoBound a, RangeInfoBound b) {
        if (a == null) return b;
        if (b == null) return a;
        int cmp = ValueComparator.INSTANCE.compare(a.value(), b.value());
        if (cmp < 0) return b;
        if (cmp > 0) return a;
        return a.inclusive() && !b.inclusive() ? b : a;
    }

    /**
     * Returns the tighter of two high bounds: the smaller value, or for equal
     * values the exclusive one.
     *
     * @param a a high bound, may be null
     * @param b a high bound, may be null
     * @return the tighter bound, or null if both are null
     */
    public static RangeInfoBound tighterHigh(RangeInfoBound a, RangeInfoBound b) {
        if (a == null) return b;
        if (b == null) return a;
        int cmp = ValueComparator.INSTANCE.compare(a.value(), b.value());
        if (cmp > 0) return b;
        if (cmp < 0) return a;
        return a.inclusive() && !b.inclusive() ? b : a;
    }

    @Override
    public String toString() {
        return bound.toAql() + (inclusive ? " (inclusive)" : " (exclusive)");
    }
}
