package com.driftql.ranges;

import com.driftql.expression.ValueComparator;
import java.util.Objects;
import java.util.Optional;

/**
 * The accumulated interval for one attribute path of one collection variable.
 *
 * <p>Either side may be open. Instances are immutable; narrowing produces a
 * new instance via {@link #intersect(RangeInfoBound, RangeInfoBound)}.
 */
public final class RangeInfo {

    private final String variable;
    private final String attribute;
    private final RangeInfoBound low;
    private final RangeInfoBound high;

    /**
     * Creates a range.
     *
     * @param variable the collection variable name
     * @param attribute the dotted attribute path
     * @param low the low bound, or null if unbounded below
     * @param high the high bound, or null if unbounded above
     */
    public RangeInfo(String variable, String attribute, RangeInfoBound low, RangeInfoBound high) {
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.attribute = Objects.requireNonNull(attribute, "attribute must not be null");
        this.low = low;
        this.high = high;
    }

    public String variable() {
        return variable;
    }

    public String attribute() {
        return attribute;
    }

    public Optional<RangeInfoBound> low() {
        return Optional.ofNullable(low);
    }

    public Optional<RangeInfoBound> high() {
        return Optional.ofNullable(high);
    }

    /**
     * Returns this range narrowed by additional bounds.
     *
     * @param otherLow an additional low bound, may be null
     * @param otherHigh an additional high bound, may be null
     * @return the intersection
     */
    public RangeInfo intersect(RangeInfoBound otherLow, RangeInfoBound otherHigh) {
        RangeInfoBound newLow = RangeInfoBound.tighterLow(low, otherLow);
        RangeInfoBound newHigh = RangeInfoBound.tighterHigh(high, otherHigh);
        if (newLow == low && newHigh == high) {
            return this;
        }
        return new RangeInfo(variable, attribute, newLow, newHigh);
    }

    /**
     * Returns whether this range is a single point, i.e. both bounds are
     * inclusive and equal.
     *
     * @return true for an equality constraint
     */
    public boolean isEquality() {
        return low != null && high != null
            && low.inclusive() && high.inclusive()
            && ValueComparator.INSTANCE.compare(low.value(), high.value()) == 0;
    }

    /**
     * Returns whether any value can satisfy this range.
     *
     * @return false if the interval is empty
     */
    public boolean isValid() {
        if (low == null || high == null) {
            return true;
        }
        int cmp = ValueComparator.INSTANCE.compare(low.value(), high.value());
        if (cmp == 0) {
            return low.inclusive() && high.inclusive();
        }
        return cmp < 0;
    }

    /**
     * Returns whether a value lies inside this range.
     *
     * @param value a document value
     * @return true if the value satisfies both bounds
     */
    public boolean contains(Object value) {
        if (low != null) {
            int cmp = ValueComparator.INSTANCE.compare(value, low.value());
            if (cmp < 0 || (cmp == 0 && !low.inclusive())) {
                return false;
            }
        }
        if (high != null) {
            int cmp = ValueComparator.INSTANCE.compare(value, high.value());
            if (cmp > 0 || (cmp == 0 && !high.inclusive())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("%s.%s in %s%s, %s%s",
            variable, attribute,
            low == null || !low.inclusive() ? "(" : "[",
            low == null ? "-inf" : low.bound().toAql(),
            high == null ? "+inf" : high.bound().toAql(),
            high == null || !high.inclusive() ? ")" : "]");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RangeInfo)) return false;
        RangeInfo that = (RangeInfo) obj;
        return variable.equals(that.variable) && attribute.equals(that.attribute)
            && Objects.equals(low, that.low) && Objects.equals(high, that.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, attribute, low, high);
    }
}
