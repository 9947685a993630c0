package com.driftql.ranges;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Range constraints collected from a filter expression, keyed by collection
 * variable name and then by dotted attribute path.
 *
 * <p>Inserting bounds for a key that is already present intersects them with
 * the existing range; an existing bound is never overwritten by a looser one.
 * Iteration order is insertion order.
 */
public final class RangesInfo {

    private final Map<String, Map<String, RangeInfo>> ranges = new LinkedHashMap<>();

    /**
     * Adds bounds for an attribute of a collection variable.
     *
     * @param variable the collection variable name
     * @param attribute the dotted attribute path
     * @param low the low bound, may be null
     * @param high the high bound, may be null
     * @throws IllegalArgumentException if both bounds are null
     */
    public void insert(String variable, String attribute, RangeInfoBound low, RangeInfoBound high) {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(attribute, "attribute must not be null");
        if (low == null && high == null) {
            throw new IllegalArgumentException("at least one bound must be given for " + variable + "." + attribute);
        }

        Map<String, RangeInfo> byAttribute = ranges.computeIfAbsent(variable, k -> new LinkedHashMap<>());
        RangeInfo existing = byAttribute.get(attribute);
        if (existing == null) {
            byAttribute.put(attribute, new RangeInfo(variable, attribute, low, high));
        } else {
            byAttribute.put(attribute, existing.intersect(low, high));
        }
    }

    /**
     * Returns the ranges recorded for a collection variable.
     *
     * @param variable the collection variable name
     * @return an unmodifiable map from attribute path to range, or empty if
     *         nothing was recorded for the variable
     */
    public Optional<Map<String, RangeInfo>> find(String variable) {
        Map<String, RangeInfo> byAttribute = ranges.get(variable);
        return byAttribute == null ? Optional.empty() : Optional.of(Collections.unmodifiableMap(byAttribute));
    }

    /**
     * Returns the range for one attribute of a collection variable.
     *
     * @param variable the collection variable name
     * @param attribute the dotted attribute path
     * @return the range, if any
     */
    public Optional<RangeInfo> get(String variable, String attribute) {
        Map<String, RangeInfo> byAttribute = ranges.get(variable);
        return byAttribute == null ? Optional.empty() : Optional.ofNullable(byAttribute.get(attribute));
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    /**
     * Returns the number of (variable, attribute) ranges.
     *
     * @return the range count
     */
    public int size() {
        int count = 0;
        for (Map<String, RangeInfo> byAttribute : ranges.values()) {
            count += byAttribute.size();
        }
        return count;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RangesInfo{");
        boolean first = true;
        for (Map<String, RangeInfo> byAttribute : ranges.values()) {
            for (RangeInfo range : byAttribute.values()) {
                if (!first) sb.append("; ");
                first = false;
                sb.append(range);
            }
        }
        return sb.append("}").toString();
    }
}
