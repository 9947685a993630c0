package com.driftql.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Total order over document values.
 *
 * <p>Values of different types are ordered by type first:
 * <pre>
 *   null &lt; boolean &lt; number &lt; string &lt; array &lt; object
 * </pre>
 * Within a type, booleans order false before true, numbers numerically,
 * strings lexicographically, arrays element by element and objects by their
 * sorted attribute names, then by the values under those names.
 */
public final class ValueComparator implements Comparator<Object> {

    public static final ValueComparator INSTANCE = new ValueComparator();

    private ValueComparator() {}

    @Override
    public int compare(Object left, Object right) {
        int leftWeight = typeWeight(left);
        int rightWeight = typeWeight(right);
        if (leftWeight != rightWeight) {
            return Integer.compare(leftWeight, rightWeight);
        }

        switch (leftWeight) {
            case 0:
                return 0;
            case 1:
                return Boolean.compare((Boolean) left, (Boolean) right);
            case 2:
                return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
            case 3:
                return ((String) left).compareTo((String) right);
            case 4:
                return compareLists((List<?>) left, (List<?>) right);
            default:
                return compareMaps((Map<?, ?>) left, (Map<?, ?>) right);
        }
    }

    private int compareLists(List<?> left, List<?> right) {
        int n = Math.min(left.size(), right.size());
        for (int i = 0; i < n; i++) {
            int cmp = compare(left.get(i), right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private int compareMaps(Map<?, ?> left, Map<?, ?> right) {
        List<String> leftKeys = sortedKeys(left);
        List<String> rightKeys = sortedKeys(right);
        int cmp = compareLists(leftKeys, rightKeys);
        if (cmp != 0) {
            return cmp;
        }
        for (String key : leftKeys) {
            cmp = compare(left.get(key), right.get(key));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private static List<String> sortedKeys(Map<?, ?> map) {
        List<String> keys = new ArrayList<>();
        for (Object key : map.keySet()) {
            keys.add(String.valueOf(key));
        }
        Collections.sort(keys);
        return keys;
    }

    /**
     * Returns the position of the value's type in the cross-type order.
     *
     * @param value a document value
     * @return 0 for null up to 5 for objects
     * @throws IllegalArgumentException if the value is not a document value
     */
    static int typeWeight(Object value) {
        if (value == null) return 0;
        if (value instanceof Boolean) return 1;
        if (value instanceof Number) return 2;
        if (value instanceof String) return 3;
        if (value instanceof List<?>) return 4;
        if (value instanceof Map<?, ?>) return 5;
        throw new IllegalArgumentException("Not a document value: " + value.getClass().getName());
    }
}
