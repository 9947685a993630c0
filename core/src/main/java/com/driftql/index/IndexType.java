package com.driftql.index;

/**
 * Index kinds known to the catalog.
 */
public enum IndexType {
    /** The collection's primary key index. Supports equality lookups only. */
    PRIMARY("primary"),
    /** Hash index over one or more attributes. Supports equality lookups on all fields. */
    HASH("hash"),
    /** Sorted index. Supports equality and range lookups on a prefix of its fields. */
    SKIPLIST("skiplist");

    private final String typeName;

    IndexType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Returns whether the index can answer range (non-equality) lookups.
     *
     * @return true for sorted indexes
     */
    public boolean isSorted() {
        return this == SKIPLIST;
    }
}
