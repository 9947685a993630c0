package com.driftql.plan;

/**
 * Kinds of execution plan nodes.
 */
public enum NodeType {
    SINGLETON("SingletonNode"),
    ENUMERATE_COLLECTION("EnumerateCollectionNode"),
    INDEX_RANGE("IndexRangeNode"),
    CALCULATION("CalculationNode"),
    SUBQUERY("SubqueryNode"),
    FILTER("FilterNode"),
    LIMIT("LimitNode"),
    RETURN("ReturnNode"),
    NO_RESULTS("NoResultsNode");

    private final String typeName;

    NodeType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
