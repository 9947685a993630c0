package com.driftql.plan;

import com.driftql.index.IndexDescriptor;
import com.driftql.ranges.RangeInfo;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Node iterating the documents of a collection through an index, restricted to
 * the documents whose attributes fall into the given ranges.
 *
 * <p>Produced by the optimizer as a replacement for an
 * {@link EnumerateCollectionNode}; it binds the same output variable.
 */
public final class IndexRangeNode extends ExecutionNode {

    private final String collection;
    private final Variable outVariable;
    private final IndexDescriptor index;
    private final List<RangeInfo> ranges;

    /**
     * Creates an index range scan.
     *
     * @param collection the collection name
     * @param outVariable the iteration variable
     * @param index the index to use
     * @param ranges the attribute ranges the documents must satisfy
     */
    public IndexRangeNode(String collection, Variable outVariable, IndexDescriptor index, List<RangeInfo> ranges) {
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
        this.outVariable = Objects.requireNonNull(outVariable, "outVariable must not be null");
        this.index = Objects.requireNonNull(index, "index must not be null");
        this.ranges = List.copyOf(Objects.requireNonNull(ranges, "ranges must not be null"));
    }

    public String collection() {
        return collection;
    }

    public Variable outVariable() {
        return outVariable;
    }

    public IndexDescriptor index() {
        return index;
    }

    /**
     * Returns the attribute ranges.
     *
     * @return an unmodifiable list of ranges
     */
    public List<RangeInfo> ranges() {
        return Collections.unmodifiableList(ranges);
    }

    @Override
    public NodeType type() {
        return NodeType.INDEX_RANGE;
    }

    @Override
    public List<Variable> variablesUsedHere() {
        return List.of();
    }

    @Override
    public List<Variable> variablesSetHere() {
        return List.of(outVariable);
    }

    @Override
    protected ExecutionNode copyPayload() {
        return new IndexRangeNode(collection, outVariable, index, ranges);
    }

    @Override
    public String describe() {
        return outVariable.name() + " IN " + collection + " USING " + index + " WHERE "
            + ranges.stream().map(RangeInfo::toString).collect(Collectors.joining(" AND "));
    }
}
