package com.driftql.plan;

import java.util.List;

/**
 * Node skipping {@code offset} rows and passing on at most {@code count}.
 */
public final class LimitNode extends ExecutionNode {

    private final long offset;
    private final long count;

    public LimitNode(long offset, long count) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative: " + offset);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative: " + count);
        }
        this.offset = offset;
        this.count = count;
    }

    public long offset() {
        return offset;
    }

    public long count() {
        return count;
    }

    @Override
    public NodeType type() {
        return NodeType.LIMIT;
    }

    @Override
    public List<Variable> variablesUsedHere() {
        return List.of();
    }

    @Override
    public List<Variable> variablesSetHere() {
        return List.of();
    }

    @Override
    protected ExecutionNode copyPayload() {
        return new LimitNode(offset, count);
    }

    @Override
    public String describe() {
        return offset + ", " + count;
    }
}
