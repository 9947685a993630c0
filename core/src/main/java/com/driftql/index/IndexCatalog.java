package com.driftql.index;

import java.util.Collection;
import java.util.List;

/**
 * Source of index metadata for the optimizer.
 */
public interface IndexCatalog {

    /**
     * Returns the indexes of a collection that can serve lookups constrained
     * on the given attribute paths.
     *
     * @param collection the collection name
     * @param attributePaths the dotted attribute paths that carry constraints
     * @return the usable indexes, in a stable order; empty if none
     */
    List<IndexDescriptor> usableIndexes(String collection, Collection<String> attributePaths);
}
