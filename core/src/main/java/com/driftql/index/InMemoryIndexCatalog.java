package com.driftql.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link IndexCatalog} backed by indexes registered in memory.
 *
 * <p>Usability:
 * <ul>
 *   <li>PRIMARY and HASH indexes are usable when every indexed field is among
 *       the constrained attribute paths.</li>
 *   <li>SKIPLIST indexes are usable when their first field is constrained.</li>
 * </ul>
 */
public class InMemoryIndexCatalog implements IndexCatalog {

    private final Map<String, List<IndexDescriptor>> indexesByCollection = new LinkedHashMap<>();

    /**
     * Registers an index for a collection.
     *
     * @param collection the collection name
     * @param index the index
     * @return this catalog
     * @throws IllegalArgumentException if an index with the same id is already registered
     */
    public InMemoryIndexCatalog addIndex(String collection, IndexDescriptor index) {
        Objects.requireNonNull(collection, "collection must not be null");
        Objects.requireNonNull(index, "index must not be null");
        for (List<IndexDescriptor> indexes : indexesByCollection.values()) {
            for (IndexDescriptor existing : indexes) {
                if (existing.id().equals(index.id())) {
                    throw new IllegalArgumentException("duplicate index id: " + index.id());
                }
            }
        }
        indexesByCollection.computeIfAbsent(collection, k -> new ArrayList<>()).add(index);
        return this;
    }

    /**
     * Returns all indexes registered for a collection.
     *
     * @param collection the collection name
     * @return an unmodifiable list of indexes
     */
    public List<IndexDescriptor> indexes(String collection) {
        return Collections.unmodifiableList(indexesByCollection.getOrDefault(collection, List.of()));
    }

    @Override
    public List<IndexDescriptor> usableIndexes(String collection, Collection<String> attributePaths) {
        Objects.requireNonNull(attributePaths, "attributePaths must not be null");
        Set<String> constrained = new HashSet<>(attributePaths);
        List<IndexDescriptor> result = new ArrayList<>();
        for (IndexDescriptor index : indexesByCollection.getOrDefault(collection, List.of())) {
            if (isUsable(index, constrained)) {
                result.add(index);
            }
        }
        return result;
    }

    private static boolean isUsable(IndexDescriptor index, Set<String> constrained) {
        switch (index.type()) {
            case SKIPLIST:
                return constrained.contains(index.fields().get(0));
            default:
                return constrained.containsAll(index.fields());
        }
    }
}
