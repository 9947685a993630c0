package com.driftql.index;

import java.util.List;
import java.util.Objects;

/**
 * Describes an index of a collection.
 *
 * @param id the catalog-wide index id
 * @param type the index type
 * @param fields the indexed attribute paths, in index order
 * @param unique whether the index enforces uniqueness
 */
public record IndexDescriptor(String id, IndexType type, List<String> fields, boolean unique) {

    public IndexDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("an index must cover at least one field");
        }
        fields = List.copyOf(fields);
    }

    public static IndexDescriptor primary(String id) {
        return new IndexDescriptor(id, IndexType.PRIMARY, List.of("_key"), true);
    }

    public static IndexDescriptor hash(String id, String... fields) {
        return new IndexDescriptor(id, IndexType.HASH, List.of(fields), false);
    }

    public static IndexDescriptor skiplist(String id, String... fields) {
        return new IndexDescriptor(id, IndexType.SKIPLIST, List.of(fields), false);
    }

    @Override
    public String toString() {
        return type.typeName() + "[" + String.join(", ", fields) + "]#" + id;
    }
}
