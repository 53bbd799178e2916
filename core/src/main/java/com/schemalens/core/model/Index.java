package com.schemalens.core.model;

import java.util.List;

/**
 * A table index. Unique constraints are represented as unique indexes.
 * {@code clustered} is null where the engine does not expose clustering.
 */
public record Index(
        String name,
        boolean unique,
        boolean primaryKey,
        List<String> columns,
        List<String> includedColumns,
        String method,
        String filter,
        Boolean clustered
) {
    public Index {
        if (name == null || name.isBlank()) {
            throw new ModelIntegrityException("index", "name is required");
        }
        if (columns == null || columns.isEmpty()) {
            throw new ModelIntegrityException("index " + name, "has no key columns");
        }
        columns = List.copyOf(columns);
        includedColumns = includedColumns == null ? List.of() : List.copyOf(includedColumns);
    }
}
