package com.schemalens.core.model;

import java.util.List;

/**
 * Primary key. {@code name} is null on engines that do not name it, {@code clustered}
 * is null where the engine has no clustering concept.
 */
public record PrimaryKey(String name, List<String> columns, Boolean clustered) {
    public PrimaryKey {
        if (columns == null || columns.isEmpty()) {
            throw new ModelIntegrityException("primary key " + name, "has no columns");
        }
        columns = List.copyOf(columns);
    }
}
