package com.schemalens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A view. {@code baseTables} comes from the catalog where the engine tracks dependencies,
 * otherwise from a best-effort parse of the definition.
 */
public record View(
        Identifier id,
        List<Attribute> columns,
        String definition,
        List<Identifier> baseTables,
        boolean materialized,
        String description
) {
    public View {
        Objects.requireNonNull(id, "id");
        columns = columns == null ? List.of() : List.copyOf(columns);
        baseTables = baseTables == null ? List.of() : baseTables.stream().distinct().sorted().toList();
    }
}
