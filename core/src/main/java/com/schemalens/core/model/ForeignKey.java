package com.schemalens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A foreign key constraint. An empty {@code targetColumns} list means the constraint
 * references the target's primary key without naming its columns. A null action means
 * the engine does not report one.
 */
public record ForeignKey(
        String name,
        List<String> columns,
        Identifier target,
        List<String> targetColumns,
        ReferentialAction onDelete,
        ReferentialAction onUpdate
) {
    public ForeignKey {
        String subject = "foreign key " + (name == null ? "(unnamed)" : name);
        if (columns == null || columns.isEmpty()) {
            throw new ModelIntegrityException(subject, "has no local columns");
        }
        Objects.requireNonNull(target, "target");
        targetColumns = targetColumns == null ? List.of() : List.copyOf(targetColumns);
        columns = List.copyOf(columns);
        if (!targetColumns.isEmpty() && targetColumns.size() != columns.size()) {
            throw new ModelIntegrityException(subject, "has " + columns.size() + " local columns but "
                    + targetColumns.size() + " target columns");
        }
    }
}
