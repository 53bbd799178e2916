package com.schemalens.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A base table with its columns, keys, indexes and checks. {@code rowCount} and
 * {@code sizeKb} are best-effort statistics and null when the engine cannot report them.
 */
public record Table(
        Identifier id,
        List<Column> columns,
        PrimaryKey primaryKey,
        List<ForeignKey> foreignKeys,
        List<Index> indexes,
        List<CheckConstraint> checks,
        Long rowCount,
        Long sizeKb,
        String description
) {
    public Table {
        Objects.requireNonNull(id, "id");
        columns = List.copyOf(columns);
        foreignKeys = foreignKeys == null ? List.of() : List.copyOf(foreignKeys);
        indexes = indexes == null ? List.of() : List.copyOf(indexes);
        checks = checks == null ? List.of() : List.copyOf(checks);

        String subject = "table " + id;
        Set<String> names = new HashSet<>();
        Set<String> folded = new HashSet<>();
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            if (column.ordinal() != i + 1) {
                throw new ModelIntegrityException(subject, "column " + column.name() + " has ordinal "
                        + column.ordinal() + ", expected " + (i + 1));
            }
            // Quoted names may differ only in case on engines with case-sensitive identifiers
            if (!names.add(column.name())) {
                throw new ModelIntegrityException(subject, "duplicate column " + column.name());
            }
            folded.add(Identifier.fold(column.name()));
        }
        if (primaryKey != null) {
            requireColumns(subject, "primary key", primaryKey.columns(), names, folded);
        }
        for (ForeignKey fk : foreignKeys) {
            requireColumns(subject, "foreign key " + (fk.name() == null ? "(unnamed)" : fk.name()),
                    fk.columns(), names, folded);
        }
    }

    private static void requireColumns(String subject, String what, List<String> used,
                                       Set<String> declared, Set<String> folded) {
        for (String column : used) {
            if (!declared.contains(column) && !folded.contains(Identifier.fold(column))) {
                throw new ModelIntegrityException(subject, what + " uses undeclared column " + column);
            }
        }
    }

    /** The column spelled exactly {@code name}, else the first one matching it case-insensitively. */
    public Column column(String name) {
        for (Column column : columns) {
            if (column.name().equals(name)) {
                return column;
            }
        }
        String key = Identifier.fold(name);
        for (Column column : columns) {
            if (Identifier.fold(column.name()).equals(key)) {
                return column;
            }
        }
        return null;
    }

    public boolean inPrimaryKey(String columnName) {
        if (primaryKey == null) {
            return false;
        }
        Column target = column(columnName);
        return target != null && primaryKey.columns().stream().anyMatch(c -> column(c) == target);
    }
}
